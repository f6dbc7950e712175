/**
 * Forest Deltas Fit
 * WaveSolution.java
 * author: Rick Ziraldo, 2018
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package forestdeltas;

/** Sampling of the common wavelength grid */
public enum WaveSolution {
	/** Constant step in wavelength */
	LIN,
	/** Constant step in log10 of the wavelength */
	LOG;

	public static WaveSolution parse(final String name) {
		if (name == null) throw new ExpectedFluxException(
			"Missing wave solution. Expected 'lin' or 'log'");
		switch (name.trim().toLowerCase()) {
			case "lin":
				return LIN;
			case "log":
				return LOG;
			default:
				throw new ExpectedFluxException(
					"Unknown wave solution '" + name + "'. Expected 'lin' or 'log'");
		}
	}
}
