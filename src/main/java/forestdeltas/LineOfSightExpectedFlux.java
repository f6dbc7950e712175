/**
 * Forest Deltas Fit
 * LineOfSightExpectedFlux.java
 * author: Rick Ziraldo, 2018
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package forestdeltas;

/**
 * Expected flux of one line of sight after the last iteration.
 */
public final class LineOfSightExpectedFlux {

	private final double[] meanExpectedFlux;
	private final double[] weights;
	private final double[] continuum;
	private final double[] ivar;

	LineOfSightExpectedFlux(final double[] meanExpectedFlux,
		final double[] weights, final double[] continuum, final double[] ivar)
	{
		this.meanExpectedFlux = meanExpectedFlux;
		this.weights = weights;
		this.continuum = continuum;
		this.ivar = ivar;
	}

	/** Continuum times the mean transmission */
	public double[] getMeanExpectedFlux() {
		return meanExpectedFlux.clone();
	}

	public double[] getWeights() {
		return weights.clone();
	}

	public double[] getContinuum() {
		return continuum.clone();
	}

	public boolean hasIvar() {
		return ivar != null;
	}

	/**
	 * Inverse variance rescaled by eta and the mean expected flux, only for lines
	 * of sight carrying exposure differences; {@code null} otherwise.
	 */
	public double[] getIvar() {
		return ivar == null ? null : ivar.clone();
	}
}
