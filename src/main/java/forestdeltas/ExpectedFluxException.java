/**
 * Forest Deltas Fit
 * ExpectedFluxException.java
 * author: Rick Ziraldo, 2018
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package forestdeltas;

/**
 * Fatal error of the expected flux computation: invalid configuration, missing
 * wavelength grid, or a diagnostic file that could not be written or read.
 */
public class ExpectedFluxException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public ExpectedFluxException(final String message) {
		super(message);
	}

	public ExpectedFluxException(final String message, final Throwable cause) {
		super(message, cause);
	}
}
