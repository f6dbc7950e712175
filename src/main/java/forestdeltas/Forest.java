/**
 * Forest Deltas Fit
 * Forest.java
 * author: Rick Ziraldo, 2018
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package forestdeltas;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NullArgumentException;

/**
 * Spectrum of one line of sight on the common observed wavelength grid,
 * together with the quantities derived from it while the expected flux is
 * computed.
 * <p>
 * The continuum is either set for every pixel and strictly positive, or
 * {@code null} when the fit failed; in that case {@link #getBadContinuumReason()}
 * tells why. Exposure differences are optional: only forests carrying them get
 * an adjusted inverse variance.
 */
public class Forest {

	private final long losId;
	private final double ra;
	private final double dec;
	private final double z;

	private final double[] logLambda;
	private final double[] flux;
	private double[] ivar;
	private double[] exposuresDiff;
	private final double[] reso;

	private double[] continuum;
	private String badContinuumReason;
	private double[] deltas;
	private double[] weights;

	public Forest(final long losId, final double ra, final double dec,
		final double z, final double[] logLambda, final double[] flux,
		final double[] ivar)
	{
		this(losId, ra, dec, z, logLambda, flux, ivar, null, null);
	}

	/**
	 * @param exposuresDiff difference between the coadds of even and odd
	 *          exposures, or {@code null}
	 * @param reso spectral resolution per pixel, or {@code null}
	 */
	public Forest(final long losId, final double ra, final double dec,
		final double z, final double[] logLambda, final double[] flux,
		final double[] ivar, final double[] exposuresDiff, final double[] reso)
	{
		if (logLambda == null) throw new NullArgumentException();
		if (flux == null) throw new NullArgumentException();
		if (ivar == null) throw new NullArgumentException();
		checkSize(logLambda, flux);
		checkSize(logLambda, ivar);
		if (exposuresDiff != null) checkSize(logLambda, exposuresDiff);
		if (reso != null) checkSize(logLambda, reso);

		this.losId = losId;
		this.ra = ra;
		this.dec = dec;
		this.z = z;
		this.logLambda = logLambda;
		this.flux = flux;
		this.ivar = ivar;
		this.exposuresDiff = exposuresDiff;
		this.reso = reso;
	}

	private static void checkSize(final double[] reference, final double[] other) {
		if (other.length != reference.length)
			throw new DimensionMismatchException(other.length, reference.length);
	}

	public long getLosId() {
		return losId;
	}

	public double getRa() {
		return ra;
	}

	public double getDec() {
		return dec;
	}

	public double getZ() {
		return z;
	}

	public int size() {
		return flux.length;
	}

	public double[] getLogLambda() {
		return logLambda;
	}

	public double[] getFlux() {
		return flux;
	}

	public double[] getIvar() {
		return ivar;
	}

	public boolean hasExposuresDiff() {
		return exposuresDiff != null;
	}

	public double[] getExposuresDiff() {
		return exposuresDiff;
	}

	public double[] getReso() {
		return reso;
	}

	public double[] getContinuum() {
		return continuum;
	}

	public boolean hasContinuum() {
		return continuum != null;
	}

	public String getBadContinuumReason() {
		return badContinuumReason;
	}

	public double[] getDeltas() {
		return deltas;
	}

	public double[] getWeights() {
		return weights;
	}

	/** Stores a successful continuum fit */
	void setContinuum(final double[] continuum) {
		checkSize(flux, continuum);
		for (final double c : continuum) {
			if (!(c > 0)) throw new IllegalArgumentException(
				"Continuum of line of sight " + losId + " must be strictly positive");
		}
		this.continuum = continuum;
		this.badContinuumReason = null;
	}

	/** Flags the continuum fit as failed */
	void setBadContinuum(final String reason) {
		this.continuum = null;
		this.badContinuumReason = reason;
	}

	void setDeltas(final double[] deltas, final double[] weights) {
		checkSize(flux, deltas);
		checkSize(flux, weights);
		this.deltas = deltas;
		this.weights = weights;
	}

	void setIvar(final double[] ivar) {
		checkSize(flux, ivar);
		this.ivar = ivar;
	}

	void setExposuresDiff(final double[] exposuresDiff) {
		checkSize(flux, exposuresDiff);
		this.exposuresDiff = exposuresDiff;
	}

	@Override
	public String toString() {
		return "Forest[" + losId + ", z=" + z + ", " + flux.length + " pixels]";
	}
}
