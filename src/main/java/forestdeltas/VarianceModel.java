/**
 * Forest Deltas Fit
 * VarianceModel.java
 * author: Rick Ziraldo, 2018
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package forestdeltas;

import java.util.Arrays;

import org.apache.commons.math3.exception.DimensionMismatchException;

/**
 * Pixel variance model as a function of the observed wavelength:
 *
 * <pre>
 * variance = eta * varPipe + varLss + fudge / varPipe
 * varPipe  = 1 / (ivar * continuum^2)
 * </pre>
 *
 * The three functions are tabulated at the centers of the variance bins and
 * read back by nearest neighbour, held flat beyond the first and last bin.
 * Only bins that received pixels take part in the interpolation. Immutable.
 */
public final class VarianceModel {

	private final double[] logLambdaGrid;
	private final double[] eta;
	private final double[] varLss;
	private final double[] fudge;
	private final long[] numPixels;
	private final boolean[] validFit;
	private final double[] chi2;

	private final TabulatedFunction etaFunction;
	private final TabulatedFunction varLssFunction;
	private final TabulatedFunction fudgeFunction;
	private final TabulatedFunction numPixelsFunction;
	private final TabulatedFunction validFitFunction;

	/**
	 * @param useAllBins interpolate over every bin, regardless of the pixel
	 *          counts (initial model, before any pixel has been counted)
	 */
	VarianceModel(final double[] logLambdaGrid, final double[] eta,
		final double[] varLss, final double[] fudge, final long[] numPixels,
		final boolean[] validFit, final double[] chi2, final boolean useAllBins)
	{
		final int n = logLambdaGrid.length;
		checkSize(n, eta.length);
		checkSize(n, varLss.length);
		checkSize(n, fudge.length);
		checkSize(n, numPixels.length);
		checkSize(n, validFit.length);
		checkSize(n, chi2.length);

		this.logLambdaGrid = logLambdaGrid.clone();
		this.eta = eta.clone();
		this.varLss = varLss.clone();
		this.fudge = fudge.clone();
		this.numPixels = numPixels.clone();
		this.validFit = validFit.clone();
		this.chi2 = chi2.clone();

		int used = 0;
		for (int i = 0; i < n; i++)
			if (useAllBins || numPixels[i] > 0) used++;
		if (used == 0) throw new ExpectedFluxException(
			"No variance bin contains pixels, cannot build the variance functions");

		final double[] x = new double[used];
		final double[] e = new double[used];
		final double[] l = new double[used];
		final double[] f = new double[used];
		final double[] p = new double[used];
		final double[] v = new double[used];
		int k = 0;
		for (int i = 0; i < n; i++) {
			if (!useAllBins && numPixels[i] <= 0) continue;
			x[k] = logLambdaGrid[i];
			e[k] = eta[i];
			l[k] = varLss[i];
			f[k] = fudge[i];
			p[k] = numPixels[i];
			v[k] = validFit[i] ? 1.0 : 0.0;
			k++;
		}
		etaFunction = TabulatedFunction.nearest(x, e);
		varLssFunction = TabulatedFunction.nearest(x, l);
		fudgeFunction = TabulatedFunction.nearest(x, f);
		numPixelsFunction = TabulatedFunction.nearest(x, p);
		validFitFunction = TabulatedFunction.nearest(x, v);
	}

	private static void checkSize(final int expected, final int actual) {
		if (actual != expected) throw new DimensionMismatchException(actual,
			expected);
	}

	/**
	 * Model used by the first continuum fits.
	 *
	 * @param config run options, deciding which functions are fixed
	 * @param logLambdaGrid centers of the variance bins
	 * @param etaPrior eta tabulated at {@code logLambdaGrid}, read from a
	 *          previous run, or {@code null}
	 */
	static VarianceModel initial(final ExpectedFluxConfig config,
		final double[] logLambdaGrid, final double[] etaPrior)
	{
		final int n = logLambdaGrid.length;
		final double[] eta = new double[n];
		final double[] varLss = new double[n];
		final double[] fudge = new double[n];
		final boolean[] valid = new boolean[n];

		if (config.isUseIvarAsWeight()) {
			Arrays.fill(eta, 1.0);
			Arrays.fill(valid, true);
		}
		else if (config.isUseConstantWeight()) {
			Arrays.fill(varLss, 1.0);
			Arrays.fill(valid, true);
		}
		else {
			Arrays.fill(varLss, VarianceFunctionEstimator.VAR_LSS_INITIAL);
			if (etaPrior != null) System.arraycopy(etaPrior, 0, eta, 0, n);
			else if (config.getFixedEta() != null) Arrays.fill(eta, config
				.getFixedEta());
			if (config.getFixedVarLss() != null) Arrays.fill(varLss, config
				.getFixedVarLss());
			if (config.getFixedFudge() != null) Arrays.fill(fudge, config
				.getFixedFudge());
		}
		return new VarianceModel(logLambdaGrid, eta, varLss, fudge, new long[n],
			valid, new double[n], true);
	}

	public double getEta(final double logLambda) {
		return etaFunction.value(logLambda);
	}

	public double getVarLss(final double logLambda) {
		return varLssFunction.value(logLambda);
	}

	public double getFudge(final double logLambda) {
		return fudgeFunction.value(logLambda);
	}

	public double[] getEta(final double[] logLambda) {
		return etaFunction.value(logLambda);
	}

	public double[] getVarLss(final double[] logLambda) {
		return varLssFunction.value(logLambda);
	}

	public double[] getFudge(final double[] logLambda) {
		return fudgeFunction.value(logLambda);
	}

	public double[] getNumPixels(final double[] logLambda) {
		return numPixelsFunction.value(logLambda);
	}

	public boolean[] getValidFit(final double[] logLambda) {
		final double[] v = validFitFunction.value(logLambda);
		final boolean[] out = new boolean[v.length];
		for (int i = 0; i < v.length; i++)
			out[i] = v[i] > 0.5;
		return out;
	}

	/** Centers of the variance bins */
	public double[] getLogLambdaGrid() {
		return logLambdaGrid.clone();
	}

	/** Fitted eta per bin, before interpolation */
	double[] getBinEta() {
		return eta.clone();
	}

	double[] getBinVarLss() {
		return varLss.clone();
	}

	double[] getBinFudge() {
		return fudge.clone();
	}

	long[] getBinNumPixels() {
		return numPixels.clone();
	}

	boolean[] getBinValidFit() {
		return validFit.clone();
	}

	/** Chi2 of the fit in every bin, zero before the first fit */
	public double[] getChi2() {
		return chi2.clone();
	}

	/**
	 * Total variance of every pixel of a forest for a given continuum. Pixels with
	 * zero inverse variance get an infinite or undefined variance; use
	 * {@link #weights(Forest, double[])} to stack.
	 */
	public double[] variance(final Forest forest, final double[] continuum) {
		final double[] logLambda = forest.getLogLambda();
		final double[] ivar = forest.getIvar();
		final double[] out = new double[ivar.length];
		for (int i = 0; i < ivar.length; i++) {
			final double varPipe = 1.0 / ivar[i] / (continuum[i] * continuum[i]);
			out[i] = etaFunction.value(logLambda[i]) * varPipe + varLssFunction
				.value(logLambda[i]) + fudgeFunction.value(logLambda[i]) / varPipe;
		}
		return out;
	}

	/**
	 * Inverse of {@link #variance(Forest, double[])}; zero for pixels with zero
	 * inverse variance or a variance that is not positive and finite.
	 */
	public double[] weights(final Forest forest, final double[] continuum) {
		final double[] variance = variance(forest, continuum);
		final double[] ivar = forest.getIvar();
		final double[] out = new double[variance.length];
		for (int i = 0; i < variance.length; i++) {
			final double v = variance[i];
			out[i] = (ivar[i] > 0 && v > 0 && !Double.isInfinite(v)) ? 1.0 / v
				: 0.0;
		}
		return out;
	}
}
