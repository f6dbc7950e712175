/**
 * Forest Deltas Fit
 * ContinuumFitter.java
 * author: Rick Ziraldo, 2018
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package forestdeltas;

import org.apache.commons.math3.util.FastMath;

/**
 * Fits the unabsorbed continuum of a single line of sight as
 *
 * <pre>
 * continuum(x) = (a + b * (x - xMin) / (xMax - xMin)) * meanContinuum(x - log10(1 + z))
 * </pre>
 *
 * minimizing the sum of {@code w (flux - continuum)^2}, where the weights are
 * computed from the variance model with the trial continuum. The fitter only
 * reads its arguments: the outcome is returned as a {@link ContinuumFit} and
 * applied to the forest by the caller.
 */
class ContinuumFitter {

	static final String DID_NOT_CONVERGE = "did not converge";
	static final String NEGATIVE_CONTINUUM = "negative continuum";

	private static final int AMPLITUDE = 0;
	private static final int SLOPE = 1;

	private final WavelengthGrid grid;
	private final int order;
	private final boolean useConstantWeight;
	private final int maxIterations;

	ContinuumFitter(final WavelengthGrid grid, final ExpectedFluxConfig config) {
		this.grid = grid;
		this.order = config.getOrder();
		this.useConstantWeight = config.isUseConstantWeight();
		this.maxIterations = config.getMaxIterationsFit();
	}

	/**
	 * Fits the continuum of {@code forest} against immutable snapshots of the
	 * current mean continuum and variance model.
	 */
	ContinuumFit fit(final Forest forest, final MeanContinuum meanContinuum,
		final VarianceModel varianceModel)
	{
		final double[] logLambda = forest.getLogLambda();
		final double[] flux = forest.getFlux();
		final double[] ivar = forest.getIvar();
		final int n = flux.length;

		final double[] rest = grid.getLogLambdaRestFrameGrid();
		final double shift = FastMath.log10(1 + forest.getZ());
		final double xMin = rest[0] + shift;
		final double xMax = rest[rest.length - 1] + shift;
		final double span = xMax > xMin ? xMax - xMin : 1.0;

		final double[] meanCont = new double[n];
		final double[] poly = new double[n];
		for (int i = 0; i < n; i++) {
			meanCont[i] = meanContinuum.value(logLambda[i] - shift);
			poly[i] = (logLambda[i] - xMin) / span;
		}

		double sumFluxIvar = 0;
		double sumIvar = 0;
		for (int i = 0; i < n; i++) {
			sumFluxIvar += flux[i] * ivar[i];
			sumIvar += ivar[i];
		}
		final double a0 = sumFluxIvar / sumIvar;
		if (Double.isNaN(a0) || Double.isInfinite(a0)) return ContinuumFit.failed(
			forest.getLosId(), DID_NOT_CONVERGE);

		final ForestResiduals residuals = new ForestResiduals(flux, ivar, meanCont,
			poly, varianceModel.getEta(logLambda), varianceModel.getVarLss(
				logLambda), varianceModel.getFudge(logLambda), useConstantWeight);

		BoundedLeastSquares solver = BoundedLeastSquares.create(2).withStartPoint(
			a0, 0.0).withMaxIterations(maxIterations);
		if (order == 0) solver = solver.withFixed(SLOPE, 0.0);
		final BoundedLeastSquares.Result result = solver.fit(residuals);
		if (!result.isConverged()) return ContinuumFit.failed(forest.getLosId(),
			DID_NOT_CONVERGE);

		final double a = result.getPoint(AMPLITUDE);
		final double b = result.getPoint(SLOPE);
		final double[] continuum = residuals.model(a, b);
		for (final double c : continuum) {
			if (!(c > 0)) return ContinuumFit.failed(forest.getLosId(),
				NEGATIVE_CONTINUUM);
		}
		return new ContinuumFit(forest.getLosId(), a, b, continuum, null);
	}

	/**
	 * Weighted residuals {@code sqrt(w) (flux - model)} of one forest. The weight
	 * of a pixel is {@code ivar / (eta + varLss m^2 ivar + fudge ivar^2 m^4)},
	 * i.e. {@code 1 / (m^2 variance)}, and zero where {@code ivar} is zero.
	 */
	static class ForestResiduals implements BoundedLeastSquares.Residuals {

		private final double[] flux;
		private final double[] ivar;
		private final double[] meanCont;
		private final double[] poly;
		private final double[] eta;
		private final double[] varLss;
		private final double[] fudge;
		private final boolean constantWeight;

		ForestResiduals(final double[] flux, final double[] ivar,
			final double[] meanCont, final double[] poly, final double[] eta,
			final double[] varLss, final double[] fudge,
			final boolean constantWeight)
		{
			this.flux = flux;
			this.ivar = ivar;
			this.meanCont = meanCont;
			this.poly = poly;
			this.eta = eta;
			this.varLss = varLss;
			this.fudge = fudge;
			this.constantWeight = constantWeight;
		}

		@Override
		public int getDimension() {
			return flux.length;
		}

		double[] model(final double a, final double b) {
			final double[] m = new double[flux.length];
			for (int i = 0; i < m.length; i++)
				m[i] = (a + b * poly[i]) * meanCont[i];
			return m;
		}

		/** Weight of pixel {@code i} for the trial continuum {@code m} */
		double weight(final int i, final double m) {
			if (constantWeight) return 1.0;
			if (!(ivar[i] > 0)) return 0.0;
			final double m2 = m * m;
			final double d = eta[i] + varLss[i] * m2 * ivar[i] + fudge[i] * ivar[i] *
				ivar[i] * m2 * m2;
			if (!(d > 0) || Double.isInfinite(d)) return 0.0;
			return ivar[i] / d;
		}

		@Override
		public double[] value(final double[] p) {
			final double[] m = model(p[AMPLITUDE], p[SLOPE]);
			final double[] r = new double[m.length];
			for (int i = 0; i < r.length; i++)
				r[i] = FastMath.sqrt(weight(i, m[i])) * (flux[i] - m[i]);
			return r;
		}

		@Override
		public double[][] jacobian(final double[] p) {
			final double[] m = model(p[AMPLITUDE], p[SLOPE]);
			final double[][] jac = new double[m.length][2];
			for (int i = 0; i < m.length; i++) {
				final double w = weight(i, m[i]);
				final double dr;
				if (constantWeight) dr = -1.0;
				else if (w == 0.0) dr = 0.0;
				else {
					// d sqrt(w)/dm = -sqrt(w) * w / ivar * dD/dm / 2
					final double m2 = m[i] * m[i];
					final double dD = 2 * varLss[i] * m[i] * ivar[i] + 4 * fudge[i] *
						ivar[i] * ivar[i] * m2 * m[i];
					final double sqrtW = FastMath.sqrt(w);
					final double dSqrtW = -0.5 * sqrtW * w / ivar[i] * dD;
					dr = dSqrtW * (flux[i] - m[i]) - sqrtW;
				}
				jac[i][AMPLITUDE] = dr * meanCont[i];
				jac[i][SLOPE] = dr * meanCont[i] * poly[i];
			}
			return jac;
		}
	}

	/**
	 * Outcome of the continuum fit of one line of sight. Immutable.
	 */
	static final class ContinuumFit {

		private final long losId;
		private final double amplitude;
		private final double slope;
		private final double[] continuum;
		private final String badContinuumReason;

		ContinuumFit(final long losId, final double amplitude, final double slope,
			final double[] continuum, final String badContinuumReason)
		{
			this.losId = losId;
			this.amplitude = amplitude;
			this.slope = slope;
			this.continuum = continuum;
			this.badContinuumReason = badContinuumReason;
		}

		static ContinuumFit failed(final long losId, final String reason) {
			return new ContinuumFit(losId, Double.NaN, Double.NaN, null, reason);
		}

		long getLosId() {
			return losId;
		}

		double getAmplitude() {
			return amplitude;
		}

		double getSlope() {
			return slope;
		}

		boolean isSuccessful() {
			return continuum != null;
		}

		String getBadContinuumReason() {
			return badContinuumReason;
		}

		double[] getContinuum() {
			return continuum;
		}

		/** Stores the outcome on {@code forest} */
		void applyTo(final Forest forest) {
			if (continuum != null) forest.setContinuum(continuum.clone());
			else forest.setBadContinuum(badContinuumReason);
		}
	}
}
