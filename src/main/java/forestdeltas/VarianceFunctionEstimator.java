/**
 * Forest Deltas Fit
 * VarianceFunctionEstimator.java
 * author: Rick Ziraldo, 2018
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package forestdeltas;

import java.util.List;

import org.scijava.log.LogService;

/**
 * Fits eta, var_lss and fudge independently in every variance bin, against the
 * scatter statistics of {@link VarianceStatistics}. Each function can be
 * frozen, either by a weighting mode or by a fixed value; frozen functions keep
 * the value of the previous model.
 */
class VarianceFunctionEstimator {

	static final double ETA_FIT_START = 1.0;
	static final double VAR_LSS_FIT_START = 0.1;
	/** fudge start, in units of {@link VarianceStatistics#FUDGE_REF} */
	static final double FUDGE_FIT_START = 1.0;
	/** var_lss of the first continuum fits when it is fitted */
	static final double VAR_LSS_INITIAL = 0.2;

	private static final int ETA = 0;
	private static final int VAR_LSS = 1;
	private static final int FUDGE = 2;

	private final LogService log;
	private final WavelengthGrid grid;
	private final double[] logLambdaVarFuncGrid;
	private final double[] limitEta;
	private final double[] limitVarLss;
	private final int minQso;
	private final int maxIterations;
	private final boolean fitEta;
	private final boolean fitVarLss;
	private final boolean fitFudge;

	VarianceFunctionEstimator(final LogService log, final WavelengthGrid grid,
		final double[] logLambdaVarFuncGrid, final ExpectedFluxConfig config)
	{
		this.log = log;
		this.grid = grid;
		this.logLambdaVarFuncGrid = logLambdaVarFuncGrid.clone();
		this.limitEta = config.getLimitEta();
		this.limitVarLss = config.getLimitVarLss();
		this.minQso = config.getMinQsoPerVarianceCell();
		this.maxIterations = config.getMaxIterationsFit();
		final boolean fixedMode = config.isFixedWeightMode();
		this.fitEta = !fixedMode && config.getFixedEta() == null && config
			.getEtaFile() == null;
		this.fitVarLss = !fixedMode && config.getFixedVarLss() == null;
		this.fitFudge = !fixedMode && config.getFixedFudge() == null;
	}

	boolean isFitEta() {
		return fitEta;
	}

	boolean isFitVarLss() {
		return fitVarLss;
	}

	boolean isFitFudge() {
		return fitFudge;
	}

	/**
	 * Fits the variance functions over the forests with a valid continuum.
	 *
	 * @param previous model of the previous iteration, providing the frozen
	 *          values
	 * @return the new model, or {@code previous} if no bin received pixels
	 */
	VarianceModel compute(final List<Forest> forests,
		final VarianceModel previous)
	{
		final int n = logLambdaVarFuncGrid.length;
		final double[] eta = previous.getBinEta();
		final double[] varLss = previous.getBinVarLss();
		final double[] fudge = previous.getBinFudge();
		final long[] numPixels = new long[n];
		final boolean[] validFit = new boolean[n];
		final double[] chi2 = new double[n];

		final VarianceStatistics stats = new VarianceStatistics(forests, grid,
			logLambdaVarFuncGrid);

		log.info("Mean quantities in observer-frame");
		log.info(" loglam    eta      var_lss  fudge    chi2     num_pix valid_fit");
		for (int b = 0; b < n; b++) {
			BoundedLeastSquares solver = BoundedLeastSquares.create(3)
				.withStartPoint(fitEta ? ETA_FIT_START : eta[b], fitVarLss
					? VAR_LSS_FIT_START : varLss[b], fitFudge ? FUDGE_FIT_START
						: fudge[b] / VarianceStatistics.FUDGE_REF).withBounds(ETA,
							limitEta[0], limitEta[1]).withBounds(VAR_LSS, limitVarLss[0],
								limitVarLss[1]).withBounds(FUDGE, 0.0, Double.POSITIVE_INFINITY)
				.withMaxIterations(maxIterations);
			if (!fitEta) solver = solver.withFixed(ETA, eta[b]);
			if (!fitVarLss) solver = solver.withFixed(VAR_LSS, varLss[b]);
			if (!fitFudge) solver = solver.withFixed(FUDGE, fudge[b] /
				VarianceStatistics.FUDGE_REF);

			final BoundedLeastSquares.Result result = solver.fit(stats.residuals(b,
				minQso));
			if (result.isConverged()) {
				if (fitEta) eta[b] = result.getPoint(ETA);
				if (fitVarLss) varLss[b] = result.getPoint(VAR_LSS);
				if (fitFudge) fudge[b] = result.getPoint(FUDGE) *
					VarianceStatistics.FUDGE_REF;
				validFit[b] = true;
			}
			else {
				if (fitEta) eta[b] = ETA_FIT_START;
				if (fitVarLss) varLss[b] = VAR_LSS_FIT_START;
				if (fitFudge) fudge[b] = FUDGE_FIT_START *
					VarianceStatistics.FUDGE_REF;
				validFit[b] = false;
				log.debug("Variance bin " + b + ": " + result.getMessage());
			}
			numPixels[b] = stats.getNumPixels(b);
			chi2[b] = result.getCost();

			log.info(String.format(" %1$.3e %2$.2e %3$.2e %4$.2e %5$.2e %6$.2e %7$b",
				logLambdaVarFuncGrid[b], eta[b], varLss[b], fudge[b], chi2[b],
				(double) numPixels[b], validFit[b]));
		}

		boolean anyPixels = false;
		for (final long p : numPixels)
			if (p > 0) anyPixels = true;
		if (!anyPixels) {
			log.warn("No pixel within the variance bins, keeping the previous " +
				"variance functions");
			return previous;
		}
		return new VarianceModel(logLambdaVarFuncGrid, eta, varLss, fudge,
			numPixels, validFit, chi2, false);
	}
}
