/**
 * Forest Deltas Fit
 * ExpectedFluxEstimator.java
 * author: Rick Ziraldo, 2018
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package forestdeltas;

import java.io.File;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.time.StopWatch;
import org.scijava.Context;
import org.scijava.app.StatusService;
import org.scijava.log.LogService;
import org.scijava.plugin.Parameter;

import forestdeltas.ContinuumFitter.ContinuumFit;

/**
 * Iterative computation of the mean expected flux of a sample of forests.
 * <p>
 * Every iteration fits the continuum of each forest in parallel, then, on the
 * calling thread, updates the mean continuum and the variance functions from
 * all the successful fits, stacks {@code flux / continuum} and saves a
 * snapshot. After the last iteration the expected flux, weights and continuum
 * of every successful line of sight are available through {@link #getLosIds()}
 * and can be turned into deltas with {@link #extractDeltas(Forest)}.
 */
public class ExpectedFluxEstimator {

	@Parameter
	private LogService log;
	@Parameter
	private StatusService statusServ;

	private final WavelengthGrid grid;
	private final ExpectedFluxConfig config;
	private final double[] logLambdaVarFuncGrid;
	private final int numProcessors;

	private final ContinuumFitter continuumFitter;
	private final MeanContinuumEstimator meanContinuumEstimator;
	private final VarianceFunctionEstimator varianceFunctionEstimator;

	// Replaced wholesale between iterations, read-only during the fits
	private MeanContinuum meanContinuum;
	private VarianceModel varianceModel;
	private DeltaStack deltaStack;
	private IterationDiagnostics diagnostics;

	private final Map<Long, double[]> continuumFitParameters;
	private final Map<Long, LineOfSightExpectedFlux> losIds;

	/**
	 * @throws ExpectedFluxException if the grid is missing, the output folder
	 *           cannot be created or the eta file cannot be read
	 */
	public ExpectedFluxEstimator(final Context context,
		final WavelengthGrid grid, final ExpectedFluxConfig config)
	{
		context.inject(this);
		if (grid == null) throw new ExpectedFluxException(
			"The wavelength grid must be set before computing the expected flux");
		if (config == null) throw new ExpectedFluxException(
			"Missing expected flux configuration");
		this.grid = grid;
		this.config = config;
		this.logLambdaVarFuncGrid = grid.varianceFunctionGrid(config
			.getNumBinsVariance());
		this.numProcessors = config.getNumProcessors() > 0 ? config
			.getNumProcessors() : Math.max(1, Runtime.getRuntime()
				.availableProcessors() / 2);

		try {
			FileUtils.forceMkdir(config.getOutDir());
		}
		catch (final IOException e) {
			throw new ExpectedFluxException("Cannot create the output folder " +
				config.getOutDir(), e);
		}

		double[] etaPrior = null;
		if (config.getEtaFile() != null) {
			try {
				etaPrior = IterationDiagnostics.read(config.getEtaFile()).etaAt(
					logLambdaVarFuncGrid);
			}
			catch (final IOException e) {
				throw new ExpectedFluxException("Cannot read eta from " + config
					.getEtaFile(), e);
			}
			log.info("Eta read from " + config.getEtaFile());
		}

		this.continuumFitter = new ContinuumFitter(grid, config);
		this.meanContinuumEstimator = new MeanContinuumEstimator(log, grid);
		this.varianceFunctionEstimator = new VarianceFunctionEstimator(log, grid,
			logLambdaVarFuncGrid, config);

		this.meanContinuum = MeanContinuum.initial(grid);
		this.varianceModel = VarianceModel.initial(config, logLambdaVarFuncGrid,
			etaPrior);
		this.deltaStack = DeltaStack.initial(grid);
		this.continuumFitParameters = new LinkedHashMap<>();
		this.losIds = new LinkedHashMap<>();
	}

	/**
	 * Runs all the iterations over {@code forests}, storing the continuum of each
	 * forest, then fills the expected flux of every successful line of sight.
	 */
	public void computeExpectedFlux(final List<Forest> forests) {
		final int numIterations = config.getNumIterations();
		final StopWatch total = new StopWatch();
		total.start();
		for (int iteration = 0; iteration < numIterations; iteration++) {
			log.info("Continuum fitting: starting iteration " + iteration + " of " +
				numIterations);
			final StopWatch sw = new StopWatch();
			sw.start();

			fitContinua(forests);

			if (iteration < numIterations - 1) {
				meanContinuum = meanContinuumEstimator.compute(forests, meanContinuum,
					varianceModel);
				if (!config.isFixedWeightMode()) varianceModel =
					varianceFunctionEstimator.compute(forests, varianceModel);
			}

			computeDeltaStack(forests, false);

			saveIterationStep(iteration == numIterations - 1 ? -1 : iteration);

			log.info(String.format("Continuum fitting: ending iteration %1$d of " +
				"%2$d (%3$.1f s)", iteration, numIterations, sw.getTime() / 1000.0));
		}
		populateLosIds(forests);
		log.info(String.format("Time elapsed: %1$.1f s", total.getTime() /
			1000.0));
	}

	/**
	 * Fits every continuum against the current snapshots on a pool of
	 * {@code numProcessors} workers. The results are stored on the forests once
	 * all the fits are done.
	 */
	void fitContinua(final List<Forest> forests) {
		final MeanContinuum meanSnapshot = meanContinuum;
		final VarianceModel varianceSnapshot = varianceModel;
		final AtomicInteger progress = new AtomicInteger();
		final int size = forests.size();

		final List<ContinuumFit> fits;
		final ForkJoinPool pool = new ForkJoinPool(numProcessors);
		try {
			fits = pool.submit(() -> forests.parallelStream().map(f -> {
				final ContinuumFit fit = continuumFitter.fit(f, meanSnapshot,
					varianceSnapshot);
				statusServ.showProgress(progress.incrementAndGet(), size);
				return fit;
			}).collect(Collectors.toList())).get();
		}
		catch (final InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new ExpectedFluxException("Interrupted while fitting continua", e);
		}
		catch (final ExecutionException e) {
			throw new ExpectedFluxException("Continuum fit failed", e.getCause());
		}
		finally {
			pool.shutdown();
		}

		int failed = 0;
		for (int i = 0; i < size; i++) {
			final Forest forest = forests.get(i);
			final ContinuumFit fit = fits.get(i);
			fit.applyTo(forest);
			continuumFitParameters.put(forest.getLosId(), new double[] { fit
				.getAmplitude(), fit.getSlope() });
			if (!fit.isSuccessful()) {
				failed++;
				log.debug("Line of sight " + forest.getLosId() + ": " + fit
					.getBadContinuumReason());
			}
		}
		if (failed > 0) log.warn(failed + " of " + size +
			" continuum fits failed");
	}

	/**
	 * Recomputes the delta stack.
	 *
	 * @param fromDeltas stack the extracted deltas instead of
	 *          {@code flux / continuum}
	 */
	public DeltaStack computeDeltaStack(final List<Forest> forests,
		final boolean fromDeltas)
	{
		deltaStack = DeltaStack.compute(forests, varianceModel, grid, fromDeltas);
		return deltaStack;
	}

	/**
	 * Writes the snapshot of the current state, and its plots if enabled.
	 *
	 * @param iteration iteration index, or -1 for the final snapshot
	 */
	void saveIterationStep(final int iteration) {
		diagnostics = IterationDiagnostics.of(config.getOrder(), deltaStack,
			varianceModel, meanContinuum, grid);
		final String name = IterationDiagnostics.fileName(config
			.getIterOutPrefix(), iteration);
		final File file = new File(config.getOutDir(), name);
		try {
			diagnostics.write(file);
			log.info("Saved " + file);
			if (config.isPlotDiagnostics()) {
				new DiagnosticsPlotter().savePlots(diagnostics, config.getOutDir(), name
					.substring(0, name.length() - IterationDiagnostics.FILE_EXTENSION
						.length()));
			}
		}
		catch (final IOException e) {
			throw new ExpectedFluxException("Cannot write " + file, e);
		}
	}

	/** Fills the expected flux of every forest with a valid continuum */
	void populateLosIds(final List<Forest> forests) {
		losIds.clear();
		for (final Forest forest : forests) {
			if (!forest.hasContinuum()) continue;
			final double[] logLambda = forest.getLogLambda();
			final double[] continuum = forest.getContinuum();
			final double[] stack = deltaStack.value(logLambda);
			final double[] meanExpectedFlux = new double[continuum.length];
			for (int i = 0; i < continuum.length; i++)
				meanExpectedFlux[i] = continuum[i] * stack[i];
			final double[] weights = varianceModel.weights(forest, meanExpectedFlux);

			double[] ivar = null;
			if (forest.hasExposuresDiff()) {
				final double[] eta = varianceModel.getEta(logLambda);
				final double[] pipelineIvar = forest.getIvar();
				ivar = new double[pipelineIvar.length];
				for (int i = 0; i < ivar.length; i++)
					ivar[i] = pipelineIvar[i] / (eta[i] + (eta[i] == 0 ? 1 : 0)) *
						meanExpectedFlux[i] * meanExpectedFlux[i];
			}
			losIds.put(forest.getLosId(), new LineOfSightExpectedFlux(
				meanExpectedFlux, weights, continuum.clone(), ivar));
		}
		log.info(losIds.size() + " of " + forests.size() +
			" lines of sight with expected flux");
	}

	/**
	 * Stores {@code flux / meanExpectedFlux - 1} as the deltas of {@code forest},
	 * with the weights and the continuum. Forests without expected flux are left
	 * untouched.
	 *
	 * @return whether the forest had an expected flux
	 */
	public boolean extractDeltas(final Forest forest) {
		final LineOfSightExpectedFlux expected = losIds.get(forest.getLosId());
		if (expected == null) return false;
		final double[] meanExpectedFlux = expected.getMeanExpectedFlux();
		final double[] flux = forest.getFlux();
		final double[] deltas = new double[flux.length];
		for (int i = 0; i < flux.length; i++)
			deltas[i] = flux[i] / meanExpectedFlux[i] - 1;
		forest.setDeltas(deltas, expected.getWeights());
		forest.setContinuum(expected.getContinuum());
		if (forest.hasExposuresDiff()) {
			if (expected.hasIvar()) forest.setIvar(expected.getIvar());
			final double[] diff = forest.getExposuresDiff().clone();
			for (int i = 0; i < diff.length; i++)
				diff[i] /= meanExpectedFlux[i];
			forest.setExposuresDiff(diff);
		}
		return true;
	}

	/** Expected flux per line-of-sight id, after the last iteration */
	public Map<Long, LineOfSightExpectedFlux> getLosIds() {
		return Collections.unmodifiableMap(losIds);
	}

	/** (amplitude, slope) of the last continuum fit per line-of-sight id */
	public Map<Long, double[]> getContinuumFitParameters() {
		return Collections.unmodifiableMap(continuumFitParameters);
	}

	public MeanContinuum getMeanContinuum() {
		return meanContinuum;
	}

	public VarianceModel getVarianceModel() {
		return varianceModel;
	}

	public DeltaStack getDeltaStack() {
		return deltaStack;
	}

	/** Snapshot written last, {@code null} before the first iteration ends */
	public IterationDiagnostics getDiagnostics() {
		return diagnostics;
	}

	public double[] getLogLambdaVarFuncGrid() {
		return logLambdaVarFuncGrid.clone();
	}

	public ExpectedFluxConfig getConfig() {
		return config;
	}

	int getNumProcessors() {
		return numProcessors;
	}
}
