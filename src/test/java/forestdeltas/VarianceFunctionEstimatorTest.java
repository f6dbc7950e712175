/**
 * Forest Deltas Fit
 * VarianceFunctionEstimatorTest.java
 * author: Rick Ziraldo, 2018
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package forestdeltas;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.apache.commons.math3.util.FastMath;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.scijava.Context;
import org.scijava.log.LogService;

class VarianceFunctionEstimatorTest {

	private static final double ETA = 1.2;
	private static final double VAR_LSS = 0.05;
	private static final int[] CELLS = { 45, 50, 55, 60, 65, 70, 75, 80 };

	private final WavelengthGrid grid = SyntheticForests.grid();
	private Context context;
	private LogService log;

	@BeforeEach
	void setUp() {
		context = new Context(LogService.class);
		log = context.getService(LogService.class);
	}

	@AfterEach
	void tearDown() {
		context.dispose();
	}

	/**
	 * Forests with unit continuum whose pipeline variance sits at the center of
	 * one pipeline variance bin, and deltas of variance
	 * {@code ETA * varPipe + VAR_LSS}.
	 */
	private List<Forest> forests(final int n, final long seed) {
		final double[] varPipe = VarianceStatistics.varPipeBinCenters();
		final Random random = new Random(seed);
		final List<Forest> forests = new ArrayList<>();
		for (int f = 0; f < n; f++) {
			final double z = 2.4 + 0.6 * random.nextDouble();
			final double[] logLambda = SyntheticForests.pixels(grid, z);
			final double vp = varPipe[CELLS[f % CELLS.length]];
			final double sigma = FastMath.sqrt(ETA * vp + VAR_LSS);
			final double[] flux = new double[logLambda.length];
			final double[] ivar = new double[logLambda.length];
			final double[] continuum = new double[logLambda.length];
			for (int i = 0; i < flux.length; i++) {
				flux[i] = 1 + sigma * random.nextGaussian();
				ivar[i] = 1.0 / vp;
				continuum[i] = 1.0;
			}
			final Forest forest = new Forest(f + 1, 0, 0, z, logLambda, flux, ivar);
			forest.setContinuum(continuum);
			forests.add(forest);
		}
		return forests;
	}

	private static ExpectedFluxConfig.Builder options() {
		return ExpectedFluxConfig.builder().outDir(new File("target"))
			.numBinsVariance(10).minQsoPerVarianceCell(10);
	}

	private VarianceModel fit(final ExpectedFluxConfig config,
		final List<Forest> forests)
	{
		final double[] varGrid = grid.varianceFunctionGrid(config
			.getNumBinsVariance());
		final VarianceFunctionEstimator estimator = new VarianceFunctionEstimator(
			log, grid, varGrid, config);
		return estimator.compute(forests, VarianceModel.initial(config, varGrid,
			null));
	}

	@Test
	void testRecoversKnownVarianceFunctions() {
		final VarianceModel model = fit(options().build(), forests(400, 21));

		final long[] numPixels = model.getBinNumPixels();
		final boolean[] valid = model.getBinValidFit();
		final double[] eta = model.getBinEta();
		final double[] varLss = model.getBinVarLss();
		int checked = 0;
		for (int b = 0; b < numPixels.length; b++) {
			if (numPixels[b] <= 5000) continue;
			checked++;
			Assertions.assertTrue(valid[b], "bin " + b);
			Assertions.assertEquals(ETA, eta[b], 0.1, "eta in bin " + b);
			Assertions.assertEquals(VAR_LSS, varLss[b], 0.02, "var_lss in bin " + b);
			Assertions.assertTrue(model.getBinFudge()[b] >= 0);
		}
		Assertions.assertTrue(checked >= 2);
	}

	@Test
	void testModelledVarianceMatchesTruth() {
		final List<Forest> forests = forests(400, 22);
		final VarianceModel model = fit(options().build(), forests);

		final Forest forest = forests.get(3);
		final double vp = 1.0 / forest.getIvar()[0];
		final double[] variance = model.variance(forest, forest.getContinuum());
		final double[] numPixels = model.getNumPixels(forest.getLogLambda());
		final boolean[] valid = model.getValidFit(forest.getLogLambda());
		int checked = 0;
		for (int i = 0; i < variance.length; i++) {
			if (!valid[i] || numPixels[i] <= 5000) continue;
			checked++;
			Assertions.assertEquals(ETA * vp + VAR_LSS, variance[i], 0.25 * (ETA *
				vp + VAR_LSS));
		}
		Assertions.assertTrue(checked > 0);
	}

	@Test
	void testPipelineModeFreezesEverything() {
		final ExpectedFluxConfig config = options().useIvarAsWeight(true).build();
		final VarianceModel model = fit(config, forests(80, 23));
		for (int b = 0; b < config.getNumBinsVariance(); b++) {
			Assertions.assertEquals(1.0, model.getBinEta()[b], 0.0);
			Assertions.assertEquals(0.0, model.getBinVarLss()[b], 0.0);
			Assertions.assertEquals(0.0, model.getBinFudge()[b], 0.0);
		}
	}

	@Test
	void testConstantWeightModeFreezesEverything() {
		final ExpectedFluxConfig config = options().useConstantWeight(true)
			.build();
		final VarianceModel model = fit(config, forests(80, 24));
		for (int b = 0; b < config.getNumBinsVariance(); b++) {
			Assertions.assertEquals(0.0, model.getBinEta()[b], 0.0);
			Assertions.assertEquals(1.0, model.getBinVarLss()[b], 0.0);
			Assertions.assertEquals(0.0, model.getBinFudge()[b], 0.0);
		}
	}

	@Test
	void testFixedEtaIsKept() {
		final ExpectedFluxConfig config = options().fixedEta(1.1).build();
		final VarianceModel model = fit(config, forests(400, 25));
		final double[] eta = model.getBinEta();
		for (final double e : eta)
			Assertions.assertEquals(1.1, e, 0.0);
		// var_lss absorbs the difference at small pipeline variance
		final long[] numPixels = model.getBinNumPixels();
		for (int b = 0; b < eta.length; b++) {
			if (numPixels[b] > 5000) Assertions.assertTrue(model.getBinValidFit()[b]);
		}
	}

	@Test
	void testTooFewObjectsFallBackToDefaults() {
		final ExpectedFluxConfig config = options().minQsoPerVarianceCell(1000)
			.build();
		final VarianceModel model = fit(config, forests(40, 26));
		final long[] numPixels = model.getBinNumPixels();
		for (int b = 0; b < numPixels.length; b++) {
			Assertions.assertFalse(model.getBinValidFit()[b]);
			Assertions.assertEquals(VarianceFunctionEstimator.ETA_FIT_START, model
				.getBinEta()[b], 0.0);
			Assertions.assertEquals(VarianceFunctionEstimator.VAR_LSS_FIT_START, model
				.getBinVarLss()[b], 0.0);
			Assertions.assertEquals(VarianceStatistics.FUDGE_REF, model
				.getBinFudge()[b], 0.0);
		}
	}

	@Test
	void testNoPixelsKeepsPreviousModel() {
		final ExpectedFluxConfig config = options().build();
		final double[] varGrid = grid.varianceFunctionGrid(config
			.getNumBinsVariance());
		final VarianceModel previous = VarianceModel.initial(config, varGrid, null);
		final List<Forest> forests = new ArrayList<>();
		forests.add(SyntheticForests.zeroIvarForest(1, 2.5, grid));
		final VarianceModel model = new VarianceFunctionEstimator(log, grid,
			varGrid, config).compute(forests, previous);
		Assertions.assertSame(previous, model);
	}

	@Test
	void testEmptyBinsAreExcludedFromInterpolation() {
		final VarianceModel model = fit(options().build(), forests(400, 27));
		final long[] numPixels = model.getBinNumPixels();
		final double[] varGrid = model.getLogLambdaGrid();
		final double[] interpolated = model.getNumPixels(varGrid);
		for (int b = 0; b < numPixels.length; b++)
			Assertions.assertTrue(interpolated[b] > 0, Arrays.toString(interpolated));
	}
}
