/**
 * Forest Deltas Fit
 * ExpectedFluxEstimatorTest.java
 * author: Rick Ziraldo, 2018
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package forestdeltas;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.scijava.Context;
import org.scijava.app.StatusService;
import org.scijava.log.LogService;

class ExpectedFluxEstimatorTest {

	@TempDir
	File tmp;

	private final WavelengthGrid grid = SyntheticForests.grid();
	private Context context;

	@BeforeEach
	void setUp() {
		context = new Context(LogService.class, StatusService.class);
	}

	@AfterEach
	void tearDown() {
		context.dispose();
	}

	private ExpectedFluxConfig.Builder options() {
		return ExpectedFluxConfig.builder().outDir(tmp).numIterations(3)
			.numBinsVariance(10).minQsoPerVarianceCell(5).numProcessors(2);
	}

	private ExpectedFluxEstimator run(final ExpectedFluxConfig config,
		final List<Forest> forests)
	{
		final ExpectedFluxEstimator estimator = new ExpectedFluxEstimator(context,
			grid, config);
		estimator.computeExpectedFlux(forests);
		return estimator;
	}

	@Test
	void testEndToEnd() throws IOException {
		final List<Forest> forests = SyntheticForests.sample(60, grid, true, 0.05,
			31);
		final ExpectedFluxEstimator estimator = run(options().build(), forests);

		Assertions.assertTrue(new File(tmp, "delta_attributes_iteration1.tsv")
			.isFile());
		Assertions.assertTrue(new File(tmp, "delta_attributes_iteration2.tsv")
			.isFile());
		Assertions.assertFalse(new File(tmp, "delta_attributes_iteration3.tsv")
			.exists());
		Assertions.assertTrue(new File(tmp, "delta_attributes.tsv").isFile());

		final Map<Long, LineOfSightExpectedFlux> losIds = estimator.getLosIds();
		Assertions.assertEquals(forests.size(), losIds.size());
		Assertions.assertEquals(forests.size(), estimator
			.getContinuumFitParameters().size());
		for (final Forest forest : forests) {
			Assertions.assertTrue(forest.hasContinuum(), forest.toString());
			final LineOfSightExpectedFlux expected = losIds.get(forest.getLosId());
			Assertions.assertFalse(expected.hasIvar());
			for (final double c : expected.getContinuum())
				Assertions.assertTrue(c > 0);
			for (final double w : expected.getWeights())
				Assertions.assertTrue(w >= 0);
			Assertions.assertEquals(forest.size(), expected.getMeanExpectedFlux()
				.length);
		}

		// the mean continuum follows the true shape
		final double[] rest = grid.getLogLambdaRestFrameGrid();
		final MeanContinuum truth = new MeanContinuum(rest, shape(rest),
			new double[rest.length]).normalize(rest);
		for (int j = 5; j < rest.length - 5; j++)
			Assertions.assertEquals(truth.value(rest[j]), estimator.getMeanContinuum()
				.value(rest[j]), 0.05);
	}

	private static double[] shape(final double[] rest) {
		final double[] values = new double[rest.length];
		for (int j = 0; j < rest.length; j++)
			values[j] = SyntheticForests.shape(rest[j]);
		return values;
	}

	@Test
	void testMeanContinuumIsNormalizedAtEveryIteration() throws IOException {
		run(options().numIterations(4).build(), SyntheticForests.sample(30, grid,
			true, 0.05, 32));
		for (final String name : new String[] { "delta_attributes_iteration1.tsv",
			"delta_attributes_iteration2.tsv", "delta_attributes_iteration3.tsv",
			"delta_attributes.tsv" })
		{
			final IterationDiagnostics d = IterationDiagnostics.read(new File(tmp,
				name));
			Assertions.assertEquals(1.0, new Mean().evaluate(d.getMeanCont()), 1e-9,
				name);
		}
	}

	@Test
	void testFinalDiagnosticsRoundTrip() throws IOException {
		final ExpectedFluxEstimator estimator = run(options().build(),
			SyntheticForests.sample(30, grid, false, 0.05, 33));
		final IterationDiagnostics read = IterationDiagnostics.read(new File(tmp,
			"delta_attributes.tsv"));
		Assertions.assertArrayEquals(estimator.getDiagnostics().getEta(), read
			.getEta());
		Assertions.assertArrayEquals(estimator.getDiagnostics().getChi2(), read
			.getChi2());
		Assertions.assertArrayEquals(estimator.getLogLambdaVarFuncGrid(), read
			.getVarLogLambda());
		Assertions.assertEquals(10, estimator.getConfig().getNumBinsVariance());

		final VarianceModel model = estimator.getVarianceModel();
		final DeltaStack stack = estimator.getDeltaStack();
		final double[] rest = grid.getLogLambdaRestFrameGrid();
		Assertions.assertEquals(1, read.getOrder());
		Assertions.assertArrayEquals(stack.getLogLambdaGrid(), read
			.getStackLogLambda());
		Assertions.assertArrayEquals(stack.getStack(), read.getStack());
		Assertions.assertArrayEquals(stack.getWeight(), read.getStackWeight());
		Assertions.assertArrayEquals(model.getLogLambdaGrid(), read
			.getVarLogLambda());
		Assertions.assertArrayEquals(model.getBinEta(), read.getEta());
		Assertions.assertArrayEquals(model.getBinVarLss(), read.getVarLss());
		Assertions.assertArrayEquals(model.getBinFudge(), read.getFudge());
		Assertions.assertArrayEquals(model.getBinNumPixels(), read.getNumPixels());
		Assertions.assertArrayEquals(model.getBinValidFit(), read.getValidFit());
		Assertions.assertArrayEquals(estimator.getMeanContinuum().value(rest), read
			.getMeanCont());
		Assertions.assertArrayEquals(estimator.getMeanContinuum().weight(rest), read
			.getContWeight());
	}

	@Test
	void testZeroIvarForestIsExcluded() {
		final List<Forest> forests = new ArrayList<>();
		forests.add(SyntheticForests.forest(1, 2.6, grid, 1.5, false, 0.05,
			new Random(34)));
		forests.add(SyntheticForests.zeroIvarForest(2, 2.6, grid));
		final ExpectedFluxEstimator estimator = run(options().numIterations(2)
			.build(), forests);

		final Forest bad = forests.get(1);
		Assertions.assertFalse(bad.hasContinuum());
		Assertions.assertNotNull(bad.getBadContinuumReason());
		Assertions.assertFalse(estimator.getLosIds().containsKey(2L));
		final double[] params = estimator.getContinuumFitParameters().get(2L);
		Assertions.assertTrue(Double.isNaN(params[0]));
		Assertions.assertTrue(Double.isNaN(params[1]));

		Assertions.assertTrue(forests.get(0).hasContinuum());
		Assertions.assertTrue(estimator.getLosIds().containsKey(1L));
		Assertions.assertEquals(1.5, estimator.getContinuumFitParameters().get(
			1L)[0], 0.05);
		Assertions.assertFalse(estimator.extractDeltas(bad));
		Assertions.assertNull(bad.getDeltas());
	}

	@Test
	void testExtractDeltas() {
		final List<Forest> forests = SyntheticForests.sample(40, grid, true, 0.05,
			35);
		final ExpectedFluxEstimator estimator = run(options().build(), forests);

		double sum = 0;
		double weights = 0;
		for (final Forest forest : forests) {
			Assertions.assertTrue(estimator.extractDeltas(forest));
			final double[] deltas = forest.getDeltas();
			final double[] w = forest.getWeights();
			final double[] mef = estimator.getLosIds().get(forest.getLosId())
				.getMeanExpectedFlux();
			for (int i = 0; i < deltas.length; i++) {
				Assertions.assertEquals(forest.getFlux()[i] / mef[i] - 1, deltas[i],
					1e-12);
				sum += deltas[i] * w[i];
				weights += w[i];
			}
		}
		Assertions.assertEquals(0.0, sum / weights, 0.01);

		final DeltaStack stack = estimator.computeDeltaStack(forests, true);
		for (final double v : stack.getStack())
			Assertions.assertTrue(Math.abs(v) < 0.2);
	}

	@Test
	void testExposureDifferences() {
		final Forest plain = SyntheticForests.forest(100, 2.5, grid, 1.0, false,
			0.05, new Random(36));
		final double[] diff = new double[plain.size()];
		for (int i = 0; i < diff.length; i++)
			diff[i] = 0.01 * (i % 3 - 1);
		final Forest forest = new Forest(100, 0, 0, 2.5, plain.getLogLambda(), plain
			.getFlux(), plain.getIvar(), diff, null);
		final double[] ivar = forest.getIvar().clone();
		final List<Forest> forests = new ArrayList<>();
		forests.add(forest);
		forests.addAll(SyntheticForests.sample(10, grid, false, 0.05, 37));

		final ExpectedFluxEstimator estimator = run(options().useIvarAsWeight(true)
			.numIterations(2).build(), forests);
		final LineOfSightExpectedFlux expected = estimator.getLosIds().get(100L);
		Assertions.assertTrue(expected.hasIvar());
		final double[] mef = expected.getMeanExpectedFlux();
		// eta is one in pipeline mode
		for (int i = 0; i < mef.length; i++)
			Assertions.assertEquals(ivar[i] * mef[i] * mef[i], expected.getIvar()[i],
				1e-9 * ivar[i]);

		estimator.extractDeltas(forest);
		Assertions.assertArrayEquals(expected.getIvar(), forest.getIvar());
		for (int i = 0; i < diff.length; i++)
			Assertions.assertEquals(diff[i] / mef[i], forest.getExposuresDiff()[i],
				1e-15);
	}

	@Test
	void testPipelineModeKeepsVarianceFunctions() {
		final ExpectedFluxEstimator estimator = run(options().useIvarAsWeight(true)
			.build(), SyntheticForests.sample(20, grid, false, 0.05, 38));
		final VarianceModel model = estimator.getVarianceModel();
		for (int b = 0; b < model.getBinEta().length; b++) {
			Assertions.assertEquals(1.0, model.getBinEta()[b], 0.0);
			Assertions.assertEquals(0.0, model.getBinVarLss()[b], 0.0);
			Assertions.assertEquals(0.0, model.getBinFudge()[b], 0.0);
		}
	}

	@Test
	void testConstantWeightModeKeepsVarianceFunctions() {
		final ExpectedFluxEstimator estimator = run(options().useConstantWeight(
			true).build(), SyntheticForests.sample(20, grid, false, 0.05, 39));
		final VarianceModel model = estimator.getVarianceModel();
		for (int b = 0; b < model.getBinEta().length; b++) {
			Assertions.assertEquals(0.0, model.getBinEta()[b], 0.0);
			Assertions.assertEquals(1.0, model.getBinVarLss()[b], 0.0);
			Assertions.assertEquals(0.0, model.getBinFudge()[b], 0.0);
		}
	}

	@Test
	void testEtaReadFromPreviousRun() throws IOException {
		final List<Forest> forests = SyntheticForests.sample(30, grid, false, 0.05,
			40);
		run(options().build(), forests);
		final File previous = new File(tmp, "delta_attributes.tsv");
		final double[] eta = IterationDiagnostics.read(previous).getEta();

		final ExpectedFluxEstimator second = run(options().iterOutPrefix("second")
			.etaFile(previous).build(), SyntheticForests.sample(30, grid, false,
				0.05, 41));
		Assertions.assertArrayEquals(eta, second.getVarianceModel().getBinEta());
	}

	@Test
	void testOrderZero() {
		final ExpectedFluxEstimator estimator = run(options().order(0)
			.numIterations(2).build(), SyntheticForests.sample(10, grid, false, 0.05,
				42));
		for (final double[] p : estimator.getContinuumFitParameters().values())
			Assertions.assertEquals(0.0, p[1], 0.0);
	}

	@Test
	void testMissingGrid() {
		final ExpectedFluxConfig config = options().build();
		Assertions.assertThrows(ExpectedFluxException.class,
			() -> new ExpectedFluxEstimator(context, null, config));
	}

	@Test
	void testDefaultProcessors() {
		final ExpectedFluxEstimator estimator = new ExpectedFluxEstimator(context,
			grid, options().numProcessors(0).build());
		Assertions.assertTrue(estimator.getNumProcessors() >= 1);
	}
}
