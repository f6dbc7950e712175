/**
 * Forest Deltas Fit
 * MeanContinuumEstimator.java
 * author: Rick Ziraldo, 2018
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package forestdeltas;

import java.util.List;

import org.apache.commons.math3.util.FastMath;
import org.scijava.log.LogService;

/**
 * Stacks {@code flux / continuum} of all the forests in rest-frame bins. Since
 * every continuum already carries the previous mean continuum, the stacked
 * ratio multiplies the previous function.
 */
class MeanContinuumEstimator {

	private final LogService log;
	private final WavelengthGrid grid;

	MeanContinuumEstimator(final LogService log, final WavelengthGrid grid) {
		this.log = log;
		this.grid = grid;
	}

	/**
	 * @return the updated mean continuum, normalized to mean one over the
	 *         rest-frame grid, or {@code previous} if no bin has weight
	 */
	MeanContinuum compute(final List<Forest> forests,
		final MeanContinuum previous, final VarianceModel varianceModel)
	{
		final double[] rest = grid.getLogLambdaRestFrameGrid();
		final double[] sum = new double[rest.length];
		final double[] weight = new double[rest.length];

		for (final Forest forest : forests) {
			if (!forest.hasContinuum()) continue;
			final int[] bins = grid.findRestFrameBins(forest.getLogLambda(), forest
				.getZ());
			final double[] flux = forest.getFlux();
			final double[] continuum = forest.getContinuum();
			final double[] w = varianceModel.weights(forest, continuum);
			for (int i = 0; i < bins.length; i++) {
				if (w[i] == 0.0) continue;
				sum[bins[i]] += flux[i] / continuum[i] * w[i];
				weight[bins[i]] += w[i];
			}
		}

		int used = 0;
		for (final double w : weight)
			if (w > 0) used++;
		if (used == 0) {
			log.warn("No rest-frame bin has weight, keeping the previous mean " +
				"continuum");
			return previous;
		}

		final double[] knots = new double[used];
		final double[] values = new double[used];
		final double[] weights = new double[used];
		int k = 0;
		for (int j = 0; j < rest.length; j++) {
			if (!(weight[j] > 0)) continue;
			knots[k] = rest[j];
			values[k] = previous.value(rest[j]) * sum[j] / weight[j];
			weights[k] = weight[j];
			k++;
		}
		final MeanContinuum updated = new MeanContinuum(knots, values, weights)
			.normalize(rest);
		log.debug(String.format("Mean continuum: %1$d of %2$d rest-frame bins, " +
			"range %3$.4f-%4$.4f", used, rest.length, FastMath.pow(10, knots[0]),
			FastMath.pow(10, knots[used - 1])));
		return updated;
	}
}
