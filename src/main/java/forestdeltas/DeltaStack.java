/**
 * Forest Deltas Fit
 * DeltaStack.java
 * author: Rick Ziraldo, 2018
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package forestdeltas;

import java.util.Arrays;
import java.util.List;

import org.apache.commons.math3.exception.DimensionMismatchException;

/**
 * Weighted mean of the deltas in observed-frame bins. During the iterations the
 * stacked quantity is {@code flux / continuum}, after the deltas are extracted
 * it is the deltas themselves. Immutable.
 */
public final class DeltaStack {

	private final double[] logLambdaGrid;
	private final double[] stack;
	private final double[] weight;
	private final TabulatedFunction stackFunction;
	private final TabulatedFunction weightFunction;

	/**
	 * @param neutral value of the stack everywhere when no bin has weight
	 */
	DeltaStack(final double[] logLambdaGrid, final double[] stack,
		final double[] weight, final double neutral)
	{
		if (stack.length != logLambdaGrid.length)
			throw new DimensionMismatchException(stack.length, logLambdaGrid.length);
		if (weight.length != logLambdaGrid.length)
			throw new DimensionMismatchException(weight.length, logLambdaGrid.length);
		this.logLambdaGrid = logLambdaGrid.clone();
		this.stack = stack.clone();
		this.weight = weight.clone();

		int used = 0;
		for (final double w : weight)
			if (w > 0) used++;
		if (used == 0) {
			stackFunction = TabulatedFunction.constant(this.logLambdaGrid, neutral);
			weightFunction = TabulatedFunction.constant(this.logLambdaGrid, 0.0);
			return;
		}
		final double[] x = new double[used];
		final double[] s = new double[used];
		final double[] w = new double[used];
		int k = 0;
		for (int i = 0; i < weight.length; i++) {
			if (!(weight[i] > 0)) continue;
			x[k] = logLambdaGrid[i];
			s[k] = stack[i];
			w[k] = weight[i];
			k++;
		}
		stackFunction = TabulatedFunction.nearest(x, s);
		weightFunction = TabulatedFunction.nearestOrZero(x, w);
	}

	/** Stack before the first iteration: one everywhere */
	static DeltaStack initial(final WavelengthGrid grid) {
		final double[] ones = new double[grid.size()];
		Arrays.fill(ones, 1.0);
		return new DeltaStack(grid.getLogLambdaGrid(), ones, new double[grid
			.size()], 1.0);
	}

	/**
	 * Stacks the forests on the observed grid.
	 *
	 * @param fromDeltas stack the extracted deltas with their weights instead of
	 *          {@code flux / continuum}
	 */
	public static DeltaStack compute(final List<Forest> forests,
		final VarianceModel varianceModel, final WavelengthGrid grid,
		final boolean fromDeltas)
	{
		final int n = grid.size();
		final double[] stack = new double[n];
		final double[] weight = new double[n];
		for (final Forest forest : forests) {
			final double[] values;
			final double[] w;
			if (fromDeltas) {
				if (forest.getDeltas() == null) continue;
				values = forest.getDeltas();
				w = forest.getWeights();
			}
			else {
				if (!forest.hasContinuum()) continue;
				final double[] flux = forest.getFlux();
				final double[] continuum = forest.getContinuum();
				values = new double[flux.length];
				for (int i = 0; i < flux.length; i++)
					values[i] = flux[i] / continuum[i];
				w = varianceModel.weights(forest, continuum);
			}
			final int[] bins = grid.findBins(forest.getLogLambda());
			for (int i = 0; i < bins.length; i++) {
				if (!(w[i] > 0)) continue;
				stack[bins[i]] += values[i] * w[i];
				weight[bins[i]] += w[i];
			}
		}
		for (int j = 0; j < n; j++) {
			if (weight[j] > 0) stack[j] /= weight[j];
			else stack[j] = 0.0;
		}
		return new DeltaStack(grid.getLogLambdaGrid(), stack, weight, fromDeltas
			? 0.0 : 1.0);
	}

	public double value(final double logLambda) {
		return stackFunction.value(logLambda);
	}

	public double[] value(final double[] logLambda) {
		return stackFunction.value(logLambda);
	}

	public double weight(final double logLambda) {
		return weightFunction.value(logLambda);
	}

	public double[] getLogLambdaGrid() {
		return logLambdaGrid.clone();
	}

	/** Stacked value per observed bin, 0 in bins without weight */
	public double[] getStack() {
		return stack.clone();
	}

	public double[] getWeight() {
		return weight.clone();
	}
}
