/**
 * Forest Deltas Fit
 * BoundedLeastSquares.java
 * author: Rick Ziraldo, 2018
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 * The least-squares problem is solved with the Levenberg-Marquardt
 * implementation of the Apache Commons project
 *
 */

package forestdeltas;

import java.util.Arrays;

import org.apache.commons.math3.analysis.MultivariateMatrixFunction;
import org.apache.commons.math3.analysis.MultivariateVectorFunction;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.exception.NumberIsTooLargeException;
import org.apache.commons.math3.exception.OutOfRangeException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.FastMath;

/**
 * Bounded nonlinear least squares over a subset of the parameters.
 * <p>
 * Every parameter has a start value and a closed interval. Parameters can be
 * frozen: they keep their start value and do not appear as free dimensions of
 * the problem handed to the optimizer. The free parameters are kept inside
 * their bounds by a {@link ParameterValidator} that clamps them after every
 * step.
 * <p>
 * Instances are immutable; the {@code with*} methods return modified copies.
 */
class BoundedLeastSquares {

	/** Residuals of a model, as functions of the full parameter vector */
	interface Residuals {

		/** @return number of residuals */
		int getDimension();

		double[] value(double[] parameters);

		/** @return derivatives, one row per residual, one column per parameter */
		double[][] jacobian(double[] parameters);
	}

	static final int DEFAULT_MAX_ITERATIONS = 1000;

	private final double[] start;
	private final double[] lower;
	private final double[] upper;
	private final boolean[] active;
	/** Maximum number of iterations of the optimization algorithm. */
	private final int maxIter;

	private BoundedLeastSquares(final double[] start, final double[] lower,
		final double[] upper, final boolean[] active, final int maxIter)
	{
		this.start = start;
		this.lower = lower;
		this.upper = upper;
		this.active = active;
		this.maxIter = maxIter;
	}

	/**
	 * Creates a solver for {@code numParameters} unbounded free parameters
	 * starting at zero.
	 */
	static BoundedLeastSquares create(final int numParameters) {
		final double[] lo = new double[numParameters];
		final double[] hi = new double[numParameters];
		final boolean[] act = new boolean[numParameters];
		Arrays.fill(lo, Double.NEGATIVE_INFINITY);
		Arrays.fill(hi, Double.POSITIVE_INFINITY);
		Arrays.fill(act, true);
		return new BoundedLeastSquares(new double[numParameters], lo, hi, act,
			DEFAULT_MAX_ITERATIONS);
	}

	BoundedLeastSquares withStartPoint(final double... newStart) {
		if (newStart.length != start.length)
			throw new DimensionMismatchException(newStart.length, start.length);
		return new BoundedLeastSquares(newStart.clone(), lower, upper, active,
			maxIter);
	}

	BoundedLeastSquares withBounds(final int index, final double min,
		final double max)
	{
		if (min > max) throw new NumberIsTooLargeException(min, max, true);
		final double[] lo = lower.clone();
		final double[] hi = upper.clone();
		lo[index] = min;
		hi[index] = max;
		return new BoundedLeastSquares(start, lo, hi, active, maxIter);
	}

	/** Freezes parameter {@code index} at {@code value} */
	BoundedLeastSquares withFixed(final int index, final double value) {
		final double[] st = start.clone();
		final boolean[] act = active.clone();
		st[index] = value;
		act[index] = false;
		return new BoundedLeastSquares(st, lower, upper, act, maxIter);
	}

	BoundedLeastSquares withMaxIterations(final int newMaxIter) {
		return new BoundedLeastSquares(start, lower, upper, active, newMaxIter);
	}

	int getNumFreeParameters() {
		return freeIndices().length;
	}

	boolean isFree(final int index) {
		return active[index];
	}

	/**
	 * Minimizes the sum of the squared residuals.
	 *
	 * @return the best point found, never {@code null}; check
	 *         {@link Result#isConverged()}
	 */
	Result fit(final Residuals residuals) {
		final int[] free = freeIndices();
		final double[] startPoint = clamp(start);
		if (free.length == 0) {
			final double cost = sumOfSquares(residuals.value(startPoint));
			return new Result(startPoint, cost, 0, !Double.isNaN(cost),
				"no free parameters");
		}
		if (residuals.getDimension() < free.length) {
			return new Result(startPoint, Double.NaN, 0, false,
				"fewer residuals (" + residuals.getDimension() +
					") than free parameters (" + free.length + ")");
		}

		final MultivariateVectorFunction model = point -> residuals.value(expand(
			point, free));
		final MultivariateMatrixFunction jacobian = point -> {
			final double[][] full = residuals.jacobian(expand(point, free));
			final double[][] sub = new double[full.length][free.length];
			for (int r = 0; r < full.length; r++) {
				for (int c = 0; c < free.length; c++)
					sub[r][c] = full[r][free[c]];
			}
			return sub;
		};

		final double[] freeStart = new double[free.length];
		for (int i = 0; i < free.length; i++)
			freeStart[i] = startPoint[free[i]];

		final LeastSquaresProblem problem = new LeastSquaresBuilder()
			.parameterValidator(new BoundsValidator(free)).maxEvaluations(
				Integer.MAX_VALUE).maxIterations(maxIter).lazyEvaluation(false).start(
					freeStart).target(new double[residuals.getDimension()]).model(model,
						jacobian).build();

		try {
			final LeastSquaresOptimizer.Optimum optimum = getOptimizer().optimize(
				problem);
			final double[] point = clamp(expand(optimum.getPoint().toArray(),
				free));
			final double cost = sumOfSquares(optimum.getResiduals().toArray());
			final boolean finite = isFinite(point) && isFinite(cost);
			return new Result(point, cost, optimum.getIterations(), finite,
				finite ? "converged" : "non-finite optimum");
		}
		catch (final MathIllegalStateException e) {
			return new Result(startPoint, Double.NaN, maxIter, false, e
				.getMessage());
		}
	}

	protected LeastSquaresOptimizer getOptimizer() {
		return new LevenbergMarquardtOptimizer();
	}

	private int[] freeIndices() {
		int count = 0;
		for (final boolean a : active)
			if (a) count++;
		final int[] free = new int[count];
		int f = 0;
		for (int i = 0; i < active.length; i++)
			if (active[i]) free[f++] = i;
		return free;
	}

	private double[] expand(final double[] freePoint, final int[] free) {
		final double[] full = start.clone();
		for (int i = 0; i < free.length; i++)
			full[free[i]] = freePoint[i];
		return full;
	}

	/** Frozen parameters are left as given */
	private double[] clamp(final double[] point) {
		final double[] out = point.clone();
		for (int i = 0; i < out.length; i++) {
			if (active[i]) out[i] = FastMath.min(FastMath.max(out[i], lower[i]),
				upper[i]);
		}
		return out;
	}

	static double sumOfSquares(final double[] values) {
		double sum = 0.0;
		for (final double v : values)
			sum += v * v;
		return sum;
	}

	private static boolean isFinite(final double value) {
		return !Double.isNaN(value) && !Double.isInfinite(value);
	}

	private static boolean isFinite(final double[] values) {
		for (final double v : values)
			if (!isFinite(v)) return false;
		return true;
	}

	/**
	 * Keeps the free parameters within their bounds.
	 */
	private class BoundsValidator implements ParameterValidator {

		private final int[] free;

		private BoundsValidator(final int[] free) {
			this.free = free;
		}

		@Override
		public RealVector validate(final RealVector params) {
			final RealVector out = new ArrayRealVector(params);
			for (int i = 0; i < free.length; i++) {
				final double v = params.getEntry(i);
				if (v < lower[free[i]]) out.setEntry(i, lower[free[i]]);
				else if (v > upper[free[i]]) out.setEntry(i, upper[free[i]]);
			}
			return out;
		}
	}

	/** Outcome of a fit */
	static class Result {

		private final double[] point;
		private final double cost;
		private final int iterations;
		private final boolean converged;
		private final String message;

		Result(final double[] point, final double cost, final int iterations,
			final boolean converged, final String message)
		{
			this.point = point;
			this.cost = cost;
			this.iterations = iterations;
			this.converged = converged;
			this.message = message;
		}

		/** Full parameter vector, frozen parameters included */
		double[] getPoint() {
			return point.clone();
		}

		double getPoint(final int index) {
			if (index < 0 || index >= point.length)
				throw new OutOfRangeException(index, 0, point.length - 1);
			return point[index];
		}

		/** Sum of the squared residuals at {@link #getPoint()} */
		double getCost() {
			return cost;
		}

		int getIterations() {
			return iterations;
		}

		boolean isConverged() {
			return converged;
		}

		String getMessage() {
			return message;
		}
	}
}
