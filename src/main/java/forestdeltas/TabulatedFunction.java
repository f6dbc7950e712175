/**
 * Forest Deltas Fit
 * TabulatedFunction.java
 * author: Rick Ziraldo, 2018
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package forestdeltas;

import java.util.Arrays;

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NoDataException;

/**
 * Function tabulated at increasing knots, either nearest-neighbour or linearly
 * interpolated. Outside the knot range the function is either held at the end
 * values or zero.
 */
final class TabulatedFunction implements UnivariateFunction {

	private final double[] knots;
	private final double[] values;
	private final boolean nearest;
	private final boolean zeroOutside;
	private final PolynomialSplineFunction spline;

	private TabulatedFunction(final double[] knots, final double[] values,
		final boolean nearest, final boolean zeroOutside)
	{
		if (knots.length == 0) throw new NoDataException();
		if (knots.length != values.length)
			throw new DimensionMismatchException(values.length, knots.length);
		this.knots = knots.clone();
		this.values = values.clone();
		this.nearest = nearest;
		this.zeroOutside = zeroOutside;
		if (!nearest && knots.length > 1) {
			spline = new LinearInterpolator().interpolate(this.knots, this.values);
		}
		else spline = null;
	}

	/** Nearest-neighbour interpolant held at the end values outside the knots */
	static TabulatedFunction nearest(final double[] knots, final double[] values) {
		return new TabulatedFunction(knots, values, true, false);
	}

	/** Nearest-neighbour interpolant, zero outside the knots */
	static TabulatedFunction nearestOrZero(final double[] knots,
		final double[] values)
	{
		return new TabulatedFunction(knots, values, true, true);
	}

	/** Linear interpolant held at the end values outside the knots */
	static TabulatedFunction linear(final double[] knots, final double[] values) {
		return new TabulatedFunction(knots, values, false, false);
	}

	/** Linear interpolant, zero outside the knots */
	static TabulatedFunction linearOrZero(final double[] knots,
		final double[] values)
	{
		return new TabulatedFunction(knots, values, false, true);
	}

	/** Same value at every knot */
	static TabulatedFunction constant(final double[] knots, final double value) {
		final double[] values = new double[knots.length];
		Arrays.fill(values, value);
		return nearest(knots, values);
	}

	@Override
	public double value(final double x) {
		final int last = knots.length - 1;
		if (x < knots[0]) return zeroOutside ? 0.0 : values[0];
		if (x > knots[last]) return zeroOutside ? 0.0 : values[last];
		if (nearest) {
			int ip = Arrays.binarySearch(knots, x);
			if (ip >= 0) return values[ip];
			ip = -ip - 1;
			return (x - knots[ip - 1] <= knots[ip] - x) ? values[ip - 1]
				: values[ip];
		}
		if (spline == null) return values[0];
		return spline.value(x);
	}

	double[] value(final double[] x) {
		final double[] out = new double[x.length];
		for (int i = 0; i < x.length; i++)
			out[i] = value(x[i]);
		return out;
	}

	double[] getKnots() {
		return knots.clone();
	}

	/** Copy of the function with every tabulated value multiplied by {@code factor} */
	TabulatedFunction scale(final double factor) {
		final double[] scaled = new double[values.length];
		for (int i = 0; i < values.length; i++)
			scaled[i] = values[i] * factor;
		return new TabulatedFunction(knots, scaled, nearest, zeroOutside);
	}
}
