/**
 * Forest Deltas Fit
 * MeanContinuum.java
 * author: Rick Ziraldo, 2018
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package forestdeltas;

import java.util.Arrays;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.stat.descriptive.moment.Mean;

/**
 * Mean unabsorbed continuum as a function of the rest-frame log wavelength,
 * with the statistical weight backing each node. Immutable: a new instance is
 * produced at every iteration and shared read-only by the continuum fits of
 * the next one.
 */
public final class MeanContinuum {

	private final TabulatedFunction continuum;
	private final TabulatedFunction weight;

	MeanContinuum(final double[] logLambdaRest, final double[] values,
		final double[] weights)
	{
		if (values.length != logLambdaRest.length)
			throw new DimensionMismatchException(values.length, logLambdaRest.length);
		if (weights.length != logLambdaRest.length)
			throw new DimensionMismatchException(weights.length, logLambdaRest.length);
		this.continuum = TabulatedFunction.linear(logLambdaRest, values);
		this.weight = TabulatedFunction.linearOrZero(logLambdaRest, weights);
	}

	private MeanContinuum(final TabulatedFunction continuum,
		final TabulatedFunction weight)
	{
		this.continuum = continuum;
		this.weight = weight;
	}

	/** Flat continuum with zero weight at every rest-frame node */
	static MeanContinuum initial(final WavelengthGrid grid) {
		final double[] rest = grid.getLogLambdaRestFrameGrid();
		final double[] ones = new double[rest.length];
		Arrays.fill(ones, 1.0);
		return new MeanContinuum(rest, ones, new double[rest.length]);
	}

	/** Mean continuum at rest-frame log wavelength {@code logLambdaRest} */
	public double value(final double logLambdaRest) {
		return continuum.value(logLambdaRest);
	}

	public double[] value(final double[] logLambdaRest) {
		return continuum.value(logLambdaRest);
	}

	public double weight(final double logLambdaRest) {
		return weight.value(logLambdaRest);
	}

	public double[] weight(final double[] logLambdaRest) {
		return weight.value(logLambdaRest);
	}

	/** Rest-frame nodes backed by data */
	public double[] getKnots() {
		return continuum.getKnots();
	}

	/** Mean of the continuum sampled at {@code logLambdaRest} */
	public double sampleMean(final double[] logLambdaRest) {
		return new Mean().evaluate(value(logLambdaRest));
	}

	/** Copy rescaled so that its mean over {@code logLambdaRest} is one */
	MeanContinuum normalize(final double[] logLambdaRest) {
		final double mean = sampleMean(logLambdaRest);
		return new MeanContinuum(continuum.scale(1.0 / mean), weight);
	}
}
