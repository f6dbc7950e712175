/**
 * Forest Deltas Fit
 * WavelengthGrid.java
 * author: Rick Ziraldo, 2018
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package forestdeltas;

import java.util.Arrays;

import org.apache.commons.math3.exception.NotStrictlyPositiveException;
import org.apache.commons.math3.exception.NumberIsTooLargeException;
import org.apache.commons.math3.util.FastMath;

/**
 * Common wavelength sampling shared by all the forests of a run: the
 * observed-frame grid (pixels of every forest) and the rest-frame grid (nodes
 * of the mean continuum). Both are stored as log10 of the wavelength. Built
 * once before the expected flux computation and never modified.
 */
public final class WavelengthGrid {

	private final WaveSolution waveSolution;
	private final double[] logLambdaGrid;
	private final double[] logLambdaRestFrameGrid;

	public WavelengthGrid(final WaveSolution waveSolution,
		final double[] logLambdaGrid, final double[] logLambdaRestFrameGrid)
	{
		if (waveSolution == null) throw new ExpectedFluxException(
			"Wave solution must be set before building the wavelength grid");
		if (logLambdaGrid == null || logLambdaGrid.length == 0)
			throw new ExpectedFluxException("Empty observed-frame wavelength grid");
		if (logLambdaRestFrameGrid == null || logLambdaRestFrameGrid.length == 0)
			throw new ExpectedFluxException("Empty rest-frame wavelength grid");
		checkIncreasing(logLambdaGrid);
		checkIncreasing(logLambdaRestFrameGrid);
		this.waveSolution = waveSolution;
		this.logLambdaGrid = logLambdaGrid.clone();
		this.logLambdaRestFrameGrid = logLambdaRestFrameGrid.clone();
	}

	/**
	 * Builds the grids from the wavelength limits.
	 *
	 * @param step wavelength step (Angstrom) for {@link WaveSolution#LIN}, log10
	 *          step for {@link WaveSolution#LOG}
	 */
	public static WavelengthGrid create(final WaveSolution waveSolution,
		final double lambdaMin, final double lambdaMax,
		final double lambdaMinRestFrame, final double lambdaMaxRestFrame,
		final double step)
	{
		if (step <= 0) throw new NotStrictlyPositiveException(step);
		if (lambdaMin >= lambdaMax)
			throw new NumberIsTooLargeException(lambdaMin, lambdaMax, false);
		if (lambdaMinRestFrame >= lambdaMaxRestFrame)
			throw new NumberIsTooLargeException(lambdaMinRestFrame,
				lambdaMaxRestFrame, false);

		final double[] obs;
		final double[] rest;
		if (waveSolution == WaveSolution.LOG) {
			obs = arange(FastMath.log10(lambdaMin), FastMath.log10(lambdaMax), step);
			rest = arange(FastMath.log10(lambdaMinRestFrame) + step / 2,
				FastMath.log10(lambdaMaxRestFrame), step);
		}
		else if (waveSolution == WaveSolution.LIN) {
			obs = log10(arange(lambdaMin, lambdaMax, step));
			rest = log10(arange(lambdaMinRestFrame + step / 2, lambdaMaxRestFrame,
				step));
		}
		else {
			throw new ExpectedFluxException(
				"Wave solution must be set before building the wavelength grid");
		}
		return new WavelengthGrid(waveSolution, obs, rest);
	}

	public WaveSolution getWaveSolution() {
		return waveSolution;
	}

	public double[] getLogLambdaGrid() {
		return logLambdaGrid.clone();
	}

	public double[] getLogLambdaRestFrameGrid() {
		return logLambdaRestFrameGrid.clone();
	}

	public int size() {
		return logLambdaGrid.length;
	}

	public int restFrameSize() {
		return logLambdaRestFrameGrid.length;
	}

	/** Observed-frame bin of every pixel */
	public int[] findBins(final double[] logLambda) {
		return findBins(logLambda, logLambdaGrid);
	}

	/** Rest-frame bin of every pixel of a forest at redshift {@code z} */
	public int[] findRestFrameBins(final double[] logLambda, final double z) {
		final double shift = FastMath.log10(1 + z);
		final double[] rest = new double[logLambda.length];
		for (int i = 0; i < rest.length; i++)
			rest[i] = logLambda[i] - shift;
		return findBins(rest, logLambdaRestFrameGrid);
	}

	/**
	 * Index of the nearest grid node for every value. Distances are measured in
	 * log10 wavelength for {@link WaveSolution#LOG} and in wavelength for
	 * {@link WaveSolution#LIN}. Ties go to the lower node.
	 */
	public int[] findBins(final double[] logLambda, final double[] grid) {
		final double[] g = waveSolution == WaveSolution.LIN ? pow10(grid) : grid;
		final int[] bins = new int[logLambda.length];
		for (int i = 0; i < logLambda.length; i++) {
			final double v = waveSolution == WaveSolution.LIN ? FastMath.pow(10.0,
				logLambda[i]) : logLambda[i];
			int ip = Arrays.binarySearch(g, v);
			if (ip >= 0) {
				bins[i] = ip;
				continue;
			}
			ip = -ip - 1;
			if (ip == 0) bins[i] = 0;
			else if (ip == g.length) bins[i] = g.length - 1;
			else bins[i] = (v - g[ip - 1] <= g[ip] - v) ? ip - 1 : ip;
		}
		return bins;
	}

	/**
	 * Centers of {@code numBins} equal-width bins spanning the observed grid,
	 * where the variance functions are fitted.
	 */
	public double[] varianceFunctionGrid(final int numBins) {
		if (numBins <= 0) throw new NotStrictlyPositiveException(numBins);
		final double first = logLambdaGrid[0];
		final double last = logLambdaGrid[logLambdaGrid.length - 1];
		final double[] out = new double[numBins];
		for (int k = 0; k < numBins; k++) {
			if (waveSolution == WaveSolution.LOG) {
				out[k] = first + (k + 0.5) * (last - first) / numBins;
			}
			else {
				final double l0 = FastMath.pow(10.0, first);
				final double l1 = FastMath.pow(10.0, last);
				out[k] = FastMath.log10(l0 + (k + 0.5) * (l1 - l0) / numBins);
			}
		}
		return out;
	}

	private static double[] arange(final double start, final double stop,
		final double step)
	{
		final int n = (int) FastMath.ceil((stop - start) / step);
		final double[] out = new double[FastMath.max(n, 0)];
		for (int i = 0; i < out.length; i++)
			out[i] = start + i * step;
		return out;
	}

	private static double[] log10(final double[] values) {
		final double[] out = new double[values.length];
		for (int i = 0; i < values.length; i++)
			out[i] = FastMath.log10(values[i]);
		return out;
	}

	private static double[] pow10(final double[] values) {
		final double[] out = new double[values.length];
		for (int i = 0; i < values.length; i++)
			out[i] = FastMath.pow(10.0, values[i]);
		return out;
	}

	private static void checkIncreasing(final double[] grid) {
		for (int i = 1; i < grid.length; i++) {
			if (!(grid[i] > grid[i - 1])) throw new ExpectedFluxException(
				"Wavelength grid must be strictly increasing, found " + grid[i - 1] +
					" followed by " + grid[i]);
		}
	}
}
