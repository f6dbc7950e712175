/**
 * Forest Deltas Fit
 * VarianceStatistics.java
 * author: Rick Ziraldo, 2018
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package forestdeltas;

import java.util.List;

import org.apache.commons.math3.util.FastMath;

/**
 * Observed scatter of {@code delta = flux / continuum - 1}, accumulated in cells
 * of (observed wavelength bin, pipeline variance bin) over all the forests with
 * a valid continuum. The variance functions of one wavelength bin are fitted
 * against the cells of that bin.
 */
class VarianceStatistics {

	static final int NUM_VAR_PIPE_BINS = 100;
	static final double LOG_VAR_PIPE_MIN = FastMath.log10(1e-5);
	static final double LOG_VAR_PIPE_MAX = FastMath.log10(2.0);

	/** fudge is fitted in units of this value */
	static final double FUDGE_REF = 1e-7;

	private final int numBins;
	private final double[] varPipeCenters;

	// [lambda bin][var pipe bin]
	private final double[][] sumDelta;
	private final double[][] sumDelta2;
	private final double[][] sumDelta4;
	private final long[][] count;
	private final int[][] numQso;
	private final long[] numPixels;

	/**
	 * @param forests all the forests; those without continuum are skipped
	 * @param grid wavelength grid, for the bin assignment
	 * @param logLambdaVarFuncGrid centers of the variance bins
	 */
	VarianceStatistics(final List<Forest> forests, final WavelengthGrid grid,
		final double[] logLambdaVarFuncGrid)
	{
		this.numBins = logLambdaVarFuncGrid.length;
		this.varPipeCenters = varPipeBinCenters();
		this.sumDelta = new double[numBins][NUM_VAR_PIPE_BINS];
		this.sumDelta2 = new double[numBins][NUM_VAR_PIPE_BINS];
		this.sumDelta4 = new double[numBins][NUM_VAR_PIPE_BINS];
		this.count = new long[numBins][NUM_VAR_PIPE_BINS];
		this.numQso = new int[numBins][NUM_VAR_PIPE_BINS];
		this.numPixels = new long[numBins];

		final double width = (LOG_VAR_PIPE_MAX - LOG_VAR_PIPE_MIN) /
			NUM_VAR_PIPE_BINS;
		for (final Forest forest : forests) {
			if (!forest.hasContinuum()) continue;
			final double[] flux = forest.getFlux();
			final double[] ivar = forest.getIvar();
			final double[] continuum = forest.getContinuum();
			final int[] lambdaBins = grid.findBins(forest.getLogLambda(),
				logLambdaVarFuncGrid);
			final boolean[][] seen = new boolean[numBins][NUM_VAR_PIPE_BINS];
			for (int i = 0; i < flux.length; i++) {
				final double logVarPipe = FastMath.log10(1.0 / ivar[i] / (continuum[i] *
					continuum[i]));
				if (!(logVarPipe > LOG_VAR_PIPE_MIN && logVarPipe < LOG_VAR_PIPE_MAX))
					continue;
				final int l = lambdaBins[i];
				final int v = FastMath.min((int) ((logVarPipe - LOG_VAR_PIPE_MIN) /
					width), NUM_VAR_PIPE_BINS - 1);
				final double delta = flux[i] / continuum[i] - 1;
				final double delta2 = delta * delta;
				sumDelta[l][v] += delta;
				sumDelta2[l][v] += delta2;
				sumDelta4[l][v] += delta2 * delta2;
				count[l][v]++;
				numPixels[l]++;
				if (!seen[l][v]) {
					seen[l][v] = true;
					numQso[l][v]++;
				}
			}
		}
	}

	/** Pipeline variance at the center of every pipeline variance bin */
	static double[] varPipeBinCenters() {
		final double width = (LOG_VAR_PIPE_MAX - LOG_VAR_PIPE_MIN) /
			NUM_VAR_PIPE_BINS;
		final double[] out = new double[NUM_VAR_PIPE_BINS];
		for (int v = 0; v < out.length; v++)
			out[v] = FastMath.pow(10.0, LOG_VAR_PIPE_MIN + (v + 0.5) * width);
		return out;
	}

	static double model(final double eta, final double varLss,
		final double fudge, final double varPipe)
	{
		return eta * varPipe + varLss + fudge / varPipe;
	}

	int getNumBins() {
		return numBins;
	}

	/** Pixels of wavelength bin {@code bin} within the pipeline variance range */
	long getNumPixels(final int bin) {
		return numPixels[bin];
	}

	/** Observed variance of delta in a cell */
	double getVariance(final int bin, final int varPipeBin) {
		final long n = count[bin][varPipeBin];
		if (n == 0) return Double.NaN;
		final double mean = sumDelta[bin][varPipeBin] / n;
		return sumDelta2[bin][varPipeBin] / n - mean * mean;
	}

	/** Variance of the observed variance in a cell */
	double getVarianceError(final int bin, final int varPipeBin) {
		final long n = count[bin][varPipeBin];
		if (n == 0) return Double.NaN;
		final double var = getVariance(bin, varPipeBin);
		return (sumDelta4[bin][varPipeBin] / n - var * var) / n;
	}

	int getNumQso(final int bin, final int varPipeBin) {
		return numQso[bin][varPipeBin];
	}

	/** Cells of {@code bin} entering the chi2 */
	int[] usableCells(final int bin, final int minQso) {
		int n = 0;
		final int[] tmp = new int[NUM_VAR_PIPE_BINS];
		for (int v = 0; v < NUM_VAR_PIPE_BINS; v++) {
			if (numQso[bin][v] > minQso && getVarianceError(bin, v) > 0) tmp[n++] =
				v;
		}
		final int[] out = new int[n];
		System.arraycopy(tmp, 0, out, 0, n);
		return out;
	}

	/**
	 * Residuals {@code (var - model) / sqrt(var2)} of the usable cells of
	 * {@code bin}, as functions of (eta, varLss, fudge / FUDGE_REF).
	 */
	BoundedLeastSquares.Residuals residuals(final int bin, final int minQso) {
		final int[] cells = usableCells(bin, minQso);
		final double[] var = new double[cells.length];
		final double[] sigma = new double[cells.length];
		final double[] vp = new double[cells.length];
		for (int c = 0; c < cells.length; c++) {
			var[c] = getVariance(bin, cells[c]);
			sigma[c] = FastMath.sqrt(getVarianceError(bin, cells[c]));
			vp[c] = varPipeCenters[cells[c]];
		}
		return new BoundedLeastSquares.Residuals() {

			@Override
			public int getDimension() {
				return cells.length;
			}

			@Override
			public double[] value(final double[] p) {
				final double[] r = new double[cells.length];
				for (int c = 0; c < r.length; c++)
					r[c] = (var[c] - model(p[0], p[1], p[2] * FUDGE_REF, vp[c])) /
						sigma[c];
				return r;
			}

			@Override
			public double[][] jacobian(final double[] p) {
				final double[][] jac = new double[cells.length][3];
				for (int c = 0; c < jac.length; c++) {
					jac[c][0] = -vp[c] / sigma[c];
					jac[c][1] = -1.0 / sigma[c];
					jac[c][2] = -FUDGE_REF / vp[c] / sigma[c];
				}
				return jac;
			}
		};
	}
}
