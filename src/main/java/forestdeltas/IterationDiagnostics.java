/**
 * Forest Deltas Fit
 * IterationDiagnostics.java
 * author: Rick Ziraldo, 2018
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package forestdeltas;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.ArrayUtils;

/**
 * Snapshot of one iteration: the delta stack, the variance functions and the
 * mean continuum. Written as a tab-separated text file with three sections,
 *
 * <pre>
 * # STACK_DELTAS
 * # FITORDER=1
 * loglam	stack	weight
 * ...
 * # VAR_FUNC
 * loglam	eta	var_lss	fudge	num_pixels	valid_fit	chi2
 * ...
 * # CONT
 * loglam_rest	mean_cont	weight
 * ...
 * </pre>
 *
 * Doubles are written with {@link Double#toString(double)}, so reading a file
 * back gives the exact values.
 */
public final class IterationDiagnostics {

	public static final String FILE_EXTENSION = ".tsv";

	static final String STACK_DELTAS = "STACK_DELTAS";
	static final String VAR_FUNC = "VAR_FUNC";
	static final String CONT = "CONT";
	private static final String FITORDER = "FITORDER=";

	private static final String[] STACK_HEADERS = { "loglam", "stack", "weight" };
	private static final String[] VAR_HEADERS = { "loglam", "eta", "var_lss",
		"fudge", "num_pixels", "valid_fit", "chi2" };
	private static final String[] CONT_HEADERS = { "loglam_rest", "mean_cont",
		"weight" };

	private final int order;
	private final double[] stackLogLambda;
	private final double[] stack;
	private final double[] stackWeight;
	private final double[] varLogLambda;
	private final double[] eta;
	private final double[] varLss;
	private final double[] fudge;
	private final long[] numPixels;
	private final boolean[] validFit;
	private final double[] chi2;
	private final double[] contLogLambdaRest;
	private final double[] meanCont;
	private final double[] contWeight;

	private IterationDiagnostics(final int order, final double[] stackLogLambda,
		final double[] stack, final double[] stackWeight,
		final double[] varLogLambda, final double[] eta, final double[] varLss,
		final double[] fudge, final long[] numPixels, final boolean[] validFit,
		final double[] chi2, final double[] contLogLambdaRest,
		final double[] meanCont, final double[] contWeight)
	{
		this.order = order;
		this.stackLogLambda = stackLogLambda;
		this.stack = stack;
		this.stackWeight = stackWeight;
		this.varLogLambda = varLogLambda;
		this.eta = eta;
		this.varLss = varLss;
		this.fudge = fudge;
		this.numPixels = numPixels;
		this.validFit = validFit;
		this.chi2 = chi2;
		this.contLogLambdaRest = contLogLambdaRest;
		this.meanCont = meanCont;
		this.contWeight = contWeight;
	}

	/**
	 * Takes the snapshot of the current state. The mean continuum is sampled at
	 * every node of the rest-frame grid.
	 */
	static IterationDiagnostics of(final int order, final DeltaStack stack,
		final VarianceModel varianceModel, final MeanContinuum meanContinuum,
		final WavelengthGrid grid)
	{
		final double[] rest = grid.getLogLambdaRestFrameGrid();
		return new IterationDiagnostics(order, stack.getLogLambdaGrid(), stack
			.getStack(), stack.getWeight(), varianceModel.getLogLambdaGrid(),
			varianceModel.getBinEta(), varianceModel.getBinVarLss(), varianceModel
				.getBinFudge(), varianceModel.getBinNumPixels(), varianceModel
					.getBinValidFit(), varianceModel.getChi2(), rest, meanContinuum
						.value(rest), meanContinuum.weight(rest));
	}

	/** Name of the file of iteration {@code iteration}, or of the final one if negative */
	static String fileName(final String prefix, final int iteration) {
		if (iteration < 0) return prefix + FILE_EXTENSION;
		return prefix + "_iteration" + (iteration + 1) + FILE_EXTENSION;
	}

	public void write(final File file) throws IOException {
		try (BufferedWriter out = new BufferedWriter(new FileWriter(file,
			StandardCharsets.UTF_8)))
		{
			out.write("# " + STACK_DELTAS + "\n");
			out.write("# " + FITORDER + order + "\n");
			out.write(String.join("\t", STACK_HEADERS) + "\n");
			for (int i = 0; i < stackLogLambda.length; i++)
				out.write(stackLogLambda[i] + "\t" + stack[i] + "\t" + stackWeight[i] +
					"\n");

			out.write("# " + VAR_FUNC + "\n");
			out.write(String.join("\t", VAR_HEADERS) + "\n");
			for (int i = 0; i < varLogLambda.length; i++)
				out.write(varLogLambda[i] + "\t" + eta[i] + "\t" + varLss[i] + "\t" +
					fudge[i] + "\t" + numPixels[i] + "\t" + validFit[i] + "\t" + chi2[i] +
					"\n");

			out.write("# " + CONT + "\n");
			out.write(String.join("\t", CONT_HEADERS) + "\n");
			for (int i = 0; i < contLogLambdaRest.length; i++)
				out.write(contLogLambdaRest[i] + "\t" + meanCont[i] + "\t" +
					contWeight[i] + "\n");
		}
	}

	/**
	 * Reads a file written by {@link #write(File)}.
	 *
	 * @throws IOException if the file cannot be read or is malformed
	 */
	public static IterationDiagnostics read(final File file) throws IOException {
		final List<String> lines = FileUtils.readLines(file,
			StandardCharsets.UTF_8);
		int order = -1;
		String section = null;
		final List<String[]> stackRows = new ArrayList<>();
		final List<String[]> varRows = new ArrayList<>();
		final List<String[]> contRows = new ArrayList<>();
		for (int l = 0; l < lines.size(); l++) {
			final String line = lines.get(l).trim();
			if (line.isEmpty()) continue;
			if (line.startsWith("#")) {
				final String tag = line.substring(1).trim();
				if (tag.startsWith(FITORDER)) {
					try {
						order = Integer.parseInt(tag.substring(FITORDER.length()));
					}
					catch (final NumberFormatException e) {
						throw new IOException("Bad " + FITORDER + " line " + (l + 1) +
							" of " + file, e);
					}
				}
				else section = tag;
				continue;
			}
			final String[] words = line.split("\t");
			if (words[0].equals(STACK_HEADERS[0]) || words[0].equals(
				CONT_HEADERS[0])) continue;
			if (STACK_DELTAS.equals(section)) stackRows.add(check(words,
				STACK_HEADERS.length, file, l));
			else if (VAR_FUNC.equals(section)) varRows.add(check(words,
				VAR_HEADERS.length, file, l));
			else if (CONT.equals(section)) contRows.add(check(words,
				CONT_HEADERS.length, file, l));
			else throw new IOException("Line " + (l + 1) + " of " + file +
				" is outside any section");
		}
		if (stackRows.isEmpty() || varRows.isEmpty() || contRows.isEmpty())
			throw new IOException("Missing section in " + file);

		try {
			return new IterationDiagnostics(order, column(stackRows, 0), column(
				stackRows, 1), column(stackRows, 2), column(varRows, 0), column(varRows,
					1), column(varRows, 2), column(varRows, 3), longColumn(varRows, 4),
				booleanColumn(varRows, 5), column(varRows, 6), column(contRows, 0),
				column(contRows, 1), column(contRows, 2));
		}
		catch (final NumberFormatException e) {
			throw new IOException("Malformed number in " + file, e);
		}
	}

	private static String[] check(final String[] words, final int columns,
		final File file, final int line) throws IOException
	{
		if (words.length != columns) throw new IOException("Line " + (line + 1) +
			" of " + file + " has " + words.length + " columns, expected " +
			columns);
		return words;
	}

	private static double[] column(final List<String[]> rows, final int c) {
		final double[] out = new double[rows.size()];
		for (int r = 0; r < out.length; r++)
			out[r] = Double.parseDouble(rows.get(r)[c]);
		return out;
	}

	private static long[] longColumn(final List<String[]> rows, final int c) {
		final long[] out = new long[rows.size()];
		for (int r = 0; r < out.length; r++)
			out[r] = Long.parseLong(rows.get(r)[c]);
		return out;
	}

	private static boolean[] booleanColumn(final List<String[]> rows,
		final int c)
	{
		final List<Boolean> out = new ArrayList<>();
		for (final String[] row : rows)
			out.add(Boolean.parseBoolean(row[c]));
		return ArrayUtils.toPrimitive(out.toArray(new Boolean[0]));
	}

	/** Continuum fit order, -1 if the file did not record it */
	public int getOrder() {
		return order;
	}

	public double[] getStackLogLambda() {
		return stackLogLambda.clone();
	}

	public double[] getStack() {
		return stack.clone();
	}

	public double[] getStackWeight() {
		return stackWeight.clone();
	}

	public double[] getVarLogLambda() {
		return varLogLambda.clone();
	}

	public double[] getEta() {
		return eta.clone();
	}

	public double[] getVarLss() {
		return varLss.clone();
	}

	public double[] getFudge() {
		return fudge.clone();
	}

	public long[] getNumPixels() {
		return numPixels.clone();
	}

	public boolean[] getValidFit() {
		return validFit.clone();
	}

	public double[] getChi2() {
		return chi2.clone();
	}

	public double[] getContLogLambdaRest() {
		return contLogLambdaRest.clone();
	}

	public double[] getMeanCont() {
		return meanCont.clone();
	}

	public double[] getContWeight() {
		return contWeight.clone();
	}

	/**
	 * Eta of this snapshot at {@code logLambda}, nearest bin, as the prior of a
	 * run with fixed eta.
	 */
	double[] etaAt(final double[] logLambda) {
		return TabulatedFunction.nearest(varLogLambda, eta).value(logLambda);
	}
}
