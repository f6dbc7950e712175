/**
 * Forest Deltas Fit
 * ExpectedFluxConfig.java
 * author: Rick Ziraldo, 2018
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package forestdeltas;

import java.io.File;
import java.util.prefs.Preferences;

import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Options of the expected flux computation. Immutable; built with
 * {@link Builder} or read from a {@link Preferences} node. All the checks are
 * done in {@link Builder#build()}, before any iteration starts.
 */
public final class ExpectedFluxConfig {

	// Preferences keys
	static final String ITEROUTPREFIX = "iter out prefix";
	static final String OUTDIR = "out dir";
	static final String LIMITETA = "limit eta";
	static final String LIMITVARLSS = "limit var lss";
	static final String NUMBINSVARIANCE = "num bins variance";
	static final String NUMITERATIONS = "num iterations";
	static final String NUMPROCESSORS = "num processors";
	static final String ORDER = "order";
	static final String USECONSTANTWEIGHT = "use constant weight";
	static final String USEIVARASWEIGHT = "use ivar as weight";
	static final String MINQSO = "min qso per variance cell";
	static final String MAXITERFIT = "max iterations fit";
	static final String ETAVALUE = "eta value";
	static final String VARLSSVALUE = "var lss value";
	static final String FUDGEVALUE = "fudge value";
	static final String PLOTDIAGNOSTICS = "plot diagnostics";

	private final String iterOutPrefix;
	private final File outDir;
	private final double[] limitEta;
	private final double[] limitVarLss;
	private final int numBinsVariance;
	private final int numIterations;
	private final int numProcessors;
	private final int order;
	private final boolean useConstantWeight;
	private final boolean useIvarAsWeight;
	private final int minQsoPerVarianceCell;
	private final int maxIterationsFit;
	private final Double fixedEta;
	private final File etaFile;
	private final Double fixedVarLss;
	private final Double fixedFudge;
	private final boolean plotDiagnostics;

	private ExpectedFluxConfig(final Builder b) {
		this.iterOutPrefix = b.iterOutPrefix;
		this.outDir = b.outDir;
		this.limitEta = b.limitEta.clone();
		this.limitVarLss = b.limitVarLss.clone();
		this.numBinsVariance = b.numBinsVariance;
		this.numIterations = b.numIterations;
		this.numProcessors = b.numProcessors;
		this.order = b.order;
		this.useConstantWeight = b.useConstantWeight;
		this.useIvarAsWeight = b.useIvarAsWeight;
		this.minQsoPerVarianceCell = b.minQsoPerVarianceCell;
		this.maxIterationsFit = b.maxIterationsFit;
		this.fixedEta = b.fixedEta;
		this.etaFile = b.etaFile;
		this.fixedVarLss = b.fixedVarLss;
		this.fixedFudge = b.fixedFudge;
		this.plotDiagnostics = b.plotDiagnostics;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Reads the options stored under {@code prefs}, falling back to the defaults
	 * for missing keys.
	 *
	 * @throws ExpectedFluxException if a value is invalid
	 */
	public static ExpectedFluxConfig fromPreferences(final Preferences prefs) {
		final Builder b = builder();
		b.iterOutPrefix(prefs.get(ITEROUTPREFIX, b.iterOutPrefix));
		final String out = prefs.get(OUTDIR, null);
		if (out != null) b.outDir(new File(out));
		b.limitEta(parseInterval(LIMITETA, prefs.get(LIMITETA, "(0.5, 1.5)")));
		b.limitVarLss(parseInterval(LIMITVARLSS, prefs.get(LIMITVARLSS,
			"(0., 0.3)")));
		b.numBinsVariance(prefs.getInt(NUMBINSVARIANCE, b.numBinsVariance));
		b.numIterations(prefs.getInt(NUMITERATIONS, b.numIterations));
		b.numProcessors(prefs.getInt(NUMPROCESSORS, b.numProcessors));
		b.order(prefs.getInt(ORDER, b.order));
		b.useConstantWeight(prefs.getBoolean(USECONSTANTWEIGHT,
			b.useConstantWeight));
		b.useIvarAsWeight(prefs.getBoolean(USEIVARASWEIGHT, b.useIvarAsWeight));
		b.minQsoPerVarianceCell(prefs.getInt(MINQSO, b.minQsoPerVarianceCell));
		b.maxIterationsFit(prefs.getInt(MAXITERFIT, b.maxIterationsFit));
		b.etaValue(prefs.get(ETAVALUE, null));
		final String varLss = prefs.get(VARLSSVALUE, null);
		if (varLss != null) b.fixedVarLss(parseNumber(VARLSSVALUE, varLss));
		final String fudge = prefs.get(FUDGEVALUE, null);
		if (fudge != null) b.fixedFudge(parseNumber(FUDGEVALUE, fudge));
		b.plotDiagnostics(prefs.getBoolean(PLOTDIAGNOSTICS, b.plotDiagnostics));
		return b.build();
	}

	/** Stores these options under {@code prefs} */
	public void toPreferences(final Preferences prefs) {
		prefs.put(ITEROUTPREFIX, iterOutPrefix);
		prefs.put(OUTDIR, outDir.getPath());
		prefs.put(LIMITETA, "(" + limitEta[0] + ", " + limitEta[1] + ")");
		prefs.put(LIMITVARLSS, "(" + limitVarLss[0] + ", " + limitVarLss[1] + ")");
		prefs.putInt(NUMBINSVARIANCE, numBinsVariance);
		prefs.putInt(NUMITERATIONS, numIterations);
		prefs.putInt(NUMPROCESSORS, numProcessors);
		prefs.putInt(ORDER, order);
		prefs.putBoolean(USECONSTANTWEIGHT, useConstantWeight);
		prefs.putBoolean(USEIVARASWEIGHT, useIvarAsWeight);
		prefs.putInt(MINQSO, minQsoPerVarianceCell);
		prefs.putInt(MAXITERFIT, maxIterationsFit);
		if (etaFile != null) prefs.put(ETAVALUE, etaFile.getPath());
		else if (fixedEta != null) prefs.put(ETAVALUE, fixedEta.toString());
		else prefs.remove(ETAVALUE);
		if (fixedVarLss != null) prefs.put(VARLSSVALUE, fixedVarLss.toString());
		else prefs.remove(VARLSSVALUE);
		if (fixedFudge != null) prefs.put(FUDGEVALUE, fixedFudge.toString());
		else prefs.remove(FUDGEVALUE);
		prefs.putBoolean(PLOTDIAGNOSTICS, plotDiagnostics);
	}

	/**
	 * Parses a closed interval written as {@code "(a, b)"}, {@code "[a, b]"} or
	 * {@code "a, b"}.
	 */
	static double[] parseInterval(final String name, final String text) {
		if (StringUtils.isBlank(text)) throw new ExpectedFluxException(
			"Missing argument '" + name + "'");
		final String[] words = StringUtils.strip(text.trim(), "()[]").split(",");
		if (words.length != 2) throw new ExpectedFluxException("Argument '" +
			name + "' should contain two comma-separated values. Found: " + text);
		final double min = parseNumber(name, words[0]);
		final double max = parseNumber(name, words[1]);
		if (min > max) throw new ExpectedFluxException("Argument '" + name +
			"' has its lower limit above the upper one. Found: " + text);
		return new double[] { min, max };
	}

	private static double parseNumber(final String name, final String text) {
		try {
			return Double.parseDouble(text.trim());
		}
		catch (final NumberFormatException e) {
			throw new ExpectedFluxException("Argument '" + name +
				"' expects a number. Found: " + text, e);
		}
	}

	public String getIterOutPrefix() {
		return iterOutPrefix;
	}

	public File getOutDir() {
		return outDir;
	}

	public double[] getLimitEta() {
		return limitEta.clone();
	}

	public double[] getLimitVarLss() {
		return limitVarLss.clone();
	}

	public int getNumBinsVariance() {
		return numBinsVariance;
	}

	public int getNumIterations() {
		return numIterations;
	}

	/** Workers used for the continuum fits, 0 meaning half the processors */
	public int getNumProcessors() {
		return numProcessors;
	}

	public int getOrder() {
		return order;
	}

	public boolean isUseConstantWeight() {
		return useConstantWeight;
	}

	public boolean isUseIvarAsWeight() {
		return useIvarAsWeight;
	}

	public int getMinQsoPerVarianceCell() {
		return minQsoPerVarianceCell;
	}

	public int getMaxIterationsFit() {
		return maxIterationsFit;
	}

	/** Constant eta, or {@code null} when eta is fitted or read from a file */
	public Double getFixedEta() {
		return fixedEta;
	}

	/** Diagnostic file of a previous run providing eta, or {@code null} */
	public File getEtaFile() {
		return etaFile;
	}

	public Double getFixedVarLss() {
		return fixedVarLss;
	}

	public Double getFixedFudge() {
		return fixedFudge;
	}

	public boolean isPlotDiagnostics() {
		return plotDiagnostics;
	}

	/** True when eta, var_lss and fudge are never fitted */
	public boolean isFixedWeightMode() {
		return useConstantWeight || useIvarAsWeight;
	}

	@Override
	public String toString() {
		return "ExpectedFluxConfig[prefix=" + iterOutPrefix + ", outDir=" +
			outDir + ", limitEta=(" + limitEta[0] + ", " + limitEta[1] +
			"), limitVarLss=(" + limitVarLss[0] + ", " + limitVarLss[1] +
			"), numBinsVariance=" + numBinsVariance + ", numIterations=" +
			numIterations + ", order=" + order + ", useConstantWeight=" +
			useConstantWeight + ", useIvarAsWeight=" + useIvarAsWeight + "]";
	}

	/**
	 * Collects the options; every setter returns the builder.
	 */
	public static final class Builder {

		private String iterOutPrefix = "delta_attributes";
		private File outDir;
		private double[] limitEta = { 0.5, 1.5 };
		private double[] limitVarLss = { 0.0, 0.3 };
		private int numBinsVariance = 20;
		private int numIterations = 5;
		private int numProcessors = 0;
		private int order = 1;
		private boolean useConstantWeight = false;
		private boolean useIvarAsWeight = false;
		private int minQsoPerVarianceCell = 100;
		private int maxIterationsFit = BoundedLeastSquares.DEFAULT_MAX_ITERATIONS;
		private Double fixedEta;
		private File etaFile;
		private Double fixedVarLss;
		private Double fixedFudge;
		private boolean plotDiagnostics = false;

		private Builder() {}

		public Builder iterOutPrefix(final String prefix) {
			this.iterOutPrefix = prefix;
			return this;
		}

		public Builder outDir(final File dir) {
			this.outDir = dir;
			return this;
		}

		public Builder limitEta(final double min, final double max) {
			return limitEta(new double[] { min, max });
		}

		private Builder limitEta(final double[] limits) {
			this.limitEta = limits;
			return this;
		}

		public Builder limitVarLss(final double min, final double max) {
			return limitVarLss(new double[] { min, max });
		}

		private Builder limitVarLss(final double[] limits) {
			this.limitVarLss = limits;
			return this;
		}

		public Builder numBinsVariance(final int n) {
			this.numBinsVariance = n;
			return this;
		}

		public Builder numIterations(final int n) {
			this.numIterations = n;
			return this;
		}

		public Builder numProcessors(final int n) {
			this.numProcessors = n;
			return this;
		}

		public Builder order(final int o) {
			this.order = o;
			return this;
		}

		public Builder useConstantWeight(final boolean use) {
			this.useConstantWeight = use;
			return this;
		}

		public Builder useIvarAsWeight(final boolean use) {
			this.useIvarAsWeight = use;
			return this;
		}

		public Builder minQsoPerVarianceCell(final int n) {
			this.minQsoPerVarianceCell = n;
			return this;
		}

		public Builder maxIterationsFit(final int n) {
			this.maxIterationsFit = n;
			return this;
		}

		public Builder fixedEta(final Double eta) {
			this.fixedEta = eta;
			this.etaFile = null;
			return this;
		}

		public Builder etaFile(final File file) {
			this.etaFile = file;
			this.fixedEta = null;
			return this;
		}

		/**
		 * Eta as written in a configuration: either a number or the path of a
		 * previous diagnostic file.
		 */
		public Builder etaValue(final String value) {
			if (StringUtils.isBlank(value)) return fixedEta(null);
			try {
				return fixedEta(Double.parseDouble(value.trim()));
			}
			catch (final NumberFormatException e) {
				return etaFile(new File(value.trim()));
			}
		}

		public Builder fixedVarLss(final Double varLss) {
			this.fixedVarLss = varLss;
			return this;
		}

		public Builder fixedFudge(final Double fudge) {
			this.fixedFudge = fudge;
			return this;
		}

		public Builder plotDiagnostics(final boolean plot) {
			this.plotDiagnostics = plot;
			return this;
		}

		/**
		 * @throws ExpectedFluxException if an option is missing or invalid
		 */
		public ExpectedFluxConfig build() {
			if (StringUtils.isBlank(iterOutPrefix)) throw new ExpectedFluxException(
				"Missing argument '" + ITEROUTPREFIX + "'");
			if (FilenameUtils.indexOfLastSeparator(iterOutPrefix) != -1)
				throw new ExpectedFluxException("'" + ITEROUTPREFIX +
					"' should not include folders. Found: " + iterOutPrefix);
			if (outDir == null) throw new ExpectedFluxException("Missing argument '" +
				OUTDIR + "'");
			checkInterval(LIMITETA, limitEta);
			checkInterval(LIMITVARLSS, limitVarLss);
			if (numBinsVariance <= 0) throw new ExpectedFluxException("'" +
				NUMBINSVARIANCE + "' must be positive. Found: " + numBinsVariance);
			if (numIterations <= 0) throw new ExpectedFluxException("'" +
				NUMITERATIONS + "' must be positive. Found: " + numIterations);
			if (numProcessors < 0) throw new ExpectedFluxException("'" +
				NUMPROCESSORS + "' must not be negative. Found: " + numProcessors);
			if (order != 0 && order != 1) throw new ExpectedFluxException("'" +
				ORDER + "' must be 0 or 1. Found: " + order);
			if (useConstantWeight && useIvarAsWeight) throw new ExpectedFluxException(
				"'" + USECONSTANTWEIGHT + "' and '" + USEIVARASWEIGHT +
					"' cannot be used together");
			if (minQsoPerVarianceCell < 0) throw new ExpectedFluxException("'" +
				MINQSO + "' must not be negative. Found: " + minQsoPerVarianceCell);
			if (maxIterationsFit <= 0) throw new ExpectedFluxException("'" +
				MAXITERFIT + "' must be positive. Found: " + maxIterationsFit);
			if (etaFile != null && !etaFile.isFile()) throw new ExpectedFluxException(
				"'" + ETAVALUE + "' file not found: " + etaFile);
			if (fixedFudge != null && fixedFudge < 0) throw new ExpectedFluxException(
				"'" + FUDGEVALUE + "' must not be negative. Found: " + fixedFudge);
			return new ExpectedFluxConfig(this);
		}

		private static void checkInterval(final String name,
			final double[] limits)
		{
			if (limits == null || limits.length != 2) throw new ExpectedFluxException(
				"Missing argument '" + name + "'");
			if (Double.isNaN(limits[0]) || Double.isNaN(limits[1]) ||
				limits[0] > limits[1]) throw new ExpectedFluxException("Invalid '" +
					name + "': (" + limits[0] + ", " + limits[1] + ")");
		}
	}
}
