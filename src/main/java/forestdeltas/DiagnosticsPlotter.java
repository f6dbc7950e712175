/**
 * Forest Deltas Fit
 * DiagnosticsPlotter.java
 * author: Rick Ziraldo, 2018
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 */

package forestdeltas;

import java.awt.Color;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.util.FastMath;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.XYPlot;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * PNG charts of an iteration snapshot: mean continuum, variance functions and
 * delta stack, against the wavelength in Angstrom.
 */
class DiagnosticsPlotter {

	static final int WIDTH = 800;
	static final int HEIGHT = 600;

	static final String CONT_SUFFIX = "_cont";
	static final String VAR_FUNC_SUFFIX = "_var_func";
	static final String STACK_SUFFIX = "_stack";

	JFreeChart meanContinuumChart(final IterationDiagnostics d,
		final String title)
	{
		final XYSeriesCollection dataset = new XYSeriesCollection();
		dataset.addSeries(series("Mean continuum", d.getContLogLambdaRest(), d
			.getMeanCont()));
		return chart(title + " - mean continuum", "Rest-frame wavelength (A)",
			"Mean continuum", dataset);
	}

	JFreeChart varianceFunctionsChart(final IterationDiagnostics d,
		final String title)
	{
		final double[] fudge = d.getFudge();
		for (int i = 0; i < fudge.length; i++)
			fudge[i] /= VarianceStatistics.FUDGE_REF;
		final XYSeriesCollection dataset = new XYSeriesCollection();
		dataset.addSeries(series("eta", d.getVarLogLambda(), d.getEta()));
		dataset.addSeries(series("var_lss", d.getVarLogLambda(), d.getVarLss()));
		dataset.addSeries(series("fudge (1e-7)", d.getVarLogLambda(), fudge));
		return chart(title + " - variance functions", "Wavelength (A)", "Value",
			dataset);
	}

	JFreeChart stackChart(final IterationDiagnostics d, final String title) {
		final double[] x = d.getStackLogLambda();
		final double[] y = d.getStack();
		final double[] w = d.getStackWeight();
		final XYSeries s = new XYSeries("Stack");
		for (int i = 0; i < x.length; i++)
			if (w[i] > 0) s.add(FastMath.pow(10, x[i]), y[i]);
		return chart(title + " - delta stack", "Wavelength (A)", "Stack",
			new XYSeriesCollection(s));
	}

	/**
	 * Saves the three charts as {@code <baseName>_cont.png},
	 * {@code <baseName>_var_func.png} and {@code <baseName>_stack.png}.
	 *
	 * @return the files written
	 */
	List<File> savePlots(final IterationDiagnostics d, final File outDir,
		final String baseName) throws IOException
	{
		final List<File> files = new ArrayList<>();
		files.add(save(meanContinuumChart(d, baseName), outDir, baseName +
			CONT_SUFFIX));
		files.add(save(varianceFunctionsChart(d, baseName), outDir, baseName +
			VAR_FUNC_SUFFIX));
		files.add(save(stackChart(d, baseName), outDir, baseName + STACK_SUFFIX));
		return files;
	}

	private static File save(final JFreeChart chart, final File outDir,
		final String name) throws IOException
	{
		final File file = new File(outDir, name + ".png");
		ChartUtils.saveChartAsPNG(file, chart, WIDTH, HEIGHT);
		return file;
	}

	private static XYSeries series(final String key, final double[] logLambda,
		final double[] y)
	{
		final XYSeries s = new XYSeries(key);
		for (int i = 0; i < logLambda.length; i++)
			s.add(FastMath.pow(10, logLambda[i]), y[i]);
		return s;
	}

	private static JFreeChart chart(final String title, final String xLabel,
		final String yLabel, final XYSeriesCollection dataset)
	{
		final JFreeChart chart = ChartFactory.createXYLineChart(title, xLabel,
			yLabel, dataset, PlotOrientation.VERTICAL, true, false, false);
		final XYPlot plot = chart.getXYPlot();
		plot.getRangeAxis().setAutoRange(true);
		plot.getDomainAxis().setAutoRange(true);
		plot.setDomainGridlinePaint(Color.DARK_GRAY);
		plot.setRangeGridlinePaint(Color.DARK_GRAY);
		plot.setBackgroundPaint(Color.WHITE);
		chart.getTitle().setPaint(Color.BLACK);
		return chart;
	}
}
