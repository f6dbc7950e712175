/**
 * Forest Deltas Fit
 * ForestDeltasFit.java
 * author: Rick Ziraldo, 2018
 * The /University of Texas at Dallas, Richardson, TX
 * http://www.utdallas.edu
 *
 * Feature: Continuum fitting and delta extraction on quasar forests
 * Forest Deltas Fit computes the mean expected flux of a sample of
 * forests, iterating over the continuum of each line of sight, the mean
 * continuum and the pixel variance functions, and stores the resulting
 * deltas and weights on every forest.
 *
 * The least-squares fits are implemented using the Levenberg-Marquardt
 * optimizer of the Apache Commons project
 *
 */

package forestdeltas;

import java.io.IOException;
import java.net.URL;
import java.util.Enumeration;
import java.util.List;
import java.util.Map;
import java.util.jar.Attributes;
import java.util.jar.Manifest;
import java.util.prefs.Preferences;

import org.scijava.Context;
import org.scijava.ItemIO;
import org.scijava.command.Command;
import org.scijava.log.LogService;
import org.scijava.plugin.Parameter;
import org.scijava.plugin.Plugin;

@Plugin(type = Command.class, headless = true,
	menuPath = "Plugins>Forest Tools>Forest Deltas Fit")
public class ForestDeltasFit implements Command {

	@Parameter
	private LogService log;
	@Parameter
	private Context context;

	@Parameter(label = "Forests")
	private List<Forest> forests;
	@Parameter(label = "Wavelength grid")
	private WavelengthGrid grid;
	@Parameter(label = "Options", required = false)
	private ExpectedFluxConfig config;

	@Parameter(type = ItemIO.OUTPUT)
	private Map<Long, LineOfSightExpectedFlux> expectedFlux;

	private String version;

	/**
	 * Computes the expected flux and extracts the deltas of every forest. Without
	 * explicit options, they are read from the preferences of this command.
	 */
	@Override
	public void run() {
		about();
		if (config == null) {
			config = ExpectedFluxConfig.fromPreferences(Preferences.userRoot().node(
				getClass().getName()));
		}
		log.info(config);

		final ExpectedFluxEstimator estimator = new ExpectedFluxEstimator(context,
			grid, config);
		estimator.computeExpectedFlux(forests);

		int extracted = 0;
		for (final Forest forest : forests) {
			if (estimator.extractDeltas(forest)) extracted++;
			else log.debug("No deltas for line of sight " + forest.getLosId() +
				": " + forest.getBadContinuumReason());
		}
		log.info("Deltas extracted for " + extracted + " of " + forests.size() +
			" forests");
		expectedFlux = estimator.getLosIds();
	}

	/**
	 * General info About the Software
	 */
	public void about() {
		try {
			final Enumeration<URL> resources = getClass().getClassLoader()
				.getResources("META-INF/MANIFEST.MF");
			while (resources.hasMoreElements()) {
				try {
					final Manifest manifest = new Manifest(resources.nextElement()
						.openStream());
					final Attributes a = manifest.getMainAttributes();
					final String name = a.getValue("Implementation-Title");
					if (name == null) continue;
					if (name.equals("Forest Deltas Fit")) {
						version = a.getValue("Implementation-Version");
						log.info(name + " " + version);
					}
				}
				catch (final IOException e) {
					log.info("Manifest not found");
				}
			}
		}
		catch (final IOException e) {
			log.info("Manifest not found");
		}
	}

	public void setForests(final List<Forest> forests) {
		this.forests = forests;
	}

	public void setGrid(final WavelengthGrid grid) {
		this.grid = grid;
	}

	public void setConfig(final ExpectedFluxConfig config) {
		this.config = config;
	}

	public Map<Long, LineOfSightExpectedFlux> getExpectedFlux() {
		return expectedFlux;
	}

	public String getVersion() {
		return version;
	}
}
