package branchshift.base;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;

/**
 * Container class for the run settings described below. The defaults are set
 * by the constructor; {@link #load(Reader)} overrides them from a control file
 * of {@code key = value} lines.
 */
public class Settings {

	/** Newick file holding the tree. */
	public String treefile;

	/** Event configuration used to seed the chain. */
	public String eventDataInfile;

	/** Whether to seed the chain from {@link #eventDataInfile}. */
	public boolean initializeModel = false;

	/** The seed for the random number generator. */
	public long seed = 1L;

	/** Number of generations to run. */
	public int numberOfGenerations = 10000;

	/** A progress line is printed after every printFreq generations. */
	public int printFreq = 1000;

	/**
	 * Width of the local event move, as a fraction of the maximum root-to-tip
	 * length.
	 */
	public double updateEventLocationScale = 0.05;

	/** Scale of the multiplicative event rate update. */
	public double updateEventRateScale = 4.0;

	/** Number of local moves proposed per global move. */
	public double localGlobalMoveRatio = 10.0;

	/**
	 * Rate of the exponential prior on the Poisson event rate. The chain
	 * starts with an event rate of 1 / poissonRatePrior.
	 */
	public double poissonRatePrior = 1.0;

	/** Rate of the exponential prior on the parameter of each event. */
	public double eventRateParameterPrior = 1.0;

	/** Relative frequency of event birth/death moves. */
	public double updateRateEventNumber = 1.0;

	/** Relative frequency of event position moves. */
	public double updateRateEventPosition = 1.0;

	/** Relative frequency of event rate updates. */
	public double updateRateEventRate = 1.0;

	/** Check the branch histories after every generation (slow). */
	public boolean validateEventConfiguration = false;

	public Settings() {
	}

	/**
	 * Reads a control file. Blank lines and lines starting with '#' are
	 * skipped; unknown keys are reported and ignored.
	 *
	 * @throws IllegalArgumentException if a line or value cannot be parsed
	 */
	public static Settings load(Reader in) throws IOException {
		Settings settings = new Settings();
		BufferedReader reader = new BufferedReader(in);
		String line;
		int lineNo = 0;
		while ((line = reader.readLine()) != null) {
			lineNo++;
			line = line.trim();
			if (line.isEmpty() || line.startsWith("#"))
				continue;
			int eq = line.indexOf('=');
			if (eq < 0)
				throw new IllegalArgumentException("Line " + lineNo + " of control file is not key = value: " + line);
			String key = line.substring(0, eq).trim();
			String value = line.substring(eq + 1).trim();
			try {
				settings.set(key, value);
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException("Bad value for " + key + " on line " + lineNo + ": " + value, e);
			}
		}
		return settings;
	}

	void set(String key, String value) {
		switch (key) {
			case "treefile":
				treefile = value;
				break;
			case "eventDataInfile":
				eventDataInfile = value;
				break;
			case "initializeModel":
				initializeModel = parseFlag(value);
				break;
			case "seed":
				seed = Long.parseLong(value);
				break;
			case "numberOfGenerations":
				numberOfGenerations = Integer.parseInt(value);
				break;
			case "printFreq":
				printFreq = Integer.parseInt(value);
				break;
			case "updateEventLocationScale":
				updateEventLocationScale = Double.parseDouble(value);
				break;
			case "updateEventRateScale":
				updateEventRateScale = Double.parseDouble(value);
				break;
			case "localGlobalMoveRatio":
				localGlobalMoveRatio = Double.parseDouble(value);
				break;
			case "poissonRatePrior":
				poissonRatePrior = Double.parseDouble(value);
				break;
			case "eventRateParameterPrior":
				eventRateParameterPrior = Double.parseDouble(value);
				break;
			case "updateRateEventNumber":
				updateRateEventNumber = Double.parseDouble(value);
				break;
			case "updateRateEventPosition":
				updateRateEventPosition = Double.parseDouble(value);
				break;
			case "updateRateEventRate":
				updateRateEventRate = Double.parseDouble(value);
				break;
			case "validateEventConfiguration":
				validateEventConfiguration = parseFlag(value);
				break;
			default:
				System.err.println("Ignoring unknown setting " + key);
		}
	}

	private static boolean parseFlag(String value) {
		if (value.equals("1") || value.equalsIgnoreCase("true"))
			return true;
		if (value.equals("0") || value.equalsIgnoreCase("false"))
			return false;
		throw new NumberFormatException("not a flag: " + value);
	}
}
