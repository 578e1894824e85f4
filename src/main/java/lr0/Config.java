package lr0;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.*;
import java.util.logging.Logger;

/**
 * Global configuration, read from the {@value #configFile} file in the working directory.
 *
 * The file is read as UTF-8, each line has the form <pre>key = value</pre>, unknown keys are ignored.
 */
public class Config {

	public static final String configFile = "config.ini";

	private static final Logger LOG = Logger.getLogger("Config");

	private static final Map<String, String> defaults = new HashMap<String, String>(){{
		put("stateCountWarningThreshold", "32");
		put("outputDir", ".");
	}};

	private static final Map<String, String> config = new HashMap<>(defaults);

	/**
	 * Number of states above which a built automaton carries a state limit advisory
	 */
	public static int stateCountWarningThreshold(){
		return getInt("stateCountWarningThreshold");
	}

	/**
	 * Directory the command line tool writes its dot and svg files into
	 */
	public static String getOutputDir(){
		return config.get("outputDir");
	}

	public static void set(String key, String value){
		if (!defaults.containsKey(key)){
			throw new LR0Exception(String.format("Unknown config key \"%s\"", key));
		}
		config.put(key, value);
	}

	/**
	 * Resets all keys to their default values
	 */
	public static void reset(){
		config.clear();
		config.putAll(defaults);
	}

	private static int getInt(String key){
		String value = config.get(key).trim();
		try {
			int number = Integer.parseInt(value);
			if (number < 0){
				throw new LR0Exception(String.format("Config key \"%s\" has to be non negative, got %d", key, number));
			}
			return number;
		} catch (NumberFormatException ex){
			throw new LR0Exception(String.format("Config key \"%s\" has to be a number, got \"%s\"", key, value), ex);
		}
	}

	/**
	 * Parses the lines of a config file, ignoring and logging unknown keys.
	 *
	 * @return the known key value pairs
	 */
	static Map<String, String> parse(BufferedReader reader) throws IOException {
		Map<String, String> values = new HashMap<>();
		String line;
		while ((line = reader.readLine()) != null){
			if (line.contains("=")){
				String[] parts = line.split("=", 2);
				String key = parts[0].trim();
				if (defaults.containsKey(key)){
					values.put(key, parts[1].trim());
				} else {
					LOG.warning("Unknown config key \"" + key + "\"");
				}
			}
		}
		return values;
	}

	/**
	 * Loads the passed config file, if it exists.
	 */
	public static void load(File file){
		if (!file.exists()){
			return;
		}
		try (BufferedReader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
			config.putAll(parse(reader));
			LOG.fine("Loaded config from " + file);
		} catch (IOException e) {
			throw new LR0Exception("Can't read config file " + file, e);
		}
	}

	static {
		load(new File(configFile));
	}
}
