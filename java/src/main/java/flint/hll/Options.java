/**
 * Options.java
 */
package flint.hll;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.util.Properties;

/**
 * Options for configuring a PipelineDB conversion.
 * 
 * Configuration file locations (in order of precedence):
 * 1. System property: -Dflinthll.config=/path/to/flinthll.properties
 * 2. ./flinthll.properties (current directory)
 * 3. ~/.flinthll/flinthll.properties (user home)
 * 
 * Configuration format:
 * <pre>
 * # always write dense, even for sparse estimators
 * hll.always.dense = false
 * # ask PipelineDB to recompute the cardinality (better for testing)
 * hll.dirty.encoding = false
 * # explicit → dense fallback threshold
 * hll.max.explicit = 600
 * </pre>
 */
public final class Options {
	public static final String PRODUCT_NAME = "FlintHLL";
	public static final String PRODUCT_NAME_LC = PRODUCT_NAME.toLowerCase();
	public static final String CONFIG_FILE_NAME = PRODUCT_NAME_LC + ".properties";

	public static final String KEY_ALWAYS_DENSE = "hll.always.dense";
	public static final String KEY_DIRTY_ENCODING = "hll.dirty.encoding";
	public static final String KEY_MAX_EXPLICIT = "hll.max.explicit";

	/**
	 * PipelineDB accepts up to 8192 explicit registers before going sparse, but
	 * explicit HLLs misbehave at medium cardinalities there, so stay well below.
	 */
	public static final int DEFAULT_MAX_EXPLICIT_REGISTERS = 600;

	boolean alwaysWriteDense = false;
	boolean writeDirtyEncoding = false;
	int maxExplicitRegisters = DEFAULT_MAX_EXPLICIT_REGISTERS;
	Logger logger = new Logger.DefaultLogger(PipelineHLL.class.getName());

	public Options alwaysWriteDense(boolean alwaysWriteDense) {
		this.alwaysWriteDense = alwaysWriteDense;
		return this;
	}

	public Options writeDirtyEncoding(boolean writeDirtyEncoding) {
		this.writeDirtyEncoding = writeDirtyEncoding;
		return this;
	}

	public Options maxExplicitRegisters(int maxExplicitRegisters) {
		if (maxExplicitRegisters < 0)
			throw new IllegalArgumentException(KEY_MAX_EXPLICIT + " : " + maxExplicitRegisters);
		this.maxExplicitRegisters = maxExplicitRegisters;
		return this;
	}

	public Options logger(Logger logger) {
		this.logger = logger != null ? logger : new Logger.NullLogger();
		return this;
	}

	public boolean alwaysWriteDense() {
		return alwaysWriteDense;
	}

	public boolean writeDirtyEncoding() {
		return writeDirtyEncoding;
	}

	public int maxExplicitRegisters() {
		return maxExplicitRegisters;
	}

	public Logger logger() {
		return logger;
	}

	/**
	 * Applies the recognized keys of {@code props}; absent keys keep their current values.
	 */
	public Options apply(final Properties props) {
		final String dense = value(props, KEY_ALWAYS_DENSE);
		if (dense != null)
			alwaysWriteDense(Boolean.parseBoolean(dense));
		final String dirty = value(props, KEY_DIRTY_ENCODING);
		if (dirty != null)
			writeDirtyEncoding(Boolean.parseBoolean(dirty));
		final String max = value(props, KEY_MAX_EXPLICIT);
		if (max != null) {
			try {
				maxExplicitRegisters(Integer.parseInt(max));
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException(KEY_MAX_EXPLICIT + " : " + max, e);
			}
		}
		return this;
	}

	public static Options fromProperties(final Properties props) {
		return new Options().apply(props);
	}

	public static Options fromFile(final File file) throws IOException {
		final Properties props = new Properties();
		try (BufferedReader reader = new BufferedReader(new FileReader(file))) {
			props.load(reader);
		}
		return fromProperties(props);
	}

	/**
	 * Loads options from the first configuration file found, or defaults if there is none.
	 */
	public static Options load() throws IOException {
		final File f = findConfigFile();
		return f != null ? fromFile(f) : new Options();
	}

	/**
	 * Find configuration file from standard locations
	 */
	static File findConfigFile() {
		// 1. System property
		String configPath = System.getProperty(PRODUCT_NAME_LC + ".config");
		if (configPath != null && !configPath.isEmpty()) {
			File f = new File(configPath);
			if (f.exists()) return f;
		}

		// 2. Current directory
		File localConfig = new File(CONFIG_FILE_NAME);
		if (localConfig.exists()) {
			return localConfig;
		}

		// 3. User home directory
		String home = System.getProperty("user.home");
		if (home != null) {
			File homeConfig = new File(home, "." + PRODUCT_NAME_LC + "/" + CONFIG_FILE_NAME);
			if (homeConfig.exists()) {
				return homeConfig;
			}
		}

		return null;
	}

	private static String value(final Properties props, final String key) {
		final String v = props.getProperty(key);
		return v == null || v.trim().isEmpty() ? null : v.trim();
	}

	@Override
	public String toString() {
		return "Options{alwaysWriteDense=" + alwaysWriteDense //
				+ ", writeDirtyEncoding=" + writeDirtyEncoding //
				+ ", maxExplicitRegisters=" + maxExplicitRegisters + "}";
	}
}
