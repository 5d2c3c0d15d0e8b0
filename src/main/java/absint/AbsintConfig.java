package absint;

/**
 * Analysis configuration defaults.
 */
public class AbsintConfig {
	/** Loop-head iterations before widening kicks in. */
	public static final int WIDENING = intEnv("ABSINT_WIDENING", 3);
	/** Maximum iterations of a single node, or 0 for no limit. */
	public static final int MAX_ITERATIONS = intEnv("ABSINT_MAX_ITERATIONS", 0);
	/** The log level name. */
	public static final String LOG_LEVEL = stringEnv("ABSINT_LOG_LEVEL", "INFO");

	private AbsintConfig() {
	}

	/**
	 * Get a string value from the environment.
	 */
	private static String stringEnv(String var, String def) {
		String value = System.getenv(var);
		if (value != null && !value.isEmpty()) {
			return value;
		} else {
			return def;
		}
	}

	/**
	 * Get an integer value from the environment.
	 */
	private static int intEnv(String var, int def) {
		String value = System.getenv(var);
		if (value != null && !value.isEmpty()) {
			return Integer.parseInt(value);
		} else {
			return def;
		}
	}
}
