package absint;

import java.io.PrintStream;
import java.util.Map;

/**
 * Utilities for TTY formatting.
 */
public class Tty {
	/** Whether standard output is a TTY. */
	public static final boolean IS_A_TTY = System.console() != null;

	private static final Map<String, String> COLORS = Map.ofEntries(
		Map.entry("<b>", "\033[1m"),
		Map.entry("</b>", "\033[22m"),

		Map.entry("<i>", "\033[3m"),
		Map.entry("</i>", "\033[23m"),

		Map.entry("<fg=red>", "\033[31m"),
		Map.entry("<fg=yellow>", "\033[33m"),
		Map.entry("<fg=cyan>", "\033[36m"),
		Map.entry("<fg=gray>", "\033[90m"),
		Map.entry("</fg>", "\033[39m")
	);

	private Tty() {
	}

	/**
	 * Replace the color tags in a format string, or strip them if we're not
	 * writing to a terminal.
	 */
	public static String colorize(String format) {
		for (var color : COLORS.entrySet()) {
			var key = color.getKey();
			var value = IS_A_TTY ? color.getValue() : "";
			format = format.replace(key, value);
		}
		return format;
	}

	public static void print(PrintStream out, String format, Object... args) {
		out.format(colorize(format), args);
	}

	public static void print(String format, Object... args) {
		print(System.out, format, args);
	}
}
