package absint.util;

import absint.Tty;
import absint.util.Log.Level;

import com.google.common.base.Throwables;

import java.io.PrintStream;

/**
 * Logging backend with colors, writing to standard error.
 */
public final class TtyLogger {
	public static final TtyLogger INSTANCE = new TtyLogger(System.err);

	private final PrintStream out;

	TtyLogger(PrintStream out) {
		this.out = out;
	}

	private void header(Level level, String tag, String line) {
		switch (level) {
		case INFO:
			Tty.print(this.out, "<fg=cyan><b>%-5s</b> <i>%-20s</i></fg> %s\n", level, tag, line);
			break;
		case WARN:
			Tty.print(this.out, "<fg=yellow><b>%-5s</b> <i>%-20s</i> <b>%s</b></fg>\n", level, tag, line);
			break;
		case ERROR:
			Tty.print(this.out, "<fg=red><b>%-5s</b> <i>%-20s</i> <b>%s</b></fg>\n", level, tag, line);
			break;
		default:
			Tty.print(this.out, "<fg=gray><b>%-5s</b> <i>%-20s</i> %s</fg>\n", level, tag, line);
			break;
		}
	}

	private void trailer(Level level, String line) {
		switch (level) {
		case INFO:
			Tty.print(this.out, "%s\n", line);
			break;
		case WARN:
			Tty.print(this.out, "<fg=yellow><b>%s</b></fg>\n", line);
			break;
		case ERROR:
			Tty.print(this.out, "<fg=red><b>%s</b></fg>\n", line);
			break;
		default:
			Tty.print(this.out, "<fg=gray>%s</fg>\n", line);
			break;
		}
	}

	private void stackTrace(Level level, String line) {
		switch (level) {
		case WARN:
			Tty.print(this.out, "<fg=yellow>%s</fg>\n", line);
			break;
		case ERROR:
			Tty.print(this.out, "<fg=red>%s</fg>\n", line);
			break;
		default:
			Tty.print(this.out, "<fg=gray>%s</fg>\n", line);
			break;
		}
	}

	private void log(Level level, Class<?> src, String msg, Throwable e) {
		if (!level.isEnabled()) {
			return;
		}

		// Avoid interleaved lines
		synchronized (this) {
			var tag = src == null ? "?" : src.getSimpleName();

			var str = String.valueOf(msg);
			if (str.contains("\n")) {
				header(level, tag, "");
				str.lines()
					.forEach(line -> trailer(level, line));
			} else {
				header(level, tag, str);
			}

			if (e != null) {
				Throwables.getStackTraceAsString(e)
					.lines()
					.forEach(line -> stackTrace(level, line));
			}
		}
	}

	public void trace(Class<?> src, String msg, Throwable e) {
		log(Level.TRACE, src, msg, e);
	}

	public void debug(Class<?> src, String msg, Throwable e) {
		log(Level.DEBUG, src, msg, e);
	}

	public void info(Class<?> src, String msg, Throwable e) {
		log(Level.INFO, src, msg, e);
	}

	public void warn(Class<?> src, String msg, Throwable e) {
		log(Level.WARN, src, msg, e);
	}

	public void error(Class<?> src, String msg, Throwable e) {
		log(Level.ERROR, src, msg, e);
	}
}
