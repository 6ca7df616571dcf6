/**
 * IO.java
 */
package termbase.flat;

import java.io.File;
import java.text.DecimalFormat;

/**
 * Utility class for path resolution and human-readable sizes and times.
 */
public final class IO {

	private IO() {
	}

	/**
	 * File for a command-line path; a leading ~ or ${HOME} stands for the user home
	 */
	public static File path(final String path) {
		final String home = System.getProperty("user.home");
		if (path.equals("~") || path.startsWith("~/"))
			return new File(home + path.substring(1));
		if (path.startsWith("${HOME}"))
			return new File(home + path.substring("${HOME}".length()));
		return new File(path);
	}

	/**
	 * Same file name with its last extension replaced, e.g. glossary.tbx to glossary.xlsx
	 */
	public static File withExtension(final File file, final String extension) {
		final String name = file.getName();
		final int dot = name.lastIndexOf('.');
		final String base = (dot > 0) ? name.substring(0, dot) : name;
		return new File(file.getParentFile(), base + extension);
	}

	/**
	 * Lower-case file name extension including the dot, or "" if none
	 */
	public static String extension(final File file) {
		final String name = file.getName();
		final int dot = name.lastIndexOf('.');
		return (dot > 0) ? name.substring(dot).toLowerCase(java.util.Locale.ROOT) : "";
	}

	static void mkdirs(final File file) throws ConversionException {
		final File parent = file.getAbsoluteFile().getParentFile();
		if (parent != null && !parent.isDirectory() && !parent.mkdirs())
			throw new ConversionException(ErrorCode.OUTPUT_WRITE_ERROR, "cannot create directory " + parent);
	}

	/**
	 * File size with a binary unit suffix, e.g. 1,536 bytes as "1.5K"
	 */
	public static String readableBytesSize(final long bytes) {
		if (bytes <= 0)
			return "0";
		final String units = "BKMGT";
		double v = bytes;
		int unit = 0;
		while (v >= 1024 && unit < units.length() - 1) {
			v /= 1024;
			unit++;
		}
		return new DecimalFormat("#,##0.#").format(v) + units.charAt(unit);
	}

	/**
	 * Wall clock for a conversion run.
	 */
	public static final class StopWatch {
		private final long start = System.currentTimeMillis();

		public long elapsed() {
			return System.currentTimeMillis() - start;
		}

		public String humanReadableTime() {
			return humanReadableTime(elapsed());
		}

		/**
		 * 850ms, 12s, 3m05s
		 */
		public static String humanReadableTime(final long ms) {
			if (ms < 1000L)
				return ms + "ms";
			final long seconds = ms / 1000L;
			if (seconds < 60)
				return seconds + "s";
			return String.format("%dm%02ds", seconds / 60, seconds % 60);
		}
	}
}
