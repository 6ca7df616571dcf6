package termbase.flat;

import java.io.PrintStream;
import java.text.SimpleDateFormat;
import java.util.Date;

/**
 * Logger interface for conversion runs
 *
 * Progress of a run goes to {@link #log}, problems to {@link #error}.
 */
public interface Logger {
    /**
     * Log progress message
     *
     * @param fmt Format string
     * @param args Format arguments
     */
    void log(String fmt, Object... args);

    /**
     * Log error message
     *
     * @param fmt Format string
     * @param args Format arguments
     */
    void error(String fmt, Object... args);


    /**
	 * Null logger that discards progress messages but prints errors
	 */
    public static final class NullLogger implements Logger {
        @Override
        public void log(String fmt, Object... args) {
        }

        @Override
        public void error(String fmt, Object... args) {
            System.err.println(String.format(fmt, args));
        }
    }

    /**
     * Logger backed by java.util.logging, progress at FINE and errors at SEVERE
     */
    public static final class DefaultLogger implements Logger {
        private final java.util.logging.Logger LOGGER;

        public DefaultLogger(String name) {
            LOGGER = java.util.logging.Logger.getLogger(name);
        }

        @Override
        public void log(String fmt, Object... args) {
            if (LOGGER.isLoggable(java.util.logging.Level.FINE))
                LOGGER.log(java.util.logging.Level.FINE, String.format(fmt, args));
        }

        @Override
        public void error(String fmt, Object... args) {
            LOGGER.log(java.util.logging.Level.SEVERE, String.format(fmt, args));
        }
    }

    /**
     * Timestamped logger writing progress to a stream, used by the -log option
     */
    public static final class ConsoleLogger implements Logger {
        private final PrintStream out;

        public ConsoleLogger(PrintStream out) {
            this.out = out;
        }

        @Override
        public void log(String fmt, Object... args) {
            out.println(timestamp() + " " + String.format(fmt, args));
        }

        @Override
        public void error(String fmt, Object... args) {
            System.err.println(timestamp() + " " + String.format(fmt, args));
        }

        private static String timestamp() {
            return new SimpleDateFormat("yyyy-MM-dd HH:mm:ss.SSS").format(new Date());
        }
    }
}
