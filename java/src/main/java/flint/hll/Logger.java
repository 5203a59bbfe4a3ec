package flint.hll;

/**
 * Logger interface for conversion operations
 * 
 * Provides logging capabilities for tracking mode decisions and write errors.
 */
public interface Logger {
    /**
     * Log debug message
     * 
     * @param fmt format string
     * @param args format arguments
     */
    void log(String fmt, Object... args);

    /**
     * Log error message
     * 
     * @param fmt format string
     * @param args format arguments
     */
    void error(String fmt, Object... args);

    /**
     * Discards log messages, prints errors to stderr.
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
}
