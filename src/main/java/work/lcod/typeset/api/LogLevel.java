package work.lcod.typeset.api;

import java.util.Locale;

/**
 * Log thresholds for the typesetting runner. Messages go to standard error.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    FATAL;

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return WARN;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    /**
     * Whether a message at {@code level} passes this threshold.
     */
    public boolean allows(LogLevel level) {
        return level.ordinal() >= ordinal();
    }
}
