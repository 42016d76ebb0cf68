package work.enamap.mapper.api;

import java.util.Locale;

/**
 * Log thresholds accepted on the command line. {@link #FATAL} behaves like {@link #ERROR}.
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
            return INFO;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    /**
     * Name of the matching SLF4J/Logback level.
     */
    public String backendName() {
        return this == FATAL ? ERROR.name() : name();
    }
}
