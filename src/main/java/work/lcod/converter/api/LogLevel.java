package work.lcod.converter.api;

import java.util.Locale;

/**
 * Converter log thresholds; {@code FATAL} silences library logging entirely.
 */
public enum LogLevel {
    TRACE("trace"),
    DEBUG("debug"),
    INFO("info"),
    WARN("warn"),
    ERROR("error"),
    FATAL("off");

    private final String simpleLoggerLevel;

    LogLevel(String simpleLoggerLevel) {
        this.simpleLoggerLevel = simpleLoggerLevel;
    }

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
     * Value understood by the {@code org.slf4j.simpleLogger.defaultLogLevel} property.
     */
    public String simpleLoggerLevel() {
        return simpleLoggerLevel;
    }
}
