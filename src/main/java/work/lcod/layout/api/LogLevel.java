package work.lcod.layout.api;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Log thresholds accepted by the CLI and the runner.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    OFF;

    /** System property read by slf4j-simple when the first logger is created. */
    public static final String SIMPLE_LOGGER_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return WARN;
        }
        return find(value).orElseThrow(() -> new IllegalArgumentException("Unsupported log level: " + value));
    }

    /** The level named {@code value}, ignoring case; empty for unknown names. */
    public static Optional<LogLevel> find(String value) {
        if (value == null) {
            return Optional.empty();
        }
        var name = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).filter(level -> level.name().equals(name)).findFirst();
    }

    /** The level name understood by slf4j-simple. */
    public String simpleLoggerLevel() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Makes this the default level of loggers created from now on. slf4j-simple reads the level
     * once, when the first logger is created, so this has to run before any class holding a
     * static logger is initialized.
     */
    public void apply() {
        System.setProperty(SIMPLE_LOGGER_PROPERTY, simpleLoggerLevel());
    }
}
