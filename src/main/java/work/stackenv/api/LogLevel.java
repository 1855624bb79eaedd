package work.stackenv.api;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Threshold for stackenv's own log output. {@code quiet} and {@code warning} are accepted as aliases.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    OFF;

    public static final LogLevel DEFAULT = WARN;

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        switch (normalized) {
            case "QUIET":
                return OFF;
            case "WARNING":
                return WARN;
            default:
                break;
        }
        for (LogLevel level : values()) {
            if (level.name().equals(normalized)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unsupported log level '" + value + "' (expected one of " + accepted() + ")");
    }

    /**
     * True when a message logged at {@code level} passes this threshold.
     */
    public boolean admits(LogLevel level) {
        return this != OFF && level != OFF && level.ordinal() >= ordinal();
    }

    static String accepted() {
        return Arrays.stream(values()).map(level -> level.name().toLowerCase(Locale.ROOT)).collect(Collectors.joining("|"));
    }
}
