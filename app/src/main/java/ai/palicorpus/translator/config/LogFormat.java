package ai.palicorpus.translator.config;

import java.util.Locale;

/**
 * Console log output: human-readable lines or one JSON object per event.
 */
public enum LogFormat {
    TEXT,
    JSON;

    public static LogFormat from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Log format must be provided");
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (LogFormat format : values()) {
            if (format.name().equals(normalized)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unsupported log format: " + raw + " (expected text or json)");
    }
}
