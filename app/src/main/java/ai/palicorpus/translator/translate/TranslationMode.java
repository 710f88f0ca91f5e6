package ai.palicorpus.translator.translate;

import java.util.Locale;

/**
 * Which {@link Translator} a session uses.
 */
public enum TranslationMode {
    /** The configured LLM provider, paced and retried. */
    PRODUCTION,
    /** Echoes the Pali source; nothing leaves the machine. */
    DRY_RUN,
    /** Deterministic placeholder output for wiring tests. */
    MOCK;

    public boolean callsProvider() {
        return this == PRODUCTION;
    }

    public static TranslationMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return PRODUCTION;
        }
        String normalized = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (TranslationMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported translation mode: " + raw);
    }
}
