package ai.palicorpus.translator.config;

import java.util.Locale;

/**
 * Supported large language model providers and the model each uses unless {@code LLM_MODEL} says otherwise.
 */
public enum LlmProvider {
    GEMINI("gemini-2.5-flash"),
    OLLAMA("gemma2:9b");

    private final String defaultModel;

    LlmProvider(String defaultModel) {
        this.defaultModel = defaultModel;
    }

    public String defaultModel() {
        return defaultModel;
    }

    public static LlmProvider from(String value) {
        if (value == null) {
            return GEMINI;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "gemini", "" -> GEMINI;
            case "ollama" -> OLLAMA;
            default -> throw new IllegalArgumentException("Unsupported LLM provider: " + value);
        };
    }
}
