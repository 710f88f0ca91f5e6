package ai.palicorpus.translator.config;

import ai.palicorpus.translator.translate.RetryPolicy;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Holds runtime settings for the translation model provider, its retry policy and request pacing.
 */
public record TranslatorConfig(LlmProvider provider,
                               String modelName,
                               Optional<String> baseUrl,
                               RetryPolicy retryPolicy,
                               int requestsPerMinute,
                               Duration minRequestInterval) {

    public TranslatorConfig {
        provider = Objects.requireNonNull(provider, "provider");
        modelName = requireNonBlank(modelName, "modelName");
        baseUrl = baseUrl == null ? Optional.empty() : baseUrl;
        retryPolicy = retryPolicy == null ? RetryPolicy.defaults() : retryPolicy;
        if (requestsPerMinute < 0) {
            throw new IllegalArgumentException("requestsPerMinute must be zero or greater");
        }
        minRequestInterval = minRequestInterval == null ? Duration.ZERO : minRequestInterval;
        if (minRequestInterval.isNegative()) {
            throw new IllegalArgumentException("minRequestInterval must not be negative");
        }
    }

    public TranslatorConfig(LlmProvider provider, String modelName, Optional<String> baseUrl) {
        this(provider, modelName, baseUrl, RetryPolicy.defaults(), 0, Duration.ZERO);
    }

    public boolean isOllama() {
        return provider == LlmProvider.OLLAMA;
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
