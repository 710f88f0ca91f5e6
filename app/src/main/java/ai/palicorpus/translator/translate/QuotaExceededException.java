package ai.palicorpus.translator.translate;

import java.time.Duration;
import java.util.Optional;

/**
 * The provider refused further requests for now (HTTP 429, RESOURCE_EXHAUSTED or a quota message).
 */
public class QuotaExceededException extends TranslationException {

    private final Duration retryAfter;

    public QuotaExceededException(String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.retryAfter = retryAfter;
    }

    /**
     * Delay suggested by the provider, when it sent one.
     */
    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
