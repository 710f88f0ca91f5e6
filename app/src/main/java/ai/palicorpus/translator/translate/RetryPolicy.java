package ai.palicorpus.translator.translate;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded exponential backoff: {@code initialBackoff * 2^attempt}, capped at {@code maxBackoff},
 * then multiplied by {@code 1 ± jitterFactor}.
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, double jitterFactor) {

    public RetryPolicy {
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialBackoff.isNegative() || initialBackoff.isZero()) {
            throw new IllegalArgumentException("initialBackoff must be positive");
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be at least initialBackoff");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(6, Duration.ofSeconds(2), Duration.ofSeconds(60), 0.3);
    }

    /**
     * @param attempt zero-based number of the failed attempt
     * @param random uniform sample in {@code [0, 1)}
     */
    public Duration backoffFor(int attempt, double random) {
        long baseMillis = initialBackoff.toMillis() * (1L << Math.min(Math.max(attempt, 0), 20));
        long cappedMillis = Math.min(baseMillis, maxBackoff.toMillis());
        double jitterMultiplier = 1.0 + (random * 2.0 - 1.0) * jitterFactor;
        return Duration.ofMillis(Math.max(1, (long) (cappedMillis * jitterMultiplier)));
    }
}
