package ai.palicorpus.translator.translate;

import ai.palicorpus.translator.corpus.Language;
import java.time.Duration;
import java.util.Objects;
import java.util.function.DoubleSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Paces provider calls and retries transient failures with exponential backoff.
 *
 * <p>Quota, unavailability and rejections are never retried here; they surface to the caller on the first
 * occurrence. When every attempt fails transiently the last {@link TransientProviderException} is rethrown.
 */
public class TranslationService implements Translator {

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationService.class);

    private final Translator delegate;
    private final RetryPolicy retryPolicy;
    private final RequestPacer pacer;
    private final Sleeper sleeper;
    private final DoubleSupplier random;

    public TranslationService(Translator delegate, RetryPolicy retryPolicy, RequestPacer pacer) {
        this(delegate, retryPolicy, pacer, Sleeper.system(), Math::random);
    }

    public TranslationService(Translator delegate, RetryPolicy retryPolicy, RequestPacer pacer,
                              Sleeper sleeper, DoubleSupplier random) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.pacer = Objects.requireNonNull(pacer, "pacer");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public String translate(String sourceText, Language target) {
        int maxAttempts = retryPolicy.maxAttempts();
        for (int attempt = 0; ; attempt++) {
            try {
                pacer.acquire();
                return delegate.translate(sourceText, target);
            } catch (TransientProviderException ex) {
                if (attempt == maxAttempts - 1) {
                    LOGGER.error("Translation into {} failed after {} attempt(s): {}", target.key(), maxAttempts,
                            ex.getMessage());
                    throw ex;
                }
                Duration delay = retryPolicy.backoffFor(attempt, random.getAsDouble());
                LOGGER.warn("Transient provider failure ({}); retrying in {} ms (attempt {}/{})",
                        ex.getMessage(), delay.toMillis(), attempt + 1, maxAttempts);
                pause(delay, ex);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new TransientProviderException("Interrupted while pacing provider requests", ex);
            }
        }
    }

    private void pause(Duration delay, TransientProviderException failure) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Translation retry interrupted");
            throw failure;
        }
    }
}
