package ai.palicorpus.translator.cli;

import ai.palicorpus.translator.session.SessionReport;
import ai.palicorpus.translator.session.TranslationSessionDriver;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shutdown hook turning an interrupt into a cooperative stop.
 *
 * <p>The JVM halts once its hooks return, so the hook blocks until the guarded session has paused and released
 * its checkpoint lock, or until the grace period runs out.
 */
final class SessionStopHook implements Runnable {

    static final Duration DEFAULT_GRACE = Duration.ofMinutes(3);

    private static final Logger LOGGER = LoggerFactory.getLogger(SessionStopHook.class);

    private final TranslationSessionDriver driver;
    private final Duration grace;
    private final CountDownLatch sessionEnded = new CountDownLatch(1);

    SessionStopHook(TranslationSessionDriver driver, Duration grace) {
        this.driver = Objects.requireNonNull(driver, "driver");
        this.grace = Objects.requireNonNull(grace, "grace");
    }

    /**
     * Runs {@code session} and signals a waiting hook when it returns or fails.
     */
    SessionReport guard(Supplier<SessionReport> session) {
        try {
            return session.get();
        } finally {
            sessionEnded.countDown();
        }
    }

    @Override
    public void run() {
        LOGGER.warn("Interrupt received; stopping after the unit in flight");
        driver.requestStop();
        try {
            if (!sessionEnded.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.error("Session did not pause within {} s; the next run resumes after the last saved unit",
                        grace.toSeconds());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while waiting for the session to pause");
        }
    }
}
