package ai.palicorpus.translator.translate;

import java.time.Duration;

/**
 * Blocking wait, replaceable in tests.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
