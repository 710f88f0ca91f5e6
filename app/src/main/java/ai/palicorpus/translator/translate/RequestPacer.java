package ai.palicorpus.translator.translate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Spaces provider calls: at most {@code requestsPerMinute} calls in any sliding minute and at least
 * {@code minInterval} between consecutive calls. A limit of zero disables the window.
 */
public class RequestPacer {

    private static final Logger LOGGER = LoggerFactory.getLogger(RequestPacer.class);
    private static final Duration WINDOW = Duration.ofMinutes(1);

    private final int requestsPerMinute;
    private final Duration minInterval;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Deque<Instant> recentRequests = new ArrayDeque<>();
    private Instant lastRequest;

    public RequestPacer(int requestsPerMinute, Duration minInterval) {
        this(requestsPerMinute, minInterval, Clock.systemUTC(), Sleeper.system());
    }

    public RequestPacer(int requestsPerMinute, Duration minInterval, Clock clock, Sleeper sleeper) {
        if (requestsPerMinute < 0) {
            throw new IllegalArgumentException("requestsPerMinute must not be negative");
        }
        this.requestsPerMinute = requestsPerMinute;
        this.minInterval = Objects.requireNonNull(minInterval, "minInterval");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public static RequestPacer unpaced() {
        return new RequestPacer(0, Duration.ZERO);
    }

    /**
     * Blocks until the next request may be sent, then records it.
     */
    public synchronized void acquire() throws InterruptedException {
        Instant now = clock.instant();
        Instant earliest = now;
        if (lastRequest != null && !minInterval.isZero()) {
            earliest = later(earliest, lastRequest.plus(minInterval));
        }
        evictBefore(now.minus(WINDOW));
        if (requestsPerMinute > 0 && recentRequests.size() >= requestsPerMinute) {
            earliest = later(earliest, recentRequests.peekFirst().plus(WINDOW));
        }
        if (earliest.isAfter(now)) {
            Duration wait = Duration.between(now, earliest);
            LOGGER.debug("Pacing provider requests: waiting {} ms", wait.toMillis());
            sleeper.sleep(wait);
        }
        Instant sent = clock.instant();
        recentRequests.addLast(sent);
        lastRequest = sent;
        evictBefore(sent.minus(WINDOW));
    }

    private void evictBefore(Instant cutoff) {
        while (!recentRequests.isEmpty() && !recentRequests.peekFirst().isAfter(cutoff)) {
            recentRequests.removeFirst();
        }
    }

    private static Instant later(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }
}
