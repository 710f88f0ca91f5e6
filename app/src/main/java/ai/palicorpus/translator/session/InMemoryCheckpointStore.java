package ai.palicorpus.translator.session;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Checkpoint store that keeps nothing on disk. Used for dry runs.
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private final Map<String, SessionCheckpoint> checkpoints = new HashMap<>();
    private final Duration staleAfter;
    private final Clock clock;

    public InMemoryCheckpointStore() {
        this(FileCheckpointStore.DEFAULT_STALE_AFTER, Clock.systemUTC());
    }

    public InMemoryCheckpointStore(Duration staleAfter, Clock clock) {
        this.staleAfter = Objects.requireNonNull(staleAfter, "staleAfter");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public synchronized Optional<SessionCheckpoint> load(String scope) {
        return Optional.ofNullable(checkpoints.get(scope));
    }

    @Override
    public synchronized SessionCheckpoint acquire(String scope, String owner) {
        SessionCheckpoint current = checkpoints.getOrDefault(scope, SessionCheckpoint.initial(scope, clock.instant()));
        if (current.isLockedAgainst(owner, clock.instant(), staleAfter)) {
            throw new SessionLockedException(scope, current.lockOwner(), current.lockHeartbeat());
        }
        for (SessionCheckpoint other : checkpoints.values()) {
            if (!other.scope().equals(scope) && other.overlaps(scope)
                    && other.isLockedAgainst(owner, clock.instant(), staleAfter)) {
                throw new SessionLockedException(other.scope(), other.lockOwner(), other.lockHeartbeat());
            }
        }
        return store(current.lockedBy(owner, clock.instant()), current.revision());
    }

    @Override
    public synchronized SessionCheckpoint save(SessionCheckpoint checkpoint, String owner) {
        SessionCheckpoint current = checkpoints.get(checkpoint.scope());
        if (current != null && current.lockOwner() != null && !current.lockOwner().equals(owner)) {
            throw new SessionLockedException(checkpoint.scope(), current.lockOwner(), current.lockHeartbeat());
        }
        return store(checkpoint, current == null ? 0 : current.revision());
    }

    private SessionCheckpoint store(SessionCheckpoint checkpoint, long previousRevision) {
        SessionCheckpoint stored = checkpoint.withRevision(previousRevision + 1);
        checkpoints.put(stored.scope(), stored);
        return stored;
    }
}
