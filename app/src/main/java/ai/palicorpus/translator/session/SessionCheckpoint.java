package ai.palicorpus.translator.session;

import ai.palicorpus.translator.corpus.NodePath;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Persisted progress of one session scope.
 *
 * @param revision incremented by the store on every write
 * @param lastCompletedLocation slot path of the last unit whose processing finished, or null before the first
 * @param lastCompletedBatchIndex batch of that unit when the scope is cut into batches of {@code batchSize}
 *                                from its first unit, -1 before the first
 * @param completedUnits units finished in scope order since the scope was started, across resumed runs
 * @param batchSize batch size the batch index was computed with, 0 before the first unit
 * @param lockOwner session currently holding the scope, or null when released
 * @param lockHeartbeat last time the owner refreshed the lock
 */
public record SessionCheckpoint(int schemaVersion,
                                long revision,
                                String scope,
                                String lastCompletedLocation,
                                int lastCompletedBatchIndex,
                                int completedUnits,
                                int batchSize,
                                Instant timestamp,
                                SessionState state,
                                String lockOwner,
                                Instant lockHeartbeat) {

    public static final int SCHEMA_VERSION = 2;

    public SessionCheckpoint {
        if (scope == null || scope.isBlank()) {
            throw new IllegalArgumentException("scope must not be blank");
        }
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(state, "state");
        if (lockOwner != null && lockHeartbeat == null) {
            throw new IllegalArgumentException("A held lock needs a heartbeat");
        }
        if (completedUnits < 0 || batchSize < 0) {
            throw new IllegalArgumentException("completedUnits and batchSize must not be negative");
        }
    }

    public static SessionCheckpoint initial(String scope, Instant now) {
        return new SessionCheckpoint(SCHEMA_VERSION, 0, scope, null, -1, 0, 0, now, SessionState.IDLE, null, null);
    }

    public Optional<String> lastCompleted() {
        return Optional.ofNullable(lastCompletedLocation);
    }

    public boolean isTerminal() {
        return state == SessionState.COMPLETE;
    }

    /**
     * Whether the lock keeps {@code candidate} out at {@code now}.
     */
    public boolean isLockedAgainst(String candidate, Instant now, Duration staleAfter) {
        if (lockOwner == null || lockOwner.equals(candidate)) {
            return false;
        }
        return lockHeartbeat.plus(staleAfter).isAfter(now);
    }

    /**
     * Whether this scope and {@code otherScope} share nodes, i.e. one contains the other.
     */
    public boolean overlaps(String otherScope) {
        NodePath own = NodePath.parse(scope);
        NodePath other = NodePath.parse(otherScope);
        return own.startsWith(other) || other.startsWith(own);
    }

    public SessionCheckpoint withRevision(long nextRevision) {
        return new SessionCheckpoint(schemaVersion, nextRevision, scope, lastCompletedLocation, lastCompletedBatchIndex,
                completedUnits, batchSize, timestamp, state, lockOwner, lockHeartbeat);
    }

    /**
     * Takes the lock for a new run. A completed scope starts over from the beginning.
     */
    public SessionCheckpoint lockedBy(String owner, Instant now) {
        if (isTerminal()) {
            return new SessionCheckpoint(SCHEMA_VERSION, revision, scope, null, -1, 0, 0, now, SessionState.RUNNING,
                    owner, now);
        }
        return new SessionCheckpoint(SCHEMA_VERSION, revision, scope, lastCompletedLocation, lastCompletedBatchIndex,
                completedUnits, batchSize, now, SessionState.RUNNING, owner, now);
    }

    /**
     * Records that the unit at {@code location} finished as the {@code unitsDone}-th unit of the scope.
     */
    public SessionCheckpoint withProgress(String location, int unitsDone, int unitsPerBatch, Instant now) {
        if (unitsDone < 1 || unitsPerBatch < 1) {
            throw new IllegalArgumentException("unitsDone and unitsPerBatch must be at least 1");
        }
        return new SessionCheckpoint(schemaVersion, revision, scope, location, (unitsDone - 1) / unitsPerBatch,
                unitsDone, unitsPerBatch, now, state, lockOwner, lockOwner == null ? null : now);
    }

    /**
     * Records the final state of a run and releases the lock.
     */
    public SessionCheckpoint released(SessionState finalState, Instant now) {
        return new SessionCheckpoint(schemaVersion, revision, scope, lastCompletedLocation, lastCompletedBatchIndex,
                completedUnits, batchSize, now, finalState, null, null);
    }
}
