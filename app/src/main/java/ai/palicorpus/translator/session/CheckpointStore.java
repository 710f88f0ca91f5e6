package ai.palicorpus.translator.session;

import java.util.Optional;

/**
 * Storage of session checkpoints. Every write increments the checkpoint revision.
 */
public interface CheckpointStore {

    Optional<SessionCheckpoint> load(String scope);

    /**
     * Loads or creates the checkpoint of {@code scope} and takes its lock for {@code owner}.
     *
     * @throws SessionLockedException when another owner holds a lock that is not stale
     */
    SessionCheckpoint acquire(String scope, String owner);

    /**
     * Writes {@code checkpoint} on behalf of {@code owner}. Fails with {@link SessionLockedException} when the
     * stored lock was taken over by another owner in the meantime.
     *
     * @return the checkpoint as stored, with its new revision
     */
    SessionCheckpoint save(SessionCheckpoint checkpoint, String owner);
}
