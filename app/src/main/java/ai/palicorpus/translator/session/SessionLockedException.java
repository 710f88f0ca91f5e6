package ai.palicorpus.translator.session;

import java.time.Instant;

/**
 * Another live session holds the checkpoint lock for the same scope or for a scope nested with it.
 */
public class SessionLockedException extends RuntimeException {

    private final String scope;
    private final String owner;

    public SessionLockedException(String scope, String owner, Instant heartbeat) {
        super("Scope '" + scope + "' is locked by " + owner + " (last heartbeat " + heartbeat + ")");
        this.scope = scope;
        this.owner = owner;
    }

    public String scope() {
        return scope;
    }

    public String owner() {
        return owner;
    }
}
