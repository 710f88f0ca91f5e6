package ai.palicorpus.translator.session;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle of a translation session.
 */
public enum SessionState {
    IDLE,
    RUNNING,
    PAUSED_QUOTA,
    PAUSED_ERROR,
    PAUSED_USER,
    COMPLETE;

    public boolean isPaused() {
        return this == PAUSED_QUOTA || this == PAUSED_ERROR || this == PAUSED_USER;
    }

    public boolean canTransitionTo(SessionState next) {
        return allowedSuccessors().contains(next);
    }

    private Set<SessionState> allowedSuccessors() {
        return switch (this) {
            case IDLE, PAUSED_QUOTA, PAUSED_ERROR, PAUSED_USER, COMPLETE -> EnumSet.of(RUNNING);
            case RUNNING -> EnumSet.of(PAUSED_QUOTA, PAUSED_ERROR, PAUSED_USER, COMPLETE);
        };
    }

    public static SessionState from(String raw) {
        if (raw == null || raw.isBlank()) {
            return IDLE;
        }
        return SessionState.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
