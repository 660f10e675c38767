package io.perceptflow.core.storage.checkpoint;

import java.io.Serial;

/// Thrown when a session has no recorded checkpoints.
public class SessionNotFoundException extends RuntimeException {
    @Serial private static final long serialVersionUID = -3079224655218802472L;

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("No checkpoints recorded for session: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
