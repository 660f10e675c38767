package io.perceptflow.core.storage.checkpoint;

import io.perceptflow.core.state.SessionSnapshot;
import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/// Immutable state snapshot keyed by session identifier and step index.
///
/// @param sessionId owning session, not null
/// @param stepIndex index of the step the snapshot follows, positive
/// @param snapshot full session state after the step, not null
/// @param createdAt when the checkpoint was written, not null
public record Checkpoint(
        String sessionId, int stepIndex, SessionSnapshot snapshot, Instant createdAt)
        implements Serializable {

    public Checkpoint {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        if (stepIndex < 1) {
            throw new IllegalArgumentException("stepIndex must be positive, got " + stepIndex);
        }
        if (!sessionId.equals(snapshot.sessionId())) {
            throw new IllegalArgumentException(
                    "snapshot belongs to session "
                            + snapshot.sessionId()
                            + ", not "
                            + sessionId);
        }
        createdAt = createdAt != null ? createdAt : Instant.now();
    }
}
