package io.perceptflow.core.state;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/// Identity of one end-to-end execution of a submitted command.
///
/// @param sessionId opaque identifier, caller-supplied or generated, not null
/// @param command the originating command text, not null
/// @param createdAt when the session was submitted, not null
public record Session(String sessionId, String command, Instant createdAt)
        implements Serializable {

    public Session {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(command, "command must not be null");
        if (sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        createdAt = createdAt != null ? createdAt : Instant.now();
    }

    /// Creates a session with a random UUID identifier.
    ///
    /// @param command the originating command text, not null
    /// @return new session, never null
    public static Session create(String command) {
        return new Session(UUID.randomUUID().toString(), command, Instant.now());
    }

    /// Creates a session with a caller-supplied identifier.
    ///
    /// @param sessionId identifier to use, not null or blank
    /// @param command the originating command text, not null
    /// @return new session, never null
    public static Session create(String sessionId, String command) {
        return new Session(sessionId, command, Instant.now());
    }
}
