package io.perceptflow.core.storage.checkpoint;

import io.perceptflow.core.state.SessionSnapshot;
import io.perceptflow.core.state.SessionState;
import java.util.List;
import java.util.Optional;

/// Append-only log of session snapshots keyed by `(sessionId, stepIndex)`.
///
/// ### Contracts
/// - {@link #put} returns only after the checkpoint is persisted
/// - step indices of one session strictly increase; an index may be skipped when the write
///   of that step failed and the executor continued without it
/// - {@link #getHistory} returns checkpoints in step order; the returned list is a copy and
///   may be iterated any number of times
///
/// @implNote Implementations must serialize writes per session and may process different
/// sessions concurrently.
///
/// @see InMemoryCheckpointStore for the default implementation
public interface CheckpointStore {

    /// Persists the snapshot taken after step `stepIndex`.
    ///
    /// @param sessionId owning session, not null
    /// @param stepIndex step the snapshot follows, greater than the latest written index
    /// @param snapshot full session state, not null
    /// @throws CheckpointWriteException if the write fails or the index does not increase
    void put(String sessionId, int stepIndex, SessionSnapshot snapshot);

    /// Returns all checkpoints of a session in step order.
    ///
    /// @param sessionId session identifier, not null
    /// @return checkpoints, empty if the session is unknown, never null
    List<Checkpoint> getHistory(String sessionId);

    /// Returns the checkpoint with the highest step index.
    ///
    /// @param sessionId session identifier, not null
    /// @return latest checkpoint, or empty if none was written
    Optional<Checkpoint> latest(String sessionId);

    /// Lists identifiers of sessions with at least one checkpoint.
    ///
    /// @return session identifiers, never null
    List<String> sessions();

    /// Reconstructs session state from the latest checkpoint.
    ///
    /// @param sessionId session identifier, not null
    /// @return state with steps, counters and payload intact, never null
    /// @throws SessionNotFoundException if no checkpoint exists
    default SessionState resume(String sessionId) {
        return latest(sessionId)
                .map(checkpoint -> checkpoint.snapshot().toState())
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }
}
