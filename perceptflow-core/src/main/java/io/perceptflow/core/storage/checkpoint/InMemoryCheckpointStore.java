package io.perceptflow.core.storage.checkpoint;

import io.perceptflow.core.state.SessionSnapshot;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory checkpoint store (default implementation).
///
/// Thread-safe, no external dependencies. Each session owns its own log, which is the unit
/// of locking; sessions never contend with each other.
///
/// @implNote Contents are lost when the process exits. Use the JSON file store from
/// `perceptflow-serialization` for restartable sessions.
///
/// @see CheckpointStore for contract
public final class InMemoryCheckpointStore implements CheckpointStore {

    private final Map<String, SessionLog> logs = new ConcurrentHashMap<>();

    @Override
    public void put(String sessionId, int stepIndex, SessionSnapshot snapshot) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(snapshot, "snapshot must not be null");

        Checkpoint checkpoint;
        try {
            checkpoint = new Checkpoint(sessionId, stepIndex, snapshot, Instant.now());
        } catch (IllegalArgumentException e) {
            throw new CheckpointWriteException(e.getMessage(), e);
        }
        logs.computeIfAbsent(sessionId, id -> new SessionLog()).append(checkpoint);
    }

    @Override
    public List<Checkpoint> getHistory(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        SessionLog log = logs.get(sessionId);
        return log != null ? log.copy() : List.of();
    }

    @Override
    public Optional<Checkpoint> latest(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        SessionLog log = logs.get(sessionId);
        return log != null ? log.last() : Optional.empty();
    }

    @Override
    public List<String> sessions() {
        return List.copyOf(logs.keySet());
    }

    /// Clears all data (useful for testing).
    public void clear() {
        logs.clear();
    }

    private static final class SessionLog {
        private final List<Checkpoint> checkpoints = new ArrayList<>();

        synchronized void append(Checkpoint checkpoint) {
            int last = last().map(Checkpoint::stepIndex).orElse(0);
            if (checkpoint.stepIndex() <= last) {
                throw new CheckpointWriteException(
                        "Checkpoint "
                                + checkpoint.stepIndex()
                                + " out of sequence for session "
                                + checkpoint.sessionId()
                                + ", must follow "
                                + last);
            }
            checkpoints.add(checkpoint);
        }

        synchronized List<Checkpoint> copy() {
            return List.copyOf(checkpoints);
        }

        synchronized Optional<Checkpoint> last() {
            return checkpoints.isEmpty()
                    ? Optional.empty()
                    : Optional.of(checkpoints.get(checkpoints.size() - 1));
        }
    }
}
