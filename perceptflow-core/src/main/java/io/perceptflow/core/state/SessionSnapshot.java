package io.perceptflow.core.state;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Immutable copy of a {@link SessionState}, used for checkpoints, resume and as the
/// read-only view handed to nodes.
///
/// ### Contracts
/// - **Precondition**: `session` and `currentNode` must not be null
/// - **Postcondition**: all collections are unmodifiable copies
///
/// ### Usage
/// {@snippet :
/// SessionSnapshot snapshot = state.snapshot();
/// SessionState restored = snapshot.toState();
/// }
///
/// @param session the session identity, not null
/// @param currentNode node recorded as current when the snapshot was taken, not null
/// @param steps completed steps in index order, not null
/// @param retryCounters cumulative per-node failure counters, not null
/// @param result accumulated result payload, not null
/// @param completed whether the completion flag was set
/// @param outcome terminal outcome, null while running
public record SessionSnapshot(
        Session session,
        String currentNode,
        List<ExecutionStep> steps,
        Map<String, Integer> retryCounters,
        Map<String, Object> result,
        boolean completed,
        Outcome outcome)
        implements StateView, Serializable {

    public SessionSnapshot {
        Objects.requireNonNull(session, "session must not be null");
        Objects.requireNonNull(currentNode, "currentNode must not be null");
        steps = steps != null ? List.copyOf(steps) : List.of();
        retryCounters = retryCounters != null ? Map.copyOf(retryCounters) : Map.of();
        result = result != null ? copyPayload(result) : Map.of();
    }

    /// Creates a snapshot from the given mutable state.
    ///
    /// @param state the state to copy, not null
    /// @return new snapshot, never null
    public static SessionSnapshot from(SessionState state) {
        Objects.requireNonNull(state, "state must not be null");
        return new SessionSnapshot(
                state.session(),
                state.currentNode(),
                state.steps(),
                state.retryCounters(),
                state.result(),
                state.isCompleted(),
                state.outcome());
    }

    /// Restores mutable state from this snapshot.
    ///
    /// @return reconstructed state with steps, counters and payload intact, never null
    public SessionState toState() {
        return SessionState.restore(this);
    }

    @Override
    public boolean isCompleted() {
        return completed;
    }

    private static Map<String, Object> copyPayload(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : source.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof List<?> list) {
                value = Collections.unmodifiableList(new ArrayList<>(list));
            }
            copy.put(entry.getKey(), value);
        }
        return Collections.unmodifiableMap(copy);
    }
}
