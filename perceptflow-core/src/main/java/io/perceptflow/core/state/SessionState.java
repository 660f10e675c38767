package io.perceptflow.core.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Mutable record threaded through the graph for one {@link Session}.
///
/// Only the executor writes to this class. Node functions and route predicates receive
/// a {@link SessionSnapshot} instead.
///
/// ### Merge Rules
/// - scalar fields: last write wins
/// - list fields: new elements are appended to the existing list
/// - a `null` value removes the field
///
/// ### Contracts
/// - **Invariant**: step indices are dense and strictly increasing, starting at 1
/// - **Invariant**: retry counters only grow
///
/// @implNote **Not thread-safe**. A session's steps run sequentially on one thread at a
/// time; publication to other threads goes through {@link #snapshot()}.
///
/// @see SessionSnapshot for the immutable counterpart
public final class SessionState implements StateView {

    private final Session session;
    private final List<ExecutionStep> steps;
    private final Map<String, Integer> retryCounters;
    private final Map<String, Object> result;
    private String currentNode;
    private boolean completed;
    private Outcome outcome;

    private SessionState(
            Session session,
            String currentNode,
            List<ExecutionStep> steps,
            Map<String, Integer> retryCounters,
            Map<String, Object> result,
            boolean completed,
            Outcome outcome) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.currentNode = Objects.requireNonNull(currentNode, "currentNode must not be null");
        this.steps = new ArrayList<>(steps);
        this.retryCounters = new HashMap<>(retryCounters);
        this.result = new LinkedHashMap<>(result);
        this.completed = completed;
        this.outcome = outcome;
    }

    /// Creates the initial state of a new session.
    ///
    /// @param session the session identity, not null
    /// @param entryNode the node to run first, not null
    /// @return fresh state with no steps, never null
    public static SessionState start(Session session, String entryNode) {
        return new SessionState(session, entryNode, List.of(), Map.of(), Map.of(), false, null);
    }

    static SessionState restore(SessionSnapshot snapshot) {
        return new SessionState(
                snapshot.session(),
                snapshot.currentNode(),
                snapshot.steps(),
                snapshot.retryCounters(),
                snapshot.result(),
                snapshot.completed(),
                snapshot.outcome());
    }

    @Override
    public Session session() {
        return session;
    }

    @Override
    public String currentNode() {
        return currentNode;
    }

    @Override
    public List<ExecutionStep> steps() {
        return Collections.unmodifiableList(steps);
    }

    @Override
    public Map<String, Integer> retryCounters() {
        return Collections.unmodifiableMap(retryCounters);
    }

    @Override
    public Map<String, Object> result() {
        return Collections.unmodifiableMap(result);
    }

    @Override
    public boolean isCompleted() {
        return completed;
    }

    @Override
    public Outcome outcome() {
        return outcome;
    }

    /// Returns the index the next appended step must carry.
    public int nextStepIndex() {
        return steps.size() + 1;
    }

    public void setCurrentNode(String currentNode) {
        this.currentNode = Objects.requireNonNull(currentNode, "currentNode must not be null");
    }

    /// Merges a node's partial update into the result payload.
    ///
    /// @param update field updates, not null (may be empty)
    /// @throws NullPointerException if update is null
    public void merge(Map<String, Object> update) {
        Objects.requireNonNull(update, "update must not be null");
        for (Map.Entry<String, Object> entry : update.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (value == null) {
                result.remove(key);
            } else if (value instanceof List<?> added) {
                List<Object> merged = new ArrayList<>();
                if (result.get(key) instanceof List<?> existing) {
                    merged.addAll(existing);
                }
                merged.addAll(added);
                result.put(key, merged);
            } else {
                result.put(key, value);
            }
        }
    }

    /// Appends a completed step.
    ///
    /// @param step the step to append, not null
    /// @throws IllegalStateException if the step index is not {@link #nextStepIndex()}
    public void appendStep(ExecutionStep step) {
        Objects.requireNonNull(step, "step must not be null");
        if (step.index() != nextStepIndex()) {
            throw new IllegalStateException(
                    "Step index "
                            + step.index()
                            + " breaks the sequence of session "
                            + session.sessionId()
                            + ", expected "
                            + nextStepIndex());
        }
        steps.add(step);
    }

    /// Increments the failure counter of a node.
    ///
    /// @param node node name, not null
    /// @return the counter value after incrementing
    public int incrementRetryCount(String node) {
        return retryCounters.merge(node, 1, Integer::sum);
    }

    /// Sets the completion flag together with the terminal outcome.
    ///
    /// @param outcome the terminal outcome, not null
    /// @throws IllegalStateException if the session is already terminal
    public void complete(Outcome outcome) {
        Objects.requireNonNull(outcome, "outcome must not be null");
        if (completed) {
            throw new IllegalStateException(
                    "Session " + session.sessionId() + " is already terminal");
        }
        this.completed = true;
        this.outcome = outcome;
    }

    public SessionSnapshot snapshot() {
        return SessionSnapshot.from(this);
    }
}
