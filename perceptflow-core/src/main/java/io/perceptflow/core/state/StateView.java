package io.perceptflow.core.state;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Read-only view of a session's state, handed to node functions and route predicates.
///
/// The typed accessors read from the free-form {@link #result()} payload and never throw
/// on a missing key; they return the supplied default or an empty value instead.
///
/// @see SessionSnapshot for the immutable implementation
public interface StateView {

    Session session();

    /// Returns the node that is about to run, or the node that just ran while a step is
    /// being post-processed.
    String currentNode();

    /// Returns completed steps in index order.
    List<ExecutionStep> steps();

    /// Returns cumulative per-node failure counters.
    Map<String, Integer> retryCounters();

    /// Returns the accumulated result payload.
    Map<String, Object> result();

    boolean isCompleted();

    /// Returns the terminal outcome, or null while the session is running.
    Outcome outcome();

    default String sessionId() {
        return session().sessionId();
    }

    default String command() {
        return session().command();
    }

    default int stepCount() {
        return steps().size();
    }

    default Optional<ExecutionStep> lastStep() {
        List<ExecutionStep> steps = steps();
        return steps.isEmpty() ? Optional.empty() : Optional.of(steps.get(steps.size() - 1));
    }

    default int retryCount(String node) {
        return retryCounters().getOrDefault(node, 0);
    }

    default boolean has(String key) {
        return result().containsKey(key);
    }

    default Object get(String key) {
        return result().get(key);
    }

    default String getString(String key) {
        Object value = result().get(key);
        return value != null ? value.toString() : null;
    }

    default boolean getBoolean(String key) {
        Object value = result().get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }

    default int getInt(String key, int defaultValue) {
        Object value = result().get(key);
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value != null) {
            try {
                return Integer.parseInt(value.toString());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    @SuppressWarnings("unchecked")
    default List<Object> getList(String key) {
        Object value = result().get(key);
        return value instanceof List<?> list ? (List<Object>) list : List.of();
    }

    @SuppressWarnings("unchecked")
    default Map<String, Object> getMap(String key) {
        Object value = result().get(key);
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }
}
