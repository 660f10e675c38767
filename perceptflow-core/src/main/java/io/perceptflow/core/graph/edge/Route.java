package io.perceptflow.core.graph.edge;

import io.perceptflow.core.state.StateView;
import java.util.Objects;
import java.util.function.Predicate;

/// One conditional branch of an {@link Edge}: when `condition` holds, go to `target`.
///
/// @param label human-readable description of the condition, used for visualization, not null
/// @param condition pure predicate over the session state, not null
/// @param target node to route to, not null
public record Route(String label, Predicate<StateView> condition, String target) {

    public Route {
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(target, "target must not be null");
    }

    /// Evaluates the condition.
    ///
    /// @param state current session state, not null
    /// @return true if this route applies
    public boolean matches(StateView state) {
        return condition.test(state);
    }
}
