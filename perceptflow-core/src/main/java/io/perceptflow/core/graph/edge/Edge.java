package io.perceptflow.core.graph.edge;

import io.perceptflow.core.graph.MalformedEdgeException;
import io.perceptflow.core.state.StateView;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/// Routing rule for one source node: ordered conditional routes plus a mandatory default.
///
/// Edges are data. They are compiled once into an {@link EdgeRouter} and never change
/// during execution.
///
/// ### Usage
/// {@snippet :
/// Edge edge = Edge.from("validate")
///     .when("more steps", state -> state.getInt("remaining", 0) > 0, "act")
///     .otherwise("capture");
/// }
///
/// @param source node the edge leaves from, not null
/// @param routes conditional routes in declaration order, not null
/// @param defaultTarget node used when no route matches, not null
public record Edge(String source, List<Route> routes, String defaultTarget) {

    public Edge {
        Objects.requireNonNull(source, "source must not be null");
        if (defaultTarget == null || defaultTarget.isBlank()) {
            throw new MalformedEdgeException("Edge from '" + source + "' has no default target");
        }
        routes = routes != null ? List.copyOf(routes) : List.of();
    }

    /// Creates an unconditional edge.
    ///
    /// @param source source node, not null
    /// @param target the only target, not null
    /// @return new edge, never null
    public static Edge always(String source, String target) {
        return new Edge(source, List.of(), target);
    }

    /// Starts a fluent edge declaration.
    ///
    /// @param source source node, not null
    /// @return builder collecting routes in declaration order, never null
    public static Builder from(String source) {
        return new Builder(source);
    }

    /// Resolves the target for the given state.
    ///
    /// The first matching route wins; declaration order is never rearranged.
    ///
    /// @param state current session state, not null
    /// @return target node name, never null
    public String resolve(StateView state) {
        for (Route route : routes) {
            if (route.matches(state)) {
                return route.target();
            }
        }
        return defaultTarget;
    }

    /// Fluent builder for {@link Edge}.
    public static final class Builder {
        private final String source;
        private final List<Route> routes = new ArrayList<>();

        private Builder(String source) {
            this.source = Objects.requireNonNull(source, "source must not be null");
        }

        public Builder when(String label, Predicate<StateView> condition, String target) {
            routes.add(new Route(label, condition, target));
            return this;
        }

        /// Finishes the edge with its mandatory default target.
        ///
        /// @param defaultTarget node used when no route matches, not null
        /// @return the built edge, never null
        public Edge otherwise(String defaultTarget) {
            return new Edge(source, routes, defaultTarget);
        }
    }
}
