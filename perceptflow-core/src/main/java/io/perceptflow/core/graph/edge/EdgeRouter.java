package io.perceptflow.core.graph.edge;

import io.perceptflow.core.graph.MalformedEdgeException;
import io.perceptflow.core.state.StateView;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Compiled routing table: one {@link Edge} per source node.
///
/// ### Contracts
/// - **Precondition**: predicates are pure functions of state
/// - **Postcondition**: {@link #route(StateView)} returns the target of the first matching
///   route of the current node's edge, or its default target
///
/// @implNote **Thread-safe**. Immutable after construction.
public final class EdgeRouter {

    private final Map<String, Edge> edges;

    /// Compiles a routing table.
    ///
    /// @param edges edges keyed by declaration, not null
    /// @throws MalformedEdgeException if two edges share a source node
    public EdgeRouter(Collection<Edge> edges) {
        Objects.requireNonNull(edges, "edges must not be null");
        Map<String, Edge> table = new LinkedHashMap<>();
        for (Edge edge : edges) {
            if (table.putIfAbsent(edge.source(), edge) != null) {
                throw new MalformedEdgeException(
                        "More than one edge declared for source '" + edge.source() + "'");
            }
        }
        this.edges = Collections.unmodifiableMap(table);
    }

    /// Returns the next node for the state's current node.
    ///
    /// @param state current session state, not null
    /// @return target node name, never null
    /// @throws MalformedEdgeException if the current node has no outgoing edge
    public String route(StateView state) {
        Edge edge = edges.get(state.currentNode());
        if (edge == null) {
            throw new MalformedEdgeException(
                    "No outgoing edge for node '" + state.currentNode() + "'");
        }
        return edge.resolve(state);
    }

    public Optional<Edge> edgeFor(String source) {
        return Optional.ofNullable(edges.get(source));
    }

    /// Returns all edges in declaration order.
    public Collection<Edge> edges() {
        return edges.values();
    }
}
