package io.perceptflow.core.graph.node;

import io.perceptflow.core.graph.DuplicateNodeException;
import io.perceptflow.core.graph.UnknownNodeException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Immutable mapping from node name to node function.
///
/// Built once through {@link Builder}; no registration is possible afterwards, so lookups
/// need no synchronization.
///
/// ### Contracts
/// - **Invariant**: names are unique and non-blank
/// - **Invariant**: iteration order is registration order
///
/// @implNote **Thread-safe** after construction.
public final class NodeRegistry {

    private final Map<String, Node> nodes;

    private NodeRegistry(Map<String, Node> nodes) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
    }

    /// Looks up a node function by name.
    ///
    /// @param name node name, not null
    /// @return the node, or empty if not registered
    public Optional<Node> find(String name) {
        return Optional.ofNullable(nodes.get(name));
    }

    /// Looks up a node function by name.
    ///
    /// @param name node name, not null
    /// @return the node, never null
    /// @throws UnknownNodeException if not registered
    public Node getOrThrow(String name) {
        Node node = nodes.get(name);
        if (node == null) {
            throw new UnknownNodeException(name, "lookup");
        }
        return node;
    }

    public boolean contains(String name) {
        return nodes.containsKey(name);
    }

    /// Returns registered names in registration order.
    public Set<String> names() {
        return nodes.keySet();
    }

    public int size() {
        return nodes.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Collects node registrations before the registry is frozen.
    public static final class Builder {
        private final Map<String, Node> nodes = new LinkedHashMap<>();

        private Builder() {}

        /// Registers a node function.
        ///
        /// @param name unique node name, not null or blank
        /// @param node the node function, not null
        /// @return this builder for chaining
        /// @throws DuplicateNodeException if `name` is already registered
        public Builder register(String name, Node node) {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(node, "node must not be null");
            if (name.isBlank()) {
                throw new IllegalArgumentException("node name must not be blank");
            }
            if (nodes.putIfAbsent(name, node) != null) {
                throw new DuplicateNodeException(name);
            }
            return this;
        }

        public NodeRegistry build() {
            return new NodeRegistry(nodes);
        }
    }
}
