package io.perceptflow.core.graph;

import io.perceptflow.core.graph.edge.Edge;
import io.perceptflow.core.graph.edge.EdgeRouter;
import io.perceptflow.core.graph.edge.Route;
import io.perceptflow.core.graph.node.Node;
import io.perceptflow.core.graph.node.NodeRegistry;
import io.perceptflow.core.graph.retry.RetryPolicy;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Compiled, immutable task graph: node functions, routing table and retry policies.
///
/// Cycles are allowed. Termination of cyclic graphs is guaranteed by the executor's step
/// budget, not by the graph shape.
///
/// ### Contracts
/// - **Postcondition** of {@link Builder#build()}: the entry node, every edge source,
///   target and default, and every recovery node name a registered node
///
/// ### Usage
/// {@snippet :
/// Graph graph = Graph.builder()
///     .name("demo")
///     .entry("capture")
///     .node("capture", captureNode)
///     .node("analyze", analyzeNode, RetryPolicy.recoverVia("capture", 3))
///     .edge(Edge.always("capture", "analyze"))
///     .edge(Edge.always("analyze", "capture"))
///     .build();
/// }
///
/// @implNote **Thread-safe**. One graph may back any number of concurrent sessions.
///
/// @see io.perceptflow.core.execution.GraphExecutor for execution
public final class Graph {

    private final String name;
    private final String entryNode;
    private final NodeRegistry registry;
    private final EdgeRouter router;
    private final Map<String, RetryPolicy> retryPolicies;

    private Graph(Builder builder, NodeRegistry registry, EdgeRouter router) {
        this.name = builder.name;
        this.entryNode = builder.entryNode;
        this.registry = registry;
        this.router = router;
        this.retryPolicies =
                Collections.unmodifiableMap(new LinkedHashMap<>(builder.retryPolicies));
    }

    public String getName() {
        return name;
    }

    public String getEntryNode() {
        return entryNode;
    }

    public NodeRegistry getRegistry() {
        return registry;
    }

    public EdgeRouter getRouter() {
        return router;
    }

    /// Returns the retry policy for a node, defaulting to retrying the node itself.
    ///
    /// @param node node name, not null
    /// @return the policy, never null
    public RetryPolicy retryPolicyFor(String node) {
        RetryPolicy policy = retryPolicies.get(node);
        return policy != null ? policy : RetryPolicy.retrySelf(node);
    }

    public Map<String, RetryPolicy> getRetryPolicies() {
        return retryPolicies;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Collects nodes, edges and retry policies, then validates them in {@link #build()}.
    public static final class Builder {
        private final NodeRegistry.Builder nodes = NodeRegistry.builder();
        private final List<Edge> edges = new ArrayList<>();
        private final Map<String, RetryPolicy> retryPolicies = new LinkedHashMap<>();
        private String name = "graph";
        private String entryNode;

        private Builder() {}

        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            return this;
        }

        public Builder entry(String entryNode) {
            this.entryNode = Objects.requireNonNull(entryNode, "entryNode must not be null");
            return this;
        }

        /// Registers a node.
        ///
        /// @throws DuplicateNodeException if the name is taken
        public Builder node(String name, Node node) {
            nodes.register(name, node);
            return this;
        }

        /// Registers a node together with its retry policy.
        ///
        /// @throws DuplicateNodeException if the name is taken
        public Builder node(String name, Node node, RetryPolicy retryPolicy) {
            nodes.register(name, node);
            return retry(name, retryPolicy);
        }

        public Builder edge(Edge edge) {
            edges.add(Objects.requireNonNull(edge, "edge must not be null"));
            return this;
        }

        public Builder retry(String node, RetryPolicy retryPolicy) {
            Objects.requireNonNull(node, "node must not be null");
            Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
            retryPolicies.put(node, retryPolicy);
            return this;
        }

        /// Validates references and freezes the graph.
        ///
        /// @return the compiled graph, never null
        /// @throws UnknownNodeException if any reference names an unregistered node
        /// @throws MalformedEdgeException if the edge table is inconsistent
        public Graph build() {
            NodeRegistry registry = nodes.build();
            if (entryNode == null) {
                throw new FatalConfigurationException("Graph '" + name + "' has no entry node");
            }
            requireRegistered(registry, entryNode, "entry of graph '" + name + "'");

            for (Edge edge : edges) {
                requireRegistered(registry, edge.source(), "edge source");
                for (Route route : edge.routes()) {
                    requireRegistered(
                            registry,
                            route.target(),
                            "route '" + route.label() + "' from '" + edge.source() + "'");
                }
                requireRegistered(
                        registry,
                        edge.defaultTarget(),
                        "default edge from '" + edge.source() + "'");
            }
            EdgeRouter router = new EdgeRouter(edges);

            for (Map.Entry<String, RetryPolicy> entry : retryPolicies.entrySet()) {
                requireRegistered(registry, entry.getKey(), "retry policy");
                requireRegistered(
                        registry,
                        entry.getValue().recoveryNode(),
                        "retry policy of '" + entry.getKey() + "'");
            }
            return new Graph(this, registry, router);
        }

        private static void requireRegistered(
                NodeRegistry registry, String node, String referencedBy) {
            if (!registry.contains(node)) {
                throw new UnknownNodeException(node, referencedBy);
            }
        }
    }
}
