package io.perceptflow.core.graph.retry;

import io.perceptflow.core.config.EngineConfig;
import io.perceptflow.core.graph.Graph;
import java.util.Objects;

/// Decides what follows a node failure, from the graph's retry policies and the engine
/// configuration.
///
/// The allowance of a node is resolved in this order: per-node override in
/// {@link EngineConfig}, value declared in the graph's {@link RetryPolicy}, engine default.
///
/// ### Contracts
/// - failure counters are cumulative per session and never reset
/// - with an allowance of `n`, failures `1..n` are retried and failure `n + 1` exhausts
///   the node
///
/// @implNote **Thread-safe**. Stateless apart from immutable inputs.
public final class ErrorPolicy {

    private final Graph graph;
    private final EngineConfig config;

    public ErrorPolicy(Graph graph, EngineConfig config) {
        this.graph = Objects.requireNonNull(graph, "graph must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /// Returns the retry allowance in effect for a node.
    ///
    /// @param node node name, not null
    /// @return non-negative allowance
    public int maxRetriesFor(String node) {
        return config.maxRetriesOverride(node)
                .orElse(
                        graph.retryPolicyFor(node)
                                .declaredMaxRetries()
                                .orElse(config.getDefaultMaxRetries()));
    }

    /// Decides the follow-up of a failure.
    ///
    /// @param node the node that failed, not null
    /// @param failures cumulative failures of the node, including this one
    /// @return retry via the recovery node, or exhaustion, never null
    public RetryDecision decide(String node, int failures) {
        int max = maxRetriesFor(node);
        if (failures > max) {
            return new RetryDecision.Exhausted(failures, max);
        }
        return new RetryDecision.Retry(graph.retryPolicyFor(node).recoveryNode(), failures, max);
    }
}
