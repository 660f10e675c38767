package io.perceptflow.core.graph.retry;

import java.util.Objects;
import java.util.OptionalInt;

/// Per-node failure handling declared in the graph.
///
/// @param recoveryNode node to route to after a retryable failure, may be the node itself,
///        not null
/// @param maxRetries retry allowance declared by the graph, or null to use the engine default
public record RetryPolicy(String recoveryNode, Integer maxRetries) {

    public RetryPolicy {
        Objects.requireNonNull(recoveryNode, "recoveryNode must not be null");
        if (maxRetries != null && maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
    }

    /// Retries by routing back to the failed node.
    public static RetryPolicy retrySelf(String node) {
        return new RetryPolicy(node, null);
    }

    /// Retries by routing to `recoveryNode`, allowance taken from the engine configuration.
    public static RetryPolicy recoverVia(String recoveryNode) {
        return new RetryPolicy(recoveryNode, null);
    }

    /// Retries by routing to `recoveryNode` at most `maxRetries` times.
    public static RetryPolicy recoverVia(String recoveryNode, int maxRetries) {
        return new RetryPolicy(recoveryNode, maxRetries);
    }

    public OptionalInt declaredMaxRetries() {
        return maxRetries != null ? OptionalInt.of(maxRetries) : OptionalInt.empty();
    }
}
