package io.perceptflow.core.graph.retry;

/// What happens after a node failure.
///
/// ### Permitted Subtypes
/// - {@link Retry} - route to the recovery node
/// - {@link Exhausted} - the node has failed more often than allowed
public sealed interface RetryDecision {

    /// @param recoveryNode node to run next, not null
    /// @param failures cumulative failures of the node, including this one
    /// @param maxRetries allowance in effect
    record Retry(String recoveryNode, int failures, int maxRetries) implements RetryDecision {}

    /// @param failures cumulative failures of the node, including this one
    /// @param maxRetries allowance in effect
    record Exhausted(int failures, int maxRetries) implements RetryDecision {}
}
