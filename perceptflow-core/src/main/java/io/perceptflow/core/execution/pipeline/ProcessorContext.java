package io.perceptflow.core.execution.pipeline;

import io.perceptflow.core.execution.ExecutionContext;
import io.perceptflow.core.execution.NodeInvocation;
import io.perceptflow.core.graph.node.NodeResult;
import io.perceptflow.core.state.SessionState;

/// Per-step context passed through the processor pipeline.
///
/// Wraps the session-scoped {@link ExecutionContext} and adds the data that changes each
/// iteration: the node name and, after the call, its invocation.
///
/// ### Contracts
/// - **Precondition**: `executionContext` and `node` are always non-null
/// - `invocation` is null for pre-execution processors, non-null for post-execution
///
/// @param executionContext the session-scoped context, not null
/// @param node the node about to run (pre) or just run (post), not null
/// @param invocation the node call outcome, null for the pre-execution pipeline
public record ProcessorContext(
        ExecutionContext executionContext, String node, NodeInvocation invocation) {

    /// Convenience accessor for the mutable session state.
    public SessionState state() {
        return executionContext.getState();
    }

    /// Convenience accessor for the node result.
    ///
    /// @return the result, or null in the pre-execution pipeline
    public NodeResult result() {
        return invocation != null ? invocation.result() : null;
    }
}
