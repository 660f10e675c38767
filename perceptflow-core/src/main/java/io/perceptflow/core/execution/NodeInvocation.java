package io.perceptflow.core.execution;

import io.perceptflow.core.graph.node.NodeResult;
import java.time.Instant;
import java.util.Objects;

/// Outcome of one timed node call, before it is recorded as a step.
///
/// @param node invoked node name, not null
/// @param result the node's result, or the failure synthesized for a throw or timeout, not null
/// @param startedAt call start, not null
/// @param finishedAt call end, not null
public record NodeInvocation(
        String node, NodeResult result, Instant startedAt, Instant finishedAt) {

    public NodeInvocation {
        Objects.requireNonNull(node, "node must not be null");
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(finishedAt, "finishedAt must not be null");
    }
}
