package io.perceptflow.core.agent.node;

import io.perceptflow.core.collaborator.CollaboratorException;
import io.perceptflow.core.graph.node.NodeResult;
import io.perceptflow.core.state.ErrorKind;

/// Maps collaborator failures onto node failure signals.
final class CollaboratorFailures {

    private CollaboratorFailures() {}

    /// Converts a collaborator failure into a retryable node failure.
    ///
    /// Collaborator timeouts are reported as {@link ErrorKind#NODE_TIMEOUT}, everything
    /// else as {@link ErrorKind#NODE_EXECUTION_ERROR}.
    static NodeResult toResult(String operation, CollaboratorException e) {
        String detail =
                operation + " failed (" + e.getReason().name().toLowerCase() + "): "
                        + e.getMessage();
        ErrorKind kind =
                e.getReason() == CollaboratorException.Reason.TIMEOUT
                        ? ErrorKind.NODE_TIMEOUT
                        : ErrorKind.NODE_EXECUTION_ERROR;
        return NodeResult.failure(kind, detail);
    }
}
