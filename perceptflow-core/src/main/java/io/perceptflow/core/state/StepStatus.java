package io.perceptflow.core.state;

/// Status of a recorded {@link ExecutionStep}.
public enum StepStatus {
    /// The node returned a state update that was merged.
    SUCCEEDED,

    /// The node failed and its retry budget was spent, or the failure was fatal.
    FAILED,

    /// The node failed and control was handed to its recovery node.
    RETRIED;

    /// Returns whether this status represents a node failure.
    ///
    /// @return true for `FAILED` and `RETRIED`
    public boolean isFailure() {
        return this != SUCCEEDED;
    }
}
