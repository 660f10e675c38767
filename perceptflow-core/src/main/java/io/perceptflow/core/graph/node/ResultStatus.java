package io.perceptflow.core.graph.node;

/// Status of a {@link NodeResult}.
public enum ResultStatus {
    /// The node produced an update and the session continues.
    SUCCESS,

    /// The node failed; the retry policy decides what runs next.
    FAILURE,

    /// The node produced an update and set the completion flag.
    END
}
