package io.perceptflow.core.state;

/// Classification of failures a session can observe.
///
/// Node-level kinds are recovered by the retry policy. The remaining kinds end the session
/// and surface in its {@link Outcome}.
public enum ErrorKind {
    /// A node reported an error or threw. Retryable.
    NODE_EXECUTION_ERROR(false),

    /// A node did not return within its timeout. Handled like `NODE_EXECUTION_ERROR`.
    NODE_TIMEOUT(false),

    /// A node failed more often than its `max_retries` allows.
    MAX_RETRIES_EXCEEDED(true),

    /// Unknown node, duplicate node or malformed edge table. Never retried.
    FATAL_CONFIGURATION_ERROR(true),

    /// The session ran out of its step budget.
    STEP_BUDGET_EXCEEDED(true),

    /// A checkpoint could not be written while durability is required.
    CHECKPOINT_WRITE_ERROR(true),

    /// The caller cancelled the session between steps.
    CANCELLED(true),

    /// A node completed the session with a failure verdict.
    NODE_REPORTED_FAILURE(true);

    private final boolean terminal;

    ErrorKind(boolean terminal) {
        this.terminal = terminal;
    }

    /// Returns whether this kind ends the session.
    ///
    /// @return true when no retry applies
    public boolean isTerminal() {
        return terminal;
    }
}
