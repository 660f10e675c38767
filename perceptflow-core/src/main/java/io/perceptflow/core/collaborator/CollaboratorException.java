package io.perceptflow.core.collaborator;

import java.io.Serial;
import java.util.Objects;

/// Failure reported by an external collaborator (vision, capture or action service).
///
/// Nodes translate this into a failure signal; it never reaches the executor's caller.
public class CollaboratorException extends Exception {
    @Serial private static final long serialVersionUID = 5518802711470284632L;

    /// Failure modes collaborators report.
    public enum Reason {
        TIMEOUT,
        MODEL_ERROR,
        PERMISSION_DENIED,
        CAPTURE_ERROR,
        OUT_OF_BOUNDS,
        EXECUTION_ERROR
    }

    private final Reason reason;

    public CollaboratorException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    public CollaboratorException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    public Reason getReason() {
        return reason;
    }
}
