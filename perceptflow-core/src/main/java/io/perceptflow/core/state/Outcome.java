package io.perceptflow.core.state;

import java.io.Serializable;
import java.util.Objects;

/// Terminal verdict of a session.
///
/// @param success whether the session reached its goal
/// @param errorKind failure classification, null on success
/// @param detail diagnostic detail, may be null
public record Outcome(boolean success, ErrorKind errorKind, String detail)
        implements Serializable {

    public Outcome {
        if (success && errorKind != null) {
            throw new IllegalArgumentException("successful outcome must not carry an errorKind");
        }
        if (!success) {
            Objects.requireNonNull(errorKind, "errorKind must not be null for a failure");
        }
    }

    public static Outcome success(String detail) {
        return new Outcome(true, null, detail);
    }

    public static Outcome failure(ErrorKind errorKind, String detail) {
        return new Outcome(false, errorKind, detail);
    }
}
