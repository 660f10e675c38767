package io.perceptflow.core.execution.result;

import io.perceptflow.core.state.ErrorKind;
import io.perceptflow.core.state.Outcome;
import io.perceptflow.core.state.SessionSnapshot;
import java.util.Objects;

/// Terminal result of a session.
///
/// Every expected failure path ends in one of these values; the executor never throws for
/// them. The final state always carries a non-null {@link Outcome}.
///
/// ### Permitted Subtypes
/// - {@link Completed} - a node set the completion flag, with a success or failure verdict
/// - {@link Failed} - the engine stopped the session (retries exhausted, step budget,
///   configuration defect, checkpoint write failure)
/// - {@link Cancelled} - the caller cancelled between steps
///
/// @see io.perceptflow.core.execution.GraphExecutor for execution logic
public sealed interface ExecutionResult {

    /// Returns the terminal state of the session.
    ///
    /// @return final state, never null
    SessionSnapshot finalState();

    default Outcome outcome() {
        return finalState().outcome();
    }

    default boolean isSuccess() {
        Outcome outcome = outcome();
        return outcome != null && outcome.success();
    }

    /// Returns the failure classification, or null on success.
    default ErrorKind errorKind() {
        Outcome outcome = outcome();
        return outcome != null ? outcome.errorKind() : null;
    }

    default String sessionId() {
        return finalState().sessionId();
    }

    /// Wraps a terminal snapshot in the matching result type.
    ///
    /// @param finalState a snapshot with the completion flag set, not null
    /// @return the result, never null
    /// @throws IllegalArgumentException if the snapshot is not terminal
    static ExecutionResult of(SessionSnapshot finalState) {
        Objects.requireNonNull(finalState, "finalState must not be null");
        Outcome outcome = finalState.outcome();
        if (!finalState.completed() || outcome == null) {
            throw new IllegalArgumentException(
                    "Session " + finalState.sessionId() + " is not terminal");
        }
        if (outcome.success() || outcome.errorKind() == ErrorKind.NODE_REPORTED_FAILURE) {
            return new Completed(finalState);
        }
        if (outcome.errorKind() == ErrorKind.CANCELLED) {
            return new Cancelled(finalState);
        }
        return new Failed(finalState);
    }

    /// Session finished because a node set the completion flag.
    ///
    /// @param finalState the state at completion, not null
    record Completed(SessionSnapshot finalState) implements ExecutionResult {}

    /// Session stopped by the engine.
    ///
    /// @param finalState the state when the session was stopped, not null
    record Failed(SessionSnapshot finalState) implements ExecutionResult {

        /// Returns the diagnostic detail of the failure.
        ///
        /// @return detail, may be null
        public String detail() {
            return finalState.outcome().detail();
        }
    }

    /// Session stopped by a cancellation signal.
    ///
    /// @param finalState the state after the last completed step, not null
    record Cancelled(SessionSnapshot finalState) implements ExecutionResult {}
}
