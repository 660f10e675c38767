package io.perceptflow.core.execution.stream;

import io.perceptflow.core.state.ErrorKind;
import io.perceptflow.core.state.ExecutionStep;
import io.perceptflow.core.state.StepStatus;
import java.util.Map;
import java.util.Objects;

/// Live-progress notification for one completed step.
///
/// @param sessionId owning session, not null
/// @param stepIndex index of the step, positive
/// @param node node that ran, not null
/// @param status step status, not null
/// @param resultDelta partial update merged by the step, empty for failures, not null
/// @param errorKind failure classification, null on success
/// @param errorDetail failure diagnostic, null on success
public record StepEvent(
        String sessionId,
        int stepIndex,
        String node,
        StepStatus status,
        Map<String, Object> resultDelta,
        ErrorKind errorKind,
        String errorDetail) {

    public StepEvent {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(node, "node must not be null");
        Objects.requireNonNull(status, "status must not be null");
        resultDelta = resultDelta != null ? resultDelta : Map.of();
    }

    /// Creates the event describing a recorded step.
    ///
    /// @param sessionId owning session, not null
    /// @param step the recorded step, not null
    /// @return new event, never null
    public static StepEvent of(String sessionId, ExecutionStep step) {
        return new StepEvent(
                sessionId,
                step.index(),
                step.node(),
                step.status(),
                step.update(),
                step.errorKind(),
                step.errorDetail());
    }
}
