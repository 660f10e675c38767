package io.perceptflow.core.execution.pipeline;

import io.perceptflow.core.execution.result.ExecutionResult;
import java.util.Optional;

/// Fires {@link io.perceptflow.core.execution.ExecutionListener#onStepComplete} with the
/// step just recorded.
public final class StepCompletePostProcessor implements StepProcessor {

    @Override
    public Optional<ExecutionResult> process(ProcessorContext context) {
        var execution = context.executionContext();
        var snapshot = execution.getState().snapshot();
        snapshot.lastStep()
                .ifPresent(step -> execution.getListener().onStepComplete(snapshot, step));
        return Optional.empty();
    }
}
