package io.perceptflow.core.execution.pipeline;

import io.perceptflow.core.execution.result.ExecutionResult;
import java.util.Optional;

/// Stops the session when the node just run set the completion flag.
public final class CompletionPostProcessor implements StepProcessor {

    @Override
    public Optional<ExecutionResult> process(ProcessorContext context) {
        var state = context.state();
        if (state.isCompleted()) {
            return Optional.of(ExecutionResult.of(state.snapshot()));
        }
        return Optional.empty();
    }
}
