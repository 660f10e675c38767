package io.perceptflow.core.execution.pipeline;

import io.perceptflow.core.execution.result.ExecutionResult;
import java.util.Optional;

/// Fires {@link io.perceptflow.core.execution.ExecutionListener#onNodeStart}.
public final class NodeStartPreProcessor implements StepProcessor {

    @Override
    public Optional<ExecutionResult> process(ProcessorContext context) {
        var execution = context.executionContext();
        execution.getListener().onNodeStart(execution.getState().snapshot(), context.node());
        return Optional.empty();
    }
}
