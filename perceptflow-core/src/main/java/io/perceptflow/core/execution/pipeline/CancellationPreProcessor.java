package io.perceptflow.core.execution.pipeline;

import io.perceptflow.core.execution.result.ExecutionResult;
import io.perceptflow.core.state.ErrorKind;
import java.util.Optional;

/// Ends the session before the next node call if cancellation was requested or the session
/// thread was interrupted.
public final class CancellationPreProcessor implements StepProcessor {

    @Override
    public Optional<ExecutionResult> process(ProcessorContext context) {
        var execution = context.executionContext();
        if (execution.getCancellationToken().isCancelled()
                || Thread.currentThread().isInterrupted()) {
            return Optional.of(
                    execution.terminate(
                            ErrorKind.CANCELLED,
                            "Cancelled before running '" + context.node() + "'"));
        }
        return Optional.empty();
    }
}
