package io.perceptflow.core.execution.pipeline;

import io.perceptflow.core.execution.result.ExecutionResult;
import io.perceptflow.core.state.ErrorKind;
import io.perceptflow.core.storage.checkpoint.CheckpointWriteException;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Persists the state after the step just recorded and waits for the write to return.
///
/// A failed write ends the session with `CHECKPOINT_WRITE_ERROR` when durable checkpoints
/// are required. Otherwise the failure is logged and the session continues with a gap in
/// its resumable history.
public final class CheckpointPostProcessor implements StepProcessor {

    private static final Logger logger =
            Logger.getLogger(CheckpointPostProcessor.class.getName());

    @Override
    public Optional<ExecutionResult> process(ProcessorContext context) {
        var execution = context.executionContext();
        var state = execution.getState();
        int stepIndex = state.stepCount();
        try {
            execution.getCheckpointStore().put(state.sessionId(), stepIndex, state.snapshot());
        } catch (CheckpointWriteException e) {
            if (execution.getConfig().isDurableCheckpoints()) {
                return Optional.of(
                        execution.terminate(
                                ErrorKind.CHECKPOINT_WRITE_ERROR,
                                "Checkpoint " + stepIndex + " not written: " + e.getMessage()));
            }
            logger.log(
                    Level.WARNING,
                    "Checkpoint "
                            + stepIndex
                            + " of session "
                            + state.sessionId()
                            + " not written, continuing without it",
                    e);
            return Optional.empty();
        }
        execution.getListener().onCheckpoint(state.sessionId(), stepIndex);
        return Optional.empty();
    }
}
