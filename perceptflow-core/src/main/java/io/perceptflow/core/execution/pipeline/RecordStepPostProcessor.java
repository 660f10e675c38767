package io.perceptflow.core.execution.pipeline;

import io.perceptflow.core.execution.NodeInvocation;
import io.perceptflow.core.execution.result.ExecutionResult;
import io.perceptflow.core.graph.node.NodeResult;
import io.perceptflow.core.graph.retry.RetryDecision;
import io.perceptflow.core.state.ExecutionStep;
import io.perceptflow.core.state.StepStatus;
import java.util.Optional;
import java.util.logging.Logger;

/// Folds the node result into the session state and appends the step.
///
/// - success: merges the partial update and appends a `SUCCEEDED` step
/// - end: also sets the completion flag and outcome, so the checkpoint written next
///   already shows the session as terminal
/// - failure: leaves the payload untouched, increments the node's failure counter and
///   appends a `RETRIED` step when the retry policy will route to a recovery node, `FAILED`
///   otherwise
///
/// ### Contracts
/// - **Postcondition**: exactly one step is appended; always returns empty
public final class RecordStepPostProcessor implements StepProcessor {

    private static final Logger logger =
            Logger.getLogger(RecordStepPostProcessor.class.getName());

    @Override
    public Optional<ExecutionResult> process(ProcessorContext context) {
        var execution = context.executionContext();
        var state = execution.getState();
        NodeInvocation invocation = context.invocation();
        NodeResult result = invocation.result();
        int index = state.nextStepIndex();

        if (result.isFailure()) {
            int failures = state.incrementRetryCount(context.node());
            boolean retried =
                    !result.getErrorKind().isTerminal()
                            && execution.getErrorPolicy().decide(context.node(), failures)
                                    instanceof RetryDecision.Retry;
            StepStatus status = retried ? StepStatus.RETRIED : StepStatus.FAILED;
            logger.warning(
                    "Step "
                            + index
                            + " of session "
                            + state.sessionId()
                            + ": node '"
                            + context.node()
                            + "' failed ("
                            + result.getErrorKind()
                            + ", failure "
                            + failures
                            + "): "
                            + result.getErrorDetail());
            state.appendStep(
                    ExecutionStep.failed(
                            index,
                            context.node(),
                            invocation.startedAt(),
                            invocation.finishedAt(),
                            status,
                            result.getErrorKind(),
                            result.getErrorDetail()));
            return Optional.empty();
        }

        state.merge(result.getUpdate());
        state.appendStep(
                ExecutionStep.succeeded(
                        index,
                        context.node(),
                        invocation.startedAt(),
                        invocation.finishedAt(),
                        result.getUpdate()));
        if (result.isEnd()) {
            state.complete(result.getOutcome());
        }
        logger.fine(
                "Step "
                        + index
                        + " of session "
                        + state.sessionId()
                        + ": '"
                        + context.node()
                        + "' succeeded");
        return Optional.empty();
    }
}
