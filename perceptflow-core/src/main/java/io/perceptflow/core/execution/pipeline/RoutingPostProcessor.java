package io.perceptflow.core.execution.pipeline;

import io.perceptflow.core.execution.result.ExecutionResult;
import io.perceptflow.core.graph.FatalConfigurationException;
import io.perceptflow.core.graph.retry.RetryDecision;
import io.perceptflow.core.state.ErrorKind;
import io.perceptflow.core.state.ExecutionStep;
import java.util.Optional;
import java.util.logging.Logger;

/// Selects the next node.
///
/// After a success the edge router decides. After a failure the retry policy decides:
/// route to the recovery node, or end the session with `MAX_RETRIES_EXCEEDED`. Failures
/// with a terminal error kind bypass the retry policy. Routing to a node that is not
/// registered ends the session with `FATAL_CONFIGURATION_ERROR`.
///
/// ### Contracts
/// - **Precondition**: the last recorded step belongs to `context.node()`
/// - **Postcondition**: on empty return, the state's current node is the next node to run
///
/// @implNote Reads only the recorded step, so the same decision is re-derived on resume.
public final class RoutingPostProcessor implements StepProcessor {

    private static final Logger logger = Logger.getLogger(RoutingPostProcessor.class.getName());

    @Override
    public Optional<ExecutionResult> process(ProcessorContext context) {
        var execution = context.executionContext();
        var state = execution.getState();
        ExecutionStep step =
                state.lastStep()
                        .orElseThrow(() -> new IllegalStateException("No step to route from"));

        String next;
        if (step.status().isFailure()) {
            if (step.errorKind().isTerminal()) {
                return Optional.of(execution.terminate(step.errorKind(), step.errorDetail()));
            }
            RetryDecision decision =
                    execution.getErrorPolicy().decide(step.node(), state.retryCount(step.node()));
            if (decision instanceof RetryDecision.Exhausted exhausted) {
                return Optional.of(
                        execution.terminate(
                                ErrorKind.MAX_RETRIES_EXCEEDED,
                                "Node '"
                                        + step.node()
                                        + "' failed "
                                        + exhausted.failures()
                                        + " times (max retries "
                                        + exhausted.maxRetries()
                                        + "), last error: "
                                        + step.errorDetail()));
            }
            next = ((RetryDecision.Retry) decision).recoveryNode();
            logger.fine("Recovering '" + step.node() + "' via '" + next + "'");
        } else {
            try {
                next = execution.getGraph().getRouter().route(state.snapshot());
            } catch (FatalConfigurationException e) {
                return Optional.of(
                        execution.terminate(ErrorKind.FATAL_CONFIGURATION_ERROR, e.getMessage()));
            } catch (RuntimeException e) {
                return Optional.of(
                        execution.terminate(
                                ErrorKind.FATAL_CONFIGURATION_ERROR,
                                "Route predicate of '" + step.node() + "' threw: " + e));
            }
        }

        if (!execution.getGraph().getRegistry().contains(next)) {
            return Optional.of(
                    execution.terminate(
                            ErrorKind.FATAL_CONFIGURATION_ERROR,
                            "Unknown node '" + next + "' routed from '" + step.node() + "'"));
        }
        state.setCurrentNode(next);
        return Optional.empty();
    }
}
