package io.perceptflow.core.execution.pipeline;

import io.perceptflow.core.execution.result.ExecutionResult;
import io.perceptflow.core.state.ErrorKind;
import java.util.Optional;

/// Ends the session once it has recorded as many steps as the step budget allows.
///
/// This is the only termination guarantee for graphs with cycles.
public final class StepBudgetPostProcessor implements StepProcessor {

    @Override
    public Optional<ExecutionResult> process(ProcessorContext context) {
        var execution = context.executionContext();
        int budget = execution.getConfig().getStepBudget();
        int steps = execution.getState().stepCount();
        if (steps >= budget) {
            return Optional.of(
                    execution.terminate(
                            ErrorKind.STEP_BUDGET_EXCEEDED,
                            "Step budget of "
                                    + budget
                                    + " exhausted, next node would have been '"
                                    + execution.getState().currentNode()
                                    + "'"));
        }
        return Optional.empty();
    }
}
