package io.perceptflow.core.agent;

import io.perceptflow.core.state.StateView;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Interpreted command: task type, intent and ordered steps.
///
/// @param taskType command classification, not null
/// @param intent one-line summary of what the user wants, not null
/// @param steps ordered plan steps, not null
public record TaskPlan(TaskType taskType, String intent, List<PlanStep> steps) {

    public TaskPlan {
        Objects.requireNonNull(taskType, "taskType must not be null");
        Objects.requireNonNull(intent, "intent must not be null");
        steps = steps != null ? List.copyOf(steps) : List.of();
    }

    /// Reads the plan stored in a session's result payload.
    ///
    /// @param state the session state, not null
    /// @return the stored plan steps, empty if no plan was recorded
    public static List<PlanStep> stepsOf(StateView state) {
        List<PlanStep> steps = new ArrayList<>();
        for (Object raw : state.getList(AgentKeys.EXECUTION_PLAN)) {
            if (raw instanceof Map<?, ?> map) {
                steps.add(PlanStep.fromMap(map));
            }
        }
        return steps;
    }

    /// Returns the plan step that runs next, if any remain.
    ///
    /// @param state the session state, not null
    /// @return the step at {@link AgentKeys#CURRENT_STEP}, or empty when the plan is done
    public static Optional<PlanStep> currentStep(StateView state) {
        List<PlanStep> steps = stepsOf(state);
        int index = state.getInt(AgentKeys.CURRENT_STEP, 0);
        if (index < 0 || index >= steps.size()) {
            return Optional.empty();
        }
        return Optional.of(steps.get(index));
    }
}
