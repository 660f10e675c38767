package io.perceptflow.core.agent.node;

import io.perceptflow.core.agent.AgentKeys;
import io.perceptflow.core.agent.PlanStep;
import io.perceptflow.core.agent.TaskPlan;
import io.perceptflow.core.collaborator.ActionDescriptor;
import io.perceptflow.core.collaborator.ActionOutcome;
import io.perceptflow.core.collaborator.ActionService;
import io.perceptflow.core.collaborator.ActionType;
import io.perceptflow.core.collaborator.Bounds;
import io.perceptflow.core.collaborator.CollaboratorException;
import io.perceptflow.core.graph.node.Node;
import io.perceptflow.core.graph.node.NodeResult;
import io.perceptflow.core.state.StateView;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Performs the current plan step through the action service and advances the plan.
///
/// Pointer actions on a located target click the centre of its bounds. The step must have
/// been located by the screen analyzer for the same `step_id`; a stale or missing location
/// is reported as a failure so recovery re-analyzes the screen.
///
/// `analyze` steps make no action call and record the latest screen description.
public final class ActionExecutorNode implements Node {

    private final ActionService actionService;

    public ActionExecutorNode(ActionService actionService) {
        this.actionService =
                Objects.requireNonNull(actionService, "actionService must not be null");
    }

    @Override
    public NodeResult execute(StateView state) {
        Optional<PlanStep> current = TaskPlan.currentStep(state);
        if (current.isEmpty()) {
            return NodeResult.failure("No pending plan step to execute");
        }
        PlanStep step = current.get();

        String sideEffect;
        if (step.actionType() == ActionType.ANALYZE) {
            sideEffect = state.getString(AgentKeys.SCREEN_ANALYSIS);
        } else {
            ActionDescriptor action;
            if (step.target() != null) {
                Optional<Bounds> bounds = locatedBounds(state, step);
                if (bounds.isEmpty()) {
                    return NodeResult.failure(
                            "Target element '" + step.target() + "' for step "
                                    + step.stepId() + " is not located on screen");
                }
                action = ActionDescriptor.click(bounds.get().centerX(), bounds.get().centerY());
            } else {
                action = describe(step);
            }
            ActionOutcome outcome;
            try {
                outcome = actionService.execute(action);
            } catch (CollaboratorException e) {
                return CollaboratorFailures.toResult("Action " + step.actionType().wireName(), e);
            }
            if (!outcome.success()) {
                return NodeResult.failure(
                        "Action " + action.describe() + " failed: " + outcome.sideEffect());
            }
            sideEffect = outcome.sideEffect();
        }

        Map<String, Object> record = new LinkedHashMap<>();
        record.put("step_id", step.stepId());
        record.put("action_type", step.actionType().wireName());
        record.put("description", step.description());
        record.put("success", true);
        if (sideEffect != null) {
            record.put("side_effect", sideEffect);
        }

        Map<String, Object> update = new LinkedHashMap<>();
        update.put(AgentKeys.EXECUTION_RESULTS, List.of(record));
        update.put(AgentKeys.CURRENT_STEP, state.getInt(AgentKeys.CURRENT_STEP, 0) + 1);
        update.put(AgentKeys.NEED_REANALYZE, step.actionType().changesScreen());
        update.put(AgentKeys.RECOVERY_STRATEGY, null);
        update.put(AgentKeys.MESSAGES, List.of("Done: " + step.description()));
        return NodeResult.update(update);
    }

    private static Optional<Bounds> locatedBounds(StateView state, PlanStep step) {
        Map<String, Object> located = state.getMap(AgentKeys.TARGET_ELEMENT);
        Object stepId = located.get("step_id");
        if (!(stepId instanceof Number n) || n.intValue() != step.stepId()) {
            return Optional.empty();
        }
        return located.get("bounds") instanceof Map<?, ?> bounds
                ? Optional.of(Bounds.fromMap(bounds))
                : Optional.empty();
    }

    private static ActionDescriptor describe(PlanStep step) {
        return switch (step.actionType()) {
            case TYPE -> ActionDescriptor.type(required(step, "text"));
            case SCROLL ->
                    ActionDescriptor.scroll(
                            required(step, "direction"),
                            Integer.parseInt(required(step, "amount")));
            case DRAG ->
                    ActionDescriptor.drag(
                            Integer.parseInt(required(step, "from_x")),
                            Integer.parseInt(required(step, "from_y")),
                            Integer.parseInt(required(step, "to_x")),
                            Integer.parseInt(required(step, "to_y")));
            case KEY_COMBO ->
                    ActionDescriptor.keyCombo(
                            Arrays.asList(required(step, "keys").split("\\+")));
            case OPEN_APP -> ActionDescriptor.openApp(required(step, "app_name"));
            case CLOSE_APP -> ActionDescriptor.closeApp(required(step, "app_name"));
            case WAIT -> ActionDescriptor.waitFor(
                    Duration.ofMillis(Long.parseLong(required(step, "millis"))));
            case CLICK ->
                    throw new IllegalArgumentException(
                            "Click step " + step.stepId() + " has no target");
            case ANALYZE -> throw new IllegalStateException("Analyze steps make no action call");
        };
    }

    private static String required(PlanStep step, String parameter) {
        String value = step.parameter(parameter);
        if (value == null) {
            throw new IllegalArgumentException(
                    "Step " + step.stepId() + " is missing parameter '" + parameter + "'");
        }
        return value;
    }
}
