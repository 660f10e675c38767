package io.perceptflow.core.agent.node;

import io.perceptflow.core.agent.AgentKeys;
import io.perceptflow.core.agent.PlanStep;
import io.perceptflow.core.agent.TaskPlan;
import io.perceptflow.core.graph.node.Node;
import io.perceptflow.core.graph.node.NodeResult;
import io.perceptflow.core.state.StateView;
import java.util.List;
import java.util.Map;

/// Checks plan progress after each action and ends the session once every step ran.
///
/// The verdict is successful when every recorded action result reports success.
public final class ResultValidatorNode implements Node {

    @Override
    public NodeResult execute(StateView state) {
        List<PlanStep> plan = TaskPlan.stepsOf(state);
        int done = state.getInt(AgentKeys.CURRENT_STEP, 0);

        if (done < plan.size()) {
            return NodeResult.update(
                    Map.of(
                            AgentKeys.MESSAGES,
                            List.of("Progress: " + done + "/" + plan.size() + " step(s) done")));
        }

        boolean allSucceeded =
                state.getList(AgentKeys.EXECUTION_RESULTS).stream()
                        .allMatch(ResultValidatorNode::succeeded);
        String intent = state.getString(AgentKeys.TASK_INTENT);
        String detail =
                allSucceeded
                        ? "Completed " + plan.size() + " step(s): " + intent
                        : "Some actions did not succeed: " + intent;
        return NodeResult.complete(
                Map.of(AgentKeys.MESSAGES, List.of(detail)), allSucceeded, detail);
    }

    private static boolean succeeded(Object result) {
        return result instanceof Map<?, ?> m && Boolean.TRUE.equals(m.get("success"));
    }
}
