package io.perceptflow.core.agent.node;

import io.perceptflow.core.agent.AgentKeys;
import io.perceptflow.core.graph.node.Node;
import io.perceptflow.core.graph.node.NodeResult;
import io.perceptflow.core.state.ExecutionStep;
import io.perceptflow.core.state.StateView;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/// Recovery node: inspects the most recent failure and picks a {@link RecoveryStrategy}.
///
/// Re-analysis clears the located target so the next action cannot reuse a stale location.
public final class ErrorHandlerNode implements Node {

    private static final Logger logger = Logger.getLogger(ErrorHandlerNode.class.getName());

    @Override
    public NodeResult execute(StateView state) {
        ExecutionStep failed = lastFailure(state.steps());
        String detail = failed != null ? failed.errorDetail() : null;
        RecoveryStrategy strategy = RecoveryStrategy.forFailure(detail);
        logger.info(
                () ->
                        "Recovering session " + state.sessionId() + " with "
                                + strategy.wireName() + " after: " + detail);

        Map<String, Object> update = new LinkedHashMap<>();
        update.put(AgentKeys.RECOVERY_STRATEGY, strategy.wireName());
        if (strategy == RecoveryStrategy.REANALYZE_SCREEN) {
            update.put(AgentKeys.NEED_REANALYZE, true);
            update.put(AgentKeys.TARGET_ELEMENT, null);
        }
        String source = failed != null ? failed.node() : "unknown node";
        update.put(
                AgentKeys.MESSAGES,
                List.of("Recovering from " + source + " failure: " + strategy.wireName()));
        return NodeResult.update(update);
    }

    private static ExecutionStep lastFailure(List<ExecutionStep> steps) {
        for (int i = steps.size() - 1; i >= 0; i--) {
            if (steps.get(i).status().isFailure()) {
                return steps.get(i);
            }
        }
        return null;
    }
}
