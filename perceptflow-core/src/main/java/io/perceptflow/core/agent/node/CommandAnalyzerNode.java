package io.perceptflow.core.agent.node;

import io.perceptflow.core.agent.AgentKeys;
import io.perceptflow.core.agent.CommandInterpreter;
import io.perceptflow.core.agent.PlanStep;
import io.perceptflow.core.agent.TaskPlan;
import io.perceptflow.core.graph.node.Node;
import io.perceptflow.core.graph.node.NodeResult;
import io.perceptflow.core.state.StateView;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Entry node: interprets the session command into a task type and execution plan.
///
/// A blank command ends the session with a failure verdict.
public final class CommandAnalyzerNode implements Node {

    private static final Logger logger = Logger.getLogger(CommandAnalyzerNode.class.getName());

    private final CommandInterpreter interpreter;

    public CommandAnalyzerNode(CommandInterpreter interpreter) {
        this.interpreter = Objects.requireNonNull(interpreter, "interpreter must not be null");
    }

    @Override
    public NodeResult execute(StateView state) {
        String command = state.command();
        if (command == null || command.isBlank()) {
            return NodeResult.complete(
                    Map.of(AgentKeys.MESSAGES, List.of("Nothing to do: the command is empty")),
                    false,
                    "Command is empty");
        }

        TaskPlan plan = interpreter.interpret(command);
        List<Object> steps =
                plan.steps().stream().map(PlanStep::toMap).map(m -> (Object) m).toList();
        logger.fine(() -> "Planned " + steps.size() + " step(s) for: " + command);

        Map<String, Object> update = new LinkedHashMap<>();
        update.put(AgentKeys.TASK_TYPE, plan.taskType().wireName());
        update.put(AgentKeys.TASK_INTENT, plan.intent());
        update.put(AgentKeys.EXECUTION_PLAN, steps);
        update.put(AgentKeys.CURRENT_STEP, 0);
        update.put(AgentKeys.NEED_REANALYZE, false);
        update.put(
                AgentKeys.MESSAGES,
                List.of("Planned " + steps.size() + " step(s): " + plan.intent()));
        return NodeResult.update(update);
    }
}
