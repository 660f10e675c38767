package io.perceptflow.core.agent;

import io.perceptflow.core.agent.node.ActionExecutorNode;
import io.perceptflow.core.agent.node.CommandAnalyzerNode;
import io.perceptflow.core.agent.node.ErrorHandlerNode;
import io.perceptflow.core.agent.node.RecoveryStrategy;
import io.perceptflow.core.agent.node.ResultValidatorNode;
import io.perceptflow.core.agent.node.ScreenAnalyzerNode;
import io.perceptflow.core.agent.node.ScreenCaptureNode;
import io.perceptflow.core.collaborator.ActionService;
import io.perceptflow.core.collaborator.ScreenCaptureService;
import io.perceptflow.core.collaborator.VisionService;
import io.perceptflow.core.graph.Graph;
import io.perceptflow.core.graph.edge.Edge;
import io.perceptflow.core.graph.retry.RetryPolicy;
import io.perceptflow.core.state.StateView;
import java.util.Objects;

/// Factory for the perceive, cognize and act agent graph.
///
/// Routing:
/// - `command_analyzer` goes to `screen_capture` when the first step needs the screen,
///   otherwise straight to `action_executor`
/// - `screen_capture` then `screen_analyzer` then `action_executor` then `result_validator`
/// - `result_validator` ends the session when the plan is done, otherwise loops back like
///   the analyzer does
/// - `error_handler` goes to `action_executor` for `retry_current_step`, otherwise to
///   `screen_capture`
///
/// Failed analyses re-capture the screen. Failed actions and validations go through
/// `error_handler`.
public final class VisionAgentGraph {

    public static final String NAME = "vision-agent";

    public static final String COMMAND_ANALYZER = "command_analyzer";
    public static final String SCREEN_CAPTURE = "screen_capture";
    public static final String SCREEN_ANALYZER = "screen_analyzer";
    public static final String ACTION_EXECUTOR = "action_executor";
    public static final String RESULT_VALIDATOR = "result_validator";
    public static final String ERROR_HANDLER = "error_handler";

    private VisionAgentGraph() {}

    /// Builds the agent graph over the given collaborators with the default interpreter.
    public static Graph create(
            VisionService vision, ScreenCaptureService capture, ActionService actions) {
        return create(vision, capture, actions, new CommandInterpreter());
    }

    /// Builds the agent graph over the given collaborators.
    ///
    /// @param vision vision inference service, not null
    /// @param capture screen capture service, not null
    /// @param actions input action service, not null
    /// @param interpreter command interpreter used by the entry node, not null
    /// @return the compiled graph, never null
    public static Graph create(
            VisionService vision,
            ScreenCaptureService capture,
            ActionService actions,
            CommandInterpreter interpreter) {
        Objects.requireNonNull(vision, "vision must not be null");
        Objects.requireNonNull(capture, "capture must not be null");
        Objects.requireNonNull(actions, "actions must not be null");

        return Graph.builder()
                .name(NAME)
                .entry(COMMAND_ANALYZER)
                .node(
                        COMMAND_ANALYZER,
                        new CommandAnalyzerNode(interpreter),
                        RetryPolicy.retrySelf(COMMAND_ANALYZER))
                .node(
                        SCREEN_CAPTURE,
                        new ScreenCaptureNode(capture),
                        RetryPolicy.retrySelf(SCREEN_CAPTURE))
                .node(
                        SCREEN_ANALYZER,
                        new ScreenAnalyzerNode(vision),
                        RetryPolicy.recoverVia(SCREEN_CAPTURE))
                .node(
                        ACTION_EXECUTOR,
                        new ActionExecutorNode(actions),
                        RetryPolicy.recoverVia(ERROR_HANDLER))
                .node(
                        RESULT_VALIDATOR,
                        new ResultValidatorNode(),
                        RetryPolicy.recoverVia(ERROR_HANDLER))
                .node(ERROR_HANDLER, new ErrorHandlerNode(), RetryPolicy.retrySelf(ERROR_HANDLER))
                .edge(
                        Edge.from(COMMAND_ANALYZER)
                                .when("needs screen", VisionAgentGraph::nextStepNeedsScreen,
                                        SCREEN_CAPTURE)
                                .otherwise(ACTION_EXECUTOR))
                .edge(Edge.always(SCREEN_CAPTURE, SCREEN_ANALYZER))
                .edge(Edge.always(SCREEN_ANALYZER, ACTION_EXECUTOR))
                .edge(Edge.always(ACTION_EXECUTOR, RESULT_VALIDATOR))
                .edge(
                        Edge.from(RESULT_VALIDATOR)
                                .when("needs screen", VisionAgentGraph::nextStepNeedsScreen,
                                        SCREEN_CAPTURE)
                                .otherwise(ACTION_EXECUTOR))
                .edge(
                        Edge.from(ERROR_HANDLER)
                                .when("retry step", VisionAgentGraph::retriesCurrentStep,
                                        ACTION_EXECUTOR)
                                .otherwise(SCREEN_CAPTURE))
                .build();
    }

    static boolean nextStepNeedsScreen(StateView state) {
        return TaskPlan.currentStep(state).map(PlanStep::needsScreen).orElse(false);
    }

    static boolean retriesCurrentStep(StateView state) {
        return RecoveryStrategy.RETRY_CURRENT_STEP
                .wireName()
                .equals(state.getString(AgentKeys.RECOVERY_STRATEGY));
    }
}
