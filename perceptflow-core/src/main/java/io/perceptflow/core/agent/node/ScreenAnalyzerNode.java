package io.perceptflow.core.agent.node;

import io.perceptflow.core.agent.AgentKeys;
import io.perceptflow.core.agent.PlanStep;
import io.perceptflow.core.agent.TaskPlan;
import io.perceptflow.core.collaborator.CollaboratorException;
import io.perceptflow.core.collaborator.ScreenCapture;
import io.perceptflow.core.collaborator.UiElement;
import io.perceptflow.core.collaborator.VisionAnalysis;
import io.perceptflow.core.collaborator.VisionService;
import io.perceptflow.core.graph.node.Node;
import io.perceptflow.core.graph.node.NodeResult;
import io.perceptflow.core.state.StateView;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Runs vision inference over the latest capture and locates the current step's target.
///
/// ### Contracts
/// - **Precondition**: a screenshot has been recorded by the capture node
/// - **Postcondition**: on success, `target_element` holds the best match for the current
///   step's target tagged with its `step_id`, or is removed when the step has no target
///
/// Fails without merging anything when the target cannot be found, so the element list
/// only grows with analyses that were usable.
public final class ScreenAnalyzerNode implements Node {

    private final VisionService visionService;

    public ScreenAnalyzerNode(VisionService visionService) {
        this.visionService =
                Objects.requireNonNull(visionService, "visionService must not be null");
    }

    @Override
    public NodeResult execute(StateView state) {
        String imagePath = state.getString(AgentKeys.SCREENSHOT_PATH);
        if (imagePath == null) {
            return NodeResult.failure("No screenshot available for analysis");
        }
        ScreenCapture capture =
                new ScreenCapture(
                        imagePath,
                        state.getInt(AgentKeys.SCREEN_WIDTH, 0),
                        state.getInt(AgentKeys.SCREEN_HEIGHT, 0),
                        parseInstant(state.getString(AgentKeys.CAPTURED_AT)),
                        Map.of());
        Optional<PlanStep> step = TaskPlan.currentStep(state);
        String target = step.map(PlanStep::target).orElse(null);

        VisionAnalysis analysis;
        try {
            analysis = visionService.analyze(capture, promptFor(target));
        } catch (CollaboratorException e) {
            return CollaboratorFailures.toResult("Screen analysis", e);
        }

        Map<String, Object> update = new LinkedHashMap<>();
        update.put(AgentKeys.SCREEN_ANALYSIS, analysis.description());
        update.put(
                AgentKeys.UI_ELEMENTS,
                analysis.elements().stream().map(e -> (Object) e.toMap()).toList());

        if (target == null) {
            update.put(AgentKeys.TARGET_ELEMENT, null);
            return NodeResult.update(update);
        }
        Optional<UiElement> match =
                analysis.elements().stream()
                        .filter(e -> e.matches(target))
                        .max(Comparator.comparingDouble(UiElement::confidence));
        if (match.isEmpty()) {
            return NodeResult.failure("Target element '" + target + "' not found on screen");
        }
        Map<String, Object> located = new LinkedHashMap<>(match.get().toMap());
        located.put("step_id", step.get().stepId());
        update.put(AgentKeys.TARGET_ELEMENT, located);
        return NodeResult.update(update);
    }

    static String promptFor(String target) {
        if (target == null) {
            return "Describe the screen and list every visible UI element.";
        }
        return "Locate the UI element labelled '" + target + "' and list every visible UI element.";
    }

    private static Instant parseInstant(String value) {
        return value != null ? Instant.parse(value) : null;
    }
}
