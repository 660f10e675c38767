package io.perceptflow.core.agent.node;

import io.perceptflow.core.agent.AgentKeys;
import io.perceptflow.core.collaborator.CollaboratorException;
import io.perceptflow.core.collaborator.ScreenCapture;
import io.perceptflow.core.collaborator.ScreenCaptureService;
import io.perceptflow.core.graph.node.Node;
import io.perceptflow.core.graph.node.NodeResult;
import io.perceptflow.core.state.StateView;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Captures the full screen and records the image location and dimensions.
public final class ScreenCaptureNode implements Node {

    private final ScreenCaptureService captureService;

    public ScreenCaptureNode(ScreenCaptureService captureService) {
        this.captureService =
                Objects.requireNonNull(captureService, "captureService must not be null");
    }

    @Override
    public NodeResult execute(StateView state) {
        ScreenCapture capture;
        try {
            capture = captureService.capture(null);
        } catch (CollaboratorException e) {
            return CollaboratorFailures.toResult("Screen capture", e);
        }

        Map<String, Object> update = new LinkedHashMap<>();
        update.put(AgentKeys.SCREENSHOT_PATH, capture.imagePath());
        update.put(AgentKeys.SCREEN_WIDTH, capture.width());
        update.put(AgentKeys.SCREEN_HEIGHT, capture.height());
        update.put(AgentKeys.CAPTURED_AT, capture.capturedAt().toString());
        update.put(AgentKeys.NEED_REANALYZE, false);
        return NodeResult.update(update);
    }
}
