package io.perceptflow.core.agent.stub;

import io.perceptflow.core.collaborator.Bounds;
import io.perceptflow.core.collaborator.ScreenCapture;
import io.perceptflow.core.collaborator.UiElement;
import io.perceptflow.core.collaborator.VisionAnalysis;
import io.perceptflow.core.collaborator.VisionService;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Deterministic vision service.
///
/// Always reports a menu bar, and reports any element named in single quotes in the
/// prompt as a button centred on the screen.
public final class StubVisionService implements VisionService {

    private static final Pattern QUOTED = Pattern.compile("'([^']+)'");

    @Override
    public VisionAnalysis analyze(ScreenCapture capture, String prompt) {
        List<UiElement> elements = new ArrayList<>();
        elements.add(
                new UiElement("e1", "menu_bar", "Menu bar",
                        new Bounds(0, 0, capture.width(), 24), 0.99));
        Matcher matcher = QUOTED.matcher(prompt);
        if (matcher.find()) {
            int w = 200;
            int h = 60;
            elements.add(
                    new UiElement("e2", "button", matcher.group(1),
                            new Bounds((capture.width() - w) / 2, (capture.height() - h) / 2, w, h),
                            0.9));
        }
        return new VisionAnalysis(
                "Stub screen " + capture.imagePath() + " with " + elements.size() + " element(s)",
                elements);
    }
}
