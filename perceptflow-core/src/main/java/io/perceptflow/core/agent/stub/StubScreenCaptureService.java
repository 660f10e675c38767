package io.perceptflow.core.agent.stub;

import io.perceptflow.core.collaborator.Bounds;
import io.perceptflow.core.collaborator.ScreenCapture;
import io.perceptflow.core.collaborator.ScreenCaptureService;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/// Deterministic capture service that produces numbered placeholder images.
public final class StubScreenCaptureService implements ScreenCaptureService {

    private final int width;
    private final int height;
    private final AtomicInteger captures = new AtomicInteger();

    public StubScreenCaptureService() {
        this(1920, 1080);
    }

    public StubScreenCaptureService(int width, int height) {
        this.width = width;
        this.height = height;
    }

    @Override
    public ScreenCapture capture(Bounds region) {
        int n = captures.incrementAndGet();
        int w = region != null ? region.width() : width;
        int h = region != null ? region.height() : height;
        return new ScreenCapture(
                "stub://capture-" + n + ".png", w, h, Instant.now(), Map.of("source", "stub"));
    }

    public int captureCount() {
        return captures.get();
    }
}
