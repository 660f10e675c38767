package io.perceptflow.core.collaborator;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/// Image artifact produced by the screen capture service, with its metadata.
///
/// @param imagePath location of the captured image, not null
/// @param width image width in pixels
/// @param height image height in pixels
/// @param capturedAt capture time, not null
/// @param metadata additional capture metadata, not null
public record ScreenCapture(
        String imagePath, int width, int height, Instant capturedAt, Map<String, String> metadata) {

    public ScreenCapture {
        Objects.requireNonNull(imagePath, "imagePath must not be null");
        capturedAt = capturedAt != null ? capturedAt : Instant.now();
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }
}
