package io.perceptflow.core.collaborator;

/// Captures the screen or a region of it.
public interface ScreenCaptureService {

    /// Captures an image.
    ///
    /// @param region area to capture, or null for the full screen
    /// @return the captured image and metadata, never null
    /// @throws CollaboratorException on permission or capture errors
    ScreenCapture capture(Bounds region) throws CollaboratorException;
}
