package io.perceptflow.core.collaborator;

/// Vision model inference over a captured image.
public interface VisionService {

    /// Analyzes an image.
    ///
    /// @param capture the image to analyze, not null
    /// @param prompt textual instruction for the model, not null
    /// @return detected elements and description, never null
    /// @throws CollaboratorException on timeout or model error
    VisionAnalysis analyze(ScreenCapture capture, String prompt) throws CollaboratorException;
}
