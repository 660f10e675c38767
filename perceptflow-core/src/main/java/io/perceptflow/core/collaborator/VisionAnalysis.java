package io.perceptflow.core.collaborator;

import java.util.List;
import java.util.Objects;

/// Structured answer of the vision inference service.
///
/// @param description free-text description of the screen, not null
/// @param elements detected elements, not null
public record VisionAnalysis(String description, List<UiElement> elements) {

    public VisionAnalysis {
        Objects.requireNonNull(description, "description must not be null");
        elements = elements != null ? List.copyOf(elements) : List.of();
    }
}
