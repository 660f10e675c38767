package io.perceptflow.core.collaborator;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// User interface element detected by the vision service.
///
/// @param id identifier unique within one analysis, not null
/// @param type element type such as `button` or `text_field`, not null
/// @param label visible text or accessible name, not null
/// @param bounds location on screen, not null
/// @param confidence detection confidence in `[0, 1]`
public record UiElement(String id, String type, String label, Bounds bounds, double confidence) {

    public UiElement {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(bounds, "bounds must not be null");
    }

    /// Returns whether the label contains `text`, ignoring case.
    public boolean matches(String text) {
        return text != null && label.toLowerCase().contains(text.toLowerCase());
    }

    /// Converts the element to a plain payload map.
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", id);
        map.put("type", type);
        map.put("label", label);
        map.put("bounds", bounds.toMap());
        map.put("confidence", confidence);
        return map;
    }

    /// Reads an element from a payload map written by {@link #toMap()}.
    ///
    /// @param map payload map, not null
    /// @return the element, never null
    public static UiElement fromMap(Map<?, ?> map) {
        Object bounds = map.get("bounds");
        Object confidence = map.get("confidence");
        return new UiElement(
                String.valueOf(map.get("id")),
                String.valueOf(map.get("type")),
                String.valueOf(map.get("label")),
                bounds instanceof Map<?, ?> b ? Bounds.fromMap(b) : new Bounds(0, 0, 0, 0),
                confidence instanceof Number n ? n.doubleValue() : 0.0);
    }
}
