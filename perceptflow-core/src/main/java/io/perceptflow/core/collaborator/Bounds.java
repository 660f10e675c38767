package io.perceptflow.core.collaborator;

import java.util.Map;

/// Screen rectangle in pixels.
///
/// @param x left edge
/// @param y top edge
/// @param width width, not negative
/// @param height height, not negative
public record Bounds(int x, int y, int width, int height) {

    public Bounds {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException(
                    "width and height must not be negative: " + width + "x" + height);
        }
    }

    public int centerX() {
        return x + width / 2;
    }

    public int centerY() {
        return y + height / 2;
    }

    public Map<String, Object> toMap() {
        return Map.of("x", x, "y", y, "width", width, "height", height);
    }

    /// Reads bounds from a payload map written by {@link #toMap()}.
    ///
    /// @param map payload map, not null
    /// @return bounds, missing fields read as 0
    public static Bounds fromMap(Map<?, ?> map) {
        return new Bounds(
                intOf(map, "x"), intOf(map, "y"), intOf(map, "width"), intOf(map, "height"));
    }

    private static int intOf(Map<?, ?> map, String key) {
        Object value = map.get(key);
        return value instanceof Number n ? n.intValue() : 0;
    }
}
