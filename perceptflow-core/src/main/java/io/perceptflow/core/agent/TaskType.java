package io.perceptflow.core.agent;

/// Classification of a user command.
public enum TaskType {
    CLICK,
    TYPE,
    SCROLL,
    DRAG,
    ANALYZE,
    OPEN_APP,
    CLOSE_APP,
    OTHER;

    public String wireName() {
        return name().toLowerCase();
    }

    /// Resolves a wire name, falling back to {@link #OTHER} for unknown names.
    public static TaskType fromWireName(String name) {
        if (name == null) {
            return OTHER;
        }
        try {
            return valueOf(name.toUpperCase());
        } catch (IllegalArgumentException e) {
            return OTHER;
        }
    }
}
