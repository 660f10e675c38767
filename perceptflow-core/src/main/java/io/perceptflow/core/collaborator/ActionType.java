package io.perceptflow.core.collaborator;

/// Kind of input action the action service performs.
public enum ActionType {
    CLICK("click", true),
    TYPE("type", false),
    DRAG("drag", true),
    KEY_COMBO("key_combo", false),
    SCROLL("scroll", true),
    OPEN_APP("open_app", true),
    CLOSE_APP("close_app", true),
    WAIT("wait", false),
    ANALYZE("analyze", false);

    private final String wireName;
    private final boolean changesScreen;

    ActionType(String wireName, boolean changesScreen) {
        this.wireName = wireName;
        this.changesScreen = changesScreen;
    }

    /// Returns the name used in plans and result payloads.
    public String wireName() {
        return wireName;
    }

    /// Returns whether the action is expected to change what is on screen.
    public boolean changesScreen() {
        return changesScreen;
    }

    /// Resolves a wire name.
    ///
    /// @param name wire name such as `open_app`, not null
    /// @return the action type
    /// @throws IllegalArgumentException if the name is unknown
    public static ActionType fromWireName(String name) {
        for (ActionType type : values()) {
            if (type.wireName.equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown action type: " + name);
    }
}
