package io.perceptflow.core.collaborator;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/// Input action handed to the action service.
///
/// Only the fields relevant to the action type are set; use the factory methods.
///
/// @param type action kind, not null
/// @param x target x coordinate for pointer actions, null otherwise
/// @param y target y coordinate for pointer actions, null otherwise
/// @param toX drag destination x, null otherwise
/// @param toY drag destination y, null otherwise
/// @param text text to type, or application name for app actions
/// @param keys keys pressed together for key combos, not null
/// @param direction scroll direction (`up`, `down`, `left`, `right`)
/// @param amount scroll amount in wheel clicks
/// @param duration wait duration
public record ActionDescriptor(
        ActionType type,
        Integer x,
        Integer y,
        Integer toX,
        Integer toY,
        String text,
        List<String> keys,
        String direction,
        int amount,
        Duration duration) {

    public ActionDescriptor {
        Objects.requireNonNull(type, "type must not be null");
        keys = keys != null ? List.copyOf(keys) : List.of();
    }

    public static ActionDescriptor click(int x, int y) {
        return new ActionDescriptor(ActionType.CLICK, x, y, null, null, null, null, null, 0, null);
    }

    public static ActionDescriptor type(String text) {
        Objects.requireNonNull(text, "text must not be null");
        return new ActionDescriptor(
                ActionType.TYPE, null, null, null, null, text, null, null, 0, null);
    }

    public static ActionDescriptor drag(int x, int y, int toX, int toY) {
        return new ActionDescriptor(ActionType.DRAG, x, y, toX, toY, null, null, null, 0, null);
    }

    public static ActionDescriptor keyCombo(List<String> keys) {
        if (keys == null || keys.isEmpty()) {
            throw new IllegalArgumentException("keys must not be empty");
        }
        return new ActionDescriptor(
                ActionType.KEY_COMBO, null, null, null, null, null, keys, null, 0, null);
    }

    public static ActionDescriptor scroll(String direction, int amount) {
        Objects.requireNonNull(direction, "direction must not be null");
        return new ActionDescriptor(
                ActionType.SCROLL, null, null, null, null, null, null, direction, amount, null);
    }

    public static ActionDescriptor openApp(String appName) {
        Objects.requireNonNull(appName, "appName must not be null");
        return new ActionDescriptor(
                ActionType.OPEN_APP, null, null, null, null, appName, null, null, 0, null);
    }

    public static ActionDescriptor closeApp(String appName) {
        Objects.requireNonNull(appName, "appName must not be null");
        return new ActionDescriptor(
                ActionType.CLOSE_APP, null, null, null, null, appName, null, null, 0, null);
    }

    public static ActionDescriptor waitFor(Duration duration) {
        Objects.requireNonNull(duration, "duration must not be null");
        return new ActionDescriptor(
                ActionType.WAIT, null, null, null, null, null, null, null, 0, duration);
    }

    /// Returns a short human-readable description.
    public String describe() {
        return switch (type) {
            case CLICK -> "click at (" + x + ", " + y + ")";
            case TYPE -> "type \"" + text + "\"";
            case DRAG -> "drag (" + x + ", " + y + ") to (" + toX + ", " + toY + ")";
            case KEY_COMBO -> "press " + String.join("+", keys);
            case SCROLL -> "scroll " + direction + " by " + amount;
            case OPEN_APP -> "open " + text;
            case CLOSE_APP -> "close " + text;
            case WAIT -> "wait " + duration.toMillis() + " ms";
            case ANALYZE -> "analyze screen";
        };
    }
}
