package io.perceptflow.core.agent;

import io.perceptflow.core.collaborator.ActionType;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// One step of an execution plan.
///
/// Plans are stored in the result payload as plain maps so they survive checkpointing;
/// {@link #toMap()} and {@link #fromMap(Map)} convert between the two forms.
///
/// @param stepId 1-based position in the plan
/// @param actionType action to perform, not null
/// @param target visible label of the element to act on, or null when the action needs
///        no located element
/// @param parameters action parameters such as `text` or `direction`, not null
/// @param description human-readable description, not null
/// @param expectedResult what the screen should show afterwards, may be null
public record PlanStep(
        int stepId,
        ActionType actionType,
        String target,
        Map<String, String> parameters,
        String description,
        String expectedResult) {

    public PlanStep {
        Objects.requireNonNull(actionType, "actionType must not be null");
        Objects.requireNonNull(description, "description must not be null");
        parameters = parameters != null ? Map.copyOf(parameters) : Map.of();
    }

    /// Returns whether the step needs a fresh screen capture and analysis before it runs.
    public boolean needsScreen() {
        return target != null || actionType == ActionType.ANALYZE;
    }

    public String parameter(String name) {
        return parameters.get(name);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("step_id", stepId);
        map.put("action_type", actionType.wireName());
        if (target != null) {
            map.put("target", target);
        }
        map.put("parameters", new LinkedHashMap<>(parameters));
        map.put("description", description);
        if (expectedResult != null) {
            map.put("expected_result", expectedResult);
        }
        return map;
    }

    /// Reads a step from a payload map written by {@link #toMap()}.
    ///
    /// @param map payload map, not null
    /// @return the step, never null
    /// @throws IllegalArgumentException if the action type is unknown
    public static PlanStep fromMap(Map<?, ?> map) {
        Object stepId = map.get("step_id");
        Map<String, String> parameters = new LinkedHashMap<>();
        if (map.get("parameters") instanceof Map<?, ?> raw) {
            raw.forEach((k, v) -> parameters.put(String.valueOf(k), String.valueOf(v)));
        }
        Object target = map.get("target");
        Object expected = map.get("expected_result");
        return new PlanStep(
                stepId instanceof Number n ? n.intValue() : 0,
                ActionType.fromWireName(String.valueOf(map.get("action_type"))),
                target != null ? target.toString() : null,
                parameters,
                String.valueOf(map.get("description")),
                expected != null ? expected.toString() : null);
    }
}
