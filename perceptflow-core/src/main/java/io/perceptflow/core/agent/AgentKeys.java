package io.perceptflow.core.agent;

/// Result payload keys written and read by the vision agent nodes.
///
/// List-valued keys accumulate across steps; all others hold the latest value.
public final class AgentKeys {

    public static final String TASK_TYPE = "task_type";
    public static final String TASK_INTENT = "task_intent";
    public static final String EXECUTION_PLAN = "execution_plan";
    public static final String CURRENT_STEP = "current_step";

    public static final String SCREENSHOT_PATH = "screenshot_path";
    public static final String SCREEN_WIDTH = "screen_width";
    public static final String SCREEN_HEIGHT = "screen_height";
    public static final String CAPTURED_AT = "captured_at";

    public static final String SCREEN_ANALYSIS = "screen_analysis";
    /// Accumulating list of every element detected in this session.
    public static final String UI_ELEMENTS = "ui_elements";
    /// Element located for the current plan step, tagged with its `step_id`.
    public static final String TARGET_ELEMENT = "target_element";

    /// Accumulating list of per-action result maps.
    public static final String EXECUTION_RESULTS = "execution_results";
    public static final String NEED_REANALYZE = "need_reanalyze";
    public static final String RECOVERY_STRATEGY = "recovery_strategy";
    /// Accumulating list of progress messages.
    public static final String MESSAGES = "messages";

    private AgentKeys() {}
}
