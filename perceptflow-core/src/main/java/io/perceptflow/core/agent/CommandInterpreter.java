package io.perceptflow.core.agent;

import io.perceptflow.core.collaborator.ActionType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Rule-based interpreter turning a natural-language command into a {@link TaskPlan}.
///
/// Recognized forms (case-insensitive):
/// - `open|launch|start <app>` and `close|quit <app>`
/// - `click [on] [the] <label>` and `double click` variants
/// - `type <text> [into|in <label>]`, quotes around the text are stripped
/// - `scroll up|down|left|right [<amount>]`
/// - `drag [from] <x>,<y> to <x>,<y>`
/// - `press <key>+<key>...`
/// - `wait <n> [second|seconds|ms]`
///
/// Anything else becomes an `analyze` task that describes the screen with the command as
/// the target of interest.
///
/// @implNote **Stateless**, safe to share.
public final class CommandInterpreter {

    private static final Pattern OPEN = Pattern.compile("^(?:open|launch|start)\\s+(.+)$");
    private static final Pattern CLOSE = Pattern.compile("^(?:close|quit)\\s+(.+)$");
    private static final Pattern CLICK =
            Pattern.compile("^(?:double\\s+)?click\\s+(?:on\\s+)?(?:the\\s+)?(.+)$");
    private static final Pattern TYPE =
            Pattern.compile("^type\\s+(.+?)(?:\\s+(?:into|in)\\s+(?:the\\s+)?(.+))?$");
    private static final Pattern SCROLL =
            Pattern.compile("^scroll\\s+(up|down|left|right)(?:\\s+(\\d+))?.*$");
    private static final Pattern DRAG =
            Pattern.compile(
                    "^drag\\s+(?:from\\s+)?(\\d+)\\s*,\\s*(\\d+)\\s+to\\s+(\\d+)\\s*,\\s*(\\d+)$");
    private static final Pattern PRESS = Pattern.compile("^press\\s+(.+)$");
    private static final Pattern WAIT =
            Pattern.compile("^wait\\s+(\\d+)\\s*(ms|milliseconds?|s|secs?|seconds?)?$");

    private static final String DEFAULT_SCROLL_AMOUNT = "3";

    /// Interprets a command.
    ///
    /// @param command the raw user command, not blank
    /// @return the interpreted plan, never null
    /// @throws IllegalArgumentException if the command is null or blank
    public TaskPlan interpret(String command) {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("Command must not be blank");
        }
        String original = command.trim();
        String text = original.toLowerCase(Locale.ROOT);
        Matcher m;

        if ((m = OPEN.matcher(text)).matches()) {
            String app = original.substring(m.start(1)).trim();
            return single(TaskType.OPEN_APP, "Open application " + app,
                    new PlanStep(1, ActionType.OPEN_APP, null, Map.of("app_name", app),
                            "Open " + app, app + " is in the foreground"));
        }
        if ((m = CLOSE.matcher(text)).matches()) {
            String app = original.substring(m.start(1)).trim();
            return single(TaskType.CLOSE_APP, "Close application " + app,
                    new PlanStep(1, ActionType.CLOSE_APP, null, Map.of("app_name", app),
                            "Close " + app, app + " is no longer running"));
        }
        if ((m = CLICK.matcher(text)).matches()) {
            String label = stripQuotes(original.substring(m.start(1)).trim());
            return single(TaskType.CLICK, "Click " + label,
                    new PlanStep(1, ActionType.CLICK, label, Map.of(),
                            "Click " + label, null));
        }
        if ((m = TYPE.matcher(text)).matches()) {
            return typePlan(original, m);
        }
        if ((m = SCROLL.matcher(text)).matches()) {
            String amount = m.group(2) != null ? m.group(2) : DEFAULT_SCROLL_AMOUNT;
            return single(TaskType.SCROLL, "Scroll " + m.group(1),
                    new PlanStep(1, ActionType.SCROLL, null,
                            Map.of("direction", m.group(1), "amount", amount),
                            "Scroll " + m.group(1) + " by " + amount, null));
        }
        if ((m = DRAG.matcher(text)).matches()) {
            return single(TaskType.DRAG, "Drag pointer",
                    new PlanStep(1, ActionType.DRAG, null,
                            Map.of("from_x", m.group(1), "from_y", m.group(2),
                                    "to_x", m.group(3), "to_y", m.group(4)),
                            "Drag from " + m.group(1) + "," + m.group(2)
                                    + " to " + m.group(3) + "," + m.group(4), null));
        }
        if ((m = PRESS.matcher(text)).matches()) {
            List<String> keys = Arrays.stream(m.group(1).split("\\s*\\+\\s*"))
                    .map(String::trim)
                    .filter(k -> !k.isEmpty())
                    .toList();
            return single(TaskType.OTHER, "Press " + String.join("+", keys),
                    new PlanStep(1, ActionType.KEY_COMBO, null,
                            Map.of("keys", String.join("+", keys)),
                            "Press " + String.join("+", keys), null));
        }
        if ((m = WAIT.matcher(text)).matches()) {
            long millis = Long.parseLong(m.group(1));
            if (m.group(2) == null || m.group(2).startsWith("s")) {
                millis *= 1000;
            }
            return single(TaskType.OTHER, "Wait",
                    new PlanStep(1, ActionType.WAIT, null,
                            Map.of("millis", Long.toString(millis)),
                            "Wait " + millis + " ms", null));
        }
        return single(TaskType.ANALYZE, "Describe the screen",
                new PlanStep(1, ActionType.ANALYZE, null, Map.of("question", original),
                        "Analyze the screen: " + original, null));
    }

    private TaskPlan typePlan(String original, Matcher m) {
        String typed = stripQuotes(original.substring(m.start(1), m.end(1)).trim());
        List<PlanStep> steps = new ArrayList<>();
        if (m.group(2) != null) {
            String field = stripQuotes(original.substring(m.start(2)).trim());
            steps.add(new PlanStep(1, ActionType.CLICK, field, Map.of(),
                    "Focus " + field, field + " has keyboard focus"));
        }
        steps.add(new PlanStep(steps.size() + 1, ActionType.TYPE, null, Map.of("text", typed),
                "Type \"" + typed + "\"", null));
        return new TaskPlan(TaskType.TYPE, "Type \"" + typed + "\"", steps);
    }

    private static TaskPlan single(TaskType type, String intent, PlanStep step) {
        return new TaskPlan(type, intent, List.of(step));
    }

    private static String stripQuotes(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }
}
