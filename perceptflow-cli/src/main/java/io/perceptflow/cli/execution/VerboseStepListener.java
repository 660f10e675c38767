package io.perceptflow.cli.execution;

import io.perceptflow.cli.ui.AnsiStyles;
import io.perceptflow.cli.ui.AnsiStyles.Tone;
import io.perceptflow.core.execution.ExecutionListener;
import io.perceptflow.core.state.ExecutionStep;
import io.perceptflow.core.state.StateView;
import java.io.PrintStream;
import java.util.Objects;

/// Execution listener that prints one line per step to the terminal.
///
/// ### Output Format
/// ```
///   ✓ [1] command_analyzer
///   ↻ [3] screen_analyzer  NODE_TIMEOUT: vision analysis failed (TIMEOUT): model slow
///   ✗ [9] action_executor  MAX_RETRIES_EXCEEDED: ...
/// ```
///
/// @implNote **Not thread-safe**. Intended for one session at a time.
public class VerboseStepListener implements ExecutionListener {

    private final PrintStream out;
    private final AnsiStyles styles;

    /// Creates a listener writing to the given stream.
    ///
    /// @param out output stream, typically `System.out`, not null
    /// @param useColor whether to apply ANSI color codes
    public VerboseStepListener(PrintStream out, boolean useColor) {
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.styles = AnsiStyles.of(useColor);
    }

    @Override
    public void onSessionStart(StateView state) {
        out.printf(
                "%s %s %s%n",
                styles.paint(Tone.HEADING, "Session"),
                styles.paint(Tone.NAME, state.sessionId()),
                styles.paint(Tone.DETAIL, "\"" + state.command() + "\""));
        if (state.stepCount() > 0) {
            out.println(
                    styles.paint(Tone.DETAIL, "  continuing after step " + state.stepCount()));
        }
    }

    @Override
    public void onStepComplete(StateView state, ExecutionStep step) {
        out.println(formatStep(step));
    }

    /// Formats a step the way it is printed during execution.
    ///
    /// @param step the step to format, not null
    /// @return single line without line terminator, never null
    public String formatStep(ExecutionStep step) {
        String line =
                "  " + styles.marker(step.status()) + " [" + step.index() + "] " + step.node();
        if (step.succeeded()) {
            return line;
        }
        String detail = step.errorDetail() != null ? ": " + step.errorDetail() : "";
        return line
                + "  "
                + styles.paint(AnsiStyles.toneOf(step.status()), step.errorKind() + detail);
    }
}
