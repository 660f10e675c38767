package io.perceptflow.cli.ui;

import io.perceptflow.core.state.Outcome;
import io.perceptflow.core.state.StepStatus;

/// Terminal styling for session output.
///
/// Every piece of text is painted with a {@link Tone}. Step statuses and session outcomes
/// map to a fixed tone and marker, so `run`, `resume` and `history` print them alike.
///
/// ### Usage
/// ```java
/// AnsiStyles styles = AnsiStyles.of(true);
/// out.println(styles.marker(step.status()) + " " + styles.paint(Tone.NAME, step.node()));
/// ```
///
/// @implNote **Thread-safe**. Instances are immutable.
public final class AnsiStyles {

    private static final String RESET = "\033[0m";

    /// Role of a piece of output.
    public enum Tone {
        /// Headings and node names in listings.
        HEADING("1"),
        /// Secondary text: timestamps, commands, diagnostics.
        DETAIL("38;5;244"),
        SUCCESS("0;32"),
        FAILURE("38;5;167"),
        /// Failures handed to a recovery node, and sessions still running.
        RETRY("38;5;214"),
        /// Session identifiers and node targets.
        NAME("38;5;39");

        private final String sgr;

        Tone(String sgr) {
            this.sgr = sgr;
        }

        private String wrap(String text) {
            return "\033[" + sgr + "m" + text + RESET;
        }
    }

    private final boolean useColor;

    private AnsiStyles(boolean useColor) {
        this.useColor = useColor;
    }

    /// Creates styles that emit escape codes only when `useColor` is set.
    ///
    /// @param useColor true to apply ANSI codes, false for plain text
    /// @return new instance, never null
    public static AnsiStyles of(boolean useColor) {
        return new AnsiStyles(useColor);
    }

    public boolean isColorEnabled() {
        return useColor;
    }

    /// Paints text with the given tone, or returns it unchanged without color.
    public String paint(Tone tone, String text) {
        return useColor ? tone.wrap(text) : text;
    }

    /// Returns the tone of a step with the given status.
    ///
    /// @param status step status, not null
    /// @return tone, never null
    public static Tone toneOf(StepStatus status) {
        switch (status) {
            case SUCCEEDED:
                return Tone.SUCCESS;
            case RETRIED:
                return Tone.RETRY;
            default:
                return Tone.FAILURE;
        }
    }

    /// Returns the painted one-character marker of a step status: `✓`, `↻` or `✗`.
    public String marker(StepStatus status) {
        String symbol;
        switch (status) {
            case SUCCEEDED:
                symbol = "✓";
                break;
            case RETRIED:
                symbol = "↻";
                break;
            default:
                symbol = "✗";
        }
        return paint(toneOf(status), symbol);
    }

    /// Marker for command errors and failed sessions.
    public String failureMarker() {
        return marker(StepStatus.FAILED);
    }

    /// Describes a session outcome in one painted phrase.
    ///
    /// @param outcome terminal outcome, or null for a session that has not ended
    /// @return `outcome: success`, `outcome: <error kind>` or `(session has not ended)`
    public String outcome(Outcome outcome) {
        if (outcome == null) {
            return paint(Tone.RETRY, "(session has not ended)");
        }
        return outcome.success()
                ? paint(Tone.SUCCESS, "outcome: success")
                : paint(Tone.FAILURE, "outcome: " + outcome.errorKind());
    }

    public String arrow() {
        return paint(Tone.NAME, "->");
    }
}
