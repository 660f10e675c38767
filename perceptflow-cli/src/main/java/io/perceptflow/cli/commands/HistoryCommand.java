package io.perceptflow.cli.commands;

import io.perceptflow.cli.execution.VerboseStepListener;
import io.perceptflow.cli.ui.AnsiStyles;
import io.perceptflow.cli.ui.AnsiStyles.Tone;
import io.perceptflow.core.state.ExecutionStep;
import io.perceptflow.core.state.SessionSnapshot;
import io.perceptflow.core.storage.checkpoint.Checkpoint;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/// CLI command that prints the checkpoints of a session, oldest first.
@Command(name = "history", description = "Print the checkpoints of a session")
class HistoryCommand extends SessionCommand {

    @Parameters(index = "0", description = "Session identifier")
    private String sessionId;

    @Override
    protected int execute() {
        AnsiStyles styles = styles();
        if (checkpointDir == null) {
            System.err.println("history requires --checkpoint-dir");
            return EXIT_FAILURE;
        }

        List<Checkpoint> history;
        try {
            history = checkpointStore().getHistory(sessionId);
        } catch (IllegalArgumentException e) {
            System.err.printf("%s %s%n", styles.failureMarker(), e.getMessage());
            return EXIT_FAILURE;
        }
        if (history.isEmpty()) {
            System.err.printf(
                    "%s No checkpoints for session %s%n", styles.failureMarker(), sessionId);
            return EXIT_FAILURE;
        }

        SessionSnapshot first = history.get(0).snapshot();
        System.out.printf(
                "%s %s %s%n",
                styles.paint(Tone.HEADING, "Session"),
                styles.paint(Tone.NAME, sessionId),
                styles.paint(Tone.DETAIL, "\"" + first.command() + "\""));

        VerboseStepListener formatter = new VerboseStepListener(System.out, color);
        for (Checkpoint checkpoint : history) {
            SessionSnapshot snapshot = checkpoint.snapshot();
            ExecutionStep step = snapshot.steps().get(checkpoint.stepIndex() - 1);
            System.out.println(
                    formatter.formatStep(step)
                            + styles.paint(Tone.DETAIL, "  @ " + checkpoint.createdAt()));
        }

        SessionSnapshot last = history.get(history.size() - 1).snapshot();
        System.out.println("  " + styles.outcome(last.outcome()));
        return EXIT_OK;
    }
}
