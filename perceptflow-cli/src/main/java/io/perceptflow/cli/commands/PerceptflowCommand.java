package io.perceptflow.cli.commands;

import io.perceptflow.cli.ui.AnsiStyles;
import java.util.concurrent.Callable;
import picocli.CommandLine.Option;

/// Minimal abstract base for all perceptflow CLI commands.
///
/// Owns the banner and the {@link #call()} / {@link #execute()} contract. Subclasses
/// provide command-specific options and return their exit code from {@link #execute()}.
///
/// @see SessionCommand
public abstract class PerceptflowCommand implements Callable<Integer> {

    /// Exit code of a successful command.
    public static final int EXIT_OK = 0;

    /// Exit code of a failed session or an unusable invocation.
    public static final int EXIT_FAILURE = 1;

    private static final String[] BANNER = {
        "",
        "  perceptflow",
        "  perceive -> cognize -> act",
        ""
    };

    @Option(
            names = {"--no-color"},
            description = "Disable colored output",
            negatable = true)
    protected boolean color = true;

    @Override
    public final Integer call() {
        for (String line : BANNER) {
            System.out.println(line);
        }
        return execute();
    }

    /// Runs the command.
    ///
    /// @return process exit code
    protected abstract int execute();

    protected AnsiStyles styles() {
        return AnsiStyles.of(color);
    }
}
