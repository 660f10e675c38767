package io.perceptflow.cli;

import io.perceptflow.cli.commands.PerceptflowCommands;
import java.io.IOException;
import java.io.InputStream;
import java.util.logging.LogManager;
import picocli.CommandLine;

/// Entry point of the `perceptflow` command line.
///
/// Subcommands:
/// - `run` - run a command through the agent graph
/// - `visualize` - render the agent graph as text or Mermaid
/// - `history` - print the checkpoints of a session
/// - `resume` - continue a session from its latest checkpoint
///
/// Logging is configured from the bundled `logging.properties` unless
/// `java.util.logging.config.file` points elsewhere.
public final class PerceptflowCli {

    private static final String LOGGING_CONFIG = "/logging.properties";

    private PerceptflowCli() {}

    public static void main(String[] args) {
        configureLogging();
        System.exit(commandLine().execute(args));
    }

    /// Creates the configured command line.
    ///
    /// @return new command line, never null
    public static CommandLine commandLine() {
        return new CommandLine(new PerceptflowCommands());
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = PerceptflowCli.class.getResourceAsStream(LOGGING_CONFIG)) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Cannot load logging configuration: " + e.getMessage());
        }
    }
}
