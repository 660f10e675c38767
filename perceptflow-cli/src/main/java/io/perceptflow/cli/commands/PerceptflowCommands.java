package io.perceptflow.cli.commands;

import picocli.CommandLine.Command;

/// Top-level command that registers all subcommands.
///
/// @see RunCommand
/// @see VisualizeCommand
/// @see HistoryCommand
/// @see ResumeCommand
@Command(
        name = "perceptflow",
        description = "Perceive-cognize-act workflow engine",
        mixinStandardHelpOptions = true,
        version = "perceptflow 0.1.0",
        subcommands = {
            RunCommand.class,
            VisualizeCommand.class,
            HistoryCommand.class,
            ResumeCommand.class
        })
public class PerceptflowCommands {}
