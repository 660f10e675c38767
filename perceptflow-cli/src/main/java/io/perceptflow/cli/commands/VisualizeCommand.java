package io.perceptflow.cli.commands;

import io.perceptflow.cli.visualizer.GraphVisualizer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "visualize", description = "Visualize the agent graph")
class VisualizeCommand extends PerceptflowCommand {

    @Option(
            names = "--format",
            defaultValue = "text",
            description = "Output format: text, mermaid")
    String format;

    @Override
    protected int execute() {
        try {
            String output =
                    GraphVisualizer.withDefaults(color)
                            .visualize(SessionCommand.agentGraph(), format);
            System.out.println(output);
            return EXIT_OK;
        } catch (IllegalArgumentException e) {
            System.err.println(" [FAIL] Visualization failed: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }
}
