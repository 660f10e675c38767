package io.perceptflow.cli.visualizer;

import io.perceptflow.cli.ui.AnsiStyles;
import io.perceptflow.cli.ui.AnsiStyles.Tone;
import io.perceptflow.core.graph.Graph;
import io.perceptflow.core.graph.edge.Edge;
import io.perceptflow.core.graph.edge.Route;
import io.perceptflow.core.graph.retry.RetryPolicy;
import java.util.Optional;

/// Plain text visualization of a graph.
///
/// Lists every node in registration order with its outgoing routes, its default target and
/// its recovery node:
/// ```
/// Graph: vision-agent (entry: command_analyzer)
///
/// command_analyzer
///   needs screen -> screen_capture
///   default -> action_executor
///   on failure -> command_analyzer (retry)
/// ```
///
/// @implNote Thread-safe. Stateless rendering.
/// @see MermaidVisualizationFormat for diagram output
public class TextVisualizationFormat implements VisualizationFormat {

    private final AnsiStyles styles;

    public TextVisualizationFormat(boolean useColor) {
        this.styles = AnsiStyles.of(useColor);
    }

    @Override
    public String getName() {
        return "text";
    }

    @Override
    public String render(Graph graph) {
        String nl = System.lineSeparator();
        StringBuilder sb = new StringBuilder();
        sb.append(styles.paint(Tone.HEADING, "Graph: "))
                .append(styles.paint(Tone.NAME, graph.getName()))
                .append(styles.paint(Tone.DETAIL, " (entry: " + graph.getEntryNode() + ")"))
                .append(nl);

        for (String node : graph.getRegistry().names()) {
            sb.append(nl).append(styles.paint(Tone.HEADING, node)).append(nl);

            Optional<Edge> edge = graph.getRouter().edgeFor(node);
            if (edge.isPresent()) {
                for (Route route : edge.get().routes()) {
                    appendLine(sb, route.label(), route.target(), "");
                }
                appendLine(sb, "default", edge.get().defaultTarget(), "");
            } else {
                sb.append("  ").append(styles.paint(Tone.DETAIL, "(no outgoing edge)")).append(nl);
            }

            RetryPolicy policy = graph.getRetryPolicies().get(node);
            if (policy != null) {
                String note =
                        policy.maxRetries() != null
                                ? " (retry, max " + policy.maxRetries() + ")"
                                : " (retry)";
                appendLine(sb, "on failure", policy.recoveryNode(), note);
            }
        }
        return sb.toString();
    }

    private void appendLine(StringBuilder sb, String label, String target, String note) {
        sb.append("  ")
                .append(label)
                .append(' ')
                .append(styles.arrow())
                .append(' ')
                .append(styles.paint(Tone.NAME, target))
                .append(styles.paint(Tone.DETAIL, note))
                .append(System.lineSeparator());
    }
}
