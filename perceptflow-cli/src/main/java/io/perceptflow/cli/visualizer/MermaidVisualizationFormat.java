package io.perceptflow.cli.visualizer;

import io.perceptflow.core.graph.Graph;
import io.perceptflow.core.graph.edge.Edge;
import io.perceptflow.core.graph.edge.Route;
import io.perceptflow.core.graph.retry.RetryPolicy;
import java.util.Locale;
import java.util.Optional;

/// Mermaid diagram format visualization for graphs.
///
/// Generates Mermaid flowchart syntax wrapped in a Markdown code block. Output can be
/// rendered in GitHub/GitLab Markdown or at [mermaid.live](https://mermaid.live).
///
/// ### Node Shapes
/// - **Entry node**: stadium
/// - **Other nodes**: rectangle
///
/// ### Edge Styles
/// - **Solid arrow** (`-->`) labelled with the route label, or `default` for the fallback
/// - **Dotted arrow** (`-.->`) from a node to its recovery node, labelled `retry` or
///   `retry max n`
///
/// @implNote Thread-safe. Stateless rendering.
/// @see TextVisualizationFormat for plain output
public class MermaidVisualizationFormat implements VisualizationFormat {

    @Override
    public String getName() {
        return "mermaid";
    }

    @Override
    public String render(Graph graph) {
        StringBuilder sb = new StringBuilder();

        sb.append("```mermaid\n");
        sb.append("flowchart TD\n");
        sb.append("  subgraph ")
                .append(sanitizeId(graph.getName()))
                .append("[\"")
                .append(graph.getName())
                .append("\"]\n");

        for (String node : graph.getRegistry().names()) {
            String id = sanitizeId(node);
            if (node.equals(graph.getEntryNode())) {
                sb.append("    ").append(id).append("([\"").append(node).append("\"])\n");
            } else {
                sb.append("    ").append(id).append("[\"").append(node).append("\"]\n");
            }
        }

        sb.append("  end\n\n");

        for (String node : graph.getRegistry().names()) {
            renderEdges(sb, graph, node);
        }

        sb.append("```\n");
        return sb.toString();
    }

    private void renderEdges(StringBuilder sb, Graph graph, String node) {
        String fromId = sanitizeId(node);

        Optional<Edge> edge = graph.getRouter().edgeFor(node);
        if (edge.isPresent()) {
            for (Route route : edge.get().routes()) {
                appendEdge(sb, fromId, " -->|", route.label(), route.target());
            }
            appendEdge(sb, fromId, " -->|", "default", edge.get().defaultTarget());
        }

        RetryPolicy policy = graph.getRetryPolicies().get(node);
        if (policy != null) {
            String label =
                    policy.maxRetries() != null ? "retry max " + policy.maxRetries() : "retry";
            appendEdge(sb, fromId, " -.->|", label, policy.recoveryNode());
        }
    }

    private void appendEdge(
            StringBuilder sb, String fromId, String arrow, String label, String target) {
        sb.append("  ")
                .append(fromId)
                .append(arrow)
                .append(label)
                .append("| ")
                .append(sanitizeId(target))
                .append("\n");
    }

    private String sanitizeId(String id) {
        String sanitized = id.replaceAll("[^a-zA-Z0-9_]", "_");
        if (isReservedKeyword(sanitized)) {
            return "node_" + sanitized;
        }
        return sanitized;
    }

    private boolean isReservedKeyword(String id) {
        return switch (id.toLowerCase(Locale.ROOT)) {
            case "end",
                    "subgraph",
                    "graph",
                    "flowchart",
                    "direction",
                    "click",
                    "style",
                    "classdef",
                    "class",
                    "linkstyle" -> true;
            default -> false;
        };
    }
}
