package io.perceptflow.cli.visualizer;

import io.perceptflow.core.graph.Graph;

/// Strategy interface for rendering a graph in one output format.
///
/// ### Built-in Formats
/// - `text` - indented listing of nodes, routes and recovery targets
///   ({@link TextVisualizationFormat})
/// - `mermaid` - Mermaid flowchart syntax ({@link MermaidVisualizationFormat})
///
/// @see GraphVisualizer
public interface VisualizationFormat {

    /// Returns the unique identifier for this format.
    ///
    /// @return format name used for CLI selection (e.g., "text", "mermaid"), never null
    String getName();

    /// Renders the graph in this format.
    ///
    /// @param graph the graph to visualize, not null
    /// @return formatted string representation, never null
    String render(Graph graph);
}
