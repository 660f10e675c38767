package io.perceptflow.cli.visualizer;

import io.perceptflow.core.graph.Graph;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Registry and dispatcher for graph visualization formats.
///
/// @implNote Thread-safe after construction. The format map is immutable.
/// @see VisualizationFormat
public class GraphVisualizer {

    private final Map<String, VisualizationFormat> formats;

    /// Creates a visualizer over the given formats.
    ///
    /// @param formats format implementations with unique names, not null
    /// @throws IllegalArgumentException if two formats share a name
    public GraphVisualizer(List<VisualizationFormat> formats) {
        Objects.requireNonNull(formats, "formats must not be null");
        Map<String, VisualizationFormat> byName = new LinkedHashMap<>();
        for (VisualizationFormat format : formats) {
            if (byName.putIfAbsent(format.getName(), format) != null) {
                throw new IllegalArgumentException("Duplicate format: " + format.getName());
            }
        }
        this.formats = Collections.unmodifiableMap(byName);
    }

    /// Creates a visualizer with the built-in text and Mermaid formats.
    ///
    /// @param useColor whether the text format applies ANSI colors
    /// @return new visualizer, never null
    public static GraphVisualizer withDefaults(boolean useColor) {
        return new GraphVisualizer(
                List.of(new TextVisualizationFormat(useColor), new MermaidVisualizationFormat()));
    }

    /// Renders a graph using the specified format.
    ///
    /// @param graph the graph to visualize, not null
    /// @param formatName the format name (e.g., "text", "mermaid"), not null
    /// @return formatted visualization, never null
    /// @throws IllegalArgumentException if the format is not registered
    public String visualize(Graph graph, String formatName) {
        VisualizationFormat format = formats.get(formatName);
        if (format == null) {
            throw new IllegalArgumentException(
                    "Unsupported format: "
                            + formatName
                            + ". Available: "
                            + String.join(", ", formats.keySet()));
        }
        return format.render(graph);
    }

    public Set<String> getAvailableFormats() {
        return formats.keySet();
    }
}
