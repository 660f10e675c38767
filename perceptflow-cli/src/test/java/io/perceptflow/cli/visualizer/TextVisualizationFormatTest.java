package io.perceptflow.cli.visualizer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.perceptflow.core.agent.VisionAgentGraph;
import io.perceptflow.core.agent.stub.StubActionService;
import io.perceptflow.core.agent.stub.StubScreenCaptureService;
import io.perceptflow.core.agent.stub.StubVisionService;
import io.perceptflow.core.graph.Graph;
import java.util.List;
import org.junit.jupiter.api.Test;

class TextVisualizationFormatTest {

    private final Graph graph =
            VisionAgentGraph.create(
                    new StubVisionService(),
                    new StubScreenCaptureService(),
                    new StubActionService());

    @Test
    void shouldListNodesRoutesAndRecovery() {
        String result = new TextVisualizationFormat(false).render(graph);

        assertThat(result)
                .startsWith("Graph: vision-agent (entry: command_analyzer)")
                .contains("needs screen -> screen_capture")
                .contains("default -> action_executor")
                .contains("on failure -> error_handler (retry)");
        assertThat(result.indexOf("command_analyzer" + System.lineSeparator()))
                .isLessThan(result.indexOf("error_handler" + System.lineSeparator()));
    }

    @Test
    void shouldColorOnlyWhenEnabled() {
        assertThat(new TextVisualizationFormat(true).render(graph)).contains("\033[");
        assertThat(new TextVisualizationFormat(false).render(graph)).doesNotContain("\033[");
    }

    @Test
    void shouldDispatchByFormatName() {
        GraphVisualizer visualizer = GraphVisualizer.withDefaults(false);

        assertThat(visualizer.getAvailableFormats()).containsExactly("text", "mermaid");
        assertThat(visualizer.visualize(graph, "text")).startsWith("Graph:");
        assertThatThrownBy(() -> visualizer.visualize(graph, "svg"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Available: text, mermaid");
    }

    @Test
    void shouldRejectDuplicateFormatNames() {
        assertThatThrownBy(
                        () ->
                                new GraphVisualizer(
                                        List.of(
                                                new TextVisualizationFormat(false),
                                                new TextVisualizationFormat(true))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("text");
    }
}
