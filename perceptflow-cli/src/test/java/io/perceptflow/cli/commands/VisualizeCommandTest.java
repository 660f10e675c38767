package io.perceptflow.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("visualize command")
class VisualizeCommandTest extends BaseCommandTest {

    @Test
    void shouldRenderTextByDefault() {
        // When
        int exitCode = execute("visualize", "--no-color");

        // Then
        assertThat(exitCode).isZero();
        assertThat(output())
                .contains("Graph: vision-agent (entry: command_analyzer)")
                .contains("needs screen -> screen_capture");
    }

    @Test
    void shouldRenderMermaid() {
        // When
        int exitCode = execute("visualize", "--format", "mermaid");

        // Then
        assertThat(exitCode).isZero();
        assertThat(output()).contains("flowchart TD").contains("-.->|retry| error_handler");
    }

    @Test
    void shouldHandleUnsupportedFormat() {
        // When
        int exitCode = execute("visualize", "--format", "unknown");

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(errors()).contains("Unsupported format: unknown");
    }
}
