package io.perceptflow.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("resume command")
class ResumeCommandTest extends BaseCommandTest {

    @TempDir Path original;
    @TempDir Path interrupted;

    @Test
    @DisplayName("continues an interrupted session from its files")
    void shouldResumeInterruptedSession() throws Exception {
        // Given
        execute(
                "run",
                "--session-id",
                "s-res",
                "--checkpoint-dir",
                original.toString(),
                "type hello into Search");
        copySteps(original, interrupted, "s-res", 3);
        outContent.reset();

        // When
        int exitCode =
                execute(
                        "resume",
                        "--no-color",
                        "--checkpoint-dir",
                        interrupted.toString(),
                        "s-res");

        // Then
        assertThat(exitCode).isZero();
        assertThat(output())
                .contains("continuing after step 3")
                .contains("[4] action_executor")
                .contains("[7] result_validator")
                .doesNotContain("[3] screen_analyzer")
                .contains("Session completed");
    }

    @Test
    @DisplayName("reports a finished session without running nodes")
    void shouldReturnTerminalSession() {
        // Given
        String dir = original.toString();
        execute("run", "--session-id", "s-done", "--checkpoint-dir", dir, "open Safari");
        outContent.reset();

        // When
        int exitCode = execute("resume", "--no-color", "--checkpoint-dir", dir, "s-done");

        // Then
        assertThat(exitCode).isZero();
        assertThat(output()).doesNotContain("[4]").contains("Steps: 3");
    }

    @Test
    @DisplayName("exits with 1 for an unknown session")
    void shouldFailForUnknownSession() {
        // When
        int exitCode = execute("resume", "--checkpoint-dir", original.toString(), "nope");

        // Then
        assertThat(exitCode).isEqualTo(1);
        assertThat(errors()).contains("nope");
    }
}
