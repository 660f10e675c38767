package io.perceptflow.cli.execution;

import static org.assertj.core.api.Assertions.assertThat;

import io.perceptflow.core.state.ErrorKind;
import io.perceptflow.core.state.ExecutionStep;
import io.perceptflow.core.state.Session;
import io.perceptflow.core.state.SessionState;
import io.perceptflow.core.state.StepStatus;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class VerboseStepListenerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private ByteArrayOutputStream out;
    private VerboseStepListener listener;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        listener =
                new VerboseStepListener(
                        new PrintStream(out, true, StandardCharsets.UTF_8), false);
    }

    @Test
    void shouldPrintSessionHeader() {
        SessionState state =
                SessionState.start(Session.create("s-1", "open Safari"), "command_analyzer");

        listener.onSessionStart(state.snapshot());

        assertThat(out.toString(StandardCharsets.UTF_8))
                .contains("Session s-1 \"open Safari\"")
                .doesNotContain("continuing");
    }

    @Test
    void shouldFormatSucceededStep() {
        ExecutionStep step =
                ExecutionStep.succeeded(1, "command_analyzer", NOW, NOW, Map.of("a", 1));

        assertThat(listener.formatStep(step)).isEqualTo("  ✓ [1] command_analyzer");
    }

    @Test
    void shouldFormatRetriedStepWithError() {
        ExecutionStep step =
                ExecutionStep.failed(
                        3,
                        "screen_analyzer",
                        NOW,
                        NOW,
                        StepStatus.RETRIED,
                        ErrorKind.NODE_TIMEOUT,
                        "model slow");

        listener.onStepComplete(null, step);

        assertThat(out.toString(StandardCharsets.UTF_8))
                .contains("  ↻ [3] screen_analyzer  NODE_TIMEOUT: model slow");
    }

    @Test
    void shouldFormatFailedStepWithoutDetail() {
        ExecutionStep step =
                ExecutionStep.failed(
                        9,
                        "action_executor",
                        NOW,
                        NOW,
                        StepStatus.FAILED,
                        ErrorKind.MAX_RETRIES_EXCEEDED,
                        null);

        assertThat(listener.formatStep(step))
                .isEqualTo("  ✗ [9] action_executor  MAX_RETRIES_EXCEEDED");
    }
}
