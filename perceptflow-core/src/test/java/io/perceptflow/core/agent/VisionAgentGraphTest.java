package io.perceptflow.core.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.perceptflow.core.agent.stub.StubActionService;
import io.perceptflow.core.agent.stub.StubScreenCaptureService;
import io.perceptflow.core.agent.stub.StubVisionService;
import io.perceptflow.core.collaborator.ActionDescriptor;
import io.perceptflow.core.collaborator.ActionOutcome;
import io.perceptflow.core.collaborator.ActionService;
import io.perceptflow.core.collaborator.Bounds;
import io.perceptflow.core.collaborator.CollaboratorException;
import io.perceptflow.core.collaborator.ScreenCapture;
import io.perceptflow.core.collaborator.ScreenCaptureService;
import io.perceptflow.core.collaborator.UiElement;
import io.perceptflow.core.collaborator.VisionAnalysis;
import io.perceptflow.core.collaborator.VisionService;
import io.perceptflow.core.config.EngineConfig;
import io.perceptflow.core.execution.GraphExecutor;
import io.perceptflow.core.execution.result.ExecutionResult;
import io.perceptflow.core.state.ErrorKind;
import io.perceptflow.core.state.ExecutionStep;
import io.perceptflow.core.state.StepStatus;
import io.perceptflow.core.storage.checkpoint.InMemoryCheckpointStore;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("VisionAgentGraph")
class VisionAgentGraphTest {

    private static final ScreenCapture CAPTURE =
            new ScreenCapture("/tmp/screen.png", 1920, 1080, Instant.now(), Map.of());

    @Mock private VisionService vision;
    @Mock private ScreenCaptureService capture;
    @Mock private ActionService actions;

    private GraphExecutor executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.close();
        }
    }

    @Nested
    @DisplayName("with mocked collaborators")
    class Mocked {

        @Test
        @DisplayName("opens an application without looking at the screen")
        void shouldOpenAppInThreeSteps() throws Exception {
            when(actions.execute(any())).thenReturn(ActionOutcome.succeeded("Safari opened"));

            ExecutionResult result = run("open Safari");

            assertThat(result).isInstanceOf(ExecutionResult.Completed.class);
            assertThat(result.isSuccess()).isTrue();
            assertThat(nodesOf(result))
                    .containsExactly(
                            VisionAgentGraph.COMMAND_ANALYZER,
                            VisionAgentGraph.ACTION_EXECUTOR,
                            VisionAgentGraph.RESULT_VALIDATOR);
            assertThat(result.finalState().getString(AgentKeys.TASK_TYPE)).isEqualTo("open_app");
            verify(actions).execute(ActionDescriptor.openApp("Safari"));
            verifyNoInteractions(vision, capture);
        }

        @Test
        @DisplayName("re-captures the screen after analysis timeouts and then succeeds")
        void shouldRecoverFromAnalysisTimeouts() throws Exception {
            when(capture.capture(any())).thenReturn(CAPTURE);
            CollaboratorException timeout =
                    new CollaboratorException(CollaboratorException.Reason.TIMEOUT, "model slow");
            when(vision.analyze(any(), anyString()))
                    .thenThrow(timeout)
                    .thenThrow(timeout)
                    .thenReturn(analysisWith("Submit", new Bounds(100, 200, 50, 20)));
            when(actions.execute(any())).thenReturn(ActionOutcome.succeeded("clicked"));

            ExecutionResult result = run("click Submit");

            assertThat(result.isSuccess()).isTrue();
            assertThat(nodesOf(result))
                    .containsExactly(
                            "command_analyzer",
                            "screen_capture",
                            "screen_analyzer",
                            "screen_capture",
                            "screen_analyzer",
                            "screen_capture",
                            "screen_analyzer",
                            "action_executor",
                            "result_validator");
            assertThat(result.finalState().steps())
                    .filteredOn(step -> step.status() == StepStatus.RETRIED)
                    .extracting(ExecutionStep::errorKind)
                    .containsExactly(ErrorKind.NODE_TIMEOUT, ErrorKind.NODE_TIMEOUT);
            assertThat(result.finalState().retryCount("screen_analyzer")).isEqualTo(2);
            verify(capture, times(3)).capture(any());
            verify(actions).execute(ActionDescriptor.click(125, 210));
        }

        @Test
        @DisplayName("stops with max retries exceeded when the target never appears")
        void shouldGiveUpWhenTargetIsMissing() throws Exception {
            when(capture.capture(any())).thenReturn(CAPTURE);
            when(vision.analyze(any(), anyString()))
                    .thenReturn(analysisWith("Cancel", new Bounds(0, 0, 10, 10)));

            ExecutionResult result = run("click Submit");

            assertThat(result.errorKind()).isEqualTo(ErrorKind.MAX_RETRIES_EXCEEDED);
            assertThat(((ExecutionResult.Failed) result).detail()).contains("Submit");
            assertThat(result.finalState().retryCount("screen_analyzer")).isEqualTo(4);
            verifyNoInteractions(actions);
        }

        @Test
        @DisplayName("retries a rejected click through the error handler")
        void shouldRetryRejectedAction() throws Exception {
            when(capture.capture(any())).thenReturn(CAPTURE);
            when(vision.analyze(any(), anyString()))
                    .thenReturn(analysisWith("Submit", new Bounds(100, 200, 50, 20)));
            when(actions.execute(any()))
                    .thenReturn(ActionOutcome.failed("button disabled"))
                    .thenReturn(ActionOutcome.succeeded("clicked"));

            ExecutionResult result = run("click Submit");

            assertThat(result.isSuccess()).isTrue();
            assertThat(nodesOf(result))
                    .containsExactly(
                            "command_analyzer",
                            "screen_capture",
                            "screen_analyzer",
                            "action_executor",
                            "error_handler",
                            "action_executor",
                            "result_validator");
            assertThat(result.finalState().getString(AgentKeys.RECOVERY_STRATEGY)).isNull();
        }

        @Test
        @DisplayName("re-analyzes the screen after an out-of-bounds click")
        void shouldReanalyzeAfterOutOfBounds() throws Exception {
            when(capture.capture(any())).thenReturn(CAPTURE);
            when(vision.analyze(any(), anyString()))
                    .thenReturn(analysisWith("Submit", new Bounds(100, 200, 50, 20)));
            when(actions.execute(any()))
                    .thenThrow(
                            new CollaboratorException(
                                    CollaboratorException.Reason.OUT_OF_BOUNDS, "off screen"))
                    .thenReturn(ActionOutcome.succeeded("clicked"));

            ExecutionResult result = run("click Submit");

            assertThat(result.isSuccess()).isTrue();
            assertThat(nodesOf(result))
                    .containsExactly(
                            "command_analyzer",
                            "screen_capture",
                            "screen_analyzer",
                            "action_executor",
                            "error_handler",
                            "screen_capture",
                            "screen_analyzer",
                            "action_executor",
                            "result_validator");
        }

        @Test
        @DisplayName("ends with a failure verdict for an empty command")
        void shouldRejectEmptyCommand() {
            ExecutionResult result = run("   ");

            assertThat(result).isInstanceOf(ExecutionResult.Completed.class);
            assertThat(result.isSuccess()).isFalse();
            assertThat(result.errorKind()).isEqualTo(ErrorKind.NODE_REPORTED_FAILURE);
            assertThat(result.finalState().stepCount()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("with stub collaborators")
    class Stubbed {

        @Test
        @DisplayName("focuses a field and types into it")
        void shouldTypeIntoField() {
            StubActionService stubActions = new StubActionService();
            executor =
                    new GraphExecutor(
                            VisionAgentGraph.create(
                                    new StubVisionService(),
                                    new StubScreenCaptureService(),
                                    stubActions),
                            EngineConfig.defaults(),
                            new InMemoryCheckpointStore(),
                            null);

            ExecutionResult result = executor.run("type hello into Search");

            assertThat(result.isSuccess()).isTrue();
            assertThat(nodesOf(result))
                    .containsExactly(
                            "command_analyzer",
                            "screen_capture",
                            "screen_analyzer",
                            "action_executor",
                            "result_validator",
                            "action_executor",
                            "result_validator");
            assertThat(stubActions.performed())
                    .containsExactly(
                            ActionDescriptor.click(960, 540), ActionDescriptor.type("hello"));
            assertThat(result.finalState().getList(AgentKeys.EXECUTION_RESULTS)).hasSize(2);
        }

        @Test
        @DisplayName("describes the screen for an unrecognized command")
        void shouldAnalyzeScreen() {
            StubActionService stubActions = new StubActionService();
            executor =
                    new GraphExecutor(
                            VisionAgentGraph.create(
                                    new StubVisionService(),
                                    new StubScreenCaptureService(),
                                    stubActions),
                            EngineConfig.defaults(),
                            new InMemoryCheckpointStore(),
                            null);

            ExecutionResult result = executor.run("what is on the screen");

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.finalState().stepCount()).isEqualTo(5);
            assertThat(result.finalState().getString(AgentKeys.SCREEN_ANALYSIS))
                    .startsWith("Stub screen");
            assertThat(stubActions.performed()).isEmpty();
        }
    }

    private ExecutionResult run(String command) {
        executor =
                new GraphExecutor(
                        VisionAgentGraph.create(vision, capture, actions),
                        EngineConfig.defaults(),
                        new InMemoryCheckpointStore(),
                        null);
        return executor.run(command);
    }

    private static VisionAnalysis analysisWith(String label, Bounds bounds) {
        return new VisionAnalysis(
                "A dialog",
                List.of(new UiElement("e1", "button", label, bounds, 0.95)));
    }

    private static List<String> nodesOf(ExecutionResult result) {
        return result.finalState().steps().stream().map(ExecutionStep::node).toList();
    }
}
