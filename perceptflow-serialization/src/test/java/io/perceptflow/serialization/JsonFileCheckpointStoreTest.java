package io.perceptflow.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.perceptflow.core.agent.VisionAgentGraph;
import io.perceptflow.core.agent.stub.StubActionService;
import io.perceptflow.core.agent.stub.StubScreenCaptureService;
import io.perceptflow.core.agent.stub.StubVisionService;
import io.perceptflow.core.collaborator.ActionDescriptor;
import io.perceptflow.core.config.EngineConfig;
import io.perceptflow.core.execution.GraphExecutor;
import io.perceptflow.core.execution.result.ExecutionResult;
import io.perceptflow.core.state.ExecutionStep;
import io.perceptflow.core.state.Session;
import io.perceptflow.core.state.SessionSnapshot;
import io.perceptflow.core.state.SessionState;
import io.perceptflow.core.storage.checkpoint.Checkpoint;
import io.perceptflow.core.storage.checkpoint.CheckpointWriteException;
import io.perceptflow.core.storage.checkpoint.SessionNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("JsonFileCheckpointStore")
class JsonFileCheckpointStoreTest {

    @TempDir Path root;

    private JsonFileCheckpointStore store;
    private SessionState state;

    @BeforeEach
    void setUp() {
        store = new JsonFileCheckpointStore(root);
        state = SessionState.start(Session.create("s-1", "open Safari"), "command_analyzer");
    }

    @Nested
    @DisplayName("writing")
    class Writing {

        @Test
        @DisplayName("writes one numbered file per step")
        void shouldWriteStepFiles() throws IOException {
            store.put("s-1", 1, advance("command_analyzer", Map.of("current_step", 0)));
            store.put("s-1", 2, advance("action_executor", Map.of("current_step", 1)));

            assertThat(fileNames(root.resolve("s-1")))
                    .containsExactly("step-000001.json", "step-000002.json");
        }

        @Test
        @DisplayName("rejects a step index that does not follow the latest file")
        void shouldRejectIndexNotIncreasing() throws IOException {
            store.put("s-1", 1, advance("command_analyzer", Map.of()));
            SessionSnapshot next = advance("action_executor", Map.of());

            assertThatThrownBy(() -> store.put("s-1", 1, next))
                    .isInstanceOf(CheckpointWriteException.class)
                    .hasMessageContaining("must follow 1");
            assertThat(fileNames(root.resolve("s-1"))).containsExactly("step-000001.json");
        }

        @Test
        @DisplayName("accepts a later index after a step whose file was not written")
        void shouldAcceptSkippedIndex() throws IOException {
            store.put("s-1", 1, advance("command_analyzer", Map.of()));
            advance("screen_capture", Map.of("screen_width", 1920));

            store.put("s-1", 3, advance("screen_analyzer", Map.of("current_step", 0)));

            assertThat(fileNames(root.resolve("s-1")))
                    .containsExactly("step-000001.json", "step-000003.json");
            assertThat(store.resume("s-1").stepCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("rejects a snapshot of another session")
        void shouldRejectForeignSnapshot() {
            SessionSnapshot snapshot = advance("command_analyzer", Map.of());

            assertThatThrownBy(() -> store.put("s-2", 1, snapshot))
                    .isInstanceOf(CheckpointWriteException.class);
        }

        @Test
        @DisplayName("keeps any session identifier inside its own directory under the root")
        void shouldEncodeSessionIdentifiers() throws IOException {
            for (String sessionId : List.of("my session", "../escape", "..", ".hidden", "é/x")) {
                SessionState other =
                        SessionState.start(Session.create(sessionId, "open Safari"), "a");
                store.put(sessionId, 1, other.snapshot());

                assertThat(store.latest(sessionId)).get()
                        .extracting(checkpoint -> checkpoint.snapshot().sessionId())
                        .isEqualTo(sessionId);
            }

            assertThat(fileNames(root))
                    .containsExactlyInAnyOrder(
                            "my%20session", "%2E.%2Fescape", "%2E.", "%2Ehidden", "%C3%A9%2Fx");
            assertThat(store.sessions())
                    .containsExactlyInAnyOrder("my session", "../escape", "..", ".hidden", "é/x");
        }

        @Test
        @DisplayName("maps plain identifiers to themselves")
        void shouldKeepPlainIdentifiers() {
            assertThat(JsonFileCheckpointStore.directoryName("s-1_a.b")).isEqualTo("s-1_a.b");
            assertThat(JsonFileCheckpointStore.decodeDirectoryName("s-1_a.b")).hasValue("s-1_a.b");
        }

        @Test
        @DisplayName("ignores directories it did not write")
        void shouldIgnoreForeignDirectories() throws IOException {
            store.put("s-1", 1, advance("command_analyzer", Map.of()));
            Path foreign = Files.createDirectories(root.resolve("not valid"));
            Files.copy(
                    root.resolve("s-1").resolve(JsonFileCheckpointStore.stepFileName(1)),
                    foreign.resolve(JsonFileCheckpointStore.stepFileName(1)));

            assertThat(store.sessions()).containsExactly("s-1");
        }

        @Test
        @DisplayName("leaves no temporary files behind")
        void shouldCleanUpTemporaryFiles() throws IOException {
            for (int i = 1; i <= 3; i++) {
                store.put("s-1", i, advance("action_executor", Map.of("current_step", i)));
            }

            assertThat(fileNames(root.resolve("s-1"))).allMatch(name -> name.startsWith("step-"));
        }
    }

    @Nested
    @DisplayName("reading")
    class Reading {

        @Test
        @DisplayName("returns history in step order and the latest checkpoint")
        void shouldReadHistory() {
            store.put("s-1", 1, advance("command_analyzer", Map.of("task_type", "open_app")));
            store.put("s-1", 2, advance("action_executor", Map.of("current_step", 1)));

            List<Checkpoint> history = store.getHistory("s-1");

            assertThat(history).extracting(Checkpoint::stepIndex).containsExactly(1, 2);
            assertThat(history.get(1).snapshot()).isEqualTo(state.snapshot());
            assertThat(store.latest("s-1")).get().extracting(Checkpoint::stepIndex).isEqualTo(2);
        }

        @Test
        @DisplayName("treats an unknown session as empty")
        void shouldHandleUnknownSession() {
            assertThat(store.getHistory("missing")).isEmpty();
            assertThat(store.latest("missing")).isEmpty();
            assertThatThrownBy(() -> store.resume("missing"))
                    .isInstanceOf(SessionNotFoundException.class);
        }

        @Test
        @DisplayName("survives a restart with a new store instance")
        void shouldSurviveRestart() {
            store.put("s-1", 1, advance("command_analyzer", Map.of("task_type", "open_app")));
            SessionSnapshot written = state.snapshot();

            JsonFileCheckpointStore reopened = new JsonFileCheckpointStore(root);

            assertThat(reopened.sessions()).containsExactly("s-1");
            assertThat(reopened.latest("s-1")).get().extracting(Checkpoint::snapshot)
                    .isEqualTo(written);
            reopened.put("s-1", 2, advance("action_executor", Map.of("current_step", 1)));
            assertThat(store.getHistory("s-1")).hasSize(2);
        }

        @Test
        @DisplayName("lists sessions in name order")
        void shouldListSessions() {
            SessionState other =
                    SessionState.start(Session.create("a-0", "scroll down"), "command_analyzer");
            store.put("s-1", 1, advance("command_analyzer", Map.of()));
            store.put("a-0", 1, other.snapshot());

            assertThat(store.sessions()).containsExactly("a-0", "s-1");
        }
    }

    @Nested
    @DisplayName("with the vision agent")
    class WithAgent {

        @Test
        @DisplayName("resumes a session interrupted mid-way from files on disk")
        void shouldResumeAfterRestart(@TempDir Path restartedRoot) throws IOException {
            ExecutionResult full;
            try (GraphExecutor executor = stubExecutor(store, new StubActionService())) {
                full = executor.run("s-type", "type hello into Search");
            }
            assertThat(full.isSuccess()).isTrue();

            // process died right after screen analysis
            Path interrupted = restartedRoot.resolve("s-type");
            Files.createDirectories(interrupted);
            for (int i = 1; i <= 3; i++) {
                String name = JsonFileCheckpointStore.stepFileName(i);
                Files.copy(root.resolve("s-type").resolve(name), interrupted.resolve(name));
            }

            StubActionService actions = new StubActionService();
            JsonFileCheckpointStore reopened = new JsonFileCheckpointStore(restartedRoot);
            ExecutionResult resumed;
            try (GraphExecutor executor = stubExecutor(reopened, actions)) {
                resumed = executor.resume("s-type");
            }

            assertThat(resumed.isSuccess()).isTrue();
            assertThat(nodesOf(resumed)).isEqualTo(nodesOf(full));
            assertThat(actions.performed())
                    .containsExactly(
                            ActionDescriptor.click(960, 540), ActionDescriptor.type("hello"));
            assertThat(reopened.getHistory("s-type")).hasSize(full.finalState().stepCount());
        }
    }

    private static GraphExecutor stubExecutor(
            JsonFileCheckpointStore checkpoints, StubActionService actions) {
        return new GraphExecutor(
                VisionAgentGraph.create(
                        new StubVisionService(), new StubScreenCaptureService(), actions),
                EngineConfig.defaults(),
                checkpoints,
                null);
    }

    private SessionSnapshot advance(String node, Map<String, Object> update) {
        Instant now = Instant.now();
        state.setCurrentNode(node);
        state.merge(update);
        state.appendStep(ExecutionStep.succeeded(state.nextStepIndex(), node, now, now, update));
        return state.snapshot();
    }

    private static List<String> nodesOf(ExecutionResult result) {
        return result.finalState().steps().stream().map(ExecutionStep::node).toList();
    }

    private static List<String> fileNames(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(path -> path.getFileName().toString()).sorted().toList();
        }
    }
}
