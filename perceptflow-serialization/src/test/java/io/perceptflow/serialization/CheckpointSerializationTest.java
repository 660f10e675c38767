package io.perceptflow.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.perceptflow.core.execution.result.ExecutionResult;
import io.perceptflow.core.execution.stream.StepEvent;
import io.perceptflow.core.state.ErrorKind;
import io.perceptflow.core.state.ExecutionStep;
import io.perceptflow.core.state.Outcome;
import io.perceptflow.core.state.Session;
import io.perceptflow.core.state.SessionSnapshot;
import io.perceptflow.core.state.StepStatus;
import io.perceptflow.core.storage.checkpoint.Checkpoint;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Checkpoint serialization")
class CheckpointSerializationTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:15:30.123456789Z");
    private static final Instant T1 = Instant.parse("2026-03-01T10:15:31Z");
    private static final Session SESSION = new Session("s-42", "click Submit", T0);

    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = CheckpointSerializer.createMapper();
    }

    @Nested
    @DisplayName("SessionSnapshot")
    class Snapshots {

        @Test
        @DisplayName("round-trips steps, counters and payload")
        void roundTrip_runningSnapshot() throws Exception {
            SessionSnapshot snapshot = runningSnapshot();

            String json = mapper.writeValueAsString(snapshot);
            SessionSnapshot restored = mapper.readValue(json, SessionSnapshot.class);

            assertThat(restored).isEqualTo(snapshot);
            assertThat(restored.getInt("current_step", -1)).isEqualTo(1);
            assertThat(restored.retryCount("screen_analyzer")).isEqualTo(1);
        }

        @Test
        @DisplayName("keeps null values in a step update")
        void roundTrip_fieldRemoval() throws Exception {
            SessionSnapshot restored =
                    mapper.readValue(
                            mapper.writeValueAsString(runningSnapshot()), SessionSnapshot.class);

            assertThat(restored.steps().get(0).update()).containsEntry("target_element", null);
        }

        @Test
        @DisplayName("omits error fields and the outcome while they are unset")
        void shouldOmitNullFields() throws Exception {
            SessionSnapshot snapshot =
                    new SessionSnapshot(
                            SESSION,
                            "screen_capture",
                            List.of(
                                    ExecutionStep.succeeded(
                                            1, "command_analyzer", T0, T1, Map.of("a", 1))),
                            Map.of(),
                            Map.of("a", 1),
                            false,
                            null);

            String json = mapper.writeValueAsString(snapshot);

            assertThat(json).doesNotContain("errorKind").doesNotContain("outcome");
            assertThat(json.indexOf("\"session\"")).isLessThan(json.indexOf("\"steps\""));
        }

        @Test
        @DisplayName("ignores unknown properties")
        void shouldIgnoreUnknownProperties() throws Exception {
            String json =
                    "{\"session\":{\"sessionId\":\"s-1\",\"command\":\"open Safari\","
                            + "\"createdAt\":\"2026-03-01T10:15:30Z\"},"
                            + "\"currentNode\":\"command_analyzer\",\"completed\":false,"
                            + "\"formatVersion\":2}";

            SessionSnapshot restored = mapper.readValue(json, SessionSnapshot.class);

            assertThat(restored.sessionId()).isEqualTo("s-1");
            assertThat(restored.steps()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Checkpoint")
    class Checkpoints {

        @Test
        @DisplayName("round-trips through the static helpers")
        void roundTrip_checkpoint() {
            Checkpoint checkpoint = new Checkpoint("s-42", 2, runningSnapshot(), T1);

            Checkpoint restored =
                    CheckpointSerializer.fromJson(CheckpointSerializer.toJson(checkpoint));

            assertThat(restored).isEqualTo(checkpoint);
        }

        @Test
        @DisplayName("rejects malformed input")
        void shouldRejectMalformedJson() {
            assertThatThrownBy(() -> CheckpointSerializer.fromJson("{not json"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Failed to deserialize checkpoint");
        }
    }

    @Nested
    @DisplayName("ExecutionResult")
    class Results {

        @Test
        @DisplayName("writes the result type discriminator")
        void shouldWriteTypeDiscriminator() throws Exception {
            ExecutionResult result = ExecutionResult.of(terminalSnapshot(Outcome.success("done")));

            String json = mapper.writeValueAsString(result);

            assertThat(mapper.readTree(json).get("type").asText()).isEqualTo("COMPLETED");
            assertThat(mapper.readTree(json).get("sessionId").asText()).isEqualTo("s-42");
        }

        @Test
        @DisplayName("restores the matching subtype")
        void roundTrip_failedResult() throws Exception {
            ExecutionResult result =
                    ExecutionResult.of(
                            terminalSnapshot(
                                    Outcome.failure(
                                            ErrorKind.MAX_RETRIES_EXCEEDED, "screen_analyzer")));

            ExecutionResult restored =
                    mapper.readValue(mapper.writeValueAsString(result), ExecutionResult.class);

            assertThat(restored).isInstanceOf(ExecutionResult.Failed.class).isEqualTo(result);
            assertThat(restored.errorKind()).isEqualTo(ErrorKind.MAX_RETRIES_EXCEEDED);
        }

        @Test
        @DisplayName("rejects a type that contradicts the outcome")
        void shouldRejectMismatchedType() throws Exception {
            ExecutionResult result = ExecutionResult.of(terminalSnapshot(Outcome.success("done")));
            String json =
                    mapper.writeValueAsString(result).replace("\"COMPLETED\"", "\"CANCELLED\"");

            assertThatThrownBy(() -> mapper.readValue(json, ExecutionResult.class))
                    .isInstanceOf(JsonMappingException.class)
                    .hasMessageContaining("does not match");
        }
    }

    @Test
    @DisplayName("writes step events in a stable property order")
    void shouldWriteStepEvent() throws Exception {
        StepEvent event =
                new StepEvent(
                        "s-42",
                        3,
                        "screen_analyzer",
                        StepStatus.SUCCEEDED,
                        Map.of("k", "v"),
                        null,
                        null);

        String json = mapper.writeValueAsString(event);

        assertThat(json).doesNotContain("errorKind");
        assertThat(json.indexOf("\"sessionId\"")).isLessThan(json.indexOf("\"resultDelta\""));
    }

    private static SessionSnapshot runningSnapshot() {
        Map<String, Object> located = new LinkedHashMap<>();
        located.put("id", "e2");
        located.put("bounds", Map.of("x", 100, "y", 200, "width", 50, "height", 20));
        located.put("confidence", 0.95);
        located.put("step_id", 1);

        Map<String, Object> cleared = new LinkedHashMap<>();
        cleared.put("target_element", null);
        cleared.put("current_step", 0);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("task_type", "click");
        result.put("current_step", 1);
        result.put("need_reanalyze", true);
        result.put("target_element", located);
        result.put("messages", List.of("Planned 1 step(s)", "click at (125, 210)"));

        List<ExecutionStep> steps =
                List.of(
                        ExecutionStep.succeeded(1, "command_analyzer", T0, T1, cleared),
                        ExecutionStep.failed(
                                2,
                                "screen_analyzer",
                                T0,
                                T1,
                                StepStatus.RETRIED,
                                ErrorKind.NODE_TIMEOUT,
                                "vision analysis failed (TIMEOUT): model slow"),
                        ExecutionStep.succeeded(
                                3, "action_executor", T0, T1, Map.of("current_step", 1)));

        return new SessionSnapshot(
                SESSION,
                "result_validator",
                steps,
                Map.of("screen_analyzer", 1),
                result,
                false,
                null);
    }

    private static SessionSnapshot terminalSnapshot(Outcome outcome) {
        return new SessionSnapshot(
                SESSION,
                "result_validator",
                List.of(ExecutionStep.succeeded(1, "result_validator", T0, T1, Map.of())),
                Map.of(),
                Map.of(),
                true,
                outcome);
    }
}
