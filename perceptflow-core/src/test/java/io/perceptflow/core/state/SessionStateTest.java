package io.perceptflow.core.state;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SessionState")
class SessionStateTest {

    private SessionState state;

    @BeforeEach
    void setUp() {
        state = SessionState.start(Session.create("s-1", "click Submit"), "entry");
    }

    @Nested
    @DisplayName("merge")
    class Merge {

        @Test
        @DisplayName("last write wins for scalar fields")
        void shouldOverwriteScalars() {
            state.merge(Map.of("current_step", 0, "intent", "first"));
            state.merge(Map.of("current_step", 1));

            assertThat(state.result())
                    .containsEntry("current_step", 1)
                    .containsEntry("intent", "first");
        }

        @Test
        @DisplayName("appends list-valued fields")
        void shouldAppendLists() {
            state.merge(Map.of("messages", List.of("a")));
            state.merge(Map.of("messages", List.of("b", "c")));

            assertThat(state.getList("messages")).containsExactly("a", "b", "c");
        }

        @Test
        @DisplayName("removes a field merged with a null value")
        void shouldRemoveNullFields() {
            state.merge(Map.of("target_element", Map.of("id", "e1")));
            Map<String, Object> update = new HashMap<>();
            update.put("target_element", null);

            state.merge(update);

            assertThat(state.has("target_element")).isFalse();
        }

        @Test
        @DisplayName("replaces a scalar field with a list")
        void shouldReplaceScalarWithList() {
            state.merge(Map.of("value", "text"));
            state.merge(Map.of("value", List.of(1)));

            assertThat(state.getList("value")).containsExactly(1);
        }
    }

    @Nested
    @DisplayName("steps")
    class Steps {

        @Test
        @DisplayName("accepts only the next dense index")
        void shouldRejectGapInIndices() {
            Instant now = Instant.now();
            state.appendStep(ExecutionStep.succeeded(1, "entry", now, now, Map.of()));

            ExecutionStep gap = ExecutionStep.succeeded(3, "entry", now, now, Map.of());

            assertThatThrownBy(() -> state.appendStep(gap))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("expected 2");
        }

        @Test
        @DisplayName("counts failures per node")
        void shouldCountFailuresPerNode() {
            state.incrementRetryCount("a");
            int second = state.incrementRetryCount("a");
            state.incrementRetryCount("b");

            assertThat(second).isEqualTo(2);
            assertThat(state.retryCount("a")).isEqualTo(2);
            assertThat(state.retryCount("b")).isEqualTo(1);
            assertThat(state.retryCount("c")).isZero();
        }
    }

    @Nested
    @DisplayName("completion")
    class Completion {

        @Test
        @DisplayName("rejects a second terminal outcome")
        void shouldRejectSecondCompletion() {
            state.complete(Outcome.success("done"));

            assertThatThrownBy(() -> state.complete(Outcome.success("again")))
                    .isInstanceOf(IllegalStateException.class);
            assertThat(state.outcome().detail()).isEqualTo("done");
        }
    }

    @Nested
    @DisplayName("snapshot")
    class Snapshot {

        @Test
        @DisplayName("is isolated from later changes")
        void shouldNotSeeLaterChanges() {
            state.merge(Map.of("messages", List.of("a")));
            SessionSnapshot snapshot = state.snapshot();

            state.merge(Map.of("messages", List.of("b")));
            state.setCurrentNode("other");

            assertThat(snapshot.getList("messages")).containsExactly("a");
            assertThat(snapshot.currentNode()).isEqualTo("entry");
        }

        @Test
        @DisplayName("restores an equivalent mutable state")
        void shouldRoundTripThroughState() {
            Instant now = Instant.now();
            state.merge(Map.of("current_step", 2));
            state.appendStep(ExecutionStep.succeeded(1, "entry", now, now, Map.of()));
            state.incrementRetryCount("entry");

            SessionState restored = state.snapshot().toState();

            assertThat(restored.snapshot()).isEqualTo(state.snapshot());
            assertThat(restored.nextStepIndex()).isEqualTo(2);
        }
    }
}
