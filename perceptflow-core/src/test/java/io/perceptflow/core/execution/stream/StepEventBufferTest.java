package io.perceptflow.core.execution.stream;

import static org.assertj.core.api.Assertions.assertThat;

import io.perceptflow.core.state.StepStatus;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StepEventBuffer")
class StepEventBufferTest {

    @Test
    @DisplayName("drops the oldest event when full")
    void shouldDropOldest() throws InterruptedException {
        StepEventBuffer buffer = new StepEventBuffer(2);

        assertThat(buffer.offer(event(1))).isTrue();
        assertThat(buffer.offer(event(2))).isTrue();
        assertThat(buffer.offer(event(3))).isFalse();

        assertThat(buffer.droppedCount()).isEqualTo(1);
        assertThat(buffer.take().stepIndex()).isEqualTo(2);
        assertThat(buffer.take().stepIndex()).isEqualTo(3);
    }

    @Test
    @DisplayName("drains remaining events after close, then returns null")
    void shouldDrainAfterClose() throws InterruptedException {
        StepEventBuffer buffer = new StepEventBuffer(4);
        buffer.offer(event(1));

        buffer.close();

        assertThat(buffer.offer(event(2))).isFalse();
        assertThat(buffer.take().stepIndex()).isEqualTo(1);
        assertThat(buffer.take()).isNull();
        assertThat(buffer.isClosed()).isTrue();
    }

    @Test
    @DisplayName("wakes a waiting consumer when an event arrives")
    void shouldWakeConsumer() throws Exception {
        StepEventBuffer buffer = new StepEventBuffer(4);
        CompletableFuture<StepEvent> consumer =
                CompletableFuture.supplyAsync(
                        () -> {
                            try {
                                return buffer.poll(5, TimeUnit.SECONDS);
                            } catch (InterruptedException e) {
                                Thread.currentThread().interrupt();
                                return null;
                            }
                        });

        buffer.offer(event(7));

        assertThat(consumer.get(5, TimeUnit.SECONDS).stepIndex()).isEqualTo(7);
    }

    @Test
    @DisplayName("poll times out on an empty open buffer")
    void shouldTimeOut() throws InterruptedException {
        StepEventBuffer buffer = new StepEventBuffer(1);

        assertThat(buffer.poll(10, TimeUnit.MILLISECONDS)).isNull();
        assertThat(buffer.size()).isZero();
    }

    private static StepEvent event(int index) {
        return new StepEvent("s", index, "node", StepStatus.SUCCEEDED, Map.of(), null, null);
    }
}
