package io.perceptflow.core.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.perceptflow.core.graph.node.NodeResult;
import io.perceptflow.core.state.ErrorKind;
import io.perceptflow.core.state.Session;
import io.perceptflow.core.state.SessionState;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("NodeInvoker")
class NodeInvokerTest {

    private final SessionState state =
            SessionState.start(Session.create("s-1", "open Safari"), "analyzer");

    @Test
    @DisplayName("returns the node's result")
    void shouldReturnResult() {
        try (NodeInvoker invoker = new NodeInvoker("s-1")) {
            NodeInvocation invocation =
                    invoker.invoke(
                            "analyzer",
                            view -> NodeResult.update(Map.of("task_type", "open_app")),
                            state,
                            Duration.ofSeconds(5));

            assertThat(invocation.node()).isEqualTo("analyzer");
            assertThat(invocation.result().isFailure()).isFalse();
            assertThat(invocation.result().getUpdate()).containsEntry("task_type", "open_app");
        }
    }

    @Test
    @DisplayName("reports a node that overruns its timeout as NODE_TIMEOUT")
    void shouldTimeOut() {
        CountDownLatch release = new CountDownLatch(1);
        try (NodeInvoker invoker = new NodeInvoker("s-1")) {
            NodeInvocation invocation =
                    invoker.invoke(
                            "analyzer",
                            view -> {
                                release.await();
                                return NodeResult.empty();
                            },
                            state,
                            Duration.ofMillis(50));

            assertThat(invocation.result().getErrorKind()).isEqualTo(ErrorKind.NODE_TIMEOUT);
        } finally {
            release.countDown();
        }
    }

    @Test
    @DisplayName("waits the full timeout when it is shorter than a millisecond")
    @SuppressWarnings("unchecked")
    void shouldKeepSubMillisecondTimeout() throws Exception {
        ExecutorService worker = mock(ExecutorService.class);
        Future<NodeResult> future = mock(Future.class);
        doReturn(future).when(worker).submit(any(Callable.class));
        when(future.get(500_000L, TimeUnit.NANOSECONDS)).thenReturn(NodeResult.empty());

        try (NodeInvoker invoker = new NodeInvoker(worker)) {
            NodeInvocation invocation =
                    invoker.invoke(
                            "analyzer",
                            view -> NodeResult.empty(),
                            state,
                            Duration.ofNanos(500_000));

            assertThat(invocation.result().isFailure()).isFalse();
        }
        verify(future).get(500_000L, TimeUnit.NANOSECONDS);
    }
}
