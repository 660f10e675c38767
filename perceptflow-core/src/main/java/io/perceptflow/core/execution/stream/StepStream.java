package io.perceptflow.core.execution.stream;

import io.perceptflow.core.execution.CancellationToken;
import io.perceptflow.core.execution.ExecutionListener;
import io.perceptflow.core.execution.result.ExecutionResult;
import io.perceptflow.core.state.ExecutionStep;
import io.perceptflow.core.state.StateView;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/// Lazy, finite, cancellable sequence of {@link StepEvent}s for one session.
///
/// The session starts on the first call to {@link #hasNext()}, {@link #next()} or
/// {@link #result()}. Events are delivered in step order through a bounded
/// {@link StepEventBuffer}; a consumer that falls behind loses the oldest events but never
/// stalls the session. The sequence ends when the session reaches a terminal state or the
/// consumer cancels.
///
/// ### Usage
/// {@snippet :
/// try (StepStream stream = executor.runStream("open Safari")) {
///     stream.forEachRemaining(event -> System.out.println(event.node()));
///     ExecutionResult result = stream.result().join();
/// }
/// }
///
/// @implNote Iteration is **not thread-safe**; consume from one thread.
public final class StepStream implements Iterator<StepEvent>, AutoCloseable {

    private final StepEventBuffer buffer;
    private final CancellationToken cancellationToken;
    private final Launcher launcher;
    private final ExecutionListener publisher;
    private CompletableFuture<ExecutionResult> result;
    private StepEvent pending;
    private volatile boolean closed;

    /// Creates a stream that starts its session through `launcher` on first use.
    ///
    /// @param capacity buffer capacity, positive
    /// @param launcher starts the session with the publishing listener and the stream's
    ///        cancellation token, not null
    public StepStream(int capacity, Launcher launcher) {
        this.buffer = new StepEventBuffer(capacity);
        this.cancellationToken = new CancellationToken();
        this.launcher = Objects.requireNonNull(launcher, "launcher must not be null");
        this.publisher =
                new ExecutionListener() {
                    @Override
                    public void onStepComplete(StateView state, ExecutionStep step) {
                        buffer.offer(StepEvent.of(state.sessionId(), step));
                    }
                };
    }

    /// Returns the terminal result of the session, starting it if needed.
    ///
    /// @return future completed with the terminal result, never null
    public synchronized CompletableFuture<ExecutionResult> result() {
        if (result == null) {
            result = launcher.launch(publisher, cancellationToken);
            result.whenComplete((r, e) -> buffer.close());
        }
        return result;
    }

    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (closed) {
            return false;
        }
        result();
        try {
            pending = buffer.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return false;
        }
        return pending != null;
    }

    @Override
    public StepEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Step stream is exhausted");
        }
        StepEvent event = pending;
        pending = null;
        return event;
    }

    /// Requests cooperative cancellation; the session stops before its next step.
    public void cancel() {
        cancellationToken.cancel();
    }

    /// Returns how many events were dropped because this consumer fell behind.
    public long droppedCount() {
        return buffer.droppedCount();
    }

    /// Adapts the remaining events to a sequential {@link Stream}.
    ///
    /// Closing the returned stream closes this step stream.
    public Stream<StepEvent> stream() {
        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(
                                this, Spliterator.ORDERED | Spliterator.NONNULL),
                        false)
                .onClose(this::close);
    }

    /// Cancels the session if it is still running and stops delivering events.
    @Override
    public void close() {
        closed = true;
        pending = null;
        cancel();
        buffer.close();
    }

    /// Starts the session behind a stream.
    @FunctionalInterface
    public interface Launcher {

        /// @param listener listener that publishes step events, not null
        /// @param cancellationToken the stream's cancellation signal, not null
        /// @return future completed with the terminal result, never null
        CompletableFuture<ExecutionResult> launch(
                ExecutionListener listener, CancellationToken cancellationToken);
    }
}
