package io.perceptflow.core.execution;

import io.perceptflow.core.graph.node.Node;
import io.perceptflow.core.graph.node.NodeResult;
import io.perceptflow.core.state.ErrorKind;
import io.perceptflow.core.state.StateView;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Runs node functions of one session with a per-call timeout.
///
/// Calls go through a single worker thread owned by the session. A call that timed out
/// keeps the worker busy until it returns, so the next call of the same session queues
/// behind it and a session never has two collaborator calls in flight.
///
/// ### Contracts
/// - **Postcondition**: {@link #invoke} never throws; throws and timeouts become failure
///   results
///
/// @implNote **Not thread-safe**. One instance per running session.
final class NodeInvoker implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(NodeInvoker.class.getName());

    private final ExecutorService worker;

    NodeInvoker(String sessionId) {
        this(
                Executors.newSingleThreadExecutor(
                        runnable -> {
                            Thread thread = new Thread(runnable, "perceptflow-node-" + sessionId);
                            thread.setDaemon(true);
                            return thread;
                        }));
    }

    NodeInvoker(ExecutorService worker) {
        this.worker = worker;
    }

    /// Invokes a node and waits at most `timeout` for its result.
    ///
    /// @param name node name, not null
    /// @param node node function, not null
    /// @param view read-only state passed to the node, not null
    /// @param timeout call timeout, positive
    /// @return the invocation with its result and timing, never null
    NodeInvocation invoke(String name, Node node, StateView view, Duration timeout) {
        Instant startedAt = Instant.now();
        NodeResult result;
        Future<NodeResult> future = worker.submit(() -> node.execute(view));
        try {
            result = future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            if (result == null) {
                result = NodeResult.failure("Node '" + name + "' returned no result");
            }
        } catch (TimeoutException e) {
            future.cancel(true);
            result =
                    NodeResult.failure(
                            ErrorKind.NODE_TIMEOUT,
                            "Node '" + name + "' timed out after " + timeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.log(Level.FINE, "Node '" + name + "' threw", cause);
            result = NodeResult.failure(cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            result = NodeResult.failure("Interrupted while waiting for node '" + name + "'");
        }
        return new NodeInvocation(name, result, startedAt, Instant.now());
    }

    @Override
    public void close() {
        worker.shutdownNow();
    }
}
