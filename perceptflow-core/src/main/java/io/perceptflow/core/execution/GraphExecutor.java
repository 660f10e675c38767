package io.perceptflow.core.execution;

import io.perceptflow.core.config.EngineConfig;
import io.perceptflow.core.config.SettingsProvider;
import io.perceptflow.core.execution.pipeline.ProcessorContext;
import io.perceptflow.core.execution.pipeline.StepPipeline;
import io.perceptflow.core.execution.result.ExecutionResult;
import io.perceptflow.core.execution.stream.StepStream;
import io.perceptflow.core.graph.Graph;
import io.perceptflow.core.graph.node.Node;
import io.perceptflow.core.graph.retry.ErrorPolicy;
import io.perceptflow.core.state.ErrorKind;
import io.perceptflow.core.state.ExecutionStep;
import io.perceptflow.core.state.Session;
import io.perceptflow.core.state.SessionState;
import io.perceptflow.core.storage.checkpoint.Checkpoint;
import io.perceptflow.core.storage.checkpoint.CheckpointStore;
import io.perceptflow.core.storage.checkpoint.SessionNotFoundException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/// Control loop of the engine: runs a {@link Graph} for one session at a time per call.
///
/// Each step looks up the current node, invokes it with its timeout, folds the result into
/// the session state, checkpoints, and routes. The per-step work is split into the
/// processors of {@link StepPipeline}.
///
/// ### Execution Modes
/// - {@link #run(String)} blocks until the session is terminal
/// - {@link #runAsync(String)} runs the same loop on the session pool
/// - {@link #runStream(String)} runs it lazily and publishes one event per step
///
/// All three record the same steps and checkpoints for the same node behavior; they differ
/// only in delivery.
///
/// ### Contracts
/// - **Invariant**: every step produces exactly one {@link ExecutionStep} and then one
///   checkpoint write, in that order
/// - **Invariant**: steps of one session never run concurrently; distinct sessions are
///   independent
/// - **Postcondition**: expected failures end in an {@link ExecutionResult} value; nothing
///   is thrown for them
///
/// @implNote **Thread-safe**. The executor holds no per-session state; any number of
/// sessions may run through one instance concurrently.
///
/// @see StepPipeline for the per-step algorithm
/// @see CheckpointStore for persistence and resume
public class GraphExecutor implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(GraphExecutor.class.getName());

    private final Graph graph;
    private final EngineConfig config;
    private final CheckpointStore checkpointStore;
    private final ErrorPolicy errorPolicy;
    private final ExecutorService sessionExecutor;
    private final boolean ownsSessionExecutor;
    private final StepPipeline preExecution = StepPipeline.preExecution();
    private final StepPipeline postExecution = StepPipeline.postExecution();
    private final StepPipeline resumeDecision = StepPipeline.resumeDecision();

    /// Creates an executor with its own session pool.
    ///
    /// @param graph compiled graph, not null
    /// @param settings configuration source, read once here, not null
    /// @param checkpointStore checkpoint persistence, not null
    public GraphExecutor(Graph graph, SettingsProvider settings, CheckpointStore checkpointStore) {
        this(graph, settings.load(), checkpointStore, null);
    }

    /// Creates an executor.
    ///
    /// @param graph compiled graph, not null
    /// @param config engine configuration, not null
    /// @param checkpointStore checkpoint persistence, not null
    /// @param sessionExecutor pool for asynchronous and streaming sessions, may be null to
    ///        let the executor create and own one
    public GraphExecutor(
            Graph graph,
            EngineConfig config,
            CheckpointStore checkpointStore,
            ExecutorService sessionExecutor) {
        this.graph = Objects.requireNonNull(graph, "graph must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.checkpointStore =
                Objects.requireNonNull(checkpointStore, "checkpointStore must not be null");
        this.errorPolicy = new ErrorPolicy(graph, config);
        this.ownsSessionExecutor = sessionExecutor == null;
        this.sessionExecutor =
                sessionExecutor != null ? sessionExecutor : newSessionPool(graph.getName());
    }

    public Graph getGraph() {
        return graph;
    }

    public EngineConfig getConfig() {
        return config;
    }

    public CheckpointStore getCheckpointStore() {
        return checkpointStore;
    }

    // --- Blocking ---

    /// Runs a new session with a generated identifier.
    ///
    /// @param command the command to execute, not null
    /// @return terminal result, never null
    public ExecutionResult run(String command) {
        return run(Session.create(command), ExecutionListener.NOOP, new CancellationToken());
    }

    /// Runs a new session with a caller-supplied identifier.
    ///
    /// @param sessionId session identifier, not null
    /// @param command the command to execute, not null
    /// @return terminal result, never null
    /// @throws IllegalStateException if checkpoints already exist for `sessionId`
    public ExecutionResult run(String sessionId, String command) {
        return run(
                Session.create(sessionId, command),
                ExecutionListener.NOOP,
                new CancellationToken());
    }

    /// Runs a new session.
    ///
    /// @param session the session to start, not null
    /// @param listener execution observer, not null
    /// @param cancellationToken cooperative cancellation signal, not null
    /// @return terminal result, never null
    /// @throws IllegalStateException if checkpoints already exist for the session
    public ExecutionResult run(
            Session session, ExecutionListener listener, CancellationToken cancellationToken) {
        Objects.requireNonNull(session, "session must not be null");
        if (checkpointStore.latest(session.sessionId()).isPresent()) {
            throw new IllegalStateException(
                    "Session " + session.sessionId() + " already exists, use resume");
        }
        logger.info(
                "Starting session "
                        + session.sessionId()
                        + " of graph '"
                        + graph.getName()
                        + "': "
                        + session.command());
        SessionState state = SessionState.start(session, graph.getEntryNode());
        return execute(state, listener, cancellationToken);
    }

    /// Continues a session from its latest checkpoint.
    ///
    /// A session whose latest checkpoint is terminal is returned as-is; no node runs.
    ///
    /// @param sessionId session identifier, not null
    /// @return terminal result, never null
    /// @throws SessionNotFoundException if the session has no checkpoint
    public ExecutionResult resume(String sessionId) {
        return resume(sessionId, ExecutionListener.NOOP, new CancellationToken());
    }

    /// Continues a session from its latest checkpoint.
    ///
    /// @param sessionId session identifier, not null
    /// @param listener execution observer, not null
    /// @param cancellationToken cooperative cancellation signal, not null
    /// @return terminal result, never null
    /// @throws SessionNotFoundException if the session has no checkpoint
    public ExecutionResult resume(
            String sessionId, ExecutionListener listener, CancellationToken cancellationToken) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        SessionState state = checkpointStore.resume(sessionId);
        logger.info("Resuming session " + sessionId + " after step " + state.stepCount());
        return execute(state, listener, cancellationToken);
    }

    /// Returns the checkpoints of a session in step order.
    ///
    /// @param sessionId session identifier, not null
    /// @return checkpoints, empty for an unknown session, never null
    public List<Checkpoint> getHistory(String sessionId) {
        return checkpointStore.getHistory(sessionId);
    }

    // --- Asynchronous ---

    /// Runs a new session on the session pool.
    ///
    /// Cancelling the returned future requests cooperative cancellation of the session.
    ///
    /// @param command the command to execute, not null
    /// @return future of the terminal result, never null
    public CompletableFuture<ExecutionResult> runAsync(String command) {
        return runAsync(Session.create(command), ExecutionListener.NOOP);
    }

    /// Runs a new session on the session pool.
    ///
    /// @param session the session to start, not null
    /// @param listener execution observer, not null
    /// @return future of the terminal result, never null
    public CompletableFuture<ExecutionResult> runAsync(
            Session session, ExecutionListener listener) {
        CancellationToken token = new CancellationToken();
        return cancellable(
                CompletableFuture.supplyAsync(() -> run(session, listener, token), sessionExecutor),
                token);
    }

    /// Continues a session from its latest checkpoint on the session pool.
    ///
    /// @param sessionId session identifier, not null
    /// @return future of the terminal result; completes exceptionally with
    ///         {@link SessionNotFoundException} for an unknown session
    public CompletableFuture<ExecutionResult> resumeAsync(String sessionId) {
        CancellationToken token = new CancellationToken();
        return cancellable(
                CompletableFuture.supplyAsync(
                        () -> resume(sessionId, ExecutionListener.NOOP, token), sessionExecutor),
                token);
    }

    // --- Streaming ---

    /// Returns a lazy event stream for a new session with a generated identifier.
    ///
    /// @param command the command to execute, not null
    /// @return stream of step events, never null
    public StepStream runStream(String command) {
        return runStream(Session.create(command), ExecutionListener.NOOP);
    }

    /// Returns a lazy event stream for a new session.
    ///
    /// @param session the session to start when the stream is first read, not null
    /// @param listener additional observer, not null
    /// @return stream of step events, never null
    public StepStream runStream(Session session, ExecutionListener listener) {
        Objects.requireNonNull(session, "session must not be null");
        return new StepStream(
                config.getStreamBufferCapacity(),
                (publisher, token) ->
                        CompletableFuture.supplyAsync(
                                () ->
                                        run(
                                                session,
                                                ExecutionListener.compose(publisher, listener),
                                                token),
                                sessionExecutor));
    }

    // --- Core loop ---

    private ExecutionResult execute(
            SessionState state, ExecutionListener listener, CancellationToken token) {
        ExecutionListener observers = ExecutionListener.compose(listener);
        ExecutionContext context =
                ExecutionContext.builder()
                        .state(state)
                        .graph(graph)
                        .config(config)
                        .checkpointStore(checkpointStore)
                        .errorPolicy(errorPolicy)
                        .listener(observers)
                        .cancellationToken(token)
                        .build();
        observers.onSessionStart(state.snapshot());

        ExecutionResult result;
        if (state.isCompleted()) {
            result = ExecutionResult.of(state.snapshot());
        } else {
            try (NodeInvoker invoker = new NodeInvoker(state.sessionId())) {
                Optional<ExecutionResult> terminal =
                        state.stepCount() > 0 ? redoLastDecision(context) : Optional.empty();
                while (terminal.isEmpty()) {
                    terminal = step(context, invoker);
                }
                result = terminal.get();
            }
        }

        logger.info(
                "Session "
                        + state.sessionId()
                        + " ended after "
                        + state.stepCount()
                        + " steps: "
                        + describe(result));
        observers.onSessionEnd(result);
        return result;
    }

    private Optional<ExecutionResult> step(ExecutionContext context, NodeInvoker invoker) {
        SessionState state = context.getState();
        String nodeName = state.currentNode();

        Optional<ExecutionResult> pre =
                preExecution.execute(new ProcessorContext(context, nodeName, null));
        if (pre.isPresent()) {
            return pre;
        }

        Optional<Node> node = graph.getRegistry().find(nodeName);
        if (node.isEmpty()) {
            return Optional.of(
                    context.terminate(
                            ErrorKind.FATAL_CONFIGURATION_ERROR,
                            "Unknown node '" + nodeName + "'"));
        }

        NodeInvocation invocation =
                invoker.invoke(
                        nodeName, node.get(), state.snapshot(), config.nodeTimeout(nodeName));
        return postExecution.execute(new ProcessorContext(context, nodeName, invocation));
    }

    // The decision following the last checkpointed step is a pure function of the recorded
    // state, so it is recomputed instead of persisted.
    private Optional<ExecutionResult> redoLastDecision(ExecutionContext context) {
        SessionState state = context.getState();
        ExecutionStep last =
                state.lastStep().orElseThrow(() -> new IllegalStateException("No steps"));
        return resumeDecision.execute(new ProcessorContext(context, last.node(), null));
    }

    private static String describe(ExecutionResult result) {
        var outcome = result.outcome();
        if (outcome.success()) {
            return "success";
        }
        String detail = outcome.detail() != null ? " (" + outcome.detail() + ")" : "";
        return outcome.errorKind() + detail;
    }

    private static CompletableFuture<ExecutionResult> cancellable(
            CompletableFuture<ExecutionResult> future, CancellationToken token) {
        future.whenComplete(
                (result, error) -> {
                    if (error instanceof CancellationException) {
                        token.cancel();
                    }
                });
        return future;
    }

    private static ExecutorService newSessionPool(String graphName) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(
                runnable -> {
                    Thread thread =
                            new Thread(
                                    runnable,
                                    "perceptflow-" + graphName + "-" + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                });
    }

    /// Shuts down the session pool if this executor created it.
    @Override
    public void close() {
        if (ownsSessionExecutor) {
            sessionExecutor.shutdownNow();
        }
    }
}
