package io.perceptflow.core.execution;

import io.perceptflow.core.config.EngineConfig;
import io.perceptflow.core.execution.result.ExecutionResult;
import io.perceptflow.core.graph.Graph;
import io.perceptflow.core.graph.retry.ErrorPolicy;
import io.perceptflow.core.state.ErrorKind;
import io.perceptflow.core.state.Outcome;
import io.perceptflow.core.state.SessionState;
import io.perceptflow.core.storage.checkpoint.CheckpointStore;
import java.util.Objects;
import java.util.logging.Logger;

/// Session-scoped services and state shared by the step processors.
///
/// Created once per run or resume. The per-step data travels separately in
/// {@link io.perceptflow.core.execution.pipeline.ProcessorContext}.
///
/// @implNote **Not thread-safe**. Confined to the thread running the session.
public final class ExecutionContext {

    private static final Logger logger = Logger.getLogger(ExecutionContext.class.getName());

    private final SessionState state;
    private final Graph graph;
    private final EngineConfig config;
    private final CheckpointStore checkpointStore;
    private final ErrorPolicy errorPolicy;
    private final ExecutionListener listener;
    private final CancellationToken cancellationToken;

    private ExecutionContext(Builder builder) {
        this.state = Objects.requireNonNull(builder.state, "state must not be null");
        this.graph = Objects.requireNonNull(builder.graph, "graph must not be null");
        this.config = Objects.requireNonNull(builder.config, "config must not be null");
        this.checkpointStore =
                Objects.requireNonNull(builder.checkpointStore, "checkpointStore must not be null");
        this.errorPolicy =
                builder.errorPolicy != null ? builder.errorPolicy : new ErrorPolicy(graph, config);
        this.listener = builder.listener != null ? builder.listener : ExecutionListener.NOOP;
        this.cancellationToken =
                builder.cancellationToken != null
                        ? builder.cancellationToken
                        : new CancellationToken();
    }

    public SessionState getState() {
        return state;
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

    public ErrorPolicy getErrorPolicy() {
        return errorPolicy;
    }

    public ExecutionListener getListener() {
        return listener;
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    /// Marks the session terminal with a failure outcome.
    ///
    /// @apiNote **Side effects**: sets the completion flag and outcome of the session state
    ///
    /// @param errorKind terminal failure classification, not null
    /// @param detail diagnostic detail, may be null
    /// @return the matching terminal result, never null
    public ExecutionResult terminate(ErrorKind errorKind, String detail) {
        logger.warning(
                "Session "
                        + state.sessionId()
                        + " terminated at step "
                        + state.stepCount()
                        + " with "
                        + errorKind
                        + ": "
                        + detail);
        state.complete(Outcome.failure(errorKind, detail));
        return ExecutionResult.of(state.snapshot());
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link ExecutionContext}.
    public static final class Builder {
        private SessionState state;
        private Graph graph;
        private EngineConfig config;
        private CheckpointStore checkpointStore;
        private ErrorPolicy errorPolicy;
        private ExecutionListener listener;
        private CancellationToken cancellationToken;

        private Builder() {}

        public Builder state(SessionState state) {
            this.state = state;
            return this;
        }

        public Builder graph(Graph graph) {
            this.graph = graph;
            return this;
        }

        public Builder config(EngineConfig config) {
            this.config = config;
            return this;
        }

        public Builder checkpointStore(CheckpointStore checkpointStore) {
            this.checkpointStore = checkpointStore;
            return this;
        }

        public Builder errorPolicy(ErrorPolicy errorPolicy) {
            this.errorPolicy = errorPolicy;
            return this;
        }

        public Builder listener(ExecutionListener listener) {
            this.listener = listener;
            return this;
        }

        public Builder cancellationToken(CancellationToken cancellationToken) {
            this.cancellationToken = cancellationToken;
            return this;
        }

        public ExecutionContext build() {
            return new ExecutionContext(this);
        }
    }
}
