package io.perceptflow.core.execution;

import io.perceptflow.core.execution.result.ExecutionResult;
import io.perceptflow.core.state.ExecutionStep;
import io.perceptflow.core.state.StateView;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Observer of session execution. All methods are no-ops by default.
///
/// Listeners run on the session's thread and only observe; the state they receive is a
/// read-only snapshot. An exception thrown by a listener is logged and does not affect
/// the session.
///
/// @see io.perceptflow.core.execution.stream.StepStream for the streaming listener
public interface ExecutionListener {

    /// No-op listener.
    ExecutionListener NOOP = new ExecutionListener() {};

    /// Called once before the first step of a run or resume.
    default void onSessionStart(StateView state) {}

    /// Called before a node is invoked.
    default void onNodeStart(StateView state, String node) {}

    /// Called once per step, after its checkpoint was written.
    default void onStepComplete(StateView state, ExecutionStep step) {}

    /// Called after a checkpoint write returned.
    default void onCheckpoint(String sessionId, int stepIndex) {}

    /// Called once with the terminal result.
    default void onSessionEnd(ExecutionResult result) {}

    /// Combines listeners; each callback is delivered to every listener in order.
    ///
    /// @param listeners listeners to notify, not null
    /// @return composite listener, never null
    static ExecutionListener compose(ExecutionListener... listeners) {
        List<ExecutionListener> all = List.of(listeners);
        return new Composite(all);
    }

    /// Fans out callbacks and isolates listener failures.
    final class Composite implements ExecutionListener {

        private static final Logger logger = Logger.getLogger(Composite.class.getName());

        private final List<ExecutionListener> listeners;

        Composite(List<ExecutionListener> listeners) {
            this.listeners = listeners;
        }

        @Override
        public void onSessionStart(StateView state) {
            for (ExecutionListener listener : listeners) {
                safely(() -> listener.onSessionStart(state));
            }
        }

        @Override
        public void onNodeStart(StateView state, String node) {
            for (ExecutionListener listener : listeners) {
                safely(() -> listener.onNodeStart(state, node));
            }
        }

        @Override
        public void onStepComplete(StateView state, ExecutionStep step) {
            for (ExecutionListener listener : listeners) {
                safely(() -> listener.onStepComplete(state, step));
            }
        }

        @Override
        public void onCheckpoint(String sessionId, int stepIndex) {
            for (ExecutionListener listener : listeners) {
                safely(() -> listener.onCheckpoint(sessionId, stepIndex));
            }
        }

        @Override
        public void onSessionEnd(ExecutionResult result) {
            for (ExecutionListener listener : listeners) {
                safely(() -> listener.onSessionEnd(result));
            }
        }

        private static void safely(Runnable callback) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Execution listener failed", e);
            }
        }
    }
}
