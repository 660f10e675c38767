package io.perceptflow.core.execution.pipeline;

import io.perceptflow.core.execution.result.ExecutionResult;
import java.util.List;
import java.util.Optional;

/// Runs {@link StepProcessor}s in order, short-circuiting on the first terminal result.
///
/// ```
/// +----------------------------+
/// | preExecution()             |   cancellation, node start
/// +----------------------------+
/// |        node call           |
/// +----------------------------+
/// | postExecution()            |   record, checkpoint, publish,
/// |                            |   completion, routing, budget
/// +----------------------------+
/// ```
///
/// ### Contracts
/// - **Invariant**: processors run in list order; none is skipped unless an earlier one
///   short-circuits
///
/// @implNote Stateless and thread-safe. Processor list is copied at construction time.
public final class StepPipeline {

    private final List<StepProcessor> processors;

    public StepPipeline(List<StepProcessor> processors) {
        this.processors = List.copyOf(processors);
    }

    /// Builds the pipeline that runs before each node call.
    ///
    /// 1. Cancellation: ends the session if the cancellation signal is set
    /// 2. Node start: notifies the listener
    ///
    /// @return pre-execution pipeline, never null
    public static StepPipeline preExecution() {
        return new StepPipeline(
                List.of(new CancellationPreProcessor(), new NodeStartPreProcessor()));
    }

    /// Builds the pipeline that runs after each node call.
    ///
    /// Order matters; it is the per-step algorithm of the engine:
    /// 1. Record: merge or record the failure, append the step
    /// 2. Checkpoint: persist the state; waits for durability
    /// 3. Step complete: notify listeners, feeding the stream
    /// 4. Completion: stop if the node set the completion flag
    /// 5. Routing: next node from the edge router, or from the retry policy after a failure
    /// 6. Step budget: stop once the budget is used up
    ///
    /// @return post-execution pipeline, never null
    public static StepPipeline postExecution() {
        return new StepPipeline(
                List.of(
                        new RecordStepPostProcessor(),
                        new CheckpointPostProcessor(),
                        new StepCompletePostProcessor(),
                        new CompletionPostProcessor(),
                        new RoutingPostProcessor(),
                        new StepBudgetPostProcessor()));
    }

    /// Builds the pipeline that re-derives the decision taken after the last checkpointed
    /// step of a resumed session.
    ///
    /// @return resume pipeline, never null
    public static StepPipeline resumeDecision() {
        return new StepPipeline(
                List.of(
                        new CompletionPostProcessor(),
                        new RoutingPostProcessor(),
                        new StepBudgetPostProcessor()));
    }

    /// Executes all processors in order.
    ///
    /// @param context the current step context, not null
    /// @return terminal result if any processor short-circuits, empty if all pass
    public Optional<ExecutionResult> execute(ProcessorContext context) {
        for (StepProcessor processor : processors) {
            Optional<ExecutionResult> result = processor.process(context);
            if (result.isPresent()) {
                return result;
            }
        }
        return Optional.empty();
    }
}
