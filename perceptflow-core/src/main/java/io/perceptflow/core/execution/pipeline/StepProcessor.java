package io.perceptflow.core.execution.pipeline;

import io.perceptflow.core.execution.result.ExecutionResult;
import java.util.Optional;

/// Single-responsibility processor for one aspect of a step.
///
/// ### Return Convention
/// - {@code Optional.empty()}: continue with the next processor
/// - {@code Optional.of(result)}: stop the pipeline and end the session
///
/// Redirects are done by setting the current node on the state and returning empty.
///
/// @implNote Implementations are stateless and reused across steps and sessions.
///
/// @see StepPipeline for composition
@FunctionalInterface
public interface StepProcessor {

    /// Processes one aspect of the step.
    ///
    /// @param context the current step context, not null
    /// @return empty to continue, or a terminal result
    Optional<ExecutionResult> process(ProcessorContext context);
}
