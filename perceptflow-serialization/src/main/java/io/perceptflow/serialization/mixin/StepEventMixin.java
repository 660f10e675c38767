package io.perceptflow.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/// Jackson mixin for `StepEvent`, used when streaming events as JSON lines.
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
    "sessionId",
    "stepIndex",
    "node",
    "status",
    "errorKind",
    "errorDetail",
    "resultDelta"
})
public abstract class StepEventMixin {}
