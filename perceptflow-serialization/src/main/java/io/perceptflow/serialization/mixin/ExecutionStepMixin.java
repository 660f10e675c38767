package io.perceptflow.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/// Jackson mixin for `ExecutionStep`.
///
/// Error fields are omitted on succeeded steps. Null values inside the `update` map are
/// kept: they record a field removal and must survive the round trip.
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({
    "index",
    "node",
    "status",
    "startedAt",
    "finishedAt",
    "errorKind",
    "errorDetail",
    "update"
})
public abstract class ExecutionStepMixin {}
