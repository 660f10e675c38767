package io.perceptflow.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/// Jackson mixin for `SessionSnapshot`.
///
/// Fixes the property order so checkpoint files read top-down like the session itself
/// (identity, position, history, payload, verdict) and omits the outcome while the session
/// is running. Unknown properties are ignored so older engines can read newer files.
///
/// @see io.perceptflow.serialization.PerceptflowJacksonModule
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({
    "session",
    "currentNode",
    "completed",
    "outcome",
    "retryCounters",
    "result",
    "steps"
})
public abstract class SessionSnapshotMixin {}
