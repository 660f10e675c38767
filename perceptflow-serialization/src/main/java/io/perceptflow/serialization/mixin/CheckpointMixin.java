package io.perceptflow.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/// Jackson mixin for `Checkpoint`, keeping the key fields ahead of the snapshot body.
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"sessionId", "stepIndex", "createdAt", "snapshot"})
public abstract class CheckpointMixin {}
