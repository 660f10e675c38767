package io.perceptflow.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonInclude;

/// Jackson mixin for `Outcome`: successful outcomes are written without `errorKind`.
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class OutcomeMixin {}
