package io.perceptflow.core.state;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// One completed node invocation within a session.
///
/// Steps are created by the executor right after a node returns and are never mutated.
/// A succeeded step carries the partial update that was merged; a failed step carries the
/// error kind and detail instead.
///
/// ### Contracts
/// - **Precondition**: `index` is positive, `node`, `startedAt`, `finishedAt` and `status`
///   are not null
/// - **Invariant**: `errorKind` is null iff `status` is `SUCCEEDED`
///
/// @param index one-based position of the step within its session
/// @param node name of the node that ran, not null
/// @param startedAt invocation start, not null
/// @param finishedAt invocation end, not null
/// @param status step status, not null
/// @param update partial update produced by the node, empty for failures
/// @param errorKind failure classification, null on success
/// @param errorDetail failure diagnostic, null on success
public record ExecutionStep(
        int index,
        String node,
        Instant startedAt,
        Instant finishedAt,
        StepStatus status,
        Map<String, Object> update,
        ErrorKind errorKind,
        String errorDetail)
        implements Serializable {

    public ExecutionStep {
        if (index < 1) {
            throw new IllegalArgumentException("index must be positive, got " + index);
        }
        Objects.requireNonNull(node, "node must not be null");
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(finishedAt, "finishedAt must not be null");
        Objects.requireNonNull(status, "status must not be null");
        if (status.isFailure()) {
            Objects.requireNonNull(errorKind, "errorKind must not be null for a failed step");
        }
        // LinkedHashMap copy: update values may legitimately be null (field removal)
        update =
                update != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(update))
                        : Map.of();
    }

    public static ExecutionStep succeeded(
            int index,
            String node,
            Instant startedAt,
            Instant finishedAt,
            Map<String, Object> update) {
        return new ExecutionStep(
                index, node, startedAt, finishedAt, StepStatus.SUCCEEDED, update, null, null);
    }

    public static ExecutionStep failed(
            int index,
            String node,
            Instant startedAt,
            Instant finishedAt,
            StepStatus status,
            ErrorKind errorKind,
            String errorDetail) {
        if (!status.isFailure()) {
            throw new IllegalArgumentException("status must be a failure status: " + status);
        }
        return new ExecutionStep(
                index, node, startedAt, finishedAt, status, Map.of(), errorKind, errorDetail);
    }

    /// Returns whether the node succeeded.
    public boolean succeeded() {
        return status == StepStatus.SUCCEEDED;
    }
}
