package io.perceptflow.core.graph.node;

import io.perceptflow.core.state.ErrorKind;
import io.perceptflow.core.state.Outcome;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Immutable result of a node invocation.
///
/// ### Factory Methods
/// - {@link #update(Map)} for a partial state update
/// - {@link #complete(Map, boolean, String)} to finish the session with a verdict
/// - {@link #failure(String)} and {@link #failure(Throwable)} for error signals
/// - {@link #empty()} for nodes with nothing to record
///
/// @implNote Update maps are copied into unmodifiable views. Null values are kept, they
/// remove the field when merged.
///
/// @see io.perceptflow.core.state.SessionState#merge(Map) for merge rules
public final class NodeResult {

    private final ResultStatus status;
    private final Map<String, Object> update;
    private final Outcome outcome;
    private final ErrorKind errorKind;
    private final String errorDetail;

    private NodeResult(Builder builder) {
        this.status = builder.status;
        this.update = Collections.unmodifiableMap(new LinkedHashMap<>(builder.update));
        this.outcome = builder.outcome;
        this.errorKind = builder.errorKind;
        this.errorDetail = builder.errorDetail;
    }

    public ResultStatus getStatus() {
        return status;
    }

    /// Returns the partial update to merge, empty for failures.
    public Map<String, Object> getUpdate() {
        return update;
    }

    /// Returns the completion verdict, non-null only when status is `END`.
    public Outcome getOutcome() {
        return outcome;
    }

    /// Returns the failure classification, non-null only when status is `FAILURE`.
    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getErrorDetail() {
        return errorDetail;
    }

    public boolean isFailure() {
        return status == ResultStatus.FAILURE;
    }

    public boolean isEnd() {
        return status == ResultStatus.END;
    }

    /// Creates a success result carrying a partial update.
    ///
    /// @param update fields to merge, not null
    /// @return new success result, never null
    public static NodeResult update(Map<String, Object> update) {
        return builder().update(update).build();
    }

    /// Creates a success result with no fields to merge.
    ///
    /// @return new empty result, never null
    public static NodeResult empty() {
        return builder().build();
    }

    /// Creates a result that merges `update` and sets the completion flag.
    ///
    /// @param update fields to merge, not null
    /// @param success the session verdict
    /// @param detail diagnostic detail, may be null
    /// @return new end result, never null
    public static NodeResult complete(Map<String, Object> update, boolean success, String detail) {
        Outcome verdict =
                success
                        ? Outcome.success(detail)
                        : Outcome.failure(ErrorKind.NODE_REPORTED_FAILURE, detail);
        return builder().status(ResultStatus.END).update(update).outcome(verdict).build();
    }

    /// Creates a failure signal with a diagnostic message.
    ///
    /// @param detail the error description, not null
    /// @return new failure result, never null
    public static NodeResult failure(String detail) {
        return failure(ErrorKind.NODE_EXECUTION_ERROR, detail);
    }

    /// Creates a failure signal from an exception.
    ///
    /// @param error the cause, not null
    /// @return new failure result, never null
    public static NodeResult failure(Throwable error) {
        Objects.requireNonNull(error, "error must not be null");
        String detail =
                error.getMessage() != null
                        ? error.getClass().getSimpleName() + ": " + error.getMessage()
                        : error.getClass().getSimpleName();
        return failure(ErrorKind.NODE_EXECUTION_ERROR, detail);
    }

    /// Creates a failure signal of a specific kind.
    ///
    /// @param errorKind the failure classification, not null
    /// @param detail the error description, may be null
    /// @return new failure result, never null
    public static NodeResult failure(ErrorKind errorKind, String detail) {
        return builder()
                .status(ResultStatus.FAILURE)
                .errorKind(errorKind)
                .errorDetail(detail)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for constructing NodeResult instances.
    public static final class Builder {
        private ResultStatus status = ResultStatus.SUCCESS;
        private Map<String, Object> update = Map.of();
        private Outcome outcome;
        private ErrorKind errorKind;
        private String errorDetail;

        private Builder() {}

        public Builder status(ResultStatus status) {
            this.status = status;
            return this;
        }

        public Builder update(Map<String, Object> update) {
            this.update = Objects.requireNonNull(update, "update must not be null");
            return this;
        }

        public Builder outcome(Outcome outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder errorKind(ErrorKind errorKind) {
            this.errorKind = errorKind;
            return this;
        }

        public Builder errorDetail(String errorDetail) {
            this.errorDetail = errorDetail;
            return this;
        }

        /// Builds the immutable NodeResult.
        ///
        /// @return new NodeResult instance, never null
        /// @throws IllegalStateException if status and verdict fields disagree
        public NodeResult build() {
            Objects.requireNonNull(status, "status must not be null");
            if (status == ResultStatus.END && outcome == null) {
                throw new IllegalStateException("END result requires an outcome");
            }
            if (status == ResultStatus.FAILURE) {
                if (errorKind == null) {
                    errorKind = ErrorKind.NODE_EXECUTION_ERROR;
                }
                update = Map.of();
            }
            return new NodeResult(this);
        }
    }
}
