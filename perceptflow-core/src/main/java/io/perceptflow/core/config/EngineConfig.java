package io.perceptflow.core.config;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/// Read-only engine settings injected into the executor at construction time.
///
/// ### Default Values
/// - `stepBudget`: `50`
/// - `defaultMaxRetries`: `3`
/// - `defaultNodeTimeout`: `30s`
/// - `durableCheckpoints`: `true`
/// - `streamBufferCapacity`: `256`
///
/// @implNote **Thread-safe**. Immutable after {@link Builder#build()}.
///
/// @see SettingsProvider for sourcing configuration
/// @see PropertiesSettingsProvider for the `perceptflow.*` property keys
public final class EngineConfig {

    public static final int DEFAULT_STEP_BUDGET = 50;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_NODE_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_STREAM_BUFFER_CAPACITY = 256;

    private final int stepBudget;
    private final int defaultMaxRetries;
    private final Duration defaultNodeTimeout;
    private final Map<String, Integer> nodeMaxRetries;
    private final Map<String, Duration> nodeTimeouts;
    private final boolean durableCheckpoints;
    private final int streamBufferCapacity;

    private EngineConfig(Builder builder) {
        this.stepBudget = builder.stepBudget;
        this.defaultMaxRetries = builder.defaultMaxRetries;
        this.defaultNodeTimeout = builder.defaultNodeTimeout;
        this.nodeMaxRetries = Collections.unmodifiableMap(new HashMap<>(builder.nodeMaxRetries));
        this.nodeTimeouts = Collections.unmodifiableMap(new HashMap<>(builder.nodeTimeouts));
        this.durableCheckpoints = builder.durableCheckpoints;
        this.streamBufferCapacity = builder.streamBufferCapacity;
    }

    /// Returns a configuration with all defaults.
    public static EngineConfig defaults() {
        return builder().build();
    }

    /// Maximum number of steps a session may record before it is stopped.
    public int getStepBudget() {
        return stepBudget;
    }

    public int getDefaultMaxRetries() {
        return defaultMaxRetries;
    }

    public Duration getDefaultNodeTimeout() {
        return defaultNodeTimeout;
    }

    /// Returns the configured retry override for a node, if any.
    ///
    /// @param node node name, not null
    /// @return the override, or empty to fall back to the graph or engine default
    public OptionalInt maxRetriesOverride(String node) {
        Integer value = nodeMaxRetries.get(node);
        return value != null ? OptionalInt.of(value) : OptionalInt.empty();
    }

    /// Returns the invocation timeout of a node.
    ///
    /// @param node node name, not null
    /// @return the per-node timeout, or the default timeout, never null
    public Duration nodeTimeout(String node) {
        return nodeTimeouts.getOrDefault(node, defaultNodeTimeout);
    }

    public Map<String, Integer> getNodeMaxRetries() {
        return nodeMaxRetries;
    }

    public Map<String, Duration> getNodeTimeouts() {
        return nodeTimeouts;
    }

    /// Whether a failed checkpoint write ends the session.
    public boolean isDurableCheckpoints() {
        return durableCheckpoints;
    }

    public int getStreamBufferCapacity() {
        return streamBufferCapacity;
    }

    /// Returns a builder seeded with this configuration's values.
    public Builder toBuilder() {
        Builder builder =
                builder()
                        .stepBudget(stepBudget)
                        .defaultMaxRetries(defaultMaxRetries)
                        .defaultNodeTimeout(defaultNodeTimeout)
                        .durableCheckpoints(durableCheckpoints)
                        .streamBufferCapacity(streamBufferCapacity);
        nodeMaxRetries.forEach(builder::maxRetries);
        nodeTimeouts.forEach(builder::nodeTimeout);
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "EngineConfig{stepBudget="
                + stepBudget
                + ", defaultMaxRetries="
                + defaultMaxRetries
                + ", defaultNodeTimeout="
                + defaultNodeTimeout
                + ", nodeMaxRetries="
                + nodeMaxRetries
                + ", nodeTimeouts="
                + nodeTimeouts
                + ", durableCheckpoints="
                + durableCheckpoints
                + ", streamBufferCapacity="
                + streamBufferCapacity
                + '}';
    }

    /// Builder for {@link EngineConfig}.
    public static final class Builder {
        private final Map<String, Integer> nodeMaxRetries = new HashMap<>();
        private final Map<String, Duration> nodeTimeouts = new HashMap<>();
        private int stepBudget = DEFAULT_STEP_BUDGET;
        private int defaultMaxRetries = DEFAULT_MAX_RETRIES;
        private Duration defaultNodeTimeout = DEFAULT_NODE_TIMEOUT;
        private boolean durableCheckpoints = true;
        private int streamBufferCapacity = DEFAULT_STREAM_BUFFER_CAPACITY;

        private Builder() {}

        /// Sets the step budget.
        ///
        /// @param stepBudget maximum steps per session, must be positive
        /// @return this builder for chaining
        public Builder stepBudget(int stepBudget) {
            if (stepBudget < 1) {
                throw new IllegalArgumentException("stepBudget must be positive: " + stepBudget);
            }
            this.stepBudget = stepBudget;
            return this;
        }

        public Builder defaultMaxRetries(int defaultMaxRetries) {
            this.defaultMaxRetries = requireNotNegative(defaultMaxRetries, "defaultMaxRetries");
            return this;
        }

        public Builder defaultNodeTimeout(Duration defaultNodeTimeout) {
            this.defaultNodeTimeout = requirePositive(defaultNodeTimeout, "defaultNodeTimeout");
            return this;
        }

        /// Overrides the retry allowance of one node.
        public Builder maxRetries(String node, int maxRetries) {
            Objects.requireNonNull(node, "node must not be null");
            nodeMaxRetries.put(node, requireNotNegative(maxRetries, "maxRetries"));
            return this;
        }

        /// Overrides the invocation timeout of one node.
        public Builder nodeTimeout(String node, Duration timeout) {
            Objects.requireNonNull(node, "node must not be null");
            nodeTimeouts.put(node, requirePositive(timeout, "timeout"));
            return this;
        }

        public Builder durableCheckpoints(boolean durableCheckpoints) {
            this.durableCheckpoints = durableCheckpoints;
            return this;
        }

        public Builder streamBufferCapacity(int streamBufferCapacity) {
            if (streamBufferCapacity < 1) {
                throw new IllegalArgumentException(
                        "streamBufferCapacity must be positive: " + streamBufferCapacity);
            }
            this.streamBufferCapacity = streamBufferCapacity;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }

        private static int requireNotNegative(int value, String name) {
            if (value < 0) {
                throw new IllegalArgumentException(name + " must not be negative: " + value);
            }
            return value;
        }

        private static Duration requirePositive(Duration value, String name) {
            Objects.requireNonNull(value, name + " must not be null");
            if (value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive: " + value);
            }
            return value;
        }
    }
}
