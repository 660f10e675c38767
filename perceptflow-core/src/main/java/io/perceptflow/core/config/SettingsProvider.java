package io.perceptflow.core.config;

/// Source of read-only engine configuration.
///
/// Consulted once when an executor is built; later changes are not observed.
@FunctionalInterface
public interface SettingsProvider {

    /// Returns the engine configuration.
    ///
    /// @return configuration, never null
    EngineConfig load();

    /// Provider that always returns the given configuration.
    static SettingsProvider of(EngineConfig config) {
        return () -> config;
    }
}
