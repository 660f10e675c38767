package io.perceptflow.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.perceptflow.core.execution.result.ExecutionResult;
import io.perceptflow.core.storage.checkpoint.Checkpoint;

/// Utility class for converting checkpoints and execution results to and from JSON.
///
/// ### Usage
/// {@snippet :
/// String json = CheckpointSerializer.toJson(checkpoint);
/// Checkpoint restored = CheckpointSerializer.fromJson(json);
///
/// ObjectMapper mapper = CheckpointSerializer.createMapper();
/// }
///
/// Result payload values come back as plain JSON types: maps, lists, strings, booleans,
/// and `Integer`, `Long` or `Double` numbers.
///
/// @implNote Thread-safe. A mapper is created per call to the static helpers; cache
/// {@link #createMapper()} for repeated use.
///
/// @see PerceptflowJacksonModule for the registered type handlers
public final class CheckpointSerializer {

    private CheckpointSerializer() {}

    /// Serializes a checkpoint to pretty-printed JSON.
    ///
    /// @param checkpoint the checkpoint, not null
    /// @return JSON text, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(Checkpoint checkpoint) {
        try {
            return createMapper().writeValueAsString(checkpoint);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize checkpoint: " + e.getMessage(), e);
        }
    }

    /// Deserializes a checkpoint.
    ///
    /// @param json JSON text, not null
    /// @return the checkpoint, never null
    /// @throws IllegalArgumentException if the text is not a valid checkpoint
    public static Checkpoint fromJson(String json) {
        try {
            return createMapper().readValue(json, Checkpoint.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize checkpoint: " + e.getMessage(), e);
        }
    }

    /// Serializes a terminal result to pretty-printed JSON.
    ///
    /// @param result the result, not null
    /// @return JSON text, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(ExecutionResult result) {
        try {
            return createMapper().writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize execution result: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for perceptflow types.
    ///
    /// Registers:
    /// - `PerceptflowJacksonModule` for state records and results
    /// - `JavaTimeModule` for `Instant` fields
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new PerceptflowJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
