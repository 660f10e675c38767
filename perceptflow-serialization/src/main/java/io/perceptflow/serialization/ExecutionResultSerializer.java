package io.perceptflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.perceptflow.core.execution.result.ExecutionResult;
import java.io.IOException;
import java.io.Serial;

/// Serializes `ExecutionResult` subtypes with a `"type"` discriminator.
///
/// ```
/// {"type": "COMPLETED" | "FAILED" | "CANCELLED", "sessionId": ..., "finalState": {...}}
/// ```
///
/// @implNote Package-private. Registered by {@link PerceptflowJacksonModule}.
/// @see ExecutionResultDeserializer for the inverse operation
class ExecutionResultSerializer extends StdSerializer<ExecutionResult> {

    @Serial private static final long serialVersionUID = -4170280932018860612L;

    static final String COMPLETED = "COMPLETED";
    static final String FAILED = "FAILED";
    static final String CANCELLED = "CANCELLED";

    ExecutionResultSerializer() {
        super(ExecutionResult.class);
    }

    @Override
    public void serialize(ExecutionResult result, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("type", typeOf(result));
        gen.writeStringField("sessionId", result.sessionId());
        gen.writeFieldName("finalState");
        provider.defaultSerializeValue(result.finalState(), gen);
        gen.writeEndObject();
    }

    static String typeOf(ExecutionResult result) {
        if (result instanceof ExecutionResult.Completed) {
            return COMPLETED;
        }
        if (result instanceof ExecutionResult.Cancelled) {
            return CANCELLED;
        }
        return FAILED;
    }
}
