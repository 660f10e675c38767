package io.perceptflow.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.perceptflow.core.execution.result.ExecutionResult;
import io.perceptflow.core.state.SessionSnapshot;
import java.io.IOException;
import java.io.Serial;

/// Deserializes `ExecutionResult` from the shape written by {@link ExecutionResultSerializer}.
///
/// The subtype is derived from the final state's outcome; the `"type"` field is checked
/// against it and a mismatch is rejected.
///
/// @implNote Package-private. Registered by {@link PerceptflowJacksonModule}.
class ExecutionResultDeserializer extends StdDeserializer<ExecutionResult> {

    @Serial private static final long serialVersionUID = 6023904587719246415L;

    ExecutionResultDeserializer() {
        super(ExecutionResult.class);
    }

    @Override
    public ExecutionResult deserialize(JsonParser parser, DeserializationContext ctxt)
            throws IOException {
        JsonNode root = parser.readValueAsTree();
        JsonNode state = root.get("finalState");
        if (state == null || state.isNull()) {
            throw JsonMappingException.from(parser, "ExecutionResult has no finalState");
        }
        SessionSnapshot snapshot =
                parser.getCodec().treeToValue(state, SessionSnapshot.class);

        ExecutionResult result;
        try {
            result = ExecutionResult.of(snapshot);
        } catch (IllegalArgumentException e) {
            throw JsonMappingException.from(parser, e.getMessage(), e);
        }

        JsonNode type = root.get("type");
        if (type != null && !type.asText().equals(ExecutionResultSerializer.typeOf(result))) {
            throw JsonMappingException.from(
                    parser,
                    "ExecutionResult type "
                            + type.asText()
                            + " does not match outcome "
                            + snapshot.outcome());
        }
        return result;
    }
}
