package io.conduit.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.conduit.core.agent.StreamResponse;
import java.io.IOException;
import java.io.Serial;
import java.util.Locale;

/// Serializes the `StreamResponse` sealed hierarchy with a `"type"` discriminator field.
///
/// Emitted JSON shape per subtype:
/// - **`Content`**: `{"type":"content","text":"..."}`
/// - **`Reasoning`**: `{"type":"reasoning","text":"..."}`
/// - **`ToolCall`**: `{"type":"tool_call","toolCallId":"...","toolName":"...",
///   "arguments":{...},"status":"started|completed|failed","result":"...","error":"..."}`.
///   `result` and `error` are omitted when absent.
/// - **`Error`**: `{"type":"error","message":"..."}`
/// - **`Done`**: `{"type":"done"}`
///
/// @implNote Package-private. Registered by {@link ConduitJacksonModule}.
/// @see StreamResponseDeserializer for the inverse operation
class StreamResponseSerializer extends StdSerializer<StreamResponse> {

    @Serial private static final long serialVersionUID = -6021870317406359141L;

    StreamResponseSerializer() {
        super(StreamResponse.class);
    }

    @Override
    public void serialize(StreamResponse event, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("type", event.type());

        if (event instanceof StreamResponse.Content content) {
            gen.writeStringField("text", content.text());
        } else if (event instanceof StreamResponse.Reasoning reasoning) {
            gen.writeStringField("text", reasoning.text());
        } else if (event instanceof StreamResponse.ToolCall call) {
            gen.writeStringField("toolCallId", call.toolCallId());
            if (call.toolName() != null) {
                gen.writeStringField("toolName", call.toolName());
            }
            provider.defaultSerializeField("arguments", call.arguments(), gen);
            gen.writeStringField("status", call.status().name().toLowerCase(Locale.ROOT));
            if (call.result() != null) {
                gen.writeStringField("result", call.result());
            }
            if (call.error() != null) {
                gen.writeStringField("error", call.error());
            }
        } else if (event instanceof StreamResponse.Error error) {
            gen.writeStringField("message", error.message());
        }

        gen.writeEndObject();
    }
}
