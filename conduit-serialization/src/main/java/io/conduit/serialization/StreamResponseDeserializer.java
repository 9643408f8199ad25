package io.conduit.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.conduit.core.agent.StreamResponse;
import java.io.IOException;
import java.io.Serial;
import java.util.Locale;
import java.util.Map;

/// Deserializes the `StreamResponse` sealed hierarchy using a `"type"` discriminator field.
///
/// Used by clients of the chat stream and by tests that replay recorded streams.
/// Arguments of a `tool_call` event are extracted via `convertValue`.
///
/// @implNote Package-private. Registered by {@link ConduitJacksonModule}.
/// @see StreamResponseSerializer for the inverse operation
class StreamResponseDeserializer extends StdDeserializer<StreamResponse> {

    @Serial private static final long serialVersionUID = 5830216465923047782L;

    StreamResponseDeserializer() {
        super(StreamResponse.class);
    }

    /// Reads the `"type"` field and dispatches to the matching event record.
    ///
    /// @param p the JSON parser positioned at the start of the event object, not null
    /// @param ctx the deserialization context, not null
    /// @return the deserialized event, never null
    /// @throws IOException if the `"type"` value is unknown or missing
    @Override
    public StreamResponse deserialize(JsonParser p, DeserializationContext ctx)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        JsonNode typeNode = root.get("type");
        if (typeNode == null) {
            throw new IOException("StreamResponse is missing the 'type' field");
        }
        String type = typeNode.asText();

        return switch (type) {
            case "content" -> new StreamResponse.Content(text(root, "text"));
            case "reasoning" -> new StreamResponse.Reasoning(text(root, "text"));
            case "tool_call" -> {
                Map<String, Object> arguments =
                        root.hasNonNull("arguments")
                                ? mapper.convertValue(root.get("arguments"), new TypeReference<>() {})
                                : Map.of();
                StreamResponse.ToolCall.Status status =
                        StreamResponse.ToolCall.Status.valueOf(
                                text(root, "status").toUpperCase(Locale.ROOT));
                yield new StreamResponse.ToolCall(
                        text(root, "toolCallId"),
                        optionalText(root, "toolName"),
                        arguments,
                        status,
                        optionalText(root, "result"),
                        optionalText(root, "error"));
            }
            case "error" -> new StreamResponse.Error(text(root, "message"));
            case "done" -> new StreamResponse.Done();
            default -> throw new IOException("Unknown StreamResponse type: " + type);
        };
    }

    private static String text(JsonNode root, String field) throws IOException {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            throw new IOException("StreamResponse is missing the '" + field + "' field");
        }
        return node.asText();
    }

    private static String optionalText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }
}
