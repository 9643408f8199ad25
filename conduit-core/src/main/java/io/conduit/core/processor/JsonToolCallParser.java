package io.conduit.core.processor;

import io.conduit.core.util.JsonCodec;
import io.conduit.core.util.JsonUtil;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// {@link ToolCallParser} that reads the body through a {@link JsonCodec}.
///
/// Tolerates prose or code fences around the JSON object by extracting the
/// first balanced `{...}` block.
public final class JsonToolCallParser implements ToolCallParser {

    static final String INVALID_ARGUMENTS = "Invalid arguments provided";

    private final JsonCodec codec;

    public JsonToolCallParser(JsonCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    @Override
    public ToolCallRequest parse(String body) {
        String json = JsonUtil.extractJsonFromOutput(body);
        if (json == null) {
            return ToolCallRequest.invalid(null, null, "Tool call is not a JSON object");
        }

        Map<String, Object> object;
        try {
            object = codec.parseObject(json);
        } catch (IllegalArgumentException e) {
            return ToolCallRequest.invalid(null, null, "Malformed tool call JSON: " + e.getMessage());
        }

        String id = stringValue(object.get("id"));
        String name = stringValue(object.get("name"));
        if (name == null || name.isBlank()) {
            return ToolCallRequest.invalid(id, null, "Tool call is missing a name");
        }

        Object arguments = object.get("arguments");
        if (arguments == null) {
            return ToolCallRequest.of(id, name.trim(), Map.of());
        }
        if (!(arguments instanceof Map<?, ?> raw)) {
            return ToolCallRequest.invalid(id, name.trim(), INVALID_ARGUMENTS);
        }
        Map<String, Object> args = new LinkedHashMap<>();
        raw.forEach((key, value) -> args.put(String.valueOf(key), value));
        return ToolCallRequest.of(id, name.trim(), args);
    }

    private static String stringValue(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
