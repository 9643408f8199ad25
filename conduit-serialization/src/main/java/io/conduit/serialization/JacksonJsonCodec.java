package io.conduit.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.conduit.core.util.JsonCodec;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// {@link JsonCodec} backed by a Jackson `ObjectMapper`.
///
/// The codec hosts hand to `ConduitFactory`, so tool arguments and observations
/// go through the same mapper as the HTTP layer.
public final class JacksonJsonCodec implements JsonCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> OBJECT_TYPE =
            new TypeReference<>() {};

    private final ObjectMapper mapper;

    public JacksonJsonCodec() {
        this(ConduitSerializer.createMapper());
    }

    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize value: " + e.getMessage(), e);
        }
    }

    @Override
    public Map<String, Object> parseObject(String json) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            Map<String, Object> object = mapper.readValue(json, OBJECT_TYPE);
            if (object == null) {
                throw new IllegalArgumentException("Expected a JSON object");
            }
            return object;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse JSON object: " + e.getMessage(), e);
        }
    }
}
