package io.conduit.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;

/// Plain Jackson {@link JsonCodec} for core tests, which cannot see `conduit-serialization`.
public final class ObjectMapperCodec implements JsonCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> OBJECT_TYPE =
            new TypeReference<>() {};

    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
    }

    @Override
    public Map<String, Object> parseObject(String json) {
        try {
            Map<String, Object> object = mapper.readValue(json, OBJECT_TYPE);
            if (object == null) {
                throw new IllegalArgumentException("Expected a JSON object");
            }
            return object;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
    }
}
