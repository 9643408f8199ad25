package io.conduit.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.conduit.core.agent.StreamResponse;

/// Utility class for writing and reading Conduit stream events as JSON.
///
/// ### Usage
/// {@snippet :
/// String json = ConduitSerializer.toJson(new StreamResponse.Content("hi"));
/// StreamResponse event = ConduitSerializer.fromJson(json);
///
/// ObjectMapper mapper = ConduitSerializer.createMapper();
/// }
///
/// @implNote Thread-safe. A shared mapper is used by the static helpers.
/// @see ConduitJacksonModule for the registered type handlers
public final class ConduitSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private ConduitSerializer() {}

    /// Serializes a stream event to compact JSON, one line per event.
    ///
    /// @param event the event to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(StreamResponse event) {
        try {
            return MAPPER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize stream event: " + e.getMessage(), e);
        }
    }

    /// Deserializes a stream event from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized event, never null
    /// @throws IllegalArgumentException if deserialization fails
    public static StreamResponse fromJson(String json) {
        try {
            return MAPPER.readValue(json, StreamResponse.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize stream event: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for Conduit types.
    ///
    /// Registers:
    /// - `ConduitJacksonModule` for stream events and agent configuration
    /// - `JavaTimeModule` for `Duration` and `Instant` fields
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return configure(new ObjectMapper());
    }

    /// Applies the Conduit configuration to an existing mapper, such as the one
    /// managed by a host framework.
    ///
    /// @param mapper mapper to configure, not null
    /// @return the same mapper, never null
    public static ObjectMapper configure(ObjectMapper mapper) {
        return mapper.registerModule(new ConduitJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
