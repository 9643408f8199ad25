package io.conduit.core.util;

import java.util.Map;

/// JSON encoding seam between the core and a serialization library.
///
/// The core has no implementation of its own; hosts plug in the Jackson
/// implementation from `conduit-serialization`.
public interface JsonCodec {

    /// Serializes maps, lists, strings, numbers, booleans and null to compact JSON.
    ///
    /// @param value value to encode, may be null
    /// @return JSON text, never null
    /// @throws IllegalArgumentException if the value cannot be encoded
    String toJson(Object value);

    /// Parses a JSON object.
    ///
    /// @param json JSON text, not null
    /// @return the object's members in document order, never null
    /// @throws IllegalArgumentException if the text is not a JSON object
    Map<String, Object> parseObject(String json);
}
