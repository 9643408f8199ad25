package io.conduit.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.conduit.core.agent.ProcessorType;

/// Jackson mixin that writes `ProcessorType` as its identifier (`react`, `coact`) and
/// reads it case-insensitively through `ProcessorType.from`.
///
/// @see io.conduit.serialization.ConduitJacksonModule
public abstract class ProcessorTypeMixin {

    @JsonValue
    public abstract String id();

    @JsonCreator
    public static ProcessorType from(String value) {
        return ProcessorType.from(value);
    }
}
