package io.conduit.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/// Jackson mixin for `AgentConfig.Builder` that configures POJO builder deserialization.
///
/// Sets `withPrefix = ""` so JSON field names map directly to builder setter names.
///
/// The getter `getAuthToken()` is ignored for output by {@link AgentConfigMixin}; the
/// explicit `@JsonProperty` on {@link #authToken(String)} keeps the token readable
/// from request bodies.
///
/// @see AgentConfigMixin
/// @see io.conduit.serialization.ConduitJacksonModule
@JsonPOJOBuilder(withPrefix = "")
public abstract class AgentConfigBuilderMixin {

    /// @param authToken model auth token, may be null
    /// @return this builder for chaining, never null
    @JsonProperty("authToken")
    public abstract AgentConfigBuilderMixin authToken(String authToken);
}
