package io.conduit.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.conduit.core.agent.AgentConfig;

/// Jackson mixin that binds `AgentConfig` deserialization to its builder.
///
/// Applied to `AgentConfig.class` via `ConduitJacksonModule.setupModule()`. Unset
/// optional fields are omitted on output and the auth token is never written.
///
/// @apiNote The companion mixin {@link AgentConfigBuilderMixin} must also be registered
/// so Jackson knows how to invoke the builder's setters and `build()` method.
///
/// @see AgentConfigBuilderMixin
/// @see io.conduit.serialization.ConduitJacksonModule
@JsonDeserialize(builder = AgentConfig.Builder.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class AgentConfigMixin {

    @JsonIgnore
    public abstract String getAuthToken();
}
