package io.conduit.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.conduit.core.agent.AgentConfig;
import io.conduit.core.agent.ProcessorType;
import io.conduit.core.agent.StreamResponse;
import io.conduit.serialization.mixin.AgentConfigBuilderMixin;
import io.conduit.serialization.mixin.AgentConfigMixin;
import io.conduit.serialization.mixin.ProcessorTypeMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all Conduit serialization configuration in one place.
///
/// **Custom serializer/deserializer pair** for the sealed `StreamResponse` hierarchy,
/// discriminator `"type"`:
/// - `content`, `reasoning`, `tool_call`, `error`, `done`
///
/// **Mixins**:
/// - `AgentConfig` + `AgentConfig.Builder`, builder-based deserialization
/// - `ProcessorType`, written and read by its lowercase identifier
///
/// @implNote All registrations are explicit, no classpath scanning.
/// @see ConduitSerializer for the convenience factory API
public class ConduitJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 3318470921552183306L;

    public ConduitJacksonModule() {
        super("ConduitJacksonModule");

        addSerializer(StreamResponse.class, new StreamResponseSerializer());
        addDeserializer(StreamResponse.class, new StreamResponseDeserializer());
    }

    /// Applies mixin annotations to the agent configuration types.
    ///
    /// @param context the setup context provided by Jackson, not null
    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(AgentConfig.class, AgentConfigMixin.class);
        context.setMixInAnnotations(AgentConfig.Builder.class, AgentConfigBuilderMixin.class);

        context.setMixInAnnotations(ProcessorType.class, ProcessorTypeMixin.class);
    }
}
