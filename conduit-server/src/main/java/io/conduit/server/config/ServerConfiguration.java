package io.conduit.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.conduit.core.ConduitEnvironment;
import io.conduit.core.agent.AgentConfig;
import io.conduit.core.connection.RetryPolicy;
import io.conduit.core.connection.ServerConfig;
import io.conduit.core.tool.ToolOrchestrator;
import io.conduit.serialization.ConduitSerializer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.util.List;

/// CDI configuration for server-specific beans.
///
/// The environment itself is produced by {@link ConduitEnvironmentProducer};
/// this class exposes its components and the loaded configuration for direct
/// injection.
@ApplicationScoped
public class ServerConfiguration {

    // ========== Utility Beans ==========

    /// The mapper used by the REST layer, the SSE stream and the MCP transport.
    @Produces
    @Singleton
    public ObjectMapper objectMapper() {
        return ConduitSerializer.createMapper();
    }

    // ========== Configuration ==========

    @Produces
    @Singleton
    public List<ServerConfig> serverConfigs(ServerConfigLoader loader) {
        return List.copyOf(loader.loadServers());
    }

    @Produces
    @Singleton
    public AgentConfig defaultAgentConfig(ServerConfigLoader loader) {
        return loader.loadAgentConfig();
    }

    @Produces
    @Singleton
    public RetryPolicy retryPolicy(ConduitEnvironment env) {
        return env.getConfig().getRetryPolicy();
    }

    // ========== ConduitEnvironment Component Delegates ==========

    @Produces
    @Singleton
    public ToolOrchestrator toolOrchestrator(ConduitEnvironment env) {
        return env.getToolOrchestrator();
    }
}
