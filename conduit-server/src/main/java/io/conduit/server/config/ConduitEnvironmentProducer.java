package io.conduit.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.conduit.adapter.langchain4j.LangChain4jModelProvider;
import io.conduit.core.ConduitEnvironment;
import io.conduit.core.ConduitFactory;
import io.conduit.serialization.JacksonJsonCodec;
import io.conduit.server.mcp.McpToolServerClientFactory;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

/// CDI producer for the Conduit runtime environment.
///
/// Wires the core components via {@link ConduitFactory}: router, connection
/// manager and orchestrator, tool registry, invoker, facade, model factory and
/// processor factory. Tool servers are reached through
/// {@link McpToolServerClientFactory}; JSON goes through the shared Jackson mapper.
///
/// ### Credential Discovery
/// Credentials are loaded from (later sources override earlier ones):
/// 1. **Environment variables** matching `*_API_KEY`, `*_KEY`, `*_SECRET`, `*_TOKEN`
/// 2. **Application properties** under `conduit.credentials.*`
///
/// ### Configuration Properties
/// | Property | Type | Default | Description |
/// |----------|------|---------|-------------|
/// | `conduit.credentials.ANTHROPIC_API_KEY` | String | - | Anthropic API key |
/// | `conduit.credentials.OPENAI_API_KEY` | String | - | OpenAI API key |
/// | `conduit.credentials.GOOGLE_API_KEY` | String | - | Google AI Gemini API key |
/// | `conduit.stub.enabled` | Boolean | `false` | Enable the stub model |
///
/// @implNote Application-scoped. The environment is closed on shutdown, which
/// disconnects every tool server and stops the worker pools.
@ApplicationScoped
public class ConduitEnvironmentProducer {

    private static final Logger LOG = Logger.getLogger(ConduitEnvironmentProducer.class);

    private final ServerConfigLoader configLoader;
    private final McpToolServerClientFactory clientFactory;
    private final ObjectMapper objectMapper;

    private ConduitEnvironment environment;

    @Inject
    public ConduitEnvironmentProducer(
            ServerConfigLoader configLoader,
            McpToolServerClientFactory clientFactory,
            ObjectMapper objectMapper) {
        this.configLoader = configLoader;
        this.clientFactory = clientFactory;
        this.objectMapper = objectMapper;
    }

    /// Produces the Conduit environment for CDI injection.
    ///
    /// @return configured environment singleton, never null
    @Produces
    @Singleton
    public ConduitEnvironment conduitEnvironment() {
        environment =
                ConduitFactory.builder()
                        .config(configLoader.loadConduitConfig())
                        .clientFactory(clientFactory)
                        .jsonCodec(new JacksonJsonCodec(objectMapper))
                        .loadCredentialsFromEnvironment()
                        .loadCredentialsFromProperties(configLoader.loadCredentialProperties())
                        .modelProvider(new LangChain4jModelProvider())
                        .build();

        LOG.info("Configured ConduitEnvironment via ConduitFactory");
        return environment;
    }

    /// Closes the environment to release connections and thread pools.
    @PreDestroy
    public void cleanup() {
        if (environment != null) {
            environment.close();
            LOG.info("ConduitEnvironment closed");
        }
    }
}
