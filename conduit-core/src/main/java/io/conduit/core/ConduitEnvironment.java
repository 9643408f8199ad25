package io.conduit.core;

import io.conduit.core.agent.AgentConfig;
import io.conduit.core.agent.AgentRuntime;
import io.conduit.core.agent.ConversationMemory;
import io.conduit.core.agent.LanguageModelFactory;
import io.conduit.core.connection.ConnectionManager;
import io.conduit.core.connection.ConnectionOrchestrator;
import io.conduit.core.processor.ProcessorFactory;
import io.conduit.core.processor.ToolCallExecutor;
import io.conduit.core.processor.ToolCatalog;
import io.conduit.core.tool.ToolOrchestrator;
import io.conduit.core.tool.ToolRegistry;
import io.conduit.core.tool.ToolRouter;
import io.conduit.core.util.JsonCodec;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.logging.Logger;

/// Container for the wired Conduit components.
///
/// Created by {@link ConduitFactory}. Holds one tool orchestration stack shared
/// by every agent session and creates per-session {@link AgentRuntime}s on top
/// of it.
///
/// @implNote Thread-safe. {@link #close()} disconnects every server and shuts
/// down the executors the factory created; executors supplied by the caller are
/// left running.
public final class ConduitEnvironment implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(ConduitEnvironment.class.getName());

    private final ConduitConfig config;
    private final ToolRouter router;
    private final ConnectionManager connectionManager;
    private final ConnectionOrchestrator connectionOrchestrator;
    private final ToolRegistry toolRegistry;
    private final ToolOrchestrator toolOrchestrator;
    private final LanguageModelFactory modelFactory;
    private final ProcessorFactory processorFactory;
    private final JsonCodec jsonCodec;
    private final ExecutorService workExecutor;
    private final List<ExecutorService> ownedExecutors;

    ConduitEnvironment(
            ConduitConfig config,
            ToolRouter router,
            ConnectionManager connectionManager,
            ConnectionOrchestrator connectionOrchestrator,
            ToolRegistry toolRegistry,
            ToolOrchestrator toolOrchestrator,
            LanguageModelFactory modelFactory,
            ProcessorFactory processorFactory,
            JsonCodec jsonCodec,
            ExecutorService workExecutor,
            List<ExecutorService> ownedExecutors) {
        this.config = config;
        this.router = router;
        this.connectionManager = connectionManager;
        this.connectionOrchestrator = connectionOrchestrator;
        this.toolRegistry = toolRegistry;
        this.toolOrchestrator = toolOrchestrator;
        this.modelFactory = modelFactory;
        this.processorFactory = processorFactory;
        this.jsonCodec = jsonCodec;
        this.workExecutor = workExecutor;
        this.ownedExecutors = List.copyOf(ownedExecutors);
    }

    /// Creates an agent runtime with its own catalog and conversation memory.
    ///
    /// @param agentConfig session configuration, not null
    /// @return new runtime in the `UNINITIALIZED` state, never null
    public AgentRuntime createRuntime(AgentConfig agentConfig) {
        ToolCatalog catalog = new ToolCatalog(toolOrchestrator, jsonCodec);
        ToolCallExecutor executor = new ToolCallExecutor(toolOrchestrator, jsonCodec);
        ConversationMemory memory =
                new ConversationMemory(config.getHistoryWindow(), toolOrchestrator, workExecutor);
        return new AgentRuntime(
                agentConfig, modelFactory, processorFactory, catalog, executor, memory);
    }

    public ConduitConfig getConfig() {
        return config;
    }

    public ToolRouter getRouter() {
        return router;
    }

    public ConnectionManager getConnectionManager() {
        return connectionManager;
    }

    public ConnectionOrchestrator getConnectionOrchestrator() {
        return connectionOrchestrator;
    }

    public ToolRegistry getToolRegistry() {
        return toolRegistry;
    }

    /// Returns the facade other subsystems should depend on.
    ///
    /// @return tool orchestrator, never null
    public ToolOrchestrator getToolOrchestrator() {
        return toolOrchestrator;
    }

    public LanguageModelFactory getModelFactory() {
        return modelFactory;
    }

    public ProcessorFactory getProcessorFactory() {
        return processorFactory;
    }

    public JsonCodec getJsonCodec() {
        return jsonCodec;
    }

    @Override
    public void close() {
        toolOrchestrator.disconnect();
        for (ExecutorService executor : ownedExecutors) {
            executor.shutdownNow();
        }
        logger.info("Conduit environment closed");
    }
}
