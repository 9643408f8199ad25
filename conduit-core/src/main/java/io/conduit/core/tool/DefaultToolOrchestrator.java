package io.conduit.core.tool;

import io.conduit.core.connection.ConnectionOrchestrator;
import io.conduit.core.connection.ConnectionStatus;
import io.conduit.core.connection.ServerConfig;
import io.conduit.core.connection.ToolCallResponse;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// {@link ToolOrchestrator} composed from the connection orchestrator, the
/// live registry and the invoker.
///
/// Holds no state of its own.
public final class DefaultToolOrchestrator implements ToolOrchestrator {

    private final ConnectionOrchestrator connections;
    private final ToolRegistry registry;
    private final ToolInvoker invoker;

    public DefaultToolOrchestrator(
            ConnectionOrchestrator connections, ToolRegistry registry, ToolInvoker invoker) {
        this.connections = Objects.requireNonNull(connections, "connections must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.invoker = Objects.requireNonNull(invoker, "invoker must not be null");
    }

    @Override
    public void initialize(List<ServerConfig> servers) {
        connections.initializeAll(servers);
    }

    @Override
    public Map<String, ToolDescriptor> getAllTools() {
        return registry.allTools();
    }

    @Override
    public CallResult<ToolCallResponse> callTool(String toolName, Map<String, Object> arguments) {
        return invoker.invoke(toolName, arguments);
    }

    @Override
    public Map<String, ConnectionStatus> getStatus() {
        return connections.getStatus();
    }

    @Override
    public void performHealthChecks() {
        connections.healthCheckAll();
        connections.reconnectUnavailable();
    }

    @Override
    public void disconnect() {
        connections.disconnectAll();
    }
}
