package io.conduit.core.tool;

import io.conduit.core.connection.Connection;
import io.conduit.core.connection.ConnectionOrchestrator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// {@link ToolRegistry} projecting the orchestrator's canonical connection map.
///
/// Holds no state: every query goes through
/// {@link ConnectionOrchestrator#connections()}, so a reconnect that replaces a
/// map entry is visible to the next lookup.
public final class LiveToolRegistry implements ToolRegistry {

    private final ConnectionOrchestrator orchestrator;
    private final ToolRouter router;

    public LiveToolRegistry(ConnectionOrchestrator orchestrator, ToolRouter router) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
        this.router = Objects.requireNonNull(router, "router must not be null");
    }

    @Override
    public Map<String, ToolDescriptor> allTools() {
        Map<String, ToolDescriptor> tools = new LinkedHashMap<>();
        for (Connection connection : orchestrator.orderedConnections()) {
            Map<String, ToolDescriptor> connectionTools = connection.tools();
            if (connectionTools == null) {
                continue;
            }
            for (ToolDescriptor descriptor : connectionTools.values()) {
                tools.put(descriptor.namespacedName(), descriptor);
            }
        }
        return tools;
    }

    @Override
    public Optional<Connection> resolve(String toolName) {
        return router.findOwningConnection(toolName, orchestrator.connections());
    }

    @Override
    public Optional<ToolDescriptor> describe(String toolName) {
        return resolve(toolName)
                .flatMap(connection -> connection.findTool(router.originalName(toolName)));
    }
}
