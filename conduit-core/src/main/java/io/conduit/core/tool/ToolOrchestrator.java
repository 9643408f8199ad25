package io.conduit.core.tool;

import io.conduit.core.connection.ConnectionStatus;
import io.conduit.core.connection.ServerConfig;
import io.conduit.core.connection.ToolCallResponse;
import java.util.List;
import java.util.Map;

/// The contract other subsystems use to reach remote tools.
///
/// Callers never see reconnection churn: tool lookups and calls always go to
/// the current connection for a server, and every call outcome is a
/// {@link CallResult}.
///
/// Alternate implementations (in-memory servers for tests) can be substituted
/// wherever this interface is accepted.
///
/// @see DefaultToolOrchestrator
public interface ToolOrchestrator {

    /// Connects to the given servers.
    ///
    /// @param servers servers in configuration order, not null
    /// @throws io.conduit.core.exception.ConnectionException if servers were
    ///         configured and none connected
    void initialize(List<ServerConfig> servers);

    /// Returns every tool currently available.
    ///
    /// @return tools by namespaced name, never null
    Map<String, ToolDescriptor> getAllTools();

    /// Calls a tool. Never throws.
    ///
    /// @param toolName namespaced or bare tool name
    /// @param arguments tool arguments, may be null
    /// @return call outcome, never null
    CallResult<ToolCallResponse> callTool(String toolName, Map<String, Object> arguments);

    /// Returns the status of every configured server.
    ///
    /// @return status by server name, in configuration order, never null
    Map<String, ConnectionStatus> getStatus();

    /// Health-checks live connections and retries servers that are down.
    /// Never throws.
    void performHealthChecks();

    /// Closes every connection. Never throws.
    void disconnect();
}
