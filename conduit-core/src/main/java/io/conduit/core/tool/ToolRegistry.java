package io.conduit.core.tool;

import io.conduit.core.connection.Connection;
import java.util.Map;
import java.util.Optional;

/// Read-only view of the tools currently available across all servers.
///
/// Implementations must answer from live state at call time and never keep a
/// snapshot that could outlive a reconnect.
///
/// @see LiveToolRegistry
public interface ToolRegistry {

    /// Returns every tool exposed by a currently connected server.
    ///
    /// @return tools by namespaced name, in server configuration order, never null
    Map<String, ToolDescriptor> allTools();

    /// Finds the connection currently serving a tool.
    ///
    /// @param toolName namespaced or bare tool name, may be null
    /// @return the owning connection, or empty if none
    Optional<Connection> resolve(String toolName);

    /// Looks up a tool's descriptor.
    ///
    /// @param toolName namespaced or bare tool name, may be null
    /// @return the descriptor, or empty if no connected server exposes it
    Optional<ToolDescriptor> describe(String toolName);
}
