package io.conduit.core.connection;

import java.util.List;
import java.util.Map;

/// Transport handle to one remote tool server.
///
/// Implementations perform blocking I/O. Time limits are enforced by the
/// {@link ConnectionManager}, which runs every call on its own executor and
/// abandons calls that overrun; implementations should still honour thread
/// interruption where their transport allows it.
///
/// ### Contracts
/// - {@link #initialize()} is called exactly once, before any other method
/// - {@link #close()} must never throw and may be called more than once
/// - failures are reported with unchecked exceptions, usually
///   {@link io.conduit.core.exception.ConnectionException}
///
/// @see ToolServerClientFactory
public interface ToolServerClient extends AutoCloseable {

    /// Performs the protocol handshake.
    void initialize();

    /// Lists the tools the server currently exposes.
    ///
    /// Also used as the lightweight health-check round trip.
    ///
    /// @return tools in server order, never null
    List<RemoteTool> listTools();

    /// Calls a tool by its server-local name.
    ///
    /// @param toolName server-local tool name, not null
    /// @param arguments tool arguments, not null
    /// @return the server's response, never null
    ToolCallResponse callTool(String toolName, Map<String, Object> arguments);

    /// Releases the transport. Never throws.
    @Override
    void close();
}
