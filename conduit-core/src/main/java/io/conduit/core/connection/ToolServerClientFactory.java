package io.conduit.core.connection;

/// Creates transport handles for server configurations.
///
/// The seam used to substitute in-memory servers in tests.
@FunctionalInterface
public interface ToolServerClientFactory {

    /// Creates an unconnected client for the given server.
    ///
    /// @param config validated server configuration, not null
    /// @return new client, never null
    ToolServerClient create(ServerConfig config);
}
