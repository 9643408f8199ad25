package io.conduit.core.connection;

import io.conduit.core.tool.ToolDescriptor;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// A live (or formerly live) connection to one tool server.
///
/// Connections are only created by {@link ConnectionManager#open} after the
/// handshake succeeded and the tool list was fetched, so a connection starts
/// out fully connected. Once it is marked disconnected it never comes back:
/// reconnecting produces a new instance that replaces this one in the
/// orchestrator's canonical map.
///
/// @implNote Thread-safe. Connected flag, tool map and health-check stamp are
/// held in a single immutable snapshot swapped through a volatile field, so
/// readers observe either the fully connected state (tools present) or the
/// disconnected state (tools null), never a mix. Mutators are synchronized;
/// reads are lock-free.
public final class Connection {

    private final ServerConfig config;
    private final ToolServerClient client;
    private final int connectionAttempts;
    private volatile Snapshot snapshot;

    private record Snapshot(
            boolean connected, Map<String, ToolDescriptor> tools, Instant lastHealthCheckAt) {}

    Connection(
            ServerConfig config,
            ToolServerClient client,
            Map<String, ToolDescriptor> tools,
            int connectionAttempts,
            Instant connectedAt) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.connectionAttempts = connectionAttempts;
        this.snapshot =
                new Snapshot(
                        true,
                        Collections.unmodifiableMap(new LinkedHashMap<>(tools)),
                        connectedAt);
    }

    public String serverName() {
        return config.name();
    }

    public ServerConfig config() {
        return config;
    }

    /// Returns the number of attempts it took to establish this connection.
    ///
    /// @return attempt count, at least 1
    public int connectionAttempts() {
        return connectionAttempts;
    }

    public boolean isConnected() {
        return snapshot.connected();
    }

    /// Returns the tools keyed by server-local name.
    ///
    /// @return unmodifiable tool map, or null once the connection is disconnected
    public Map<String, ToolDescriptor> tools() {
        return snapshot.tools();
    }

    /// Returns the tool count, `0` when disconnected.
    ///
    /// @return number of tools
    public int toolCount() {
        Map<String, ToolDescriptor> tools = snapshot.tools();
        return tools == null ? 0 : tools.size();
    }

    /// Returns when the connection was last confirmed healthy.
    ///
    /// @return last successful check (or connect) time, never null
    public Instant lastHealthCheckAt() {
        return snapshot.lastHealthCheckAt();
    }

    /// Checks whether this connection exposes a tool under its local or
    /// namespaced name.
    ///
    /// @param toolName local or namespaced tool name, may be null
    /// @return true if connected and the tool is present
    public boolean hasTool(String toolName) {
        return findTool(toolName).isPresent();
    }

    /// Looks up a tool by local or namespaced name.
    ///
    /// @param toolName local or namespaced tool name, may be null
    /// @return the descriptor, or empty if absent or disconnected
    public Optional<ToolDescriptor> findTool(String toolName) {
        Map<String, ToolDescriptor> tools = snapshot.tools();
        if (tools == null || toolName == null) {
            return Optional.empty();
        }
        ToolDescriptor byLocal = tools.get(toolName);
        if (byLocal != null) {
            return Optional.of(byLocal);
        }
        return tools.values().stream()
                .filter(tool -> tool.namespacedName().equals(toolName))
                .findFirst();
    }

    ToolServerClient client() {
        return client;
    }

    synchronized void markHealthy(Instant checkedAt) {
        Snapshot current = snapshot;
        if (current.connected()) {
            snapshot = new Snapshot(true, current.tools(), checkedAt);
        }
    }

    synchronized void markDisconnected() {
        snapshot = new Snapshot(false, null, snapshot.lastHealthCheckAt());
    }

    @Override
    public String toString() {
        return "Connection{server="
                + config.name()
                + ", connected="
                + isConnected()
                + ", tools="
                + toolCount()
                + "}";
    }
}
