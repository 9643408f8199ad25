package io.conduit.core.tool;

import io.conduit.core.connection.Connection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/// Maps between namespaced tool identifiers and `(server, local name)` pairs.
///
/// The wire format is `<serverName>:<localToolName>`. Parsing splits on the
/// **first** separator only, so local names may themselves contain `:`.
///
/// ### Resolution
/// {@link #findOwningConnection} has two paths:
/// - **Namespaced**: the server is looked up directly and must be connected
///   and expose the tool. There is no fallback when this fails.
/// - **Bare name**: every connected server is scanned and the first one whose
///   tool map contains the name (local or namespaced) wins. Unqualified callers
///   rely on this; the scan is linear in the number of servers.
///
/// @implNote Thread-safe. Parse results are memoized in a bounded advisory
/// cache that the orchestrator clears whenever the connection set changes.
/// Correctness never depends on the cache being populated.
public final class ToolRouter {

    /// Separator between server name and local tool name.
    public static final char SEPARATOR = ':';

    private static final Pattern SEGMENT = Pattern.compile("^[a-zA-Z0-9_-]+$");
    private static final int MAX_CACHE_ENTRIES = 1024;

    private final Map<String, Optional<QualifiedToolName>> parseCache = new ConcurrentHashMap<>();

    /// Splits a namespaced name into server and local name.
    ///
    /// Both halves are trimmed; a name with a blank half is not namespaced.
    ///
    /// @param toolName candidate name, may be null
    /// @return the parsed pair, or empty if the name is not namespaced
    public Optional<QualifiedToolName> parse(String toolName) {
        if (toolName == null) {
            return Optional.empty();
        }
        Optional<QualifiedToolName> cached = parseCache.get(toolName);
        if (cached != null) {
            return cached;
        }
        Optional<QualifiedToolName> parsed = doParse(toolName);
        if (parseCache.size() >= MAX_CACHE_ENTRIES) {
            parseCache.clear();
        }
        parseCache.put(toolName, parsed);
        return parsed;
    }

    /// Formats a namespaced name.
    ///
    /// @param serverName owning server, not null, must not contain the separator
    /// @param originalName server-local name, not null
    /// @return `<serverName>:<originalName>`, never null
    /// @throws IllegalArgumentException if the server name contains the separator
    public String format(String serverName, String originalName) {
        Objects.requireNonNull(serverName, "serverName must not be null");
        Objects.requireNonNull(originalName, "originalName must not be null");
        if (serverName.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException(
                    "Server name must not contain '" + SEPARATOR + "': " + serverName);
        }
        return serverName + SEPARATOR + originalName;
    }

    /// Finds the connection that currently serves a tool.
    ///
    /// @param toolName namespaced or bare tool name, may be null
    /// @param liveConnections the orchestrator's canonical connections by server name
    /// @return the owning connection, or empty if no connected server exposes the tool
    public Optional<Connection> findOwningConnection(
            String toolName, Map<String, Connection> liveConnections) {
        if (toolName == null || liveConnections == null) {
            return Optional.empty();
        }

        Optional<QualifiedToolName> qualified = parse(toolName);
        if (qualified.isPresent()) {
            Connection connection = liveConnections.get(qualified.get().serverName());
            if (connection != null
                    && connection.isConnected()
                    && connection.hasTool(qualified.get().originalName())) {
                return Optional.of(connection);
            }
            return Optional.empty();
        }

        for (Connection connection : liveConnections.values()) {
            if (connection.isConnected() && connection.hasTool(toolName)) {
                return Optional.of(connection);
            }
        }
        return Optional.empty();
    }

    /// Returns the server-local part of a tool name.
    ///
    /// @param toolName namespaced or bare name, not null
    /// @return the local name for namespaced input, otherwise the input unchanged
    public String originalName(String toolName) {
        return parse(toolName).map(QualifiedToolName::originalName).orElse(toolName);
    }

    /// Checks whether a name is a well-formed bare or namespaced tool name.
    ///
    /// @param toolName candidate name, may be null
    /// @return true if every segment matches `[a-zA-Z0-9_-]+`
    public boolean isValidToolName(String toolName) {
        if (toolName == null || toolName.isEmpty()) {
            return false;
        }
        int separator = toolName.indexOf(SEPARATOR);
        if (separator < 0) {
            return SEGMENT.matcher(toolName).matches();
        }
        return SEGMENT.matcher(toolName.substring(0, separator)).matches()
                && SEGMENT.matcher(toolName.substring(separator + 1)).matches();
    }

    /// Drops all memoized parse results.
    public void clearCache() {
        parseCache.clear();
    }

    int cacheSize() {
        return parseCache.size();
    }

    private static Optional<QualifiedToolName> doParse(String toolName) {
        int separator = toolName.indexOf(SEPARATOR);
        if (separator < 0) {
            return Optional.empty();
        }
        String server = toolName.substring(0, separator).trim();
        String local = toolName.substring(separator + 1).trim();
        if (server.isEmpty() || local.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new QualifiedToolName(server, local));
    }
}
