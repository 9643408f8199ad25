package io.conduit.core.connection;

import io.conduit.core.exception.ConduitException;
import io.conduit.core.exception.ConfigurationException;
import io.conduit.core.exception.ConnectionException;
import io.conduit.core.tool.ToolRouter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/// Owns the canonical set of live connections.
///
/// The orchestrator is the single writer of the connection map. The registry
/// and invoker read it through {@link #connections()}, a live unmodifiable
/// view, and therefore always observe the current entry for a server, either
/// the old connection or its replacement.
///
/// ### Lifecycle
/// - {@link #initializeAll}: opens every configured server concurrently and
///   waits for all of them to settle. A failing server is logged and isolated;
///   initialization fails only when no server connects.
/// - {@link #ensureHealthy}: trusts a recent health check, otherwise checks and,
///   on failure, runs one reconnect cycle.
/// - {@link #healthCheckAll} and {@link #reconnectUnavailable}: periodic
///   maintenance driven by the host application.
/// - {@link #disconnectAll}: closes everything.
///
/// ### Reconnect coalescing
/// Concurrent reconnects for the same server are single-flight: the first
/// caller performs the reconnect and the others wait for its outcome.
///
/// @implNote Thread-safe.
public class ConnectionOrchestrator {

    private static final Logger logger = Logger.getLogger(ConnectionOrchestrator.class.getName());

    /// Window in which a successful health check is trusted without a new one.
    public static final Duration DEFAULT_HEALTH_CHECK_TTL = Duration.ofSeconds(5);

    private final ConnectionManager manager;
    private final ToolRouter router;
    private final ExecutorService executor;
    private final RetryPolicy reconnectPolicy;
    private final Duration healthCheckTtl;
    private final Clock clock;

    private final ConcurrentHashMap<String, Connection> connections = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicInteger> failures = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CompletableFuture<Boolean>> reconnects =
            new ConcurrentHashMap<>();
    private volatile List<ServerConfig> servers = List.of();

    public ConnectionOrchestrator(
            ConnectionManager manager,
            ToolRouter router,
            ExecutorService executor,
            RetryPolicy reconnectPolicy,
            Duration healthCheckTtl,
            Clock clock) {
        this.manager = Objects.requireNonNull(manager, "manager must not be null");
        this.router = Objects.requireNonNull(router, "router must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.reconnectPolicy =
                Objects.requireNonNull(reconnectPolicy, "reconnectPolicy must not be null");
        this.healthCheckTtl =
                Objects.requireNonNull(healthCheckTtl, "healthCheckTtl must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /// Connects to every configured server concurrently.
    ///
    /// Any connections from a previous initialization are closed first.
    /// Duplicate server names are treated as configuration errors for the
    /// duplicates; the first occurrence wins.
    ///
    /// @param configs servers in configuration order, not null
    /// @throws ConnectionException if at least one server was configured and none connected
    public void initializeAll(List<ServerConfig> configs) {
        Objects.requireNonNull(configs, "configs must not be null");
        if (!connections.isEmpty()) {
            disconnectAll();
        }
        failures.clear();

        if (configs.isEmpty()) {
            servers = List.of();
            logger.warning("No tool servers configured");
            return;
        }

        List<ServerConfig> accepted = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (ServerConfig config : configs) {
            if (config.name() != null && !seen.add(config.name())) {
                recordFailure(
                        config.name(),
                        new ConfigurationException(
                                "name", "Duplicate server name '" + config.name() + "'"));
                continue;
            }
            accepted.add(config);
        }
        servers = List.copyOf(accepted);

        logger.info("Connecting to " + accepted.size() + " tool servers");
        List<CompletableFuture<Connection>> attempts = new ArrayList<>();
        for (ServerConfig config : accepted) {
            attempts.add(CompletableFuture.supplyAsync(() -> manager.open(config), executor));
        }
        awaitAll(attempts);

        int connected = 0;
        for (int i = 0; i < accepted.size(); i++) {
            ServerConfig config = accepted.get(i);
            try {
                Connection connection = attempts.get(i).join();
                connections.put(connection.serverName(), connection);
                connected++;
            } catch (CompletionException e) {
                recordFailure(nameOf(config), unwrap(e));
            }
        }
        router.clearCache();

        if (connected == 0) {
            throw ConnectionException.noServersConnected(accepted.size());
        }
        logger.info("Connected to " + connected + "/" + accepted.size() + " tool servers");
    }

    /// Health-checks every connection concurrently. Never throws.
    ///
    /// Unhealthy connections are marked disconnected by the manager and stay
    /// in the map until reconnected.
    public void healthCheckAll() {
        List<Connection> snapshot = new ArrayList<>(connections.values());
        List<CompletableFuture<Boolean>> checks = new ArrayList<>();
        for (Connection connection : snapshot) {
            checks.add(
                    CompletableFuture.supplyAsync(() -> manager.healthCheck(connection), executor));
        }
        awaitAll(checks);

        long healthy = checks.stream().filter(check -> check.getNow(false)).count();
        logger.fine("Health check: " + healthy + "/" + snapshot.size() + " connections healthy");
    }

    /// Attempts to (re)open every configured server without a live connection.
    ///
    /// Each server is retried according to the reconnect policy. Failures are
    /// logged and counted. Never throws.
    public void reconnectUnavailable() {
        List<CompletableFuture<Boolean>> attempts = new ArrayList<>();
        for (ServerConfig config : servers) {
            if (config.name() == null || config.name().isBlank()) {
                continue;
            }
            Connection current = connections.get(config.name());
            if (current != null && current.isConnected()) {
                continue;
            }
            attempts.add(
                    CompletableFuture.supplyAsync(
                            () -> reconnectWithPolicy(config, current), executor));
        }
        awaitAll(attempts);
    }

    /// Ensures a connection is usable, reconnecting once if it is not.
    ///
    /// A connection checked within the trust window is accepted without a new
    /// round trip. Otherwise it is health-checked; on failure the stale transport
    /// is closed, the server is reopened with the same config, and the new
    /// connection replaces the old one under the same key.
    ///
    /// @param connection connection about to be used, may be null
    /// @return false only if the connection is null or the reconnect failed
    public boolean ensureHealthy(Connection connection) {
        if (connection == null) {
            return false;
        }
        if (isRecentlyChecked(connection)) {
            return true;
        }
        if (manager.healthCheck(connection)) {
            return true;
        }
        return reconnect(connection.config(), connection);
    }

    /// Closes every connection concurrently and clears the map. Never throws.
    public void disconnectAll() {
        List<Connection> snapshot = new ArrayList<>(connections.values());
        List<CompletableFuture<Void>> closes = new ArrayList<>();
        for (Connection connection : snapshot) {
            closes.add(CompletableFuture.runAsync(() -> manager.close(connection), executor));
        }
        awaitAll(closes);
        for (Connection connection : snapshot) {
            connections.remove(connection.serverName(), connection);
        }
        router.clearCache();
        logger.info("Disconnected from " + snapshot.size() + " tool servers");
    }

    /// Reports the state of every configured server, in configuration order.
    ///
    /// Servers that never connected are included with `connected=false`.
    ///
    /// @return status by server name, never null
    public Map<String, ConnectionStatus> getStatus() {
        Map<String, ConnectionStatus> status = new LinkedHashMap<>();
        for (ServerConfig config : servers) {
            String name = nameOf(config);
            int errorCount = failureCount(name);
            Connection connection = connections.get(name);
            if (connection == null) {
                status.put(name, ConnectionStatus.neverConnected(errorCount));
            } else {
                status.put(
                        name,
                        new ConnectionStatus(
                                connection.isConnected(),
                                connection.toolCount(),
                                connection.lastHealthCheckAt(),
                                errorCount));
            }
        }
        return status;
    }

    /// Returns a live, read-only view of the canonical connection map.
    ///
    /// @return connections by server name, never null
    public Map<String, Connection> connections() {
        return Collections.unmodifiableMap(connections);
    }

    /// Returns the connections of configured servers in configuration order.
    ///
    /// @return ordered snapshot of current entries, never null
    public List<Connection> orderedConnections() {
        List<Connection> ordered = new ArrayList<>();
        for (ServerConfig config : servers) {
            Connection connection = connections.get(nameOf(config));
            if (connection != null) {
                ordered.add(connection);
            }
        }
        return ordered;
    }

    public Optional<Connection> connection(String serverName) {
        return Optional.ofNullable(connections.get(serverName));
    }

    public List<ServerConfig> servers() {
        return servers;
    }

    private boolean isRecentlyChecked(Connection connection) {
        if (!connection.isConnected()) {
            return false;
        }
        Instant lastCheck = connection.lastHealthCheckAt();
        return lastCheck != null
                && Duration.between(lastCheck, clock.instant()).compareTo(healthCheckTtl) < 0;
    }

    private boolean reconnectWithPolicy(ServerConfig config, Connection stale) {
        try {
            return reconnectPolicy.execute(
                    "reconnect " + config.name(),
                    () -> {
                        Connection current = connections.get(config.name());
                        if (!reconnect(config, current != null ? current : stale)) {
                            throw new ConnectionException(
                                    config.name(), "Reconnect to '" + config.name() + "' failed");
                        }
                        return true;
                    });
        } catch (ConduitException e) {
            logger.warning(e.getMessage());
            return false;
        }
    }

    private boolean reconnect(ServerConfig config, Connection stale) {
        String name = config.name();

        Connection current = connections.get(name);
        if (current != null && current != stale && current.isConnected()) {
            return true;
        }

        CompletableFuture<Boolean> mine = new CompletableFuture<>();
        CompletableFuture<Boolean> inFlight = reconnects.putIfAbsent(name, mine);
        if (inFlight != null) {
            logger.fine("Joining in-flight reconnect for server '" + name + "'");
            return inFlight.join();
        }

        try {
            Connection replaced = connections.get(name);
            if (replaced != null && replaced != stale && replaced.isConnected()) {
                mine.complete(true);
                return true;
            }
            boolean reconnected = doReconnect(config, stale);
            mine.complete(reconnected);
            return reconnected;
        } catch (RuntimeException e) {
            mine.complete(false);
            throw e;
        } finally {
            reconnects.remove(name, mine);
        }
    }

    private boolean doReconnect(ServerConfig config, Connection stale) {
        String name = config.name();
        logger.info("Reconnecting to server '" + name + "'");
        if (stale != null) {
            manager.close(stale);
        }
        try {
            Connection fresh = manager.open(config, failureCount(name) + 1);
            connections.put(name, fresh);
            router.clearCache();
            logger.info("Reconnected to server '" + name + "'");
            return true;
        } catch (RuntimeException e) {
            recordFailure(name, e);
            return false;
        }
    }

    private void recordFailure(String serverName, Throwable cause) {
        failures.computeIfAbsent(serverName, key -> new AtomicInteger()).incrementAndGet();
        logger.warning(
                "Failed to connect to server '"
                        + serverName
                        + "': "
                        + (cause != null ? cause.getMessage() : "unknown error"));
    }

    private int failureCount(String serverName) {
        AtomicInteger count = failures.get(serverName);
        return count == null ? 0 : count.get();
    }

    private static String nameOf(ServerConfig config) {
        return config.name() != null ? config.name() : "<unnamed>";
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static void awaitAll(List<? extends CompletableFuture<?>> futures) {
        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                .handle((ignored, error) -> null)
                .join();
    }
}
