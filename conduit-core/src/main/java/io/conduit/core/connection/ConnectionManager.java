package io.conduit.core.connection;

import io.conduit.core.exception.ConnectionException;
import io.conduit.core.exception.ConnectionTimeoutException;
import io.conduit.core.tool.ToolDescriptor;
import io.conduit.core.tool.ToolRouter;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/// Opens, health-checks, and closes connections to individual tool servers.
///
/// Owns the time budgets of a single connection. Every transport operation is
/// submitted to the manager's executor and awaited with a hard timeout; an
/// operation that overruns is cancelled and abandoned.
///
/// ### Failure semantics
/// - {@link #open} and {@link #callTool} throw {@link ConnectionException}
///   (or its {@link ConnectionTimeoutException} specialization)
/// - {@link #healthCheck} never throws, it returns false
/// - {@link #close} never throws
///
/// @implNote Thread-safe and stateless apart from its collaborators. The
/// executor must not be shared with callers that block on this manager,
/// otherwise a bounded pool can starve.
///
/// @see ConnectionOrchestrator for the owner of the resulting connections
public class ConnectionManager {

    private static final Logger logger = Logger.getLogger(ConnectionManager.class.getName());

    private final ToolServerClientFactory clientFactory;
    private final ToolRouter router;
    private final ExecutorService executor;
    private final ConnectionTimeouts timeouts;
    private final Clock clock;

    public ConnectionManager(
            ToolServerClientFactory clientFactory,
            ToolRouter router,
            ExecutorService executor,
            ConnectionTimeouts timeouts,
            Clock clock) {
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory must not be null");
        this.router = Objects.requireNonNull(router, "router must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.timeouts = Objects.requireNonNull(timeouts, "timeouts must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /// Opens a connection on the first attempt.
    ///
    /// @param config server configuration, not null
    /// @return a fully connected connection with its tools populated, never null
    /// @throws io.conduit.core.exception.ConfigurationException if the config is invalid
    /// @throws ConnectionException if the handshake or tool listing fails
    public Connection open(ServerConfig config) {
        return open(config, 1);
    }

    /// Opens a connection, validating the config before any I/O.
    ///
    /// Performs the handshake and immediately fetches the tool list, namespacing
    /// every tool through the {@link ToolRouter}. A partially opened transport is
    /// closed before the failure is raised.
    ///
    /// @param config server configuration, not null
    /// @param attempt the attempt number recorded on the connection, at least 1
    /// @return a fully connected connection with its tools populated, never null
    /// @throws io.conduit.core.exception.ConfigurationException if the config is invalid
    /// @throws ConnectionException if the handshake or tool listing fails
    public Connection open(ServerConfig config, int attempt) {
        Objects.requireNonNull(config, "config must not be null");
        config.validate();

        String serverName = config.name();
        logger.fine("Connecting to server '" + serverName + "' at " + config.targetUri());

        ToolServerClient client = clientFactory.create(config);
        try {
            call(
                    serverName,
                    "connect",
                    timeouts.connect(),
                    () -> {
                        client.initialize();
                        return null;
                    });
            List<RemoteTool> remoteTools =
                    call(serverName, "tools/list", timeouts.connect(), client::listTools);

            Map<String, ToolDescriptor> tools = describe(serverName, remoteTools);
            Connection connection =
                    new Connection(config, client, tools, Math.max(1, attempt), clock.instant());
            logger.info(
                    "Connected to server '"
                            + serverName
                            + "' with "
                            + tools.size()
                            + " tools: "
                            + tools.keySet());
            return connection;
        } catch (ConnectionException e) {
            closeQuietly(serverName, client);
            throw e;
        } catch (RuntimeException e) {
            closeQuietly(serverName, client);
            throw ConnectionException.connectFailed(serverName, e);
        }
    }

    /// Confirms that a connection is still usable with a tool-listing round trip.
    ///
    /// The only place that flips a connection from healthy to unhealthy. A
    /// connection that is already disconnected is never revived.
    ///
    /// @param connection connection to check, may be null
    /// @return true if the server answered within the health-check budget
    public boolean healthCheck(Connection connection) {
        if (connection == null || !connection.isConnected()) {
            return false;
        }
        String serverName = connection.serverName();
        try {
            call(serverName, "health-check", timeouts.healthCheck(), connection.client()::listTools);
            connection.markHealthy(clock.instant());
            return true;
        } catch (RuntimeException e) {
            logger.warning(
                    "Health check failed for server '" + serverName + "': " + e.getMessage());
            connection.markDisconnected();
            return false;
        }
    }

    /// Calls a tool on a connection under the tool-call budget.
    ///
    /// @param connection owning connection, not null
    /// @param localToolName server-local tool name, not null
    /// @param arguments tool arguments, not null
    /// @return the server's response, never null
    /// @throws ConnectionException on transport failure or timeout
    /// @throws io.conduit.core.exception.ToolExecutionException if the transport
    ///         reports an application-level failure
    public ToolCallResponse callTool(
            Connection connection, String localToolName, Map<String, Object> arguments) {
        Objects.requireNonNull(connection, "connection must not be null");
        Objects.requireNonNull(localToolName, "localToolName must not be null");
        Map<String, Object> args = arguments != null ? arguments : Map.of();
        return call(
                connection.serverName(),
                "tools/call",
                timeouts.toolCall(),
                () -> connection.client().callTool(localToolName, args));
    }

    /// Marks a connection disconnected and releases its transport. Never throws.
    ///
    /// @param connection connection to close, may be null
    public void close(Connection connection) {
        if (connection == null) {
            return;
        }
        connection.markDisconnected();
        closeQuietly(connection.serverName(), connection.client());
        logger.fine("Closed connection to server '" + connection.serverName() + "'");
    }

    private Map<String, ToolDescriptor> describe(String serverName, List<RemoteTool> remoteTools) {
        Map<String, ToolDescriptor> tools = new LinkedHashMap<>();
        if (remoteTools == null) {
            return tools;
        }
        for (RemoteTool remote : remoteTools) {
            ToolDescriptor descriptor =
                    new ToolDescriptor(
                            router.format(serverName, remote.name()),
                            remote.description(),
                            remote.inputSchema(),
                            serverName,
                            remote.name());
            if (tools.put(remote.name(), descriptor) != null) {
                logger.warning(
                        "Server '" + serverName + "' lists tool '" + remote.name() + "' twice");
            }
        }
        return tools;
    }

    private <T> T call(String serverName, String operation, Duration timeout, Callable<T> task) {
        Future<T> future = executor.submit(task);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw ConnectionTimeoutException.of(serverName, operation, timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ConnectionException(
                    serverName, "Interrupted during '" + operation + "' on '" + serverName + "'", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new ConnectionException(
                    serverName,
                    "Operation '" + operation + "' on '" + serverName + "' failed: " + cause,
                    cause);
        }
    }

    private static void closeQuietly(String serverName, ToolServerClient client) {
        try {
            client.close();
        } catch (RuntimeException e) {
            logger.fine("Ignoring close failure for server '" + serverName + "': " + e);
        }
    }
}
