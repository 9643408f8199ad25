package io.conduit.core.tool;

import io.conduit.core.connection.Connection;
import io.conduit.core.connection.ConnectionManager;
import io.conduit.core.connection.ConnectionOrchestrator;
import io.conduit.core.connection.ToolCallResponse;
import io.conduit.core.exception.ToolExecutionException;
import io.conduit.core.exception.ToolNotFoundException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/// Executes single tool calls and reports every outcome as a {@link CallResult}.
///
/// ### Invocation steps
/// 1. Resolve the owning connection through the registry.
/// 2. Ensure it is healthy, which may reconnect and replace it.
/// 3. Re-resolve, so the call never goes to a transport closed by step 2.
/// 4. Translate the name to the server-local name and call the server.
///
/// No exception escapes {@link #invoke}. Not-found, connection-unavailable,
/// remote tool errors and transport failures all become failed results.
/// Arguments are not validated against the tool's schema; that is the caller's
/// responsibility.
public final class ToolInvoker {

    private static final Logger logger = Logger.getLogger(ToolInvoker.class.getName());

    private final ToolRegistry registry;
    private final ConnectionOrchestrator orchestrator;
    private final ConnectionManager manager;
    private final ToolRouter router;

    public ToolInvoker(
            ToolRegistry registry,
            ConnectionOrchestrator orchestrator,
            ConnectionManager manager,
            ToolRouter router) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
        this.manager = Objects.requireNonNull(manager, "manager must not be null");
        this.router = Objects.requireNonNull(router, "router must not be null");
    }

    /// Invokes a tool.
    ///
    /// @param toolName namespaced or bare tool name, may be null
    /// @param arguments tool arguments, null is treated as empty
    /// @return the outcome with wall-clock execution time, never null
    public CallResult<ToolCallResponse> invoke(String toolName, Map<String, Object> arguments) {
        long start = System.nanoTime();
        try {
            Optional<Connection> owner = registry.resolve(toolName);
            if (owner.isEmpty()) {
                return failure(toolName, new ToolNotFoundException(toolName).getMessage(), start);
            }

            Connection connection = owner.get();
            if (!orchestrator.ensureHealthy(connection)) {
                return failure(toolName, unavailable(connection.serverName()), start);
            }

            Optional<Connection> current = registry.resolve(toolName);
            if (current.isEmpty()) {
                return failure(toolName, unavailable(connection.serverName()), start);
            }

            String localName = router.originalName(toolName);
            logger.fine(
                    "Calling tool '" + localName + "' on server '" + current.get().serverName() + "'");
            ToolCallResponse response =
                    manager.callTool(
                            current.get(), localName, arguments != null ? arguments : Map.of());

            if (response.isError()) {
                throw new ToolExecutionException(toolName, response.errorMessage());
            }
            return CallResult.success(response, elapsedMillis(start));
        } catch (ToolExecutionException e) {
            return failure(toolName, e.getMessage(), start);
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return failure(toolName, "Tool '" + toolName + "' failed: " + message, start);
        }
    }

    private static String unavailable(String serverName) {
        return "Connection to " + serverName + " unavailable";
    }

    private static CallResult<ToolCallResponse> failure(String toolName, String error, long start) {
        logger.warning("Tool call '" + toolName + "' failed: " + error);
        return CallResult.failure(error, elapsedMillis(start));
    }

    private static long elapsedMillis(long start) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    }
}
