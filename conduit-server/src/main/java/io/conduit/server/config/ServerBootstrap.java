package io.conduit.server.config;

import io.conduit.core.connection.RetryPolicy;
import io.conduit.core.connection.ServerConfig;
import io.conduit.core.tool.ToolOrchestrator;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import java.util.List;
import org.jboss.logging.Logger;

/// Connects to the configured tool servers on startup and disconnects on shutdown.
///
/// A total connection failure is retried under the configured
/// {@link RetryPolicy}. When every attempt fails the server still starts in a
/// degraded state; the scheduled health job keeps trying to reach the servers.
///
/// @see io.conduit.server.health.ToolServerHealthJob
@ApplicationScoped
public class ServerBootstrap {

    private static final Logger LOG = Logger.getLogger(ServerBootstrap.class);

    private final ToolOrchestrator orchestrator;
    private final List<ServerConfig> servers;
    private final RetryPolicy retryPolicy;

    private volatile boolean degraded;

    @Inject
    public ServerBootstrap(
            ToolOrchestrator orchestrator, List<ServerConfig> servers, RetryPolicy retryPolicy) {
        this.orchestrator = orchestrator;
        this.servers = servers;
        this.retryPolicy = retryPolicy;
    }

    /// Connects to the tool servers on application startup.
    ///
    /// @param ev the startup event
    void onStart(@Observes StartupEvent ev) {
        LOG.infov("Connecting to {0} tool servers...", servers.size());
        try {
            retryPolicy.execute(
                    "initialize tool servers",
                    () -> {
                        orchestrator.initialize(servers);
                        return null;
                    });
            degraded = false;
            LOG.infov("Tool orchestration ready: {0} tools", orchestrator.getAllTools().size());
        } catch (RuntimeException e) {
            degraded = true;
            LOG.warnv(
                    "Starting without tool servers after {0} attempts: {1}",
                    retryPolicy.maxAttempts(),
                    e.getMessage());
        }
    }

    /// Disconnects every tool server on application shutdown.
    ///
    /// @param ev the shutdown event
    void onStop(@Observes ShutdownEvent ev) {
        orchestrator.disconnect();
        LOG.info("Disconnected from tool servers");
    }

    /// @return true when startup failed to reach any tool server
    public boolean isDegraded() {
        return degraded;
    }
}
