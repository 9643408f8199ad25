package io.conduit.server.health;

import io.conduit.core.connection.ConnectionStatus;
import io.conduit.core.tool.ToolOrchestrator;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Map;
import org.jboss.logging.Logger;

/// Scheduled job that health-checks live tool-server connections and retries
/// servers that are down.
///
/// ### Configuration
/// | Property                            | Default | Description              |
/// |-------------------------------------|---------|--------------------------|
/// | `conduit.mcp.health-check-interval` | `30s`   | How often the job runs   |
///
/// @implNote Runs with `SKIP` concurrent execution so a slow round never
/// overlaps the next one.
@ApplicationScoped
public class ToolServerHealthJob {

    private static final Logger LOG = Logger.getLogger(ToolServerHealthJob.class);

    private final ToolOrchestrator orchestrator;

    @Inject
    public ToolServerHealthJob(ToolOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Scheduled(
            every = "${conduit.mcp.health-check-interval:30s}",
            delayed = "${conduit.mcp.health-check-interval:30s}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void tick() {
        orchestrator.performHealthChecks();
        Map<String, ConnectionStatus> status = orchestrator.getStatus();
        long connected = status.values().stream().filter(ConnectionStatus::connected).count();
        LOG.debugv(
                "Health check round finished: {0}/{1} servers connected", connected, status.size());
    }
}
