package io.conduit.server.agent;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/// Scheduled job that drops chat sessions idle for longer than
/// `conduit.agent.session-idle-timeout`.
///
/// ### Configuration
/// | Property                                   | Default | Description            |
/// |--------------------------------------------|---------|------------------------|
/// | `conduit.agent.session-eviction-interval`  | `1m`    | How often the job runs |
@ApplicationScoped
public class SessionEvictionJob {

    private static final Logger LOG = Logger.getLogger(SessionEvictionJob.class);

    private final AgentSessionManager sessions;

    @Inject
    public SessionEvictionJob(AgentSessionManager sessions) {
        this.sessions = sessions;
    }

    @Scheduled(
            every = "${conduit.agent.session-eviction-interval:1m}",
            delayed = "${conduit.agent.session-eviction-interval:1m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void tick() {
        int evicted = sessions.evictIdle();
        if (evicted > 0) {
            LOG.debugv(
                    "Evicted {0} idle sessions, {1} remain", evicted, sessions.sessionCount());
        }
    }
}
