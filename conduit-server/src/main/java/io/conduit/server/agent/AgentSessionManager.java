package io.conduit.server.agent;

import io.conduit.core.ConduitEnvironment;
import io.conduit.core.agent.AgentConfig;
import io.conduit.core.agent.AgentRuntime;
import io.conduit.core.agent.CancellationToken;
import io.conduit.core.agent.StreamResponse;
import io.conduit.server.validation.LogSanitizer;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/// Holds one {@link AgentRuntime} per chat session and turns messages into
/// event streams.
///
/// Sessions are created on first use with the default agent configuration and
/// live until deleted or idle for longer than the idle timeout, after which
/// {@link #evictIdle()} drops them. Turns of one session run one at a time; a
/// second message waits for the running turn to finish.
///
/// ### Cancellation
/// Each turn gets its own {@link CancellationToken} with the configured turn
/// deadline. Cancelling the returned `Multi` (the SSE client disconnecting)
/// cancels the token, which stops the reasoning loop before its next model or
/// tool call.
///
/// ### Configuration
/// | Property | Default | Description |
/// |----------|---------|-------------|
/// | `conduit.agent.turn-timeout` | `5m` | Deadline of a single turn |
/// | `conduit.agent.session-idle-timeout` | `30m` | Idle time after which a session is evicted |
@ApplicationScoped
public class AgentSessionManager {

    private static final Logger LOG = Logger.getLogger(AgentSessionManager.class);

    private final ConduitEnvironment environment;
    private final AgentConfig defaultConfig;
    private final Duration turnTimeout;
    private final Duration idleTimeout;
    private final Executor executor;
    private final Clock clock;
    private final ConcurrentHashMap<String, Session> sessions = new ConcurrentHashMap<>();

    @Inject
    public AgentSessionManager(
            ConduitEnvironment environment,
            AgentConfig defaultConfig,
            @ConfigProperty(name = "conduit.agent.turn-timeout", defaultValue = "5m")
                    Duration turnTimeout,
            @ConfigProperty(name = "conduit.agent.session-idle-timeout", defaultValue = "30m")
                    Duration idleTimeout) {
        this(
                environment,
                defaultConfig,
                turnTimeout,
                idleTimeout,
                Infrastructure.getDefaultWorkerPool(),
                Clock.systemUTC());
    }

    public AgentSessionManager(
            ConduitEnvironment environment,
            AgentConfig defaultConfig,
            Duration turnTimeout,
            Duration idleTimeout,
            Executor executor,
            Clock clock) {
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
        this.defaultConfig = Objects.requireNonNull(defaultConfig, "defaultConfig must not be null");
        this.turnTimeout = Objects.requireNonNull(turnTimeout, "turnTimeout must not be null");
        this.idleTimeout = Objects.requireNonNull(idleTimeout, "idleTimeout must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /// Streams the events of one turn.
    ///
    /// The turn starts when the stream is subscribed and runs on a worker
    /// thread. The stream completes after the terminal event.
    ///
    /// @param sessionId session identifier, not null
    /// @param message the user's message, not null
    /// @return cold stream of the turn's events, never null
    public Multi<StreamResponse> chat(String sessionId, String message) {
        Session session = session(sessionId);
        return Multi.createFrom()
                .<StreamResponse>emitter(
                        emitter -> {
                            CancellationToken cancellation =
                                    CancellationToken.withTimeout(turnTimeout);
                            emitter.onTermination(cancellation::cancel);
                            session.lock.lock();
                            try {
                                session.runtime.handleChat(
                                        message,
                                        event -> {
                                            if (!emitter.isCancelled()) {
                                                emitter.emit(event);
                                            }
                                        },
                                        cancellation);
                                emitter.complete();
                            } catch (RuntimeException e) {
                                LOG.errorv(
                                        e,
                                        "Chat turn failed for session {0}",
                                        LogSanitizer.sanitize(sessionId));
                                emitter.fail(e);
                            } finally {
                                session.touch(clock.instant());
                                session.lock.unlock();
                            }
                        })
                .runSubscriptionOn(executor);
    }

    /// Clears the conversation history and rebuilds the processor on the next message.
    ///
    /// @param sessionId session identifier, not null
    /// @return true if the session existed
    public boolean reset(String sessionId) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            return false;
        }
        session.runtime.reset();
        session.runtime.memory().clear();
        LOG.infov("Session reset: {0}", LogSanitizer.sanitize(sessionId));
        return true;
    }

    /// Replaces the model auth token of a session, creating the session if needed.
    ///
    /// @param sessionId session identifier, not null
    /// @param authToken new token, null to fall back to provider credentials
    public void updateAuthToken(String sessionId, String authToken) {
        session(sessionId).runtime.updateAuthToken(authToken);
        LOG.infov("Auth token updated for session: {0}", LogSanitizer.sanitize(sessionId));
    }

    /// Replaces the agent configuration of a session, creating the session if needed.
    ///
    /// @param sessionId session identifier, not null
    /// @param config new configuration, not null
    public void updateConfig(String sessionId, AgentConfig config) {
        session(sessionId).runtime.updateConfig(config);
    }

    /// Looks up the runtime of a session without creating it.
    ///
    /// @param sessionId session identifier, not null
    /// @return the runtime, empty if the session does not exist
    public Optional<AgentRuntime> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId)).map(session -> session.runtime);
    }

    /// Deletes a session.
    ///
    /// @param sessionId session identifier, not null
    /// @return true if the session existed
    public boolean remove(String sessionId) {
        boolean removed = sessions.remove(sessionId) != null;
        if (removed) {
            LOG.infov("Session removed: {0}", LogSanitizer.sanitize(sessionId));
        }
        return removed;
    }

    public int sessionCount() {
        return sessions.size();
    }

    /// Drops sessions that have not been used for longer than the idle timeout.
    ///
    /// A session with a turn in progress is never evicted.
    ///
    /// @return number of sessions evicted
    public int evictIdle() {
        Instant cutoff = clock.instant().minus(idleTimeout);
        int evicted = 0;
        for (Map.Entry<String, Session> entry : sessions.entrySet()) {
            Session session = entry.getValue();
            if (session.lock.isLocked() || !session.lastUsed().isBefore(cutoff)) {
                continue;
            }
            if (sessions.remove(entry.getKey(), session)) {
                evicted++;
                LOG.infov(
                        "Session evicted after idle timeout: {0}",
                        LogSanitizer.sanitize(entry.getKey()));
            }
        }
        return evicted;
    }

    private Session session(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Instant now = clock.instant();
        Session session =
                sessions.computeIfAbsent(
                        sessionId,
                        id -> {
                            LOG.infov("Session created: {0}", LogSanitizer.sanitize(id));
                            return new Session(environment.createRuntime(defaultConfig), now);
                        });
        session.touch(now);
        return session;
    }

    private static final class Session {
        private final AgentRuntime runtime;
        private final ReentrantLock lock = new ReentrantLock();
        private volatile Instant lastUsed;

        Session(AgentRuntime runtime, Instant createdAt) {
            this.runtime = runtime;
            this.lastUsed = createdAt;
        }

        void touch(Instant now) {
            lastUsed = now;
        }

        Instant lastUsed() {
            return lastUsed;
        }
    }
}
