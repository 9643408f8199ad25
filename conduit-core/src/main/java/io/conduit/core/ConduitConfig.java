package io.conduit.core;

import io.conduit.core.agent.ConversationMemory;
import io.conduit.core.connection.ConnectionOrchestrator;
import io.conduit.core.connection.ConnectionTimeouts;
import io.conduit.core.connection.RetryPolicy;
import java.time.Duration;
import java.util.Objects;

/// Tunables of a Conduit environment.
///
/// ### Default Values
/// - `connectTimeout`: 10s
/// - `healthCheckTimeout`: 5s
/// - `toolCallTimeout`: 120s
/// - `healthCheckTtl`: 5s, the window in which a health check is trusted
/// - `retryPolicy`: 3 attempts, 1s initial delay, doubling, 20% jitter
/// - `historyWindow`: 20 messages
///
/// @see ConduitFactory#builder()
public final class ConduitConfig {

    private final ConnectionTimeouts timeouts;
    private final Duration healthCheckTtl;
    private final RetryPolicy retryPolicy;
    private final int historyWindow;

    private ConduitConfig(Builder builder) {
        this.timeouts =
                new ConnectionTimeouts(
                        builder.connectTimeout, builder.healthCheckTimeout, builder.toolCallTimeout);
        this.healthCheckTtl =
                Objects.requireNonNull(builder.healthCheckTtl, "healthCheckTtl must not be null");
        this.retryPolicy = Objects.requireNonNull(builder.retryPolicy, "retryPolicy must not be null");
        if (builder.historyWindow < 1) {
            throw new IllegalArgumentException("historyWindow must be at least 1");
        }
        this.historyWindow = builder.historyWindow;
    }

    /// Returns a configuration with every default.
    ///
    /// @return default configuration, never null
    public static ConduitConfig defaults() {
        return builder().build();
    }

    public ConnectionTimeouts getTimeouts() {
        return timeouts;
    }

    public Duration getHealthCheckTtl() {
        return healthCheckTtl;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public int getHistoryWindow() {
        return historyWindow;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration connectTimeout = ConnectionTimeouts.DEFAULT_CONNECT;
        private Duration healthCheckTimeout = ConnectionTimeouts.DEFAULT_HEALTH_CHECK;
        private Duration toolCallTimeout = ConnectionTimeouts.DEFAULT_TOOL_CALL;
        private Duration healthCheckTtl = ConnectionOrchestrator.DEFAULT_HEALTH_CHECK_TTL;
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private int historyWindow = ConversationMemory.DEFAULT_WINDOW_SIZE;

        private Builder() {}

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder healthCheckTimeout(Duration healthCheckTimeout) {
            this.healthCheckTimeout = healthCheckTimeout;
            return this;
        }

        public Builder toolCallTimeout(Duration toolCallTimeout) {
            this.toolCallTimeout = toolCallTimeout;
            return this;
        }

        public Builder healthCheckTtl(Duration healthCheckTtl) {
            this.healthCheckTtl = healthCheckTtl;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder historyWindow(int historyWindow) {
            this.historyWindow = historyWindow;
            return this;
        }

        public ConduitConfig build() {
            return new ConduitConfig(this);
        }
    }
}
