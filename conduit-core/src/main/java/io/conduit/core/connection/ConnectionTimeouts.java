package io.conduit.core.connection;

import java.time.Duration;
import java.util.Objects;

/// Time budgets for the operations of a {@link ConnectionManager}.
///
/// @param connect budget for the handshake and for the initial tool listing
/// @param healthCheck budget for the health-check round trip
/// @param toolCall budget for a single remote tool call
public record ConnectionTimeouts(Duration connect, Duration healthCheck, Duration toolCall) {

    public static final Duration DEFAULT_CONNECT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_HEALTH_CHECK = Duration.ofSeconds(5);
    public static final Duration DEFAULT_TOOL_CALL = Duration.ofSeconds(120);

    public ConnectionTimeouts {
        Objects.requireNonNull(connect, "connect must not be null");
        Objects.requireNonNull(healthCheck, "healthCheck must not be null");
        Objects.requireNonNull(toolCall, "toolCall must not be null");
        if (connect.isNegative() || connect.isZero()) {
            throw new IllegalArgumentException("connect timeout must be positive");
        }
        if (healthCheck.isNegative() || healthCheck.isZero()) {
            throw new IllegalArgumentException("healthCheck timeout must be positive");
        }
        if (toolCall.isNegative() || toolCall.isZero()) {
            throw new IllegalArgumentException("toolCall timeout must be positive");
        }
    }

    public static ConnectionTimeouts defaults() {
        return new ConnectionTimeouts(DEFAULT_CONNECT, DEFAULT_HEALTH_CHECK, DEFAULT_TOOL_CALL);
    }
}
