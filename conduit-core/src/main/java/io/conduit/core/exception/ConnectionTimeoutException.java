package io.conduit.core.exception;

import java.io.Serial;
import java.time.Duration;

/// Thrown when a connection-level operation exceeds its time budget.
///
/// Carries the operation name (`connect`, `health-check`, `tools/call`) and
/// the timeout that was exceeded.
public class ConnectionTimeoutException extends ConnectionException {

    @Serial private static final long serialVersionUID = -1457802262031547791L;

    private final String operation;
    private final Duration timeout;

    public ConnectionTimeoutException(String serverName, String operation, Duration timeout) {
        super(
                serverName,
                "Operation '"
                        + operation
                        + "' on server '"
                        + serverName
                        + "' timed out after "
                        + timeout.toMillis()
                        + "ms");
        this.operation = operation;
        this.timeout = timeout;
    }

    /// Creates a timeout exception.
    ///
    /// @param serverName the server, not null
    /// @param operation the operation that timed out, not null
    /// @param timeout the budget that was exceeded, not null
    /// @return new exception, never null
    public static ConnectionTimeoutException of(
            String serverName, String operation, Duration timeout) {
        return new ConnectionTimeoutException(serverName, operation, timeout);
    }

    public String getOperation() {
        return operation;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
