package io.conduit.core.exception;

import java.io.Serial;

/// Thrown when a connection to a tool server cannot be established or used.
///
/// Always carries the name of the server involved so that callers aggregating
/// failures across servers can report which one failed.
public class ConnectionException extends ConduitException {

    @Serial private static final long serialVersionUID = 2861092455783310427L;

    private final String serverName;

    public ConnectionException(String serverName, String message) {
        super(message);
        this.serverName = serverName;
    }

    public ConnectionException(String serverName, String message, Throwable cause) {
        super(message, cause);
        this.serverName = serverName;
    }

    /// Returns the server this failure relates to.
    ///
    /// @return server name, may be null for aggregate failures
    public String getServerName() {
        return serverName;
    }

    /// Creates an exception for a failed connect handshake.
    ///
    /// @param serverName the server that failed, not null
    /// @param cause the underlying cause, not null
    /// @return new exception, never null
    public static ConnectionException connectFailed(String serverName, Throwable cause) {
        return new ConnectionException(
                serverName,
                "Failed to connect to server '" + serverName + "': " + describe(cause),
                cause);
    }

    /// Creates an exception for the case where every configured server failed.
    ///
    /// @param attempted number of servers that were attempted
    /// @return new exception, never null
    public static ConnectionException noServersConnected(int attempted) {
        return new ConnectionException(
                null,
                "Failed to connect to any tool servers (" + attempted + " attempted)");
    }

    static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
