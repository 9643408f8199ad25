package io.conduit.core.connection;

import java.time.Instant;

/// Per-server health snapshot for dashboards.
///
/// @param connected whether the server currently has a live connection
/// @param toolCount number of tools exposed, `0` when disconnected
/// @param lastCheck time of the last successful health check, null if never
/// @param errorCount number of failed connection attempts
public record ConnectionStatus(boolean connected, int toolCount, Instant lastCheck, int errorCount) {

    static ConnectionStatus neverConnected(int errorCount) {
        return new ConnectionStatus(false, 0, null, errorCount);
    }
}
