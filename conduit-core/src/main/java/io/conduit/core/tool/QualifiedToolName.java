package io.conduit.core.tool;

import java.util.Objects;

/// A tool identifier split into its owning server and server-local name.
///
/// @param serverName owning server, not null
/// @param originalName server-local tool name, not null
public record QualifiedToolName(String serverName, String originalName) {

    public QualifiedToolName {
        Objects.requireNonNull(serverName, "serverName must not be null");
        Objects.requireNonNull(originalName, "originalName must not be null");
    }

    /// Returns the wire form `<server>:<localName>`.
    @Override
    public String toString() {
        return serverName + ToolRouter.SEPARATOR + originalName;
    }
}
