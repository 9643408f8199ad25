package io.conduit.core.exception;

import java.io.Serial;

/// Thrown by a transport when the remote server reports an application-level
/// tool failure (as opposed to a transport failure).
public class ToolExecutionException extends ConduitException {

    @Serial private static final long serialVersionUID = 4410932087352019684L;

    private final String toolName;

    public ToolExecutionException(String toolName, String message) {
        super(message);
        this.toolName = toolName;
    }

    public ToolExecutionException(String toolName, String message, Throwable cause) {
        super(message, cause);
        this.toolName = toolName;
    }

    /// Returns the tool that failed.
    ///
    /// @return tool name, never null
    public String getToolName() {
        return toolName;
    }
}
