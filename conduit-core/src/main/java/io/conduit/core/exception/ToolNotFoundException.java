package io.conduit.core.exception;

import java.io.Serial;

/// Thrown when a tool name has no owning connection.
public class ToolNotFoundException extends ConduitException {

    @Serial private static final long serialVersionUID = -6203391743317425540L;

    private final String toolName;

    public ToolNotFoundException(String toolName) {
        super("Tool '" + toolName + "' not found");
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
