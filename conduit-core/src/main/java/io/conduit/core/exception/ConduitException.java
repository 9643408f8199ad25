package io.conduit.core.exception;

import java.io.Serial;

/// Base exception for all Conduit runtime failures.
///
/// Per-invocation failures are reported as data (`CallResult`, stream `error`
/// events). Only lifecycle operations such as opening a connection or
/// initializing the runtime throw subclasses of this type.
///
/// @see ConfigurationException
/// @see ConnectionException
/// @see ToolExecutionException
/// @see ToolNotFoundException
public class ConduitException extends RuntimeException {

    @Serial private static final long serialVersionUID = -3180465920741356372L;

    public ConduitException(String message) {
        super(message);
    }

    public ConduitException(String message, Throwable cause) {
        super(message, cause);
    }
}
