package io.conduit.core.exception;

import java.io.Serial;

/// Thrown when a server or agent configuration is invalid.
///
/// Raised before any I/O is attempted. The message names the offending field.
public class ConfigurationException extends ConduitException {

    @Serial private static final long serialVersionUID = 7124586930224189001L;

    private final String field;

    /// Creates a configuration exception for a specific field.
    ///
    /// @param field the configuration field that failed validation, not null
    /// @param message human-readable description, not null
    public ConfigurationException(String field, String message) {
        super(message);
        this.field = field;
    }

    /// Returns the name of the field that failed validation.
    ///
    /// @return field name, never null
    public String getField() {
        return field;
    }
}
