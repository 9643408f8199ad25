package io.conduit.core.agent;

import java.util.Locale;

/// Reasoning loop variant used by an agent.
public enum ProcessorType {
    /// Strict reason-then-act: one tool call per model turn.
    REACT("react"),
    /// Coordinated action: a model turn may propose several tool calls.
    COACT("coact");

    private final String id;

    ProcessorType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /// Resolves a variant from its identifier, case-insensitively.
    ///
    /// @param value `react` or `coact`, may be null
    /// @return the matching variant, {@link #REACT} for null or blank input
    /// @throws IllegalArgumentException if the identifier is unknown
    public static ProcessorType from(String value) {
        if (value == null || value.isBlank()) {
            return REACT;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ProcessorType type : values()) {
            if (type.id.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown processor type: " + value);
    }
}
