package io.conduit.core.processor;

import java.util.Objects;

/// Result of a tool call as fed back into the reasoning loop.
///
/// A failed call is a normal observation with `error` set; the model sees it
/// and can adapt.
///
/// @param toolCallId identifier of the originating tool call, not null
/// @param toolName requested tool name, not null
/// @param result tool output, null when the call failed
/// @param error failure description, null when the call succeeded
public record Observation(String toolCallId, String toolName, String result, String error) {

    public Observation {
        Objects.requireNonNull(toolCallId, "toolCallId must not be null");
        Objects.requireNonNull(toolName, "toolName must not be null");
    }

    public static Observation success(String toolCallId, String toolName, String result) {
        return new Observation(toolCallId, toolName, result, null);
    }

    public static Observation failure(String toolCallId, String toolName, String error) {
        return new Observation(toolCallId, toolName, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
