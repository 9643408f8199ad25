package io.conduit.core.processor;

import java.util.Map;

/// A tool call proposed by the model.
///
/// A request that could not be understood (malformed JSON, missing name,
/// non-object arguments) is still represented, with `problem` set, so the loop
/// can report the problem back to the model as an observation.
///
/// @param id call identifier, null until assigned by the loop
/// @param name requested tool name, null if missing
/// @param arguments call arguments, never null
/// @param problem why the request is unusable, null for a valid request
public record ToolCallRequest(
        String id, String name, Map<String, Object> arguments, String problem) {

    public ToolCallRequest {
        arguments = arguments != null ? arguments : Map.of();
    }

    public static ToolCallRequest of(String id, String name, Map<String, Object> arguments) {
        return new ToolCallRequest(id, name, arguments, null);
    }

    public static ToolCallRequest invalid(String id, String name, String problem) {
        return new ToolCallRequest(id, name, Map.of(), problem);
    }

    public boolean isValid() {
        return problem == null;
    }

    public ToolCallRequest withId(String newId) {
        return new ToolCallRequest(newId, name, arguments, problem);
    }
}
