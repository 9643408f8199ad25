package io.conduit.core.processor;

import io.conduit.core.connection.ToolCallResponse;
import io.conduit.core.tool.CallResult;
import io.conduit.core.tool.ToolOrchestrator;
import io.conduit.core.util.JsonCodec;
import java.util.Objects;

/// Runs model-proposed tool calls and converts each outcome to an
/// {@link Observation}. Never throws.
public final class ToolCallExecutor {

    static final String DEFAULT_ERROR = "Tool execution failed";

    private final ToolOrchestrator tools;
    private final JsonCodec codec;

    public ToolCallExecutor(ToolOrchestrator tools, JsonCodec codec) {
        this.tools = Objects.requireNonNull(tools, "tools must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    /// Executes a tool call.
    ///
    /// @param request call with an assigned id, not null
    /// @return the observation, never null
    public Observation execute(ToolCallRequest request) {
        String toolName = request.name() != null ? request.name() : "unknown";
        if (!request.isValid()) {
            return Observation.failure(request.id(), toolName, request.problem());
        }

        CallResult<ToolCallResponse> result = tools.callTool(request.name(), request.arguments());
        if (result.success()) {
            return Observation.success(request.id(), toolName, render(result.data()));
        }
        return Observation.failure(
                request.id(), toolName, result.error() != null ? result.error() : DEFAULT_ERROR);
    }

    private String render(ToolCallResponse response) {
        if (response == null) {
            return "";
        }
        if (response.structuredContent() != null) {
            return codec.toJson(response.structuredContent());
        }
        String text = response.textContent();
        return text.isBlank() ? codec.toJson(response.content()) : text;
    }
}
