package io.conduit.core.agent;

import java.util.Map;
import java.util.Objects;

/// Events yielded to the caller while an agent handles one user message.
///
/// Every turn ends with exactly one terminal event, {@link Done} or
/// {@link Error}, and nothing follows it.
///
/// ### Event types
/// | Type | Record | Terminal |
/// |------|--------|----------|
/// | `content` | {@link Content} | no |
/// | `reasoning` | {@link Reasoning} | no |
/// | `tool_call` | {@link ToolCall} | no |
/// | `error` | {@link Error} | yes |
/// | `done` | {@link Done} | yes |
public sealed interface StreamResponse
        permits StreamResponse.Content,
                StreamResponse.Reasoning,
                StreamResponse.ToolCall,
                StreamResponse.Error,
                StreamResponse.Done {

    /// Returns the wire discriminator of this event.
    ///
    /// @return event type, never null
    String type();

    /// Returns whether this event ends the turn.
    ///
    /// @return true for `done` and `error`
    default boolean isTerminal() {
        return false;
    }

    /// Final answer text.
    record Content(String text) implements StreamResponse {
        public Content {
            Objects.requireNonNull(text, "text must not be null");
        }

        @Override
        public String type() {
            return "content";
        }
    }

    /// Intermediate model reasoning (thoughts and plans).
    record Reasoning(String text) implements StreamResponse {
        public Reasoning {
            Objects.requireNonNull(text, "text must not be null");
        }

        @Override
        public String type() {
            return "reasoning";
        }
    }

    /// Progress of a tool call requested by the model.
    ///
    /// @param toolCallId identifier correlating the start and end events
    /// @param toolName requested tool name
    /// @param arguments requested arguments, never null
    /// @param status lifecycle stage of the call
    /// @param result tool output, present when completed
    /// @param error failure description, present when failed
    record ToolCall(
            String toolCallId,
            String toolName,
            Map<String, Object> arguments,
            Status status,
            String result,
            String error)
            implements StreamResponse {

        public enum Status {
            STARTED,
            COMPLETED,
            FAILED
        }

        public ToolCall {
            Objects.requireNonNull(toolCallId, "toolCallId must not be null");
            Objects.requireNonNull(status, "status must not be null");
            arguments = arguments != null ? arguments : Map.of();
        }

        public static ToolCall started(
                String toolCallId, String toolName, Map<String, Object> arguments) {
            return new ToolCall(toolCallId, toolName, arguments, Status.STARTED, null, null);
        }

        public static ToolCall completed(
                String toolCallId, String toolName, Map<String, Object> arguments, String result) {
            return new ToolCall(toolCallId, toolName, arguments, Status.COMPLETED, result, null);
        }

        public static ToolCall failed(
                String toolCallId, String toolName, Map<String, Object> arguments, String error) {
            return new ToolCall(toolCallId, toolName, arguments, Status.FAILED, null, error);
        }

        @Override
        public String type() {
            return "tool_call";
        }
    }

    /// Terminal failure of the turn.
    record Error(String message) implements StreamResponse {
        public Error {
            Objects.requireNonNull(message, "message must not be null");
        }

        public static Error of(String message) {
            return new Error(message != null ? message : "Unknown error");
        }

        @Override
        public String type() {
            return "error";
        }

        @Override
        public boolean isTerminal() {
            return true;
        }
    }

    /// Successful end of the turn.
    record Done() implements StreamResponse {
        @Override
        public String type() {
            return "done";
        }

        @Override
        public boolean isTerminal() {
            return true;
        }
    }
}
