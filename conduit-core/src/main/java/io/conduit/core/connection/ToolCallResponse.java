package io.conduit.core.connection;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/// Raw result of a remote `tools/call`.
///
/// `isError` reflects the server-reported application-level outcome; transport
/// failures never produce a response and are raised as exceptions instead.
///
/// @param content content blocks (`{"type": "text", "text": ...}` and others), not null
/// @param structuredContent optional structured payload, may be null
/// @param isError whether the server flagged the call as failed
public record ToolCallResponse(
        List<Map<String, Object>> content, Map<String, Object> structuredContent, boolean isError) {

    public ToolCallResponse {
        Objects.requireNonNull(content, "content must not be null");
        content = List.copyOf(content);
    }

    /// Creates a successful response carrying a single text block.
    ///
    /// @param text the text, not null
    /// @return new response, never null
    public static ToolCallResponse text(String text) {
        return new ToolCallResponse(List.of(Map.of("type", "text", "text", text)), null, false);
    }

    /// Creates an error response carrying a single text block.
    ///
    /// @param message the error text, not null
    /// @return new response, never null
    public static ToolCallResponse error(String message) {
        return new ToolCallResponse(List.of(Map.of("type", "text", "text", message)), null, true);
    }

    /// Joins the `text` of every text block with newlines.
    ///
    /// @return joined text, empty when there are no text blocks
    public String textContent() {
        return content.stream()
                .filter(block -> "text".equals(block.get("type")))
                .map(block -> String.valueOf(block.get("text")))
                .collect(Collectors.joining("\n"));
    }

    /// Returns the message to report when {@link #isError()} is set.
    ///
    /// @return the text content, or `Tool execution failed` when there is none
    public String errorMessage() {
        String text = textContent();
        return text.isBlank() ? "Tool execution failed" : text;
    }
}
