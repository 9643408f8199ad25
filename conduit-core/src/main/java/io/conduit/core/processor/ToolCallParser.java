package io.conduit.core.processor;

/// Parses the body of a `<tool_call>` block.
///
/// The body is a JSON object `{"name": ..., "arguments": {...}, "id": ...}`.
///
/// @see JsonToolCallParser
@FunctionalInterface
public interface ToolCallParser {

    /// Parses a tool call body. Never throws.
    ///
    /// @param body the text between the tags, not null
    /// @return the request, marked invalid when the body cannot be used
    ToolCallRequest parse(String body);
}
