package io.conduit.core.processor;

import java.util.List;

/// One parsed model output.
///
/// @param thought content of `<thought>`, null if absent
/// @param plan content of `<plan>`, null if absent
/// @param toolCalls every `<tool_call>` block in order, never null
/// @param response content of `<response>`, null if absent
/// @param untagged text outside all known tags, trimmed, never null
public record ModelTurn(
        String thought,
        String plan,
        List<ToolCallRequest> toolCalls,
        String response,
        String untagged) {

    public ModelTurn {
        toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
        untagged = untagged != null ? untagged : "";
    }

    /// Returns the final answer of this turn, if it has one.
    ///
    /// An explicit `<response>` wins; otherwise non-blank untagged text is
    /// taken as the answer of a model that ignored the tag format.
    ///
    /// @return answer text, or null if the turn carries no answer
    public String finalAnswer() {
        if (response != null && !response.isBlank()) {
            return response.trim();
        }
        return untagged.isBlank() ? null : untagged;
    }
}
