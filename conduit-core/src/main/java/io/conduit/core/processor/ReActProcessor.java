package io.conduit.core.processor;

import io.conduit.core.agent.spi.LanguageModel;
import io.conduit.core.util.JsonCodec;
import java.util.List;
import java.util.logging.Logger;

/// Strict reason-then-act loop: one tool call per model turn.
///
/// When a turn proposes several tool calls only the first runs; the model
/// sees its observation before deciding on the next action.
public class ReActProcessor extends ReasoningProcessor {

    private static final Logger logger = Logger.getLogger(ReActProcessor.class.getName());

    static final String SYSTEM_PROMPT =
            """
            You are a helpful assistant that answers questions step by step and can call tools.

            Available tools:
            <tools>
            {{TOOLS}}
            </tools>

            The user's question is wrapped in <question> tags. On every turn, first think inside
            <thought> tags. Then do exactly one of the following:
            - call one tool with <tool_call>{"name": "server:tool", "arguments": {...}, "id": "call_001"}</tool_call>
            - give the final answer inside <response> tags

            Tool results are returned to you inside <observation> tags. If a tool fails, the
            observation contains an "error" field; adapt your approach instead of repeating the
            same call.
            """;

    public ReActProcessor(
            LanguageModel model,
            ToolCatalog catalog,
            ToolCallExecutor executor,
            ToolCallParser toolCallParser,
            JsonCodec codec,
            int maxIterations,
            String systemPromptOverride) {
        super(model, catalog, executor, toolCallParser, codec, maxIterations, systemPromptOverride);
    }

    @Override
    protected String defaultSystemPrompt() {
        return SYSTEM_PROMPT;
    }

    @Override
    protected List<ToolCallRequest> selectToolCalls(ModelTurn turn) {
        List<ToolCallRequest> proposed = turn.toolCalls();
        if (proposed.isEmpty()) {
            return List.of();
        }
        if (proposed.size() > 1) {
            logger.fine("Ignoring " + (proposed.size() - 1) + " extra tool calls in ReAct turn");
        }
        return List.of(proposed.get(0));
    }

    @Override
    public String name() {
        return "react";
    }
}
