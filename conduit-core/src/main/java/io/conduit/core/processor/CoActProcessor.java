package io.conduit.core.processor;

import io.conduit.core.agent.spi.LanguageModel;
import io.conduit.core.util.JsonCodec;
import java.util.List;

/// Coordinated-action loop: a model turn may lay out a plan and propose a
/// batch of tool calls that run in order before the model is asked again.
///
/// Termination and tool invocation follow the shared loop; only prompting and
/// tool-call selection differ from {@link ReActProcessor}.
public class CoActProcessor extends ReasoningProcessor {

    static final String SYSTEM_PROMPT =
            """
            You are a helpful assistant that plans and coordinates tool use to answer questions.

            Available tools:
            <tools>
            {{TOOLS}}
            </tools>

            The user's question is wrapped in <question> tags. On every turn:
            1. Think inside <thought> tags. When several steps are needed, outline them in <plan> tags.
            2. Then either propose one or more independent tool calls, each in its own block:
               <tool_call>{"name": "server:tool", "arguments": {...}, "id": "call_001"}</tool_call>
               or give the final answer inside <response> tags.

            All tool calls of a turn run in the order given and their results come back together,
            each in an <observation> tag. Failed calls carry an "error" field.
            """;

    public CoActProcessor(
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
        return turn.toolCalls();
    }

    @Override
    public String name() {
        return "coact";
    }
}
