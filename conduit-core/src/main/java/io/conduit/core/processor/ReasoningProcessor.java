package io.conduit.core.processor;

import io.conduit.core.agent.CancellationToken;
import io.conduit.core.agent.ConversationMessage;
import io.conduit.core.agent.StreamObserver;
import io.conduit.core.agent.StreamResponse;
import io.conduit.core.agent.spi.LanguageModel;
import io.conduit.core.util.JsonCodec;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Iterative reasoning loop shared by the ReAct and CoAct variants.
///
/// Each iteration asks the model for its next step given the running transcript
/// and the tool catalog, then:
/// - executes the tool calls selected by the variant and appends their
///   observations to the transcript, or
/// - emits the final answer as `content` followed by `done`.
///
/// The loop is capped at `maxIterations` model calls. Exhausting the cap,
/// cancellation, and model failures each end the turn with an `error` event.
/// Failed tool calls are not fatal: their observations carry an error and the
/// model decides what to do next.
///
/// Variants supply the system prompt and decide which of a turn's proposed
/// tool calls to run; everything else is shared.
///
/// @implNote Not thread-safe per call: one {@link #process} invocation owns its
/// transcript. A processor instance may serve sequential turns.
public abstract class ReasoningProcessor implements Processor {

    private static final Logger logger = Logger.getLogger(ReasoningProcessor.class.getName());

    /// Placeholder replaced by the rendered tool catalog in system prompts.
    public static final String TOOLS_PLACEHOLDER = "{{TOOLS}}";

    static final String CANCELLED = "Request cancelled";
    static final String FORMAT_REMINDER =
            "Your previous reply contained neither a <tool_call> nor a <response>."
                    + " Reply with exactly one of them.";

    private final LanguageModel model;
    private final ToolCatalog catalog;
    private final ToolCallExecutor executor;
    private final ModelTurnParser parser;
    private final JsonCodec codec;
    private final int maxIterations;
    private final String systemPromptOverride;

    protected ReasoningProcessor(
            LanguageModel model,
            ToolCatalog catalog,
            ToolCallExecutor executor,
            ToolCallParser toolCallParser,
            JsonCodec codec,
            int maxIterations,
            String systemPromptOverride) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.parser = new ModelTurnParser(toolCallParser);
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1");
        }
        this.maxIterations = maxIterations;
        this.systemPromptOverride = systemPromptOverride;
    }

    /// Returns the variant's default system prompt, containing {@link #TOOLS_PLACEHOLDER}.
    ///
    /// @return prompt template, never null
    protected abstract String defaultSystemPrompt();

    /// Picks which of a turn's proposed tool calls to execute, in order.
    ///
    /// @param turn the parsed model output, not null
    /// @return calls to execute, empty when the turn proposes none
    protected abstract List<ToolCallRequest> selectToolCalls(ModelTurn turn);

    /// Returns the variant name for logs.
    ///
    /// @return variant name, never null
    public abstract String name();

    public int maxIterations() {
        return maxIterations;
    }

    @Override
    public void process(
            String message,
            List<ConversationMessage> history,
            StreamObserver observer,
            CancellationToken cancellation) {
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(observer, "observer must not be null");
        Objects.requireNonNull(cancellation, "cancellation must not be null");

        List<ConversationMessage> transcript = new ArrayList<>();
        transcript.add(ConversationMessage.system(systemPrompt()));
        if (history != null) {
            transcript.addAll(history);
        }
        transcript.add(ConversationMessage.user("<question>" + message + "</question>"));

        int callCounter = 0;
        try {
            for (int iteration = 1; iteration <= maxIterations; iteration++) {
                if (cancellation.isCancelled()) {
                    observer.onResponse(StreamResponse.Error.of(CANCELLED));
                    return;
                }

                logger.fine(name() + " iteration " + iteration + "/" + maxIterations);
                String output = model.generate(List.copyOf(transcript));
                ModelTurn turn = parser.parse(output);
                emitReasoning(turn, observer);

                List<ToolCallRequest> calls = selectToolCalls(turn);
                if (!calls.isEmpty()) {
                    transcript.add(ConversationMessage.assistant(output != null ? output : ""));
                    List<Observation> observations = new ArrayList<>();
                    for (ToolCallRequest call : calls) {
                        if (cancellation.isCancelled()) {
                            observer.onResponse(StreamResponse.Error.of(CANCELLED));
                            return;
                        }
                        callCounter++;
                        ToolCallRequest identified =
                                call.id() != null && !call.id().isBlank()
                                        ? call
                                        : call.withId(String.format("call_%03d", callCounter));
                        observations.add(runToolCall(identified, observer));
                    }
                    transcript.add(ConversationMessage.user(formatObservations(observations)));
                    continue;
                }

                String answer = turn.finalAnswer();
                if (answer != null) {
                    observer.onResponse(new StreamResponse.Content(answer));
                    observer.onResponse(new StreamResponse.Done());
                    return;
                }

                transcript.add(ConversationMessage.assistant(output != null ? output : ""));
                transcript.add(ConversationMessage.user(FORMAT_REMINDER));
            }

            logger.warning(name() + " reached the iteration cap of " + maxIterations);
            observer.onResponse(
                    StreamResponse.Error.of(
                            "Reached the maximum of "
                                    + maxIterations
                                    + " reasoning iterations without a final response"));
        } catch (RuntimeException e) {
            logger.warning(name() + " failed: " + e.getMessage());
            observer.onResponse(
                    StreamResponse.Error.of(
                            "Model call failed: "
                                    + (e.getMessage() != null
                                            ? e.getMessage()
                                            : e.getClass().getSimpleName())));
        }
    }

    /// Builds the system prompt: the override when set, otherwise the variant
    /// default, with the tool catalog substituted for {@link #TOOLS_PLACEHOLDER}.
    /// An override without the placeholder gets the catalog appended.
    ///
    /// @return system prompt, never null
    String systemPrompt() {
        String tools = catalog.render();
        if (systemPromptOverride == null || systemPromptOverride.isBlank()) {
            return defaultSystemPrompt().replace(TOOLS_PLACEHOLDER, tools);
        }
        if (systemPromptOverride.contains(TOOLS_PLACEHOLDER)) {
            return systemPromptOverride.replace(TOOLS_PLACEHOLDER, tools);
        }
        return systemPromptOverride + "\n\n<tools>\n" + tools + "\n</tools>";
    }

    private Observation runToolCall(ToolCallRequest call, StreamObserver observer) {
        String toolName = call.name() != null ? call.name() : "unknown";
        observer.onResponse(StreamResponse.ToolCall.started(call.id(), toolName, call.arguments()));

        Observation observation = executor.execute(call);

        if (observation.isSuccess()) {
            observer.onResponse(
                    StreamResponse.ToolCall.completed(
                            call.id(), toolName, call.arguments(), observation.result()));
        } else {
            observer.onResponse(
                    StreamResponse.ToolCall.failed(
                            call.id(), toolName, call.arguments(), observation.error()));
        }
        return observation;
    }

    private void emitReasoning(ModelTurn turn, StreamObserver observer) {
        if (turn.plan() != null && !turn.plan().isBlank()) {
            observer.onResponse(new StreamResponse.Reasoning(turn.plan()));
        }
        if (turn.thought() != null && !turn.thought().isBlank()) {
            observer.onResponse(new StreamResponse.Reasoning(turn.thought()));
        }
    }

    private String formatObservations(List<Observation> observations) {
        StringBuilder text = new StringBuilder();
        for (Observation observation : observations) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("tool_call_id", observation.toolCallId());
            payload.put("tool_name", observation.toolName());
            payload.put("result", observation.result());
            if (observation.error() != null) {
                payload.put("error", observation.error());
            }
            if (text.length() > 0) {
                text.append('\n');
            }
            text.append("<observation>").append(codec.toJson(payload)).append("</observation>");
        }
        return text.toString();
    }
}
