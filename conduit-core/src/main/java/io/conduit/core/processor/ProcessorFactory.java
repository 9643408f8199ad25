package io.conduit.core.processor;

import io.conduit.core.agent.AgentConfig;
import io.conduit.core.agent.spi.LanguageModel;
import io.conduit.core.util.JsonCodec;
import java.util.Objects;
import java.util.logging.Logger;

/// Creates the processor variant named by an {@link AgentConfig}.
public class ProcessorFactory {

    private static final Logger logger = Logger.getLogger(ProcessorFactory.class.getName());

    private final JsonCodec codec;
    private final ToolCallParser toolCallParser;

    public ProcessorFactory(JsonCodec codec) {
        this(codec, new JsonToolCallParser(codec));
    }

    public ProcessorFactory(JsonCodec codec, ToolCallParser toolCallParser) {
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.toolCallParser = Objects.requireNonNull(toolCallParser, "toolCallParser must not be null");
    }

    /// Creates a processor.
    ///
    /// @param config agent configuration, not null
    /// @param model language model, not null
    /// @param catalog tool catalog, not null
    /// @param executor tool call executor, not null
    /// @return new processor, never null
    public ReasoningProcessor create(
            AgentConfig config, LanguageModel model, ToolCatalog catalog, ToolCallExecutor executor) {
        Objects.requireNonNull(config, "config must not be null");
        ReasoningProcessor processor =
                switch (config.getProcessorType()) {
                    case COACT -> new CoActProcessor(
                            model,
                            catalog,
                            executor,
                            toolCallParser,
                            codec,
                            config.getMaxIterations(),
                            config.getSystemPrompt());
                    case REACT -> new ReActProcessor(
                            model,
                            catalog,
                            executor,
                            toolCallParser,
                            codec,
                            config.getMaxIterations(),
                            config.getSystemPrompt());
                };
        logger.info(
                "Created "
                        + processor.name()
                        + " processor (max iterations: "
                        + processor.maxIterations()
                        + ")");
        return processor;
    }
}
