package io.conduit.core.agent;

import io.conduit.core.agent.spi.LanguageModel;
import io.conduit.core.processor.Processor;
import io.conduit.core.processor.ProcessorFactory;
import io.conduit.core.processor.ToolCallExecutor;
import io.conduit.core.processor.ToolCatalog;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Per-session entry point that turns one user message into an ordered stream
/// of {@link StreamResponse} events.
///
/// The processor is built lazily on the first message, after the tool catalog
/// is invalidated, and reused for later messages until the configuration
/// changes or {@link #reset()} is called.
///
/// ### Per message
/// 1. Read the bounded conversation history.
/// 2. Build the processor if needed (`UNINITIALIZED → PROCESSOR_READY`).
/// 3. Run the reasoning loop, forwarding its events (`ITERATING ⇄ TOOL_CALL`).
/// 4. Guarantee exactly one terminal event (`DONE` or `ERROR`).
/// 5. Record the exchange in conversation memory when an answer was produced.
///    The long-term write is asynchronous and never affects the stream.
///
/// @implNote Thread-safe for configuration changes. Messages for one session
/// are expected to be handled one at a time; concurrent turns share the
/// processor but not their transcripts.
///
/// @see ProcessorFactory
/// @see ConversationMemory
public class AgentRuntime {

    private static final Logger logger = Logger.getLogger(AgentRuntime.class.getName());

    private final LanguageModelFactory modelFactory;
    private final ProcessorFactory processorFactory;
    private final ToolCatalog catalog;
    private final ToolCallExecutor toolExecutor;
    private final ConversationMemory memory;
    private final Object lock = new Object();

    private volatile AgentConfig config;
    private volatile Processor processor;
    private volatile RuntimeState state = RuntimeState.UNINITIALIZED;

    public AgentRuntime(
            AgentConfig config,
            LanguageModelFactory modelFactory,
            ProcessorFactory processorFactory,
            ToolCatalog catalog,
            ToolCallExecutor toolExecutor,
            ConversationMemory memory) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.modelFactory = Objects.requireNonNull(modelFactory, "modelFactory must not be null");
        this.processorFactory =
                Objects.requireNonNull(processorFactory, "processorFactory must not be null");
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.toolExecutor = Objects.requireNonNull(toolExecutor, "toolExecutor must not be null");
        this.memory = Objects.requireNonNull(memory, "memory must not be null");
    }

    /// Handles one user message, delivering events to the observer.
    ///
    /// Blocks until the turn is over. Never throws for model, tool or
    /// configuration failures; they arrive as a terminal `error` event.
    ///
    /// @param message the user's message, not null
    /// @param observer receives events in order, not null
    /// @param cancellation aborts the turn when cancelled, not null
    public void handleChat(String message, StreamObserver observer, CancellationToken cancellation) {
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(observer, "observer must not be null");
        Objects.requireNonNull(cancellation, "cancellation must not be null");

        TurnTracker turn = new TurnTracker(observer);
        List<ConversationMessage> history = memory.history();

        Processor active;
        try {
            active = ensureProcessor();
        } catch (RuntimeException e) {
            logger.warning("Failed to create processor: " + e.getMessage());
            turn.onResponse(StreamResponse.Error.of("Failed to initialize agent: " + e.getMessage()));
            return;
        }

        state = RuntimeState.ITERATING;
        try {
            active.process(message, history, turn, cancellation);
        } catch (RuntimeException e) {
            logger.warning("Reasoning loop failed: " + e.getMessage());
            turn.onResponse(StreamResponse.Error.of(e.getMessage()));
        }
        if (!turn.terminated) {
            turn.onResponse(new StreamResponse.Done());
        }

        if (!turn.answer.isEmpty()) {
            memory.record(message, turn.answer.toString());
        }
    }

    /// Handles one user message and collects its events.
    ///
    /// @param message the user's message, not null
    /// @return all events of the turn, the last one terminal, never null
    public List<StreamResponse> chat(String message) {
        List<StreamResponse> events = new ArrayList<>();
        handleChat(message, events::add, CancellationToken.create());
        return events;
    }

    /// Discards the processor and the cached tool catalog.
    public void reset() {
        synchronized (lock) {
            processor = null;
            catalog.invalidate();
            state = RuntimeState.UNINITIALIZED;
        }
        logger.fine("Agent runtime reset");
    }

    /// Replaces the configuration and resets the runtime.
    ///
    /// @param newConfig new configuration, not null
    public void updateConfig(AgentConfig newConfig) {
        Objects.requireNonNull(newConfig, "newConfig must not be null");
        synchronized (lock) {
            config = newConfig;
            reset();
        }
        logger.info("Agent configuration updated: " + newConfig);
    }

    /// Replaces the model auth token and resets the runtime so the next message
    /// builds a model with the new credentials.
    ///
    /// @param authToken new token, null to fall back to provider credentials
    public void updateAuthToken(String authToken) {
        synchronized (lock) {
            updateConfig(config.toBuilder().authToken(authToken).build());
        }
    }

    public AgentConfig config() {
        return config;
    }

    public RuntimeState state() {
        return state;
    }

    public ConversationMemory memory() {
        return memory;
    }

    private Processor ensureProcessor() {
        synchronized (lock) {
            if (processor == null) {
                catalog.invalidate();
                AgentConfig current = config;
                LanguageModel model = modelFactory.createModel(current);
                processor = processorFactory.create(current, model, catalog, toolExecutor);
                state = RuntimeState.PROCESSOR_READY;
            }
            return processor;
        }
    }

    /// Forwards events, tracks state and suppresses anything after the first
    /// terminal event.
    private final class TurnTracker implements StreamObserver {
        private final StreamObserver delegate;
        private final StringBuilder answer = new StringBuilder();
        private boolean terminated;

        TurnTracker(StreamObserver delegate) {
            this.delegate = delegate;
        }

        @Override
        public void onResponse(StreamResponse response) {
            if (terminated) {
                logger.fine("Dropping event after end of turn: " + response.type());
                return;
            }
            if (response instanceof StreamResponse.Content content) {
                answer.append(content.text());
            } else if (response instanceof StreamResponse.ToolCall toolCall) {
                state =
                        toolCall.status() == StreamResponse.ToolCall.Status.STARTED
                                ? RuntimeState.TOOL_CALL
                                : RuntimeState.ITERATING;
            } else if (response instanceof StreamResponse.Done) {
                terminated = true;
                state = RuntimeState.DONE;
            } else if (response instanceof StreamResponse.Error) {
                terminated = true;
                state = RuntimeState.ERROR;
            }
            delegate.onResponse(response);
        }
    }
}
