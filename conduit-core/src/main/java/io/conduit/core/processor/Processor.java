package io.conduit.core.processor;

import io.conduit.core.agent.CancellationToken;
import io.conduit.core.agent.ConversationMessage;
import io.conduit.core.agent.StreamObserver;
import java.util.List;

/// A reasoning loop that turns one user message into a stream of events.
///
/// ### Contracts
/// - Emits exactly one terminal event (`done` or `error`) and nothing after it
/// - Terminates within the configured iteration cap
/// - Does not throw for model or tool failures; they become events
///
/// @see ReasoningProcessor
public interface Processor {

    /// Processes a user message.
    ///
    /// @param message the user's message, not null
    /// @param history recent conversation, oldest first, not null
    /// @param observer receives events in order, not null
    /// @param cancellation checked before each model and tool call, not null
    void process(
            String message,
            List<ConversationMessage> history,
            StreamObserver observer,
            CancellationToken cancellation);
}
