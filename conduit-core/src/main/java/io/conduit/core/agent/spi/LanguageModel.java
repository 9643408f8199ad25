package io.conduit.core.agent.spi;

import io.conduit.core.agent.ConversationMessage;
import java.util.List;

/// An opaque chat-completion capability.
///
/// Sampling parameters are fixed when the model is created from an
/// {@link io.conduit.core.agent.AgentConfig}; a call only carries the transcript.
///
/// @see LanguageModelProvider
@FunctionalInterface
public interface LanguageModel {

    /// Produces the next assistant message for a transcript.
    ///
    /// @param messages transcript, oldest first, not null
    /// @return the assistant's text, never null
    /// @throws RuntimeException if the model call fails
    String generate(List<ConversationMessage> messages);
}
