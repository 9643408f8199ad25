package io.conduit.adapter.langchain4j;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.conduit.core.agent.ConversationMessage;
import io.conduit.core.agent.spi.LanguageModel;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// LangChain4j implementation of {@link LanguageModel}.
///
/// Translates the core transcript into LangChain4j chat messages and returns the
/// text of the model's reply. The instance holds no conversation state: the
/// runtime passes the full transcript on every call.
///
/// @implNote Thread-safe as long as the wrapped {@link ChatModel} is.
/// @see LangChain4jModelProvider for model creation
public class LangChain4jLanguageModel implements LanguageModel {

    private static final Logger logger = Logger.getLogger(LangChain4jLanguageModel.class.getName());

    private final String modelName;
    private final ChatModel model;

    /// @param modelName model identifier for logs, not null
    /// @param model the LangChain4j chat model to delegate to, not null
    public LangChain4jLanguageModel(String modelName, ChatModel model) {
        this.modelName = Objects.requireNonNull(modelName, "modelName must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
    }

    /// Sends the transcript to the chat model.
    ///
    /// @param messages transcript, oldest first, not null
    /// @return the reply text, empty when the model returned no text; never null
    /// @throws IllegalStateException if the model returned no response
    /// @throws RuntimeException propagated from the chat model on call failure
    @Override
    public String generate(List<ConversationMessage> messages) {
        Objects.requireNonNull(messages, "messages must not be null");
        logger.fine("Calling model '" + modelName + "' with " + messages.size() + " messages");

        ChatResponse response = model.chat(toChatMessages(messages));
        if (response == null || response.aiMessage() == null) {
            throw new IllegalStateException("No response from model '" + modelName + "'");
        }

        String text = response.aiMessage().text();
        if (response.metadata() != null && response.metadata().tokenUsage() != null) {
            logger.fine(
                    "Model '"
                            + modelName
                            + "' used "
                            + response.metadata().tokenUsage().totalTokenCount()
                            + " tokens");
        }
        return text != null ? text : "";
    }

    static List<ChatMessage> toChatMessages(List<ConversationMessage> messages) {
        List<ChatMessage> chatMessages = new ArrayList<>(messages.size());
        for (ConversationMessage message : messages) {
            switch (message.role()) {
                case SYSTEM -> chatMessages.add(SystemMessage.from(message.content()));
                case USER -> chatMessages.add(UserMessage.from(message.content()));
                case ASSISTANT -> chatMessages.add(AiMessage.from(message.content()));
            }
        }
        return chatMessages;
    }
}
