package io.conduit.core.agent;

import java.util.Objects;

/// One message of a conversation transcript.
///
/// @param role who produced the message, not null
/// @param content message text, not null
public record ConversationMessage(Role role, String content) {

    public enum Role {
        SYSTEM,
        USER,
        ASSISTANT
    }

    public ConversationMessage {
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    public static ConversationMessage system(String content) {
        return new ConversationMessage(Role.SYSTEM, content);
    }

    public static ConversationMessage user(String content) {
        return new ConversationMessage(Role.USER, content);
    }

    public static ConversationMessage assistant(String content) {
        return new ConversationMessage(Role.ASSISTANT, content);
    }
}
