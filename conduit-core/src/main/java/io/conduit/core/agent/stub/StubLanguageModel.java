package io.conduit.core.agent.stub;

import io.conduit.core.agent.ConversationMessage;
import io.conduit.core.agent.spi.LanguageModel;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;

/// Scripted {@link LanguageModel} for offline runs and tests.
///
/// Replies with the scripted responses in order. Once the script is exhausted
/// it answers with a final `<response>` echoing the last user message.
///
/// @implNote Thread-safe. Every transcript passed to {@link #generate} is kept
/// and can be inspected with {@link #requests()}.
public class StubLanguageModel implements LanguageModel {

    private static final Logger logger = Logger.getLogger(StubLanguageModel.class.getName());

    private final Deque<String> script;
    private final List<List<ConversationMessage>> requests = new ArrayList<>();

    public StubLanguageModel(List<String> script) {
        this.script = new ArrayDeque<>(script);
    }

    /// Creates a stub that always answers immediately.
    ///
    /// @return new stub, never null
    public static StubLanguageModel echo() {
        return new StubLanguageModel(List.of());
    }

    @Override
    public synchronized String generate(List<ConversationMessage> messages) {
        requests.add(List.copyOf(messages));
        String scripted = script.pollFirst();
        if (scripted != null) {
            logger.fine("[STUB] Returning scripted response (" + script.size() + " left)");
            return scripted;
        }
        return "<thought>Stub mode, no model call made.</thought>\n<response>[STUB] "
                + lastUserMessage(messages)
                + "</response>";
    }

    /// Returns the transcripts received so far, oldest first.
    ///
    /// @return immutable copy, never null
    public synchronized List<List<ConversationMessage>> requests() {
        return List.copyOf(requests);
    }

    private static String lastUserMessage(List<ConversationMessage> messages) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (messages.get(i).role() == ConversationMessage.Role.USER) {
                return messages.get(i).content().replace("<question>", "").replace("</question>", "");
            }
        }
        return "";
    }
}
