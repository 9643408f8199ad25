package io.conduit.adapter.langchain4j;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.conduit.core.agent.ConversationMessage;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class LangChain4jLanguageModelTest {

    private ChatModel chatModel;
    private LangChain4jLanguageModel model;

    @BeforeEach
    void setUp() {
        chatModel = mock(ChatModel.class);
        model = new LangChain4jLanguageModel("claude-sonnet-4", chatModel);
    }

    @Test
    void shouldMapTranscriptRolesToChatMessages() {
        // Given
        when(chatModel.chat(anyList()))
                .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from("<response>hi</response>")).build());
        List<ConversationMessage> transcript =
                List.of(
                        ConversationMessage.system("You are helpful"),
                        ConversationMessage.user("<question>hello</question>"),
                        ConversationMessage.assistant("<thought>t</thought>"),
                        ConversationMessage.user("<observation>{}</observation>"));

        // When
        String reply = model.generate(transcript);

        // Then
        assertThat(reply).isEqualTo("<response>hi</response>");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ChatMessage>> captor = ArgumentCaptor.forClass(List.class);
        verify(chatModel).chat(captor.capture());
        List<ChatMessage> sent = captor.getValue();
        assertThat(sent).hasSize(4);
        assertThat(sent.get(0)).isEqualTo(SystemMessage.from("You are helpful"));
        assertThat(sent.get(1)).isEqualTo(UserMessage.from("<question>hello</question>"));
        assertThat(sent.get(2)).isEqualTo(AiMessage.from("<thought>t</thought>"));
        assertThat(sent.get(3)).isInstanceOf(UserMessage.class);
    }

    @Test
    void shouldFailWhenModelReturnsNothing() {
        when(chatModel.chat(anyList())).thenReturn(null);

        assertThatThrownBy(() -> model.generate(List.of(ConversationMessage.user("q"))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("No response from model 'claude-sonnet-4'");
    }

    @Test
    void shouldPropagateModelFailures() {
        when(chatModel.chat(anyList())).thenThrow(new RuntimeException("rate limited"));

        assertThatThrownBy(() -> model.generate(List.of(ConversationMessage.user("q"))))
                .hasMessage("rate limited");
    }
}
