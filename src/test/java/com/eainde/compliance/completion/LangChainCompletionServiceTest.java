package com.eainde.compliance.completion;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LangChainCompletionServiceTest {

    @Mock
    private ChatModel chatModel;

    private LangChainCompletionService service() {
        return new LangChainCompletionService(chatModel, GenerationSettings.builder().modelName("gpt-4o-mini").build());
    }

    private static ChatResponse response(String text) {
        return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
    }

    @Test
    void generate_shouldSendSystemAndUserMessages() {
        // Arrange
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(response("KYC is verified."));

        // Act
        String text = service().generate("facts...\n\nQuestion: is C1 verified?", 128, 0.0);

        // Assert
        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(captor.capture());
        ChatRequest request = captor.getValue();

        assertThat(text).isEqualTo("KYC is verified.");
        assertThat(request.messages()).hasSize(2);
        assertThat(request.messages().get(0)).isInstanceOf(SystemMessage.class);
        assertThat(((SystemMessage) request.messages().get(0)).text())
                .isEqualTo(LangChainCompletionService.DEFAULT_SYSTEM_PROMPT);
        assertThat(((UserMessage) request.messages().get(1)).singleText())
                .isEqualTo("facts...\n\nQuestion: is C1 verified?");
        assertThat(request.parameters().modelName()).isEqualTo("gpt-4o-mini");
        assertThat(request.parameters().maxOutputTokens()).isEqualTo(128);
        assertThat(request.parameters().temperature()).isEqualTo(0.0);
    }

    @Test
    void generate_shouldWrapProviderFailures() {
        // Arrange
        RuntimeException cause = new RuntimeException("connection reset");
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(cause);

        // Act / Assert
        assertThatThrownBy(() -> service().generate("prompt", 64, 0.0))
                .isInstanceOf(ServiceException.class)
                .hasMessageContaining("connection reset")
                .hasCause(cause);
    }

    @Test
    void generate_shouldRejectBlankText() {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(response(" "));

        assertThatThrownBy(() -> service().generate("prompt", 64, 0.0))
                .isInstanceOf(ServiceException.class)
                .hasMessageStartingWith("malformed response");
    }

    @Test
    void constructor_shouldFallBackToDefaultSystemPrompt_whenBlank() {
        LangChainCompletionService service = new LangChainCompletionService(chatModel, GenerationSettings.defaults(),
                new ChatParameterMapper(), "  ");

        assertThat(service.getSystemPrompt()).isEqualTo(LangChainCompletionService.DEFAULT_SYSTEM_PROMPT);
    }
}
