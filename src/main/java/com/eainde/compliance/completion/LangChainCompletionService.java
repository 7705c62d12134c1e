package com.eainde.compliance.completion;

import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link CompletionService} backed by a langchain4j {@link ChatModel}.
 *
 * Each call sends the financial-reasoning system prompt followed by the prompt as a user message.
 * Transport retries are the model's concern (see {@code maxRetries} on the model builder).
 */
@Slf4j
public class LangChainCompletionService implements CompletionService {

    public static final String DEFAULT_SYSTEM_PROMPT = "You are a financial reasoning assistant. "
            + "You answer strictly based on provided facts or instructions. "
            + "If information is missing, state that it is not available.";

    private final ChatModel chatModel;
    private final GenerationSettings settings;
    private final ChatParameterMapper parameterMapper;
    private final String systemPrompt;

    public LangChainCompletionService(ChatModel chatModel, GenerationSettings settings) {
        this(chatModel, settings, new ChatParameterMapper(), DEFAULT_SYSTEM_PROMPT);
    }

    public LangChainCompletionService(ChatModel chatModel, GenerationSettings settings,
                                      ChatParameterMapper parameterMapper, String systemPrompt) {
        this.chatModel = chatModel;
        this.settings = settings;
        this.parameterMapper = parameterMapper;
        this.systemPrompt = systemPrompt == null || systemPrompt.isBlank() ? DEFAULT_SYSTEM_PROMPT : systemPrompt;
    }

    @Override
    public String generate(String prompt, int maxTokens, double temperature) {
        ChatRequest request = ChatRequest.builder()
                .messages(SystemMessage.from(systemPrompt), UserMessage.from(prompt))
                .parameters(parameterMapper.toRequestParameters(settings, maxTokens, temperature))
                .build();

        ChatResponse response;
        try {
            response = chatModel.chat(request);
        } catch (RuntimeException e) {
            throw new ServiceException("Completion request failed: " + e.getMessage(), e);
        }

        String text = response == null || response.aiMessage() == null ? null : response.aiMessage().text();
        if (text == null || text.isBlank()) {
            throw new ServiceException("malformed response: model returned no text");
        }
        return text;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }
}
