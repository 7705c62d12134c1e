package com.eainde.compliance.completion;

import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.request.DefaultChatRequestParameters;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;

/**
 * Maps {@link GenerationSettings} plus per-call overrides onto langchain4j request parameters.
 */
public class ChatParameterMapper {

    public ChatRequestParameters toRequestParameters(GenerationSettings settings) {
        if (settings == null) {
            return ChatRequestParameters.builder().build();
        }
        return toRequestParameters(settings, settings.getMaxOutputTokens(), settings.getTemperature());
    }

    public ChatRequestParameters toRequestParameters(GenerationSettings settings, int maxTokens, double temperature) {
        DefaultChatRequestParameters.Builder<?> builder = ChatRequestParameters.builder();

        if (settings != null && settings.getModelName() != null) {
            builder.modelName(settings.getModelName());
        }
        if (maxTokens > 0) {
            builder.maxOutputTokens(maxTokens);
        }
        builder.temperature(temperature);

        if (settings != null && settings.getTopP() != null) {
            builder.topP(settings.getTopP());
        }

        // JSON mode
        if (settings != null && settings.isJsonResponse()) {
            builder.responseFormat(ResponseFormat.builder()
                    .type(ResponseFormatType.JSON)
                    .build());
        }

        return builder.build();
    }
}
