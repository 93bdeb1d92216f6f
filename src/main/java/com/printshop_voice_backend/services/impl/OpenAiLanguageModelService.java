package com.printshop_voice_backend.services.impl;

import com.printshop_voice_backend.config.VoiceAIConfig;
import com.printshop_voice_backend.dto.ConversationMessage;
import com.printshop_voice_backend.dto.ConversationRole;
import com.printshop_voice_backend.exceptions.VoicePipelineExceptionHandler.LanguageModelException;
import com.printshop_voice_backend.services.LanguageModelService;
import com.theokanning.openai.completion.chat.ChatCompletionRequest;
import com.theokanning.openai.completion.chat.ChatCompletionResult;
import com.theokanning.openai.completion.chat.ChatMessage;
import com.theokanning.openai.completion.chat.ChatMessageRole;
import com.theokanning.openai.service.OpenAiService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class OpenAiLanguageModelService implements LanguageModelService {

    private final OpenAiService openAiService;
    private final VoiceAIConfig voiceAIConfig;

    @Override
    public String complete(String systemPrompt, List<ConversationMessage> conversation) {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(new ChatMessage(ChatMessageRole.SYSTEM.value(), systemPrompt));
        for (ConversationMessage message : conversation) {
            String role = message.getRole() == ConversationRole.USER
                    ? ChatMessageRole.USER.value()
                    : ChatMessageRole.ASSISTANT.value();
            messages.add(new ChatMessage(role, message.getContent()));
        }

        ChatCompletionRequest request = ChatCompletionRequest.builder()
                .model(voiceAIConfig.getGptModel())
                .messages(messages)
                .maxTokens(voiceAIConfig.getMaxTokens())
                .temperature(voiceAIConfig.getTemperature())
                .build();

        try {
            ChatCompletionResult result = openAiService.createChatCompletion(request);
            if (result.getChoices() == null || result.getChoices().isEmpty()) {
                log.warn("Chat completion returned no choices");
                return "";
            }
            String response = result.getChoices().get(0).getMessage().getContent();
            log.info("Chat completion generated. Response length: {}", response != null ? response.length() : 0);
            return response != null ? response : "";
        } catch (RuntimeException e) {
            throw new LanguageModelException("Language model request failed: " + e.getMessage(), e);
        }
    }
}
