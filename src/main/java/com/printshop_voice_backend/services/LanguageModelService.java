package com.printshop_voice_backend.services;

import com.printshop_voice_backend.dto.ConversationMessage;

import java.util.List;

public interface LanguageModelService {

    /**
     * Single chat completion over the system prompt followed by the conversation so far.
     */
    String complete(String systemPrompt, List<ConversationMessage> conversation);
}
