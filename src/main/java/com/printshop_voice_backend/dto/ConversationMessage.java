package com.printshop_voice_backend.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ConversationMessage {
    private ConversationRole role;
    private String content;

    public static ConversationMessage user(String content) {
        return new ConversationMessage(ConversationRole.USER, content);
    }

    public static ConversationMessage assistant(String content) {
        return new ConversationMessage(ConversationRole.ASSISTANT, content);
    }
}
