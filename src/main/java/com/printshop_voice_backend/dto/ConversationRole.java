package com.printshop_voice_backend.dto;

public enum ConversationRole {
    USER("user"),
    ASSISTANT("assistant");

    private final String value;

    ConversationRole(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
