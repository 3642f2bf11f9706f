package com.agentrunner.orchestration.model;

public record ConversationMessage(
        MessageRole role,
        String content
) {
    public static ConversationMessage system(String content) {
        return new ConversationMessage(MessageRole.SYSTEM, content);
    }

    public static ConversationMessage human(String content) {
        return new ConversationMessage(MessageRole.HUMAN, content);
    }

    public static ConversationMessage model(String content) {
        return new ConversationMessage(MessageRole.MODEL, content == null ? "" : content);
    }
}
