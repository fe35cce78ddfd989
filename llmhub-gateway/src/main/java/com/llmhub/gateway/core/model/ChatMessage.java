package com.llmhub.gateway.core.model;

import lombok.Value;

/**
 * 归一化后的单条对话消息，不可变
 */
@Value
public class ChatMessage {
    Role role;
    String content;

    public static ChatMessage of(Role role, String content) {
        return new ChatMessage(role, content == null ? "" : content);
    }

    public static ChatMessage system(String content) {
        return of(Role.SYSTEM, content);
    }

    public static ChatMessage user(String content) {
        return of(Role.USER, content);
    }

    public static ChatMessage assistant(String content) {
        return of(Role.ASSISTANT, content);
    }

    public boolean isSystem() {
        return role == Role.SYSTEM;
    }
}
