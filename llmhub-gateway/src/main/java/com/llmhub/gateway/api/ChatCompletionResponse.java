package com.llmhub.gateway.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.llmhub.gateway.core.model.ChatCompletionResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * 标准的 OpenAI ChatCompletion 响应格式（非流式）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatCompletionResponse {

    private String id;
    private String object;
    private Long created;
    private String model;
    private List<Choice> choices;
    private Usage usage;

    public static ChatCompletionResponse from(ChatCompletionResult result) {
        Usage usage = null;
        if (result.getUsage() != null) {
            usage = Usage.builder()
                    .promptTokens(result.getUsage().getPromptTokens())
                    .completionTokens(result.getUsage().getCompletionTokens())
                    .totalTokens(result.getUsage().getTotalTokens())
                    .build();
        }
        return ChatCompletionResponse.builder()
                .id(newId())
                .object("chat.completion")
                .created(Instant.now().getEpochSecond())
                .model(result.getModel())
                .choices(List.of(Choice.builder()
                        .index(0)
                        .message(new Message("assistant", result.getContent()))
                        .finishReason(result.getFinishReason() != null ? result.getFinishReason() : "stop")
                        .build()))
                .usage(usage)
                .build();
    }

    static String newId() {
        return "chatcmpl-" + UUID.randomUUID().toString().replace("-", "");
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Choice {
        private Integer index;
        private Message message;

        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Message {
        private String role;
        private String content;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Usage {
        @JsonProperty("prompt_tokens")
        private Integer promptTokens;

        @JsonProperty("completion_tokens")
        private Integer completionTokens;

        @JsonProperty("total_tokens")
        private Integer totalTokens;
    }
}
