package com.llmhub.gateway.api;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.llmhub.gateway.core.model.ChatMessage;
import com.llmhub.gateway.core.model.ChatRequest;
import com.llmhub.gateway.core.model.Role;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * OpenAI 格式的请求体。未声明的字段（top_p、stop ...）收集到 providerOptions 透传给上游
 */
@Data
@NoArgsConstructor
public class ChatCompletionRequest {

    @NotBlank
    private String model;

    @NotEmpty
    @Valid
    private List<Message> messages;

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private Double temperature;

    @Positive
    @JsonProperty("max_tokens")
    private Integer maxTokens;

    private Boolean stream;

    @JsonIgnore
    private Map<String, Object> providerOptions = new LinkedHashMap<>();

    @JsonAnySetter
    public void putProviderOption(String key, Object value) {
        if (value != null) {
            providerOptions.put(key, value);
        }
    }

    @JsonIgnore
    public boolean isStreaming() {
        return Boolean.TRUE.equals(stream);
    }

    public ChatRequest toChatRequest() {
        return ChatRequest.builder()
                .model(model)
                .messages(messages.stream().map(Message::toChatMessage).collect(Collectors.toList()))
                .temperature(temperature)
                .maxTokens(maxTokens)
                .providerOptions(providerOptions)
                .build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Message {
        @NotBlank
        private String role;

        @NotNull
        private String content;

        ChatMessage toChatMessage() {
            return ChatMessage.of(Role.fromValue(role), content);
        }
    }
}
