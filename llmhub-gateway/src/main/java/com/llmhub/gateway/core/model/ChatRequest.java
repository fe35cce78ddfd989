package com.llmhub.gateway.core.model;

import com.llmhub.gateway.exception.ValidationException;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 归一化的聊天请求，每次调用构造一次，不直接持久化
 */
@Value
public class ChatRequest {

    public static final double DEFAULT_TEMPERATURE = 0.7;

    List<ChatMessage> messages;
    String model;
    double temperature;
    Integer maxTokens;
    // 透传给上游的附加参数（top_p、stop 等），不覆盖适配器自己设置的字段
    Map<String, Object> providerOptions;

    @Builder
    private ChatRequest(List<ChatMessage> messages, String model, Double temperature,
                        Integer maxTokens, Map<String, Object> providerOptions) {
        if (model == null || model.isBlank()) {
            throw new ValidationException("model is required");
        }
        if (messages == null || messages.isEmpty()) {
            throw new ValidationException("messages must not be empty");
        }
        double t = temperature == null ? DEFAULT_TEMPERATURE : temperature;
        if (t < 0 || t > 2) {
            throw new ValidationException("temperature must be between 0 and 2, got " + t);
        }
        if (maxTokens != null && maxTokens <= 0) {
            throw new ValidationException("max_tokens must be positive, got " + maxTokens);
        }
        this.messages = List.copyOf(messages);
        this.model = model;
        this.temperature = t;
        this.maxTokens = maxTokens;
        this.providerOptions = providerOptions == null ? Map.of() : Map.copyOf(providerOptions);
    }
}
