package com.llmhub.gateway.core.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * 一次非流式调用的归一化结果。usage / costUsd 为空表示上游未提供
 */
@Value
@Builder
public class ChatCompletionResult {
    @Builder.Default
    String content = "";
    String model;
    Usage usage;
    String finishReason;
    Double costUsd;
    @Builder.Default
    Map<String, Object> providerMetadata = Map.of();
}
