package com.llmhub.gateway.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 对应 message 表。token 与 cost 可为空：并非所有上游都返回用量，流式调用也拿不到
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageRecord {
    private Long id;
    private Long conversationId;
    private Long seq;             // 会话内单调递增，决定历史顺序
    private String role;
    private String content;

    private Integer promptTokens;
    private Integer completionTokens;
    private Integer totalTokens;
    private Double cost;

    private Map<String, Object> metadata;
    private LocalDateTime createdAt;
}
