package com.llmhub.gateway.core.usage;

import lombok.Builder;
import lombok.Value;

/**
 * 一次上游交换的归属信息。conversationId 为空表示网关直连请求，不落消息
 */
@Value
@Builder
public class UsageContext {
    Long credentialId;
    String provider;
    String model;
    Long conversationId;
}
