package com.llmhub.gateway.core.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 对应数据库中的 credential 表
 * 每一个对象代表一个用户持有的上游 API Key（或网关客户端 token），密钥加密存储
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Credential {

    /** 网关客户端凭证的 provider 值，不对应任何上游适配器 */
    public static final String GATEWAY_CLIENT = "gateway_client";

    private Long id;
    private Long ownerId;
    private String provider;      // 规范化后的 provider id, e.g. "anthropic"
    private String displayName;

    private String secret;        // 加密后的密钥 (AES-GCM, base64)
    private String secretHash;    // 明文的 SHA-256，仅 gateway_client 用于按 token 查找

    private Map<String, Object> extraConfig; // base_url, model_type, pricing ...

    private Boolean isActive;
    private Integer rateLimitRpm;

    private LocalDateTime lastUsedAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public boolean isUsable() {
        return Boolean.TRUE.equals(isActive);
    }

    public boolean isOwnedBy(Long principalId) {
        return ownerId != null && ownerId.equals(principalId);
    }
}
