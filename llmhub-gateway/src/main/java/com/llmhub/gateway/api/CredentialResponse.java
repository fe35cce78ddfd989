package com.llmhub.gateway.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.llmhub.gateway.core.model.Credential;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 凭证视图，永远不包含密钥本身
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CredentialResponse {

    private Long id;
    private String provider;

    @JsonProperty("display_name")
    private String displayName;

    @JsonProperty("extra_config")
    private Map<String, Object> extraConfig;

    @JsonProperty("is_active")
    private Boolean isActive;

    @JsonProperty("rate_limit_rpm")
    private Integer rateLimitRpm;

    @JsonProperty("has_secret")
    private boolean hasSecret;

    @JsonProperty("last_used_at")
    private LocalDateTime lastUsedAt;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    @JsonProperty("updated_at")
    private LocalDateTime updatedAt;

    public static CredentialResponse from(Credential credential) {
        return CredentialResponse.builder()
                .id(credential.getId())
                .provider(credential.getProvider())
                .displayName(credential.getDisplayName())
                .extraConfig(credential.getExtraConfig())
                .isActive(credential.getIsActive())
                .rateLimitRpm(credential.getRateLimitRpm())
                .hasSecret(credential.getSecret() != null)
                .lastUsedAt(credential.getLastUsedAt())
                .createdAt(credential.getCreatedAt())
                .updatedAt(credential.getUpdatedAt())
                .build();
    }
}
