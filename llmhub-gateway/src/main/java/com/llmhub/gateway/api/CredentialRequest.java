package com.llmhub.gateway.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 注册凭证。provider 支持别名 (claude / gemini)，gateway_client 表示网关客户端 token
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CredentialRequest {

    @NotBlank
    private String provider;

    @NotBlank
    @JsonProperty("display_name")
    private String displayName;

    @JsonProperty("api_key")
    private String apiKey;

    @JsonProperty("extra_config")
    private Map<String, Object> extraConfig;

    @Positive
    @JsonProperty("rate_limit_rpm")
    private Integer rateLimitRpm;
}
