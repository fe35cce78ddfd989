package com.llmhub.gateway.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

// 字段为空表示不修改
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CredentialUpdateRequest {

    @JsonProperty("display_name")
    private String displayName;

    @JsonProperty("extra_config")
    private Map<String, Object> extraConfig;

    @Positive
    @JsonProperty("rate_limit_rpm")
    private Integer rateLimitRpm;
}
