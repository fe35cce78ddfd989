package com.llmhub.gateway.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConversationChatRequest {

    @NotBlank
    private String content;

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private Double temperature;

    @Positive
    @JsonProperty("max_tokens")
    private Integer maxTokens;

    private Boolean stream;
}
