package com.llmhub.gateway.core.model;

import lombok.Value;

@Value
public class Usage {
    int promptTokens;
    int completionTokens;
    int totalTokens;

    public static Usage of(int promptTokens, int completionTokens) {
        return new Usage(promptTokens, completionTokens, promptTokens + completionTokens);
    }

    public static Usage of(int promptTokens, int completionTokens, int totalTokens) {
        return new Usage(promptTokens, completionTokens, totalTokens);
    }
}
