package com.llmhub.gateway.core.router;

import com.llmhub.gateway.core.model.ProviderType;

import java.util.Locale;

/**
 * 按模型名前缀判断：gpt* / claude* / gemini*，其余都交给本地 ollama
 */
public class PrefixProviderResolutionPolicy implements ProviderResolutionPolicy {

    @Override
    public ProviderType resolve(String model) {
        String name = model == null ? "" : model.trim().toLowerCase(Locale.ROOT);
        if (name.startsWith("gpt")) {
            return ProviderType.OPENAI;
        }
        if (name.startsWith("claude")) {
            return ProviderType.ANTHROPIC;
        }
        if (name.startsWith("gemini")) {
            return ProviderType.GOOGLE;
        }
        return ProviderType.OLLAMA;
    }
}
