package com.llmhub.gateway.core.model;

import com.llmhub.gateway.exception.UnsupportedProviderException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 上游服务商。id 为规范名称，aliases 为兼容写法（claude -> anthropic, gemini -> google）
 */
public enum ProviderType {
    OPENAI("openai", true),
    ANTHROPIC("anthropic", true, "claude"),
    GOOGLE("google", true, "gemini"),
    OLLAMA("ollama", false),
    CUSTOM("custom", true);

    private final String id;
    private final boolean requiresSecret;
    private final List<String> aliases;

    ProviderType(String id, boolean requiresSecret, String... aliases) {
        this.id = id;
        this.requiresSecret = requiresSecret;
        this.aliases = List.of(aliases);
    }

    public String id() {
        return id;
    }

    public boolean requiresSecret() {
        return requiresSecret;
    }

    public static ProviderType fromId(String provider) {
        if (provider == null) {
            throw new UnsupportedProviderException(null);
        }
        String normalized = provider.trim().toLowerCase(Locale.ROOT);
        for (ProviderType type : values()) {
            if (type.id.equals(normalized) || type.aliases.contains(normalized)) {
                return type;
            }
        }
        throw new UnsupportedProviderException(provider);
    }

    public static List<String> supportedIdentifiers() {
        List<String> ids = new ArrayList<>();
        for (ProviderType type : values()) {
            ids.add(type.id);
            ids.addAll(type.aliases);
        }
        return ids;
    }
}
