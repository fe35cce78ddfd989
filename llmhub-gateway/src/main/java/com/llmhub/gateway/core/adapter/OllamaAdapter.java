package com.llmhub.gateway.core.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmhub.gateway.core.model.ProviderType;
import com.llmhub.gateway.core.transport.UpstreamTransport;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * 本地 Ollama，走其 OpenAI 兼容层 (/v1)
 */
@Slf4j
public class OllamaAdapter extends OpenAiCompatibleAdapter {

    // 兼容层要求 Authorization 非空，但不会校验
    public static final String PLACEHOLDER_TOKEN = "ollama";

    public OllamaAdapter(String baseUrl, PricingTable pricing, UpstreamTransport transport, ObjectMapper objectMapper) {
        super(PLACEHOLDER_TOKEN, withVersionPath(baseUrl), pricing != null ? pricing : PricingTable.empty(),
                transport, objectMapper);
        validateConfiguration();
        log.info("Ollama adapter initialized: {}", this.baseUrl);
    }

    static String withVersionPath(String rawUrl) {
        if (rawUrl == null || rawUrl.isBlank()) {
            return rawUrl;
        }
        String trimmed = trimTrailingSlash(rawUrl);
        return trimmed.endsWith("/v1") ? trimmed : trimmed + "/v1";
    }

    @Override
    public ProviderType provider() {
        return ProviderType.OLLAMA;
    }

    @Override
    protected Map<String, Object> metadata() {
        return Map.of("base_url", baseUrl);
    }

    // 旧版本 Ollama 不支持 /v1/models
    @Override
    public Mono<List<String>> listModels() {
        return super.listModels()
                .onErrorResume(e -> {
                    log.warn("Failed to get Ollama models via {}/models: {}", baseUrl, e.getMessage());
                    return Mono.just(List.of());
                });
    }
}
