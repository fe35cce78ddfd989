package com.llmhub.gateway.core.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmhub.gateway.core.model.ProviderType;
import com.llmhub.gateway.core.transport.UpstreamTransport;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * 任意 OpenAI 兼容端点（OneAPI、vLLM、FastChat 等）。
 * 默认不计费，可在凭证配置里用 pricing 覆盖
 */
@Slf4j
public class CustomAdapter extends OpenAiCompatibleAdapter {

    public static final String DEFAULT_MODEL_TYPE = "openai-compatible";

    private final String modelType;

    public CustomAdapter(String apiKey, String baseUrl, String modelType, PricingTable pricing,
                         UpstreamTransport transport, ObjectMapper objectMapper) {
        super(apiKey, baseUrl, pricing != null ? pricing : PricingTable.empty(), transport, objectMapper);
        this.modelType = modelType != null ? modelType : DEFAULT_MODEL_TYPE;
        validateConfiguration();
        log.info("Custom adapter initialized: {} ({})", this.baseUrl, this.modelType);
    }

    @Override
    public ProviderType provider() {
        return ProviderType.CUSTOM;
    }

    @Override
    protected Map<String, Object> metadata() {
        return Map.of("base_url", baseUrl, "model_type", modelType);
    }

    // 很多兼容端点没有实现 /models
    @Override
    public Mono<List<String>> listModels() {
        return super.listModels()
                .onErrorResume(e -> {
                    log.warn("Failed to get models from {}: {}", baseUrl, e.getMessage());
                    return Mono.just(List.of());
                });
    }
}
