package com.llmhub.gateway.core.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.llmhub.gateway.core.model.Usage;
import com.llmhub.gateway.core.transport.UpstreamTransport;
import com.llmhub.gateway.exception.ConfigException;
import com.llmhub.gateway.exception.UpstreamException;
import reactor.core.publisher.SynchronousSink;

import java.net.URI;
import java.util.Collection;
import java.util.Map;

/**
 * 各适配器共享的状态与工具方法：密钥、base URL、定价表、传输层
 */
public abstract class AbstractProviderAdapter implements ProviderAdapter {

    protected final String secret;
    protected final String baseUrl;
    protected final UpstreamTransport transport;
    protected final ObjectMapper objectMapper;
    protected final PricingTable pricing;

    protected AbstractProviderAdapter(String secret, String baseUrl, PricingTable pricing,
                                      UpstreamTransport transport, ObjectMapper objectMapper) {
        this.secret = secret;
        this.baseUrl = trimTrailingSlash(baseUrl);
        this.pricing = pricing;
        this.transport = transport;
        this.objectMapper = objectMapper;
    }

    @Override
    public void validateConfiguration() {
        if (provider().requiresSecret() && (secret == null || secret.isBlank())) {
            throw new ConfigException(provider().id() + " requires an API key");
        }
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new ConfigException(provider().id() + " requires a base URL");
        }
        try {
            URI uri = URI.create(baseUrl);
            String scheme = uri.getScheme();
            if (uri.getHost() == null || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                throw new ConfigException("Invalid base URL for " + provider().id() + ": " + baseUrl);
            }
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Invalid base URL for " + provider().id() + ": " + baseUrl);
        }
    }

    @Override
    public double estimateCost(String model, int promptTokens, int completionTokens) {
        return pricing.estimateCost(model, promptTokens, completionTokens);
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    protected Double costOf(String model, Usage usage) {
        return usage == null ? null : estimateCost(model, usage.getPromptTokens(), usage.getCompletionTokens());
    }

    /**
     * 把调用方附加参数中已知的一项映射到上游字段，不存在或已被适配器写入时跳过
     */
    protected void mapOption(Map<String, Object> options, String key, ObjectNode target, String field) {
        Object value = options.get(key);
        if (value != null && !target.has(field)) {
            target.set(field, objectMapper.valueToTree(value));
        }
    }

    /**
     * OpenAI 的 stop 可以是单个字符串或字符串数组，统一写成数组
     */
    protected void mapStopSequences(Map<String, Object> options, ObjectNode target, String field) {
        Object stop = options.get("stop");
        if (stop == null || target.has(field)) {
            return;
        }
        ArrayNode sequences = target.putArray(field);
        if (stop instanceof Collection) {
            for (Object item : (Collection<?>) stop) {
                sequences.add(String.valueOf(item));
            }
        } else {
            sequences.add(String.valueOf(stop));
        }
    }

    protected JsonNode parseChunk(String data, SynchronousSink<?> sink) {
        try {
            return objectMapper.readTree(data);
        } catch (Exception e) {
            sink.error(new UpstreamException(0, "Malformed stream chunk from " + provider().id() + ": " + e.getMessage(), e));
            return null;
        }
    }

    protected static String textOrNull(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull() ? null : node.asText();
    }

    protected static String trimTrailingSlash(String url) {
        if (url == null) {
            return null;
        }
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
