package com.llmhub.gateway.core.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmhub.gateway.config.GatewayProperties;
import com.llmhub.gateway.core.credential.CredentialStore;
import com.llmhub.gateway.core.model.Credential;
import com.llmhub.gateway.core.model.ProviderType;
import com.llmhub.gateway.core.transport.UpstreamTransport;
import com.llmhub.gateway.core.transport.UpstreamTransports;
import com.llmhub.gateway.exception.ConfigException;
import com.llmhub.gateway.exception.UnsupportedProviderException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * 按 provider 构造适配器。适配器是一次性的轻量对象，每个请求新建一个
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdapterFactory {

    public static final String BASE_URL = "base_url";
    public static final String MODEL_TYPE = "model_type";
    public static final String PRICING = "pricing";

    private final UpstreamTransports transports;
    private final ObjectMapper objectMapper;
    private final GatewayProperties properties;
    private final CredentialStore credentialStore;

    public ProviderAdapter createAdapter(String provider, String secret, Map<String, Object> config) {
        ProviderType type = ProviderType.fromId(provider);
        Map<String, Object> extra = config != null ? config : Map.of();
        String baseUrl = stringValue(extra, BASE_URL);
        UpstreamTransport transport = transports.forProvider(type);
        log.debug("Creating {} adapter (base_url={})", type.id(), baseUrl != null ? baseUrl : "default");

        switch (type) {
            case OPENAI:
                return new OpenAiAdapter(secret, baseUrl, transport, objectMapper);
            case ANTHROPIC:
                return new ClaudeAdapter(secret, baseUrl, transport, objectMapper);
            case GOOGLE:
                return new GeminiAdapter(secret, baseUrl, transport, objectMapper);
            case CUSTOM:
                if (baseUrl == null) {
                    throw new ConfigException("custom provider requires base_url");
                }
                return new CustomAdapter(secret, baseUrl, stringValue(extra, MODEL_TYPE),
                        pricingOverride(extra), transport, objectMapper);
            case OLLAMA:
                return new OllamaAdapter(baseUrl != null ? baseUrl : properties.getOllamaBaseUrl(),
                        pricingOverride(extra), transport, objectMapper);
            default:
                throw new UnsupportedProviderException(provider);
        }
    }

    public ProviderAdapter createAdapterFromCredential(Credential credential) {
        if (Credential.GATEWAY_CLIENT.equals(credential.getProvider())) {
            throw new UnsupportedProviderException(credential.getProvider());
        }
        return createAdapter(credential.getProvider(),
                credentialStore.decryptSecret(credential.getSecret()),
                credential.getExtraConfig());
    }

    public List<String> supportedProviders() {
        return ProviderType.supportedIdentifiers();
    }

    /**
     * extra_config.pricing = {input, output}，单位 USD / 百万 token，对所有模型生效
     */
    private static PricingTable pricingOverride(Map<String, Object> config) {
        Object raw = config.get(PRICING);
        if (raw == null) {
            return null;
        }
        if (!(raw instanceof Map)) {
            throw new ConfigException("pricing must be an object with input and output");
        }
        Map<?, ?> pricing = (Map<?, ?>) raw;
        try {
            return PricingTable.flat(new PricingTable.ModelPricing(
                    decimal(pricing.get("input")), decimal(pricing.get("output"))));
        } catch (NumberFormatException e) {
            throw new ConfigException("pricing.input and pricing.output must be numbers");
        }
    }

    private static BigDecimal decimal(Object value) {
        return value == null ? BigDecimal.ZERO : new BigDecimal(String.valueOf(value));
    }

    private static String stringValue(Map<String, Object> config, String key) {
        Object value = config.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }
}
