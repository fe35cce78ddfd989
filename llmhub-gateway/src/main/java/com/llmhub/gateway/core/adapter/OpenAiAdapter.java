package com.llmhub.gateway.core.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmhub.gateway.core.model.ProviderType;
import com.llmhub.gateway.core.transport.UpstreamTransport;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class OpenAiAdapter extends OpenAiCompatibleAdapter {

    public static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";

    public OpenAiAdapter(String apiKey, String baseUrl, UpstreamTransport transport, ObjectMapper objectMapper) {
        super(apiKey, baseUrl != null ? baseUrl : DEFAULT_BASE_URL,
                PricingTable.defaultsFor(ProviderType.OPENAI), transport, objectMapper);
        validateConfiguration();
        log.info("OpenAI adapter initialized: {}", this.baseUrl);
    }

    @Override
    public ProviderType provider() {
        return ProviderType.OPENAI;
    }
}
