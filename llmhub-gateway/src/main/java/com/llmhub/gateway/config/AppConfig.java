package com.llmhub.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmhub.gateway.core.cache.CaffeineTtlCache;
import com.llmhub.gateway.core.cache.TtlCache;
import com.llmhub.gateway.core.model.ProviderType;
import com.llmhub.gateway.core.router.PrefixProviderResolutionPolicy;
import com.llmhub.gateway.core.router.ProviderResolutionPolicy;
import com.llmhub.gateway.core.transport.UpstreamTransport;
import com.llmhub.gateway.core.transport.UpstreamTransports;
import com.llmhub.gateway.core.transport.WebClientTransport;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Configuration
@EnableConfigurationProperties(GatewayProperties.class)
public class AppConfig {

    // 路由策略可替换：业务方声明自己的 ProviderResolutionPolicy 即可覆盖
    @Bean
    @ConditionalOnMissingBean(ProviderResolutionPolicy.class)
    public ProviderResolutionPolicy providerResolutionPolicy() {
        return new PrefixProviderResolutionPolicy();
    }

    @Bean
    public UpstreamTransports upstreamTransports(WebClient.Builder webClientBuilder,
                                                 GatewayProperties properties,
                                                 ObjectMapper objectMapper) {
        Map<ProviderType, UpstreamTransport> transports = new EnumMap<>(ProviderType.class);
        for (ProviderType type : ProviderType.values()) {
            transports.put(type, WebClientTransport.create(webClientBuilder, properties.timeoutsFor(type), objectMapper));
        }
        return new UpstreamTransports(transports);
    }

    // credential -> 模型列表
    @Bean
    public TtlCache<String, List<String>> modelListCache() {
        return new CaffeineTtlCache<>(1000);
    }
}
