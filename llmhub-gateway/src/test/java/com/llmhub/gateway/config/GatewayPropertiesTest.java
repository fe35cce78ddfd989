package com.llmhub.gateway.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.llmhub.gateway.core.model.ProviderType;

class GatewayPropertiesTest {

    @Test
    void missingValuesShouldFallBackToDefaults() {
        GatewayProperties properties = GatewayProperties.defaults();

        assertThat(properties.getOllamaBaseUrl()).isEqualTo("http://localhost:11434");
        assertThat(properties.getModelCacheTtl()).isEqualTo(Duration.ofMinutes(5));
        assertThat(properties.getStreamPrefetch()).isEqualTo(64);
        assertThat(properties.getDefaultRateLimitRpm()).isEqualTo(60);
        assertThat(properties.getEncryptionKey()).isNotBlank();
        assertThat(properties.timeoutsFor(ProviderType.OPENAI).getReadTimeout()).isEqualTo(Duration.ofSeconds(120));
    }

    @Test
    void configuredTimeoutsShouldApplyPerProvider() {
        GatewayProperties properties = new GatewayProperties("k", null, Duration.ZERO, -1, 30,
                Map.of("ollama", new GatewayProperties.TransportTimeouts(null, Duration.ofMinutes(10))));

        assertThat(properties.getModelCacheTtl()).isEqualTo(Duration.ofMinutes(5));
        assertThat(properties.getStreamPrefetch()).isEqualTo(64);
        assertThat(properties.getDefaultRateLimitRpm()).isEqualTo(30);
        assertThat(properties.timeoutsFor(ProviderType.OLLAMA).getReadTimeout()).isEqualTo(Duration.ofMinutes(10));
        assertThat(properties.timeoutsFor(ProviderType.OLLAMA).getConnectTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(properties.timeoutsFor(ProviderType.GOOGLE).getReadTimeout()).isEqualTo(Duration.ofSeconds(120));
    }
}
