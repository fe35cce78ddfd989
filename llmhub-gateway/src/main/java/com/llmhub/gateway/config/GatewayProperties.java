package com.llmhub.gateway.config;

import com.llmhub.gateway.core.model.ProviderType;
import lombok.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

/**
 * 网关配置，对应 application.yaml 中的 gateway.* 节点
 *
 * <pre>
 * gateway:
 *   encryption-key: change-me
 *   ollama-base-url: http://localhost:11434
 *   model-cache-ttl: 5m
 *   stream-prefetch: 64
 *   default-rate-limit-rpm: 60
 *   transport:
 *     openai:
 *       connect-timeout: 10s
 *       read-timeout: 120s
 * </pre>
 */
@Value
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    /** 派生凭证加密密钥的口令 */
    String encryptionKey;
    /** ollama 凭证未配置 base_url 时使用 */
    String ollamaBaseUrl;
    Duration modelCacheTtl;
    /** 流式转发时向上游预取的分片数 */
    int streamPrefetch;
    /** 注册凭证未指定限流时的默认值 */
    int defaultRateLimitRpm;
    /** 按 provider 区分的超时配置，key 为 provider id */
    Map<String, TransportTimeouts> transport;

    public GatewayProperties(String encryptionKey, String ollamaBaseUrl, Duration modelCacheTtl,
                             Integer streamPrefetch, Integer defaultRateLimitRpm,
                             Map<String, TransportTimeouts> transport) {
        this.encryptionKey = encryptionKey == null || encryptionKey.isBlank()
                ? "llmhub-dev-encryption-key-change-me" : encryptionKey;
        this.ollamaBaseUrl = ollamaBaseUrl == null || ollamaBaseUrl.isBlank()
                ? "http://localhost:11434" : ollamaBaseUrl;
        this.modelCacheTtl = modelCacheTtl == null || modelCacheTtl.isNegative() || modelCacheTtl.isZero()
                ? Duration.ofMinutes(5) : modelCacheTtl;
        this.streamPrefetch = streamPrefetch == null || streamPrefetch <= 0 ? 64 : streamPrefetch;
        this.defaultRateLimitRpm = defaultRateLimitRpm == null || defaultRateLimitRpm <= 0 ? 60 : defaultRateLimitRpm;
        this.transport = transport == null ? Map.of() : transport;
    }

    public static GatewayProperties defaults() {
        return new GatewayProperties(null, null, null, null, null, null);
    }

    public TransportTimeouts timeoutsFor(ProviderType provider) {
        TransportTimeouts timeouts = transport.get(provider.id());
        return timeouts != null ? timeouts : TransportTimeouts.defaults();
    }

    /**
     * 单个 provider 的连接/读取超时。本地模型推理慢，可单独调大 read-timeout
     */
    @Value
    public static class TransportTimeouts {
        Duration connectTimeout;
        Duration readTimeout;

        public TransportTimeouts(Duration connectTimeout, Duration readTimeout) {
            this.connectTimeout = connectTimeout != null ? connectTimeout : Duration.ofSeconds(10);
            this.readTimeout = readTimeout != null ? readTimeout : Duration.ofSeconds(120);
        }

        public static TransportTimeouts defaults() {
            return new TransportTimeouts(null, null);
        }
    }
}
