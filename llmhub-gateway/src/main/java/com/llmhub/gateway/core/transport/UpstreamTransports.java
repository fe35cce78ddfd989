package com.llmhub.gateway.core.transport;

import com.llmhub.gateway.core.model.ProviderType;

import java.util.EnumMap;
import java.util.Map;

/**
 * provider -> transport 映射，不同 provider 使用各自超时配置的连接池
 */
public class UpstreamTransports {

    private final Map<ProviderType, UpstreamTransport> transports;

    public UpstreamTransports(Map<ProviderType, UpstreamTransport> transports) {
        this.transports = new EnumMap<>(transports);
    }

    public static UpstreamTransports shared(UpstreamTransport transport) {
        Map<ProviderType, UpstreamTransport> map = new EnumMap<>(ProviderType.class);
        for (ProviderType type : ProviderType.values()) {
            map.put(type, transport);
        }
        return new UpstreamTransports(map);
    }

    public UpstreamTransport forProvider(ProviderType provider) {
        UpstreamTransport transport = transports.get(provider);
        if (transport == null) {
            throw new IllegalStateException("No transport registered for provider " + provider.id());
        }
        return transport;
    }
}
