package com.llmhub.gateway.core.router;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.llmhub.gateway.config.GatewayProperties;
import com.llmhub.gateway.core.model.Credential;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 每个凭证每分钟的请求数限制 (rate_limit_rpm)。
 * 固定窗口：计数器在第一次请求时创建，一分钟后整体过期
 */
@Slf4j
@Component
public class CredentialRateLimiter {

    private static final Duration WINDOW = Duration.ofMinutes(1);

    private final Cache<Long, AtomicInteger> counters;
    private final int defaultRpm;

    @Autowired
    public CredentialRateLimiter(GatewayProperties properties) {
        this(properties, Ticker.systemTicker());
    }

    CredentialRateLimiter(GatewayProperties properties, Ticker ticker) {
        this.defaultRpm = properties.getDefaultRateLimitRpm();
        this.counters = Caffeine.newBuilder()
                .expireAfterWrite(WINDOW)
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    public boolean tryAcquire(Credential credential) {
        int limit = credential.getRateLimitRpm() != null ? credential.getRateLimitRpm() : defaultRpm;
        AtomicInteger counter = counters.get(credential.getId(), id -> new AtomicInteger());
        if (counter.incrementAndGet() > limit) {
            counter.decrementAndGet();
            log.debug("Credential {} reached {} rpm", credential.getId(), limit);
            return false;
        }
        return true;
    }

    public void reset(Long credentialId) {
        counters.invalidate(credentialId);
    }
}
