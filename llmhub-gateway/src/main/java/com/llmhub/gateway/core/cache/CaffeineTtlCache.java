package com.llmhub.gateway.core.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;

@Slf4j
public class CaffeineTtlCache<K, V> implements TtlCache<K, V> {

    private final Cache<K, Timed<V>> cache;

    public CaffeineTtlCache(long maximumSize) {
        this(maximumSize, Ticker.systemTicker());
    }

    public CaffeineTtlCache(long maximumSize, Ticker ticker) {
        // 过期时间跟随每条记录，写入时决定
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .ticker(ticker)
                .executor(Runnable::run)
                .expireAfter(new Expiry<K, Timed<V>>() {
                    @Override
                    public long expireAfterCreate(K key, Timed<V> value, long currentTime) {
                        return value.getTtl().toNanos();
                    }

                    @Override
                    public long expireAfterUpdate(K key, Timed<V> value, long currentTime, long currentDuration) {
                        return value.getTtl().toNanos();
                    }

                    @Override
                    public long expireAfterRead(K key, Timed<V> value, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }

    @Override
    public Optional<V> get(K key) {
        Timed<V> timed = cache.getIfPresent(key);
        return timed == null ? Optional.empty() : Optional.of(timed.getValue());
    }

    @Override
    public void set(K key, V value, Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        cache.put(key, new Timed<>(value, ttl));
        log.debug("Cached {} for {}", key, ttl);
    }

    @Override
    public void delete(K key) {
        cache.invalidate(key);
    }

    @Override
    public void clear() {
        cache.invalidateAll();
    }

    @Value
    private static class Timed<V> {
        V value;
        Duration ttl;
    }
}
