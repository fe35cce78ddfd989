package com.llmhub.gateway.core.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * 带逐条过期时间的缓存
 */
public interface TtlCache<K, V> {

    Optional<V> get(K key);

    void set(K key, V value, Duration ttl);

    void delete(K key);

    void clear();
}
