package com.llmhub.gateway.core.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CaffeineTtlCacheTest {

    private final AtomicLong nanos = new AtomicLong();
    private CaffeineTtlCache<String, String> cache;

    @BeforeEach
    void setUp() {
        cache = new CaffeineTtlCache<>(100, nanos::get);
    }

    @Test
    void shouldExpireEachEntryAfterItsOwnTtl() {
        cache.set("short", "a", Duration.ofSeconds(10));
        cache.set("long", "b", Duration.ofMinutes(5));

        nanos.addAndGet(Duration.ofSeconds(11).toNanos());

        assertThat(cache.get("short")).isEmpty();
        assertThat(cache.get("long")).contains("b");
    }

    @Test
    void shouldRenewTtlOnOverwrite() {
        cache.set("k", "v1", Duration.ofSeconds(10));
        nanos.addAndGet(Duration.ofSeconds(8).toNanos());
        cache.set("k", "v2", Duration.ofSeconds(10));
        nanos.addAndGet(Duration.ofSeconds(8).toNanos());

        assertThat(cache.get("k")).contains("v2");
    }

    @Test
    void shouldDeleteAndClear() {
        cache.set("a", "1", Duration.ofMinutes(1));
        cache.set("b", "2", Duration.ofMinutes(1));

        cache.delete("a");
        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.get("b")).contains("2");

        cache.clear();
        assertThat(cache.get("b")).isEmpty();
    }

    @Test
    void shouldRejectNonPositiveTtl() {
        assertThatThrownBy(() -> cache.set("k", "v", Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
    }
}
