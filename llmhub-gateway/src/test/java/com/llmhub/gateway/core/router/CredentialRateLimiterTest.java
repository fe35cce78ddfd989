package com.llmhub.gateway.core.router;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.llmhub.gateway.config.GatewayProperties;
import com.llmhub.gateway.core.model.Credential;

class CredentialRateLimiterTest {

    private final AtomicLong nanos = new AtomicLong();
    private CredentialRateLimiter limiter;

    @BeforeEach
    void setUp() {
        limiter = new CredentialRateLimiter(GatewayProperties.defaults(), nanos::get);
    }

    @Test
    void shouldRejectRequestsBeyondLimitWithinWindow() {
        Credential credential = Credential.builder().id(1L).rateLimitRpm(2).build();

        assertThat(limiter.tryAcquire(credential)).isTrue();
        assertThat(limiter.tryAcquire(credential)).isTrue();
        assertThat(limiter.tryAcquire(credential)).isFalse();
    }

    @Test
    void shouldResetAfterOneMinute() {
        Credential credential = Credential.builder().id(1L).rateLimitRpm(1).build();
        assertThat(limiter.tryAcquire(credential)).isTrue();
        assertThat(limiter.tryAcquire(credential)).isFalse();

        nanos.addAndGet(Duration.ofSeconds(61).toNanos());

        assertThat(limiter.tryAcquire(credential)).isTrue();
    }

    @Test
    void shouldFallBackToDefaultLimit() {
        Credential credential = Credential.builder().id(2L).build();

        for (int i = 0; i < 60; i++) {
            assertThat(limiter.tryAcquire(credential)).isTrue();
        }
        assertThat(limiter.tryAcquire(credential)).isFalse();
    }

    @Test
    void shouldCountCredentialsIndependently() {
        Credential first = Credential.builder().id(1L).rateLimitRpm(1).build();
        Credential second = Credential.builder().id(2L).rateLimitRpm(1).build();

        assertThat(limiter.tryAcquire(first)).isTrue();
        assertThat(limiter.tryAcquire(second)).isTrue();
        assertThat(limiter.tryAcquire(first)).isFalse();
    }
}
