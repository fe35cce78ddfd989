package com.llmhub.gateway.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import com.llmhub.gateway.exception.UnsupportedProviderException;

class ProviderTypeTest {

    @Test
    void shouldResolveAliasesCaseInsensitively() {
        assertThat(ProviderType.fromId("Claude")).isEqualTo(ProviderType.ANTHROPIC);
        assertThat(ProviderType.fromId(" GEMINI ")).isEqualTo(ProviderType.GOOGLE);
        assertThat(ProviderType.fromId("openai")).isEqualTo(ProviderType.OPENAI);
    }

    @Test
    void shouldRejectUnknownProvider() {
        assertThatThrownBy(() -> ProviderType.fromId("mistral"))
                .isInstanceOf(UnsupportedProviderException.class);
        assertThatThrownBy(() -> ProviderType.fromId(null))
                .isInstanceOf(UnsupportedProviderException.class);
    }

    @Test
    void shouldListCanonicalIdsAndAliases() {
        assertThat(ProviderType.supportedIdentifiers())
                .contains("openai", "anthropic", "claude", "google", "gemini", "ollama", "custom");
    }

    @Test
    void onlyLocalProviderWorksWithoutSecret() {
        assertThat(ProviderType.OLLAMA.requiresSecret()).isFalse();
        assertThat(ProviderType.CUSTOM.requiresSecret()).isTrue();
    }
}
