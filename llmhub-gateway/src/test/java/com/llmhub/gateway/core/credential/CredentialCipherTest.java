package com.llmhub.gateway.core.credential;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import com.llmhub.gateway.config.GatewayProperties;
import com.llmhub.gateway.exception.ConfigException;

class CredentialCipherTest {

    private static GatewayProperties withKey(String key) {
        return new GatewayProperties(key, null, null, 0, 0, null);
    }

    private final CredentialCipher cipher = new CredentialCipher(withKey("unit-test-key"));

    @Test
    void shouldDecryptWhatItEncrypts() {
        String blob = cipher.encrypt("sk-live-123");

        assertThat(blob).isNotEqualTo("sk-live-123").doesNotContain("sk-live");
        assertThat(cipher.decrypt(blob)).isEqualTo("sk-live-123");
    }

    @Test
    void shouldUseFreshIvForEveryEncryption() {
        assertThat(cipher.encrypt("same")).isNotEqualTo(cipher.encrypt("same"));
    }

    @Test
    void shouldRejectBlobEncryptedWithAnotherKey() {
        String blob = new CredentialCipher(withKey("other-key")).encrypt("sk-live-123");

        assertThatThrownBy(() -> cipher.decrypt(blob)).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> cipher.decrypt("%%%")).isInstanceOf(ConfigException.class);
    }

    @Test
    void shouldPassNullThrough() {
        assertThat(cipher.encrypt(null)).isNull();
        assertThat(cipher.decrypt(null)).isNull();
    }

    @Test
    void hashShouldBeStableLowercaseHex() {
        assertThat(Hashing.sha256Hex("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }
}
