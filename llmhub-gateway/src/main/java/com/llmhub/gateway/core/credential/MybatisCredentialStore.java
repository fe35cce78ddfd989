package com.llmhub.gateway.core.credential;

import com.llmhub.gateway.config.GatewayProperties;
import com.llmhub.gateway.core.dao.CredentialMapper;
import com.llmhub.gateway.core.model.Credential;
import com.llmhub.gateway.core.model.ProviderType;
import com.llmhub.gateway.exception.ConfigException;
import com.llmhub.gateway.exception.ResourceNotFoundException;
import com.llmhub.gateway.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Slf4j
@Service
@RequiredArgsConstructor
public class MybatisCredentialStore implements CredentialStore {

    private final CredentialMapper credentialMapper;
    private final CredentialCipher cipher;
    private final GatewayProperties properties;

    @Override
    public Mono<Credential> getCredential(Long id, Long ownerId) {
        return blocking(() -> loadOwned(id, ownerId));
    }

    @Override
    public String decryptSecret(String blob) {
        return cipher.decrypt(blob);
    }

    @Override
    public Mono<List<Credential>> findActiveByProvider(String provider, Long ownerId) {
        return blocking(() -> credentialMapper.findActiveByProvider(ownerId, provider));
    }

    @Override
    public Mono<Credential> findGatewayClient(String token) {
        if (token == null || token.isBlank()) {
            return Mono.empty();
        }
        String hash = Hashing.sha256Hex(token);
        return Mono.fromCallable(() -> credentialMapper.findGatewayClientByHash(hash))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Void> touch(Long credentialId) {
        return Mono.fromRunnable(() -> credentialMapper.touch(credentialId, LocalDateTime.now()))
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    @Override
    public Mono<List<Credential>> listByOwner(Long ownerId) {
        return blocking(() -> credentialMapper.findByOwner(ownerId));
    }

    @Override
    public Mono<Credential> register(Long ownerId, String provider, String displayName, String secret,
                                     Map<String, Object> extraConfig, Integer rateLimitRpm) {
        return Mono.fromCallable(() -> prepare(ownerId, provider, displayName, secret, extraConfig, rateLimitRpm))
                .publishOn(Schedulers.boundedElastic())
                .map(credential -> {
                    credentialMapper.insert(credential);
                    log.info("Registered credential: id={}, owner={}, provider={}",
                            credential.getId(), ownerId, credential.getProvider());
                    return credential;
                });
    }

    @Override
    public Mono<Credential> update(Long id, Long ownerId, String displayName,
                                   Map<String, Object> extraConfig, Integer rateLimitRpm) {
        return blocking(() -> {
            Credential credential = loadOwned(id, ownerId);
            if (displayName != null) {
                if (displayName.isBlank()) {
                    throw new ValidationException("display_name must not be blank");
                }
                credential.setDisplayName(displayName);
            }
            if (extraConfig != null) {
                credential.setExtraConfig(new LinkedHashMap<>(extraConfig));
            }
            if (rateLimitRpm != null) {
                credential.setRateLimitRpm(checkedRpm(rateLimitRpm));
            }
            credential.setUpdatedAt(LocalDateTime.now());
            credentialMapper.update(credential);
            log.info("Updated credential {}", id);
            return credential;
        });
    }

    @Override
    public Mono<Credential> toggle(Long id, Long ownerId) {
        return blocking(() -> {
            Credential credential = loadOwned(id, ownerId);
            credential.setIsActive(!credential.isUsable());
            credential.setUpdatedAt(LocalDateTime.now());
            credentialMapper.updateStatus(id, credential.getIsActive(), credential.getUpdatedAt());
            log.info("Credential {} is now {}", id, credential.isUsable() ? "active" : "inactive");
            return credential;
        });
    }

    @Override
    public Mono<Void> delete(Long id, Long ownerId) {
        return blocking(() -> {
            loadOwned(id, ownerId);
            credentialMapper.delete(id);
            log.info("Deleted credential {}", id);
            return id;
        }).then();
    }

    private Credential loadOwned(Long id, Long ownerId) {
        Credential credential = credentialMapper.findById(id);
        if (credential == null || !credential.isOwnedBy(ownerId)) {
            throw new ResourceNotFoundException("Credential " + id + " not found");
        }
        return credential;
    }

    private Credential prepare(Long ownerId, String provider, String displayName, String secret,
                               Map<String, Object> extraConfig, Integer rateLimitRpm) {
        if (displayName == null || displayName.isBlank()) {
            throw new ValidationException("display_name is required");
        }
        boolean gatewayClient = Credential.GATEWAY_CLIENT.equalsIgnoreCase(provider == null ? "" : provider.trim());
        String normalized;
        boolean secretRequired;
        if (gatewayClient) {
            normalized = Credential.GATEWAY_CLIENT;
            secretRequired = true;
        } else {
            ProviderType type = ProviderType.fromId(provider);
            normalized = type.id();
            secretRequired = type.requiresSecret();
            if (type == ProviderType.CUSTOM && (extraConfig == null || extraConfig.get("base_url") == null)) {
                throw new ConfigException("custom provider requires base_url in extra_config");
            }
        }
        boolean hasSecret = secret != null && !secret.isBlank();
        if (secretRequired && !hasSecret) {
            throw new ConfigException(normalized + " requires an API key");
        }

        LocalDateTime now = LocalDateTime.now();
        return Credential.builder()
                .ownerId(ownerId)
                .provider(normalized)
                .displayName(displayName.trim())
                .secret(hasSecret ? cipher.encrypt(secret) : null)
                .secretHash(gatewayClient ? Hashing.sha256Hex(secret) : null)
                .extraConfig(extraConfig != null ? new LinkedHashMap<>(extraConfig) : new LinkedHashMap<>())
                .isActive(true)
                .rateLimitRpm(rateLimitRpm != null ? checkedRpm(rateLimitRpm) : properties.getDefaultRateLimitRpm())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private static int checkedRpm(int rpm) {
        if (rpm <= 0) {
            throw new ValidationException("rate_limit_rpm must be positive");
        }
        return rpm;
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
