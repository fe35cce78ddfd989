package com.llmhub.gateway.core.catalog;

import com.llmhub.gateway.config.GatewayProperties;
import com.llmhub.gateway.core.adapter.AdapterFactory;
import com.llmhub.gateway.core.cache.TtlCache;
import com.llmhub.gateway.core.credential.CredentialStore;
import com.llmhub.gateway.core.model.Credential;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 凭证可用模型列表，结果按凭证缓存 gateway.model-cache-ttl
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelCatalogService {

    private final CredentialStore credentialStore;
    private final AdapterFactory adapterFactory;
    private final GatewayProperties properties;
    private final TtlCache<String, List<String>> modelCache;

    @Value
    public static class CatalogEntry {
        String id;
        String provider;
    }

    public Mono<List<String>> listModels(Credential credential) {
        String key = cacheKey(credential.getId());
        return Mono.justOrEmpty(modelCache.get(key))
                .doOnNext(models -> log.debug("Model list cache hit for credential {}", credential.getId()))
                .switchIfEmpty(Mono.defer(() -> adapterFactory.createAdapterFromCredential(credential).listModels())
                        .doOnNext(models -> modelCache.set(key, List.copyOf(models), properties.getModelCacheTtl())));
    }

    public Mono<List<String>> listCredentialModels(Long credentialId, Long ownerId) {
        return credentialStore.getCredential(credentialId, ownerId).flatMap(this::listModels);
    }

    /**
     * owner 所有 active 上游凭证的模型并集，按首次出现去重。单个凭证失败时跳过
     */
    public Mono<List<CatalogEntry>> listOwnerModels(Long ownerId) {
        return credentialStore.listByOwner(ownerId)
                .flatMapMany(Flux::fromIterable)
                .filter(credential -> credential.isUsable() && !Credential.GATEWAY_CLIENT.equals(credential.getProvider()))
                .concatMap(credential -> listModels(credential)
                        .map(models -> models.stream().map(id -> new CatalogEntry(id, credential.getProvider()))
                                .collect(Collectors.toList()))
                        .onErrorResume(e -> {
                            log.warn("Skipping models of credential {}: {}", credential.getId(), e.getMessage());
                            return Mono.just(List.of());
                        }))
                .collectList()
                .map(ModelCatalogService::union);
    }

    public void invalidate(Long credentialId) {
        modelCache.delete(cacheKey(credentialId));
        log.debug("Invalidated model list cache for credential {}", credentialId);
    }

    private static List<CatalogEntry> union(List<List<CatalogEntry>> lists) {
        Map<String, CatalogEntry> byId = new LinkedHashMap<>();
        lists.forEach(entries -> entries.forEach(entry -> byId.putIfAbsent(entry.getId(), entry)));
        return new ArrayList<>(byId.values());
    }

    private static String cacheKey(Long credentialId) {
        return "models:" + credentialId;
    }
}
