package com.llmhub.gateway.core.router;

import com.llmhub.gateway.core.adapter.AdapterFactory;
import com.llmhub.gateway.core.credential.CredentialStore;
import com.llmhub.gateway.core.model.ChatCompletionResult;
import com.llmhub.gateway.core.model.ChatRequest;
import com.llmhub.gateway.core.model.Credential;
import com.llmhub.gateway.core.model.ProviderType;
import com.llmhub.gateway.core.usage.UsageContext;
import com.llmhub.gateway.core.usage.UsageRecorder;
import com.llmhub.gateway.exception.NoCapacityException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * 网关入口的路由：模型名 -> provider -> 凭证 -> 适配器。
 * 同一 owner 同一 provider 下有多个凭证时轮询，跳过本分钟已达 rpm 上限的凭证
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GatewayRouter {

    private final ProviderResolutionPolicy resolutionPolicy;
    private final CredentialStore credentialStore;
    private final AdapterFactory adapterFactory;
    private final CredentialRateLimiter rateLimiter;
    private final UsageRecorder usageRecorder;

    // provider:owner -> 轮询游标
    private final Map<String, AtomicInteger> cursors = new ConcurrentHashMap<>();

    public ProviderType resolveProvider(String model) {
        return resolutionPolicy.resolve(model);
    }

    /**
     * 选出凭证并构建适配器。任何错误都发生在上游调用之前
     */
    public Mono<Route> route(String model, Long ownerId) {
        ProviderType provider = resolveProvider(model);
        return selectCredential(provider.id(), ownerId)
                .map(credential -> {
                    log.info("Routing model {} -> provider {} (credential {})", model, provider.id(), credential.getId());
                    return new Route(provider, credential, adapterFactory.createAdapterFromCredential(credential));
                });
    }

    public Mono<ChatCompletionResult> chat(ChatRequest request, Long ownerId) {
        return route(request.getModel(), ownerId).flatMap(route -> chat(route, request));
    }

    public Mono<ChatCompletionResult> chat(Route route, ChatRequest request) {
        return route.getAdapter().chat(request)
                .flatMap(result -> usageRecorder.recordCompletion(contextOf(route, request), result));
    }

    public Flux<String> streamChat(Route route, ChatRequest request) {
        return usageRecorder.recordStream(contextOf(route, request), route.getAdapter().streamChat(request));
    }

    Mono<Credential> selectCredential(String provider, Long ownerId) {
        return credentialStore.findActiveByProvider(provider, ownerId)
                .map(candidates -> {
                    List<Credential> usable = candidates.stream().filter(Credential::isUsable).collect(Collectors.toList());
                    if (usable.isEmpty()) {
                        throw NoCapacityException.noCredential(provider);
                    }
                    AtomicInteger cursor = cursors.computeIfAbsent(provider + ":" + ownerId, k -> new AtomicInteger());
                    int start = Math.floorMod(cursor.getAndIncrement(), usable.size());
                    for (int i = 0; i < usable.size(); i++) {
                        Credential candidate = usable.get((start + i) % usable.size());
                        if (rateLimiter.tryAcquire(candidate)) {
                            return candidate;
                        }
                    }
                    log.warn("All {} credentials of owner {} are rate limited", provider, ownerId);
                    throw NoCapacityException.rateLimited(provider);
                });
    }

    private static UsageContext contextOf(Route route, ChatRequest request) {
        return UsageContext.builder()
                .credentialId(route.getCredential().getId())
                .provider(route.getProvider().id())
                .model(request.getModel())
                .build();
    }
}
