package com.llmhub.gateway.web;

import com.llmhub.gateway.api.CredentialRequest;
import com.llmhub.gateway.api.CredentialResponse;
import com.llmhub.gateway.api.CredentialUpdateRequest;
import com.llmhub.gateway.core.adapter.AdapterFactory;
import com.llmhub.gateway.core.catalog.ModelCatalogService;
import com.llmhub.gateway.core.credential.CredentialStore;
import com.llmhub.gateway.core.router.CredentialRateLimiter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 凭证管理。用户身份由外层认证服务通过 X-User-Id 传入
 */
@RestController
@RequestMapping("/api/credentials")
@RequiredArgsConstructor
@Slf4j
public class CredentialController {

    static final String USER_HEADER = "X-User-Id";

    private final CredentialStore credentialStore;
    private final ModelCatalogService catalogService;
    private final AdapterFactory adapterFactory;
    private final CredentialRateLimiter rateLimiter;

    @GetMapping("/providers")
    public List<String> providers() {
        return adapterFactory.supportedProviders();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<CredentialResponse> register(@RequestHeader(USER_HEADER) Long userId,
                                             @Valid @RequestBody CredentialRequest request) {
        return credentialStore.register(userId, request.getProvider(), request.getDisplayName(), request.getApiKey(),
                        request.getExtraConfig(), request.getRateLimitRpm())
                .map(CredentialResponse::from);
    }

    @GetMapping
    public Mono<List<CredentialResponse>> list(@RequestHeader(USER_HEADER) Long userId) {
        return credentialStore.listByOwner(userId)
                .map(credentials -> credentials.stream().map(CredentialResponse::from).collect(Collectors.toList()));
    }

    @PutMapping("/{id}")
    public Mono<CredentialResponse> update(@RequestHeader(USER_HEADER) Long userId, @PathVariable Long id,
                                           @Valid @RequestBody CredentialUpdateRequest request) {
        return credentialStore.update(id, userId, request.getDisplayName(), request.getExtraConfig(), request.getRateLimitRpm())
                .doOnNext(c -> evict(id))
                .map(CredentialResponse::from);
    }

    @PostMapping("/{id}/toggle")
    public Mono<CredentialResponse> toggle(@RequestHeader(USER_HEADER) Long userId, @PathVariable Long id) {
        return credentialStore.toggle(id, userId)
                .doOnNext(c -> evict(id))
                .map(CredentialResponse::from);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> delete(@RequestHeader(USER_HEADER) Long userId, @PathVariable Long id) {
        return credentialStore.delete(id, userId)
                .doOnSuccess(v -> evict(id));
    }

    @GetMapping("/{id}/models")
    public Mono<Map<String, Object>> models(@RequestHeader(USER_HEADER) Long userId, @PathVariable Long id) {
        return catalogService.listCredentialModels(id, userId)
                .map(models -> Map.of("credential_id", id, "models", models));
    }

    // rpm 或状态变了，缓存的模型列表和本分钟计数都作废
    private void evict(Long id) {
        catalogService.invalidate(id);
        rateLimiter.reset(id);
    }
}
