package com.llmhub.gateway.web;

import com.llmhub.gateway.core.credential.CredentialStore;
import com.llmhub.gateway.core.model.Credential;
import com.llmhub.gateway.exception.AuthException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * 校验 Authorization: Bearer <token>，解析出网关客户端凭证
 */
@Component
@RequiredArgsConstructor
public class GatewayAuthenticator {

    private static final String BEARER = "Bearer ";

    private final CredentialStore credentialStore;

    public Mono<Credential> authenticate(String authorization) {
        if (authorization == null || !authorization.regionMatches(true, 0, BEARER, 0, BEARER.length())) {
            return Mono.error(new AuthException("Missing bearer token"));
        }
        String token = authorization.substring(BEARER.length()).trim();
        if (token.isEmpty()) {
            return Mono.error(new AuthException("Missing bearer token"));
        }
        return credentialStore.findGatewayClient(token)
                .switchIfEmpty(Mono.error(() -> new AuthException("Invalid API key")));
    }
}
