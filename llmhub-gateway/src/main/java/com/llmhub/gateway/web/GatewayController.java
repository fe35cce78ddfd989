package com.llmhub.gateway.web;

import com.llmhub.gateway.api.ChatCompletionRequest;
import com.llmhub.gateway.api.ChatCompletionResponse;
import com.llmhub.gateway.api.ModelListResponse;
import com.llmhub.gateway.core.catalog.ModelCatalogService;
import com.llmhub.gateway.core.model.ChatRequest;
import com.llmhub.gateway.core.router.GatewayRouter;
import com.llmhub.gateway.core.stream.StreamBridge;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * OpenAI 兼容入口。鉴权、路由和选凭证都在返回响应头之前完成，
 * 这些阶段的错误以普通 HTTP 状态码返回；流开始之后的错误走 SSE error 事件
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class GatewayController {

    private final GatewayAuthenticator authenticator;
    private final GatewayRouter router;
    private final StreamBridge streamBridge;
    private final ModelCatalogService catalogService;

    @PostMapping(value = {"/v1/chat/completions", "/chat/completions"})
    public Mono<ResponseEntity<Object>> chatCompletions(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody ChatCompletionRequest body) {
        return authenticator.authenticate(authorization)
                .flatMap(client -> {
                    ChatRequest request = body.toChatRequest();
                    log.info("Received request for model: {} (client {}, stream={})",
                            request.getModel(), client.getId(), body.isStreaming());
                    return router.route(request.getModel(), client.getOwnerId())
                            .flatMap(route -> body.isStreaming()
                                    ? Mono.just(ResponseEntity.ok()
                                            .contentType(MediaType.TEXT_EVENT_STREAM)
                                            .body((Object) streamBridge.toSse(router.streamChat(route, request), request.getModel())))
                                    : router.chat(route, request)
                                            .map(result -> ResponseEntity.ok()
                                                    .contentType(MediaType.APPLICATION_JSON)
                                                    .body((Object) ChatCompletionResponse.from(result))));
                });
    }

    @GetMapping("/v1/models")
    public Mono<ModelListResponse> models(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return authenticator.authenticate(authorization)
                .flatMap(client -> catalogService.listOwnerModels(client.getOwnerId()))
                .map(ModelListResponse::of);
    }
}
