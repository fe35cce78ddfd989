package com.llmhub.gateway.core.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmhub.gateway.api.ChatCompletionChunk;
import com.llmhub.gateway.api.ErrorResponse;
import com.llmhub.gateway.config.GatewayProperties;
import com.llmhub.gateway.exception.GatewayException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.UUID;

/**
 * 把适配器产出的内容分片桥接成 OpenAI 格式的 SSE：
 * 每个分片一个 chat.completion.chunk，正常结束追加 finish_reason=stop 分片和 [DONE]，
 * 出错时发送 event:error 并结束，不发送 [DONE]
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StreamBridge {

    public static final String DONE = "[DONE]";
    public static final String ERROR_EVENT = "error";

    private final ObjectMapper objectMapper;
    private final GatewayProperties properties;

    public Flux<ServerSentEvent<String>> toSse(Flux<String> fragments, String model) {
        String id = "chatcmpl-" + UUID.randomUUID().toString().replace("-", "");
        long created = Instant.now().getEpochSecond();

        return fragments
                // 有界预取，上游不会跑在 SSE 消费者前面太多
                .limitRate(properties.getStreamPrefetch())
                .map(fragment -> data(ChatCompletionChunk.of(id, created, model, fragment, null)))
                .concatWith(Mono.fromSupplier(() -> data(ChatCompletionChunk.of(id, created, model, null, "stop"))))
                .concatWith(Mono.just(ServerSentEvent.builder(DONE).build()))
                .onErrorResume(e -> {
                    if (e instanceof GatewayException) {
                        log.warn("Stream {} failed: {}", id, e.getMessage());
                    } else {
                        log.error("Stream {} failed unexpectedly", id, e);
                    }
                    return Mono.just(ServerSentEvent.builder(json(ErrorResponse.from(e))).event(ERROR_EVENT).build());
                })
                .doOnCancel(() -> log.warn("Client cancelled stream: {}", id));
    }

    private ServerSentEvent<String> data(ChatCompletionChunk chunk) {
        return ServerSentEvent.builder(json(chunk)).build();
    }

    private String json(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize stream frame", e);
        }
    }
}
