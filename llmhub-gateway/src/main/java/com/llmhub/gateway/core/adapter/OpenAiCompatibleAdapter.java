package com.llmhub.gateway.core.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.llmhub.gateway.core.model.ChatCompletionResult;
import com.llmhub.gateway.core.model.ChatMessage;
import com.llmhub.gateway.core.model.ChatRequest;
import com.llmhub.gateway.core.model.Usage;
import com.llmhub.gateway.core.transport.UpstreamCall;
import com.llmhub.gateway.core.transport.UpstreamTransport;
import com.llmhub.gateway.exception.UpstreamException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * OpenAI Chat Completions 协议。openai / custom / ollama 共用，只在 base URL、定价和元数据上不同
 */
@Slf4j
public abstract class OpenAiCompatibleAdapter extends AbstractProviderAdapter {

    private static final String DONE = "[DONE]";

    protected OpenAiCompatibleAdapter(String secret, String baseUrl, PricingTable pricing,
                                      UpstreamTransport transport, ObjectMapper objectMapper) {
        super(secret, baseUrl, pricing, transport, objectMapper);
    }

    /**
     * 附加到结果上的 provider 元数据
     */
    protected Map<String, Object> metadata() {
        return Map.of();
    }

    @Override
    public Mono<ChatCompletionResult> chat(ChatRequest request) {
        return transport.exchange(completionCall(request, false))
                .map(response -> toResult(request, response))
                .doOnNext(result -> log.info("{} chat completed: model={}, tokens={}", provider().id(),
                        request.getModel(), result.getUsage() != null ? result.getUsage().getTotalTokens() : "unknown"))
                .doOnError(e -> log.error("{} chat error: {}", provider().id(), e.getMessage()));
    }

    @Override
    public Flux<String> streamChat(ChatRequest request) {
        return transport.stream(completionCall(request, true))
                .doOnSubscribe(s -> log.info("{} stream chat started: model={}", provider().id(), request.getModel()))
                .takeUntil(DONE::equals)
                .filter(data -> !DONE.equals(data))
                .<String>handle((data, sink) -> {
                    JsonNode chunk = parseChunk(data, sink);
                    if (chunk == null) {
                        return;
                    }
                    if (chunk.hasNonNull("error")) {
                        sink.error(new UpstreamException(0, chunk.path("error").path("message").asText(chunk.get("error").toString())));
                        return;
                    }
                    String delta = chunk.path("choices").path(0).path("delta").path("content").asText("");
                    if (!delta.isEmpty()) {
                        sink.next(delta);
                    }
                })
                .doOnError(e -> log.error("{} stream chat error: {}", provider().id(), e.getMessage()));
    }

    @Override
    public Mono<List<String>> listModels() {
        UpstreamCall call = UpstreamCall.builder()
                .method(HttpMethod.GET)
                .url(baseUrl + "/models")
                .header("Authorization", "Bearer " + secret)
                .build();
        return transport.exchange(call)
                .map(response -> {
                    List<String> ids = new ArrayList<>();
                    response.path("data").forEach(model -> ids.add(model.path("id").asText()));
                    log.info("Retrieved {} models from {}", ids.size(), baseUrl);
                    return ids;
                });
    }

    protected UpstreamCall completionCall(ChatRequest request, boolean stream) {
        return UpstreamCall.builder()
                .url(baseUrl + "/chat/completions")
                .header("Authorization", "Bearer " + secret)
                .body(buildBody(request, stream))
                .build();
    }

    protected ObjectNode buildBody(ChatRequest request, boolean stream) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", request.getModel());
        // system 消息原样保留在 messages 中
        ArrayNode messages = body.putArray("messages");
        for (ChatMessage message : request.getMessages()) {
            messages.addObject()
                    .put("role", message.getRole().value())
                    .put("content", message.getContent());
        }
        body.put("temperature", request.getTemperature());
        if (request.getMaxTokens() != null) {
            body.put("max_tokens", request.getMaxTokens());
        }
        body.put("stream", stream);
        // 同一协议，附加参数原样透传，不覆盖已写入的字段
        request.getProviderOptions().forEach((key, value) -> {
            if (!body.has(key)) {
                body.set(key, objectMapper.valueToTree(value));
            }
        });
        return body;
    }

    private ChatCompletionResult toResult(ChatRequest request, JsonNode response) {
        JsonNode choices = response.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new UpstreamException(0, provider().id() + " response contains no choices");
        }
        JsonNode choice = choices.get(0);
        Usage usage = null;
        JsonNode usageNode = response.path("usage");
        if (usageNode.isObject()) {
            int prompt = usageNode.path("prompt_tokens").asInt(0);
            int completion = usageNode.path("completion_tokens").asInt(0);
            usage = Usage.of(prompt, completion, usageNode.path("total_tokens").asInt(prompt + completion));
        }
        return ChatCompletionResult.builder()
                .content(choice.path("message").path("content").asText(""))
                .model(request.getModel())
                .usage(usage)
                .finishReason(textOrNull(choice.path("finish_reason")))
                .costUsd(costOf(request.getModel(), usage))
                .providerMetadata(metadata())
                .build();
    }
}
