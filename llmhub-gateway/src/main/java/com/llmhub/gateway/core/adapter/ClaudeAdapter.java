package com.llmhub.gateway.core.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.llmhub.gateway.core.model.ChatCompletionResult;
import com.llmhub.gateway.core.model.ChatMessage;
import com.llmhub.gateway.core.model.ChatRequest;
import com.llmhub.gateway.core.model.ProviderType;
import com.llmhub.gateway.core.model.Usage;
import com.llmhub.gateway.core.transport.UpstreamCall;
import com.llmhub.gateway.core.transport.UpstreamTransport;
import com.llmhub.gateway.exception.UpstreamException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Anthropic Messages API。
 * system 消息单独放到顶层 system 字段；上游强制要求 max_tokens，缺省补 4096
 */
@Slf4j
public class ClaudeAdapter extends AbstractProviderAdapter {

    public static final String DEFAULT_BASE_URL = "https://api.anthropic.com";
    public static final String API_VERSION = "2023-06-01";
    public static final int DEFAULT_MAX_TOKENS = 4096;

    // Anthropic 没有模型列表接口
    static final List<String> KNOWN_MODELS = List.of(
            "claude-3-opus-20240229",
            "claude-3-sonnet-20240229",
            "claude-3-haiku-20240307",
            "claude-3-5-sonnet-20241022"
    );

    public ClaudeAdapter(String apiKey, String baseUrl, UpstreamTransport transport, ObjectMapper objectMapper) {
        super(apiKey, baseUrl != null ? baseUrl : DEFAULT_BASE_URL,
                PricingTable.defaultsFor(ProviderType.ANTHROPIC), transport, objectMapper);
        validateConfiguration();
        log.info("Claude adapter initialized");
    }

    @Override
    public ProviderType provider() {
        return ProviderType.ANTHROPIC;
    }

    @Override
    public Mono<ChatCompletionResult> chat(ChatRequest request) {
        return transport.exchange(messagesCall(request, false))
                .map(response -> toResult(request, response))
                .doOnNext(result -> log.info("Claude chat completed: model={}, tokens={}",
                        request.getModel(), result.getUsage().getTotalTokens()))
                .doOnError(e -> log.error("Claude chat error: {}", e.getMessage()));
    }

    @Override
    public Flux<String> streamChat(ChatRequest request) {
        return transport.stream(messagesCall(request, true))
                .doOnSubscribe(s -> log.info("Claude stream chat started: model={}", request.getModel()))
                .<JsonNode>handle((data, sink) -> {
                    JsonNode event = parseChunk(data, sink);
                    if (event != null) {
                        sink.next(event);
                    }
                })
                .takeUntil(event -> "message_stop".equals(event.path("type").asText()))
                .<String>handle((event, sink) -> {
                    String type = event.path("type").asText();
                    if ("error".equals(type)) {
                        JsonNode error = event.path("error");
                        sink.error(new UpstreamException(0, error.path("type").asText("error") + ": "
                                + error.path("message").asText("stream aborted")));
                        return;
                    }
                    if ("content_block_delta".equals(type) && "text_delta".equals(event.path("delta").path("type").asText())) {
                        String text = event.path("delta").path("text").asText("");
                        if (!text.isEmpty()) {
                            sink.next(text);
                        }
                    }
                })
                .doOnError(e -> log.error("Claude stream chat error: {}", e.getMessage()));
    }

    @Override
    public Mono<List<String>> listModels() {
        log.info("Retrieved {} Claude models", KNOWN_MODELS.size());
        return Mono.just(KNOWN_MODELS);
    }

    private UpstreamCall messagesCall(ChatRequest request, boolean stream) {
        return UpstreamCall.builder()
                .url(baseUrl + "/v1/messages")
                .header("x-api-key", secret)
                .header("anthropic-version", API_VERSION)
                .body(buildBody(request, stream))
                .build();
    }

    ObjectNode buildBody(ChatRequest request, boolean stream) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", request.getModel());

        String system = null;
        ArrayNode messages = body.putArray("messages");
        for (ChatMessage message : request.getMessages()) {
            if (message.isSystem()) {
                if (system == null) {
                    system = message.getContent();
                } else {
                    log.debug("Dropping additional system message for Claude request");
                }
                continue;
            }
            messages.addObject()
                    .put("role", message.getRole().value())
                    .put("content", message.getContent());
        }

        body.put("max_tokens", request.getMaxTokens() != null ? request.getMaxTokens() : DEFAULT_MAX_TOKENS);
        body.put("temperature", request.getTemperature());
        if (system != null) {
            body.put("system", system);
        }
        if (stream) {
            body.put("stream", true);
        }
        // 其余 OpenAI 字段 (n, user, presence_penalty ...) Messages API 不接受，丢弃
        Map<String, Object> options = request.getProviderOptions();
        mapOption(options, "top_p", body, "top_p");
        mapOption(options, "top_k", body, "top_k");
        mapStopSequences(options, body, "stop_sequences");
        return body;
    }

    private ChatCompletionResult toResult(ChatRequest request, JsonNode response) {
        StringBuilder content = new StringBuilder();
        for (JsonNode block : response.path("content")) {
            if ("text".equals(block.path("type").asText())) {
                content.append(block.path("text").asText(""));
            }
        }
        JsonNode usageNode = response.path("usage");
        Usage usage = Usage.of(usageNode.path("input_tokens").asInt(0), usageNode.path("output_tokens").asInt(0));

        Map<String, Object> metadata = new HashMap<>();
        if (response.hasNonNull("id")) {
            metadata.put("upstream_id", response.get("id").asText());
        }
        return ChatCompletionResult.builder()
                .content(content.toString())
                .model(request.getModel())
                .usage(usage)
                .finishReason(finishReason(textOrNull(response.path("stop_reason"))))
                .costUsd(costOf(request.getModel(), usage))
                .providerMetadata(metadata)
                .build();
    }

    /**
     * stop_reason 转成 OpenAI 的 finish_reason
     */
    static String finishReason(String stopReason) {
        if (stopReason == null) {
            return "stop";
        }
        switch (stopReason) {
            case "max_tokens":
                return "length";
            case "tool_use":
                return "tool_calls";
            default:
                // end_turn, stop_sequence
                return "stop";
        }
    }
}
