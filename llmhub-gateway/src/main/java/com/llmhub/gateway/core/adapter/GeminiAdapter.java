package com.llmhub.gateway.core.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.llmhub.gateway.core.model.ChatCompletionResult;
import com.llmhub.gateway.core.model.ChatMessage;
import com.llmhub.gateway.core.model.ChatRequest;
import com.llmhub.gateway.core.model.ProviderType;
import com.llmhub.gateway.core.model.Role;
import com.llmhub.gateway.core.model.Usage;
import com.llmhub.gateway.core.transport.UpstreamCall;
import com.llmhub.gateway.core.transport.UpstreamTransport;
import com.llmhub.gateway.exception.UpstreamException;
import com.llmhub.gateway.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Google Gemini (Generative Language API)。
 * 没有 system 角色：system 消息直接丢弃；assistant 改写为 model
 */
@Slf4j
public class GeminiAdapter extends AbstractProviderAdapter {

    public static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com";

    public GeminiAdapter(String apiKey, String baseUrl, UpstreamTransport transport, ObjectMapper objectMapper) {
        super(apiKey, baseUrl != null ? baseUrl : DEFAULT_BASE_URL,
                PricingTable.defaultsFor(ProviderType.GOOGLE), transport, objectMapper);
        validateConfiguration();
        log.info("Gemini adapter initialized");
    }

    @Override
    public ProviderType provider() {
        return ProviderType.GOOGLE;
    }

    @Override
    public Mono<ChatCompletionResult> chat(ChatRequest request) {
        return Mono.fromSupplier(() -> generateCall(request, ":generateContent"))
                .flatMap(transport::exchange)
                .map(response -> toResult(request, response))
                .doOnNext(result -> log.info("Gemini chat completed: model={}", request.getModel()))
                .doOnError(e -> log.error("Gemini chat error: {}", e.getMessage()));
    }

    @Override
    public Flux<String> streamChat(ChatRequest request) {
        return Mono.fromSupplier(() -> generateCall(request, ":streamGenerateContent?alt=sse"))
                .flatMapMany(transport::stream)
                .doOnSubscribe(s -> log.info("Gemini stream chat started: model={}", request.getModel()))
                .<String>handle((data, sink) -> {
                    JsonNode chunk = parseChunk(data, sink);
                    if (chunk == null) {
                        return;
                    }
                    if (chunk.hasNonNull("error")) {
                        sink.error(new UpstreamException(chunk.path("error").path("code").asInt(0),
                                chunk.path("error").path("message").asText("stream aborted")));
                        return;
                    }
                    String text = candidateText(chunk);
                    if (!text.isEmpty()) {
                        sink.next(text);
                    }
                })
                .doOnError(e -> log.error("Gemini stream chat error: {}", e.getMessage()));
    }

    /**
     * Gemini 总是提供列表接口，失败直接抛出
     */
    @Override
    public Mono<List<String>> listModels() {
        UpstreamCall call = UpstreamCall.builder()
                .method(HttpMethod.GET)
                .url(baseUrl + "/v1beta/models?pageSize=1000")
                .header("x-goog-api-key", secret)
                .build();
        return transport.exchange(call)
                .map(response -> {
                    List<String> names = new ArrayList<>();
                    for (JsonNode model : response.path("models")) {
                        boolean generates = false;
                        for (JsonNode method : model.path("supportedGenerationMethods")) {
                            generates |= "generateContent".equals(method.asText());
                        }
                        if (generates) {
                            names.add(stripModelsPrefix(model.path("name").asText()));
                        }
                    }
                    log.info("Retrieved {} Gemini models", names.size());
                    return names;
                })
                .doOnError(e -> log.error("Failed to get Gemini models: {}", e.getMessage()));
    }

    private UpstreamCall generateCall(ChatRequest request, String action) {
        return UpstreamCall.builder()
                .url(baseUrl + "/v1beta/models/" + stripModelsPrefix(request.getModel()) + action)
                .header("x-goog-api-key", secret)
                .body(buildBody(request))
                .build();
    }

    ObjectNode buildBody(ChatRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        ArrayNode contents = body.putArray("contents");
        for (ChatMessage message : request.getMessages()) {
            if (message.isSystem()) {
                continue;
            }
            ObjectNode content = contents.addObject();
            content.put("role", message.getRole() == Role.ASSISTANT ? "model" : "user");
            content.putArray("parts").addObject().put("text", message.getContent());
        }
        if (contents.isEmpty()) {
            throw new ValidationException("Gemini requires at least one non-system message");
        }

        ObjectNode generationConfig = body.putObject("generationConfig");
        generationConfig.put("temperature", request.getTemperature());
        if (request.getMaxTokens() != null) {
            generationConfig.put("maxOutputTokens", request.getMaxTokens());
        }
        Map<String, Object> options = request.getProviderOptions();
        mapOption(options, "top_p", generationConfig, "topP");
        mapOption(options, "top_k", generationConfig, "topK");
        mapStopSequences(options, generationConfig, "stopSequences");
        return body;
    }

    private ChatCompletionResult toResult(ChatRequest request, JsonNode response) {
        JsonNode candidates = response.path("candidates");
        if (!candidates.isArray() || candidates.isEmpty()) {
            String reason = response.path("promptFeedback").path("blockReason").asText("no candidates");
            throw new UpstreamException(0, "Gemini returned no candidates: " + reason);
        }
        Usage usage = null;
        JsonNode usageNode = response.path("usageMetadata");
        if (usageNode.isObject()) {
            int prompt = usageNode.path("promptTokenCount").asInt(0);
            int completion = usageNode.path("candidatesTokenCount").asInt(0);
            usage = Usage.of(prompt, completion, usageNode.path("totalTokenCount").asInt(prompt + completion));
        }
        return ChatCompletionResult.builder()
                .content(candidateText(response))
                .model(request.getModel())
                .usage(usage)
                .finishReason(finishReason(textOrNull(candidates.get(0).path("finishReason"))))
                .costUsd(costOf(request.getModel(), usage))
                .build();
    }

    /**
     * Gemini 的 finishReason (STOP / MAX_TOKENS / SAFETY ...) 转成 OpenAI 的 finish_reason
     */
    static String finishReason(String reason) {
        if (reason == null) {
            return "stop";
        }
        switch (reason.toUpperCase(Locale.ROOT)) {
            case "MAX_TOKENS":
                return "length";
            case "SAFETY":
            case "RECITATION":
            case "BLOCKLIST":
            case "PROHIBITED_CONTENT":
            case "SPII":
                return "content_filter";
            default:
                return "stop";
        }
    }

    private static String candidateText(JsonNode response) {
        StringBuilder text = new StringBuilder();
        for (JsonNode part : response.path("candidates").path(0).path("content").path("parts")) {
            text.append(part.path("text").asText(""));
        }
        return text.toString();
    }

    private static String stripModelsPrefix(String name) {
        return name.startsWith("models/") ? name.substring("models/".length()) : name;
    }
}
