package com.llmhub.gateway.core.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmhub.gateway.config.GatewayProperties.TransportTimeouts;
import com.llmhub.gateway.exception.AuthException;
import com.llmhub.gateway.exception.GatewayException;
import com.llmhub.gateway.exception.UpstreamException;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.codec.CodecException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.net.URI;

/**
 * 基于 WebClient 的上游传输实现，每个 provider 一个实例（各自的超时配置）
 */
@Slf4j
public class WebClientTransport implements UpstreamTransport {

    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
            new ParameterizedTypeReference<>() {
            };
    private static final int MAX_ERROR_BODY = 500;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public WebClientTransport(WebClient webClient, ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
    }

    public static WebClientTransport create(WebClient.Builder builder, TransportTimeouts timeouts, ObjectMapper objectMapper) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeouts.getConnectTimeout().toMillis())
                // 两次读之间的最大间隔，流式场景下即分片间隔上限
                .responseTimeout(timeouts.getReadTimeout());
        WebClient client = builder.clone()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
        return new WebClientTransport(client, objectMapper);
    }

    @Override
    public Mono<JsonNode> exchange(UpstreamCall call) {
        return prepare(call)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .onErrorMap(this::translate);
    }

    @Override
    public Flux<String> stream(UpstreamCall call) {
        return prepare(call)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .retrieve()
                .bodyToFlux(SSE_TYPE)
                .mapNotNull(ServerSentEvent::data)
                .doOnCancel(() -> log.debug("Upstream stream cancelled: {}", call.getUrl()))
                .onErrorMap(this::translate);
    }

    private WebClient.RequestHeadersSpec<?> prepare(UpstreamCall call) {
        WebClient.RequestBodySpec spec = webClient.method(call.getMethod())
                .uri(URI.create(call.getUrl()))
                .headers(h -> call.getHeaders().forEach(h::set));
        if (call.getBody() != null) {
            return spec.contentType(MediaType.APPLICATION_JSON).bodyValue(call.getBody());
        }
        return spec;
    }

    private Throwable translate(Throwable e) {
        if (e instanceof GatewayException) {
            return e;
        }
        if (e instanceof WebClientResponseException) {
            WebClientResponseException responseException = (WebClientResponseException) e;
            int status = responseException.getStatusCode().value();
            String message = providerMessage(responseException.getResponseBodyAsString());
            if (status == 401 || status == 403) {
                return new AuthException(HttpStatus.valueOf(status), "Upstream rejected credential: " + message, e);
            }
            return new UpstreamException(status, message, e);
        }
        if (e instanceof WebClientRequestException) {
            return new UpstreamException(0, e.getMessage(), e);
        }
        if (e instanceof CodecException) {
            return new UpstreamException(0, "Malformed upstream response: " + e.getMessage(), e);
        }
        return e;
    }

    /**
     * 尽量从上游错误体中取出 error.message，取不到就返回截断后的原文
     */
    private String providerMessage(String body) {
        if (body == null || body.isBlank()) {
            return "(empty body)";
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            JsonNode error = node.path("error");
            if (error.isTextual()) {
                return error.asText();
            }
            if (error.hasNonNull("message")) {
                return error.get("message").asText();
            }
        } catch (Exception parseError) {
            log.debug("Upstream error body is not JSON: {}", parseError.getMessage());
        }
        return body.length() > MAX_ERROR_BODY ? body.substring(0, MAX_ERROR_BODY) : body;
    }
}
