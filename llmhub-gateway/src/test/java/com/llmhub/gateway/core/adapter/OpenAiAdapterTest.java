package com.llmhub.gateway.core.adapter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmhub.gateway.core.model.ChatCompletionResult;
import com.llmhub.gateway.core.model.ChatMessage;
import com.llmhub.gateway.core.model.ChatRequest;
import com.llmhub.gateway.core.transport.StubTransport;
import com.llmhub.gateway.core.transport.UpstreamCall;
import com.llmhub.gateway.exception.ConfigException;
import com.llmhub.gateway.exception.UpstreamException;

import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

class OpenAiAdapterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private StubTransport transport;
    private OpenAiAdapter adapter;

    @BeforeEach
    void setUp() {
        transport = new StubTransport();
        adapter = new OpenAiAdapter("sk-test", null, transport, objectMapper);
    }

    private static ChatRequest request(String model) {
        return ChatRequest.builder()
                .model(model)
                .messages(List.of(ChatMessage.system("be brief"), ChatMessage.user("hi")))
                .maxTokens(50)
                .providerOptions(Map.of("top_p", 0.9, "model", "ignored"))
                .build();
    }

    @Test
    void shouldTranslateRequestWithInlineSystemMessage() {
        transport.respond("""
                {"choices":[{"message":{"role":"assistant","content":"hello"},"finish_reason":"stop"}],
                 "usage":{"prompt_tokens":10,"completion_tokens":5,"total_tokens":15}}
                """);

        adapter.chat(request("gpt-4o")).block();

        UpstreamCall call = transport.lastCall();
        assertThat(call.getUrl()).isEqualTo("https://api.openai.com/v1/chat/completions");
        assertThat(call.getHeaders()).containsEntry("Authorization", "Bearer sk-test");
        JsonNode body = call.getBody();
        assertThat(body.path("model").asText()).isEqualTo("gpt-4o");
        assertThat(body.path("messages")).hasSize(2);
        assertThat(body.path("messages").get(0).path("role").asText()).isEqualTo("system");
        assertThat(body.path("max_tokens").asInt()).isEqualTo(50);
        assertThat(body.path("stream").asBoolean()).isFalse();
        // 附加参数只补充，不覆盖
        assertThat(body.path("top_p").asDouble()).isEqualTo(0.9);
    }

    @Test
    void shouldNormalizeResponseAndComputeCost() {
        transport.respond("""
                {"choices":[{"message":{"role":"assistant","content":"hello"},"finish_reason":"stop"}],
                 "usage":{"prompt_tokens":1000,"completion_tokens":500,"total_tokens":1500}}
                """);

        ChatCompletionResult result = adapter.chat(request("gpt-4o")).block();

        assertThat(result.getContent()).isEqualTo("hello");
        assertThat(result.getFinishReason()).isEqualTo("stop");
        assertThat(result.getUsage().getTotalTokens()).isEqualTo(1500);
        assertThat(result.getCostUsd()).isCloseTo(0.0125, within(1e-9));
    }

    @Test
    void shouldLeaveUsageUnknownWhenUpstreamOmitsIt() {
        transport.respond("""
                {"choices":[{"message":{"role":"assistant","content":"hello"},"finish_reason":"stop"}]}
                """);

        ChatCompletionResult result = adapter.chat(request("gpt-4o")).block();

        assertThat(result.getUsage()).isNull();
        assertThat(result.getCostUsd()).isNull();
    }

    @Test
    void shouldFailWhenResponseHasNoChoices() {
        transport.respond("{\"choices\":[]}");

        StepVerifier.create(adapter.chat(request("gpt-4o")))
                .expectError(UpstreamException.class)
                .verify();
    }

    @Test
    void shouldStreamNonEmptyDeltasUntilDone() {
        transport.streamData(
                "{\"choices\":[{\"delta\":{\"role\":\"assistant\"}}]}",
                "{\"choices\":[{\"delta\":{\"content\":\"Hel\"}}]}",
                "{\"choices\":[{\"delta\":{\"content\":\"\"}}]}",
                "{\"choices\":[{\"delta\":{\"content\":\"lo\"}}]}",
                "[DONE]",
                "{\"choices\":[{\"delta\":{\"content\":\"ignored\"}}]}");

        StepVerifier.create(adapter.streamChat(request("gpt-4o")))
                .expectNext("Hel", "lo")
                .verifyComplete();

        assertThat(transport.lastCall().getBody().path("stream").asBoolean()).isTrue();
    }

    @Test
    void shouldSignalMidStreamErrorStructurally() {
        transport.streamWith(Flux.concat(
                Flux.just("{\"choices\":[{\"delta\":{\"content\":\"partial\"}}]}"),
                Flux.error(new UpstreamException(0, "connection reset"))));

        StepVerifier.create(adapter.streamChat(request("gpt-4o")))
                .expectNext("partial")
                .expectError(UpstreamException.class)
                .verify();
    }

    @Test
    void shouldRejectMalformedChunk() {
        transport.streamData("not json");

        StepVerifier.create(adapter.streamChat(request("gpt-4o")))
                .expectError(UpstreamException.class)
                .verify();
    }

    @Test
    void shouldListModelIds() {
        transport.respond("{\"data\":[{\"id\":\"gpt-4o\"},{\"id\":\"gpt-4o-mini\"}]}");

        StepVerifier.create(adapter.listModels())
                .expectNext(List.of("gpt-4o", "gpt-4o-mini"))
                .verifyComplete();
        assertThat(transport.lastCall().getMethod()).isEqualTo(HttpMethod.GET);
        assertThat(transport.lastCall().getUrl()).isEqualTo("https://api.openai.com/v1/models");
    }

    @Test
    void shouldPropagateListModelsFailure() {
        transport.fail(new UpstreamException(500, "boom"));

        StepVerifier.create(adapter.listModels())
                .expectError(UpstreamException.class)
                .verify();
    }

    @Test
    void shouldRequireApiKey() {
        assertThatThrownBy(() -> new OpenAiAdapter(" ", null, transport, objectMapper))
                .isInstanceOf(ConfigException.class);
    }

    @Test
    void shouldRejectNonHttpBaseUrl() {
        assertThatThrownBy(() -> new OpenAiAdapter("sk", "ftp://example.com", transport, objectMapper))
                .isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> new OpenAiAdapter("sk", "not a url", transport, objectMapper))
                .isInstanceOf(ConfigException.class);
    }

    @Test
    void shouldForwardExtraOpenAiFieldsVerbatim() {
        transport.respond("{\"choices\":[{\"message\":{\"content\":\"ok\"}}]}");

        adapter.chat(ChatRequest.builder()
                .model("gpt-4o")
                .messages(List.of(ChatMessage.user("hi")))
                .providerOptions(Map.of("n", 1, "user", "u-1", "stop", List.of("END")))
                .build()).block();

        JsonNode body = transport.lastCall().getBody();
        assertThat(body.path("n").asInt()).isEqualTo(1);
        assertThat(body.path("user").asText()).isEqualTo("u-1");
        assertThat(body.path("stop").get(0).asText()).isEqualTo("END");
    }

    @Test
    void streamedFragmentsShouldAddUpToBufferedContent() {
        transport.respond("""
                {"choices":[{"message":{"role":"assistant","content":"Hello, world!"},"finish_reason":"stop"}],
                 "usage":{"prompt_tokens":3,"completion_tokens":4,"total_tokens":7}}
                """);
        transport.streamData(
                "{\"choices\":[{\"delta\":{\"role\":\"assistant\"}}]}",
                "{\"choices\":[{\"delta\":{\"content\":\"Hello\"}}]}",
                "{\"choices\":[{\"delta\":{\"content\":\", \"}}]}",
                "{\"choices\":[{\"delta\":{\"content\":\"world!\"}}]}",
                "[DONE]");

        String buffered = adapter.chat(request("gpt-4o")).block().getContent();
        Integer streamed = adapter.streamChat(request("gpt-4o")).map(String::length).reduce(0, Integer::sum).block();

        assertThat(streamed).isEqualTo(buffered.length());
    }
}
