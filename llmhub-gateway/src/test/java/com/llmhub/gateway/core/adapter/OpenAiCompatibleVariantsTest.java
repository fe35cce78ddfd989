package com.llmhub.gateway.core.adapter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmhub.gateway.core.model.ChatCompletionResult;
import com.llmhub.gateway.core.model.ChatMessage;
import com.llmhub.gateway.core.model.ChatRequest;
import com.llmhub.gateway.core.transport.StubTransport;
import com.llmhub.gateway.exception.ConfigException;
import com.llmhub.gateway.exception.UpstreamException;

import reactor.test.StepVerifier;

class OpenAiCompatibleVariantsTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final StubTransport transport = new StubTransport();

    private static ChatRequest request(String model) {
        return ChatRequest.builder().model(model).messages(List.of(ChatMessage.user("hi"))).build();
    }

    @Test
    void ollamaShouldAppendVersionPathAndUsePlaceholderToken() {
        OllamaAdapter adapter = new OllamaAdapter("http://localhost:11434/", null, transport, objectMapper);
        transport.respond("""
                {"choices":[{"message":{"content":"ok"},"finish_reason":"stop"}],
                 "usage":{"prompt_tokens":100,"completion_tokens":100,"total_tokens":200}}
                """);

        ChatCompletionResult result = adapter.chat(request("llama3")).block();

        assertThat(adapter.getBaseUrl()).isEqualTo("http://localhost:11434/v1");
        assertThat(transport.lastCall().getUrl()).isEqualTo("http://localhost:11434/v1/chat/completions");
        assertThat(transport.lastCall().getHeaders()).containsEntry("Authorization", "Bearer ollama");
        assertThat(result.getCostUsd()).isZero();
        assertThat(result.getProviderMetadata()).containsEntry("base_url", "http://localhost:11434/v1");
    }

    @Test
    void ollamaShouldNotDuplicateVersionPath() {
        assertThat(OllamaAdapter.withVersionPath("http://gpu-box:11434/v1/")).isEqualTo("http://gpu-box:11434/v1");
    }

    @Test
    void localAndCustomListModelsShouldSwallowFailures() {
        transport.fail(new UpstreamException(404, "not found"));

        StepVerifier.create(new OllamaAdapter("http://localhost:11434", null, transport, objectMapper).listModels())
                .expectNext(List.of())
                .verifyComplete();
        StepVerifier.create(new CustomAdapter("k", "https://llm.internal/v1", null, null, transport, objectMapper)
                        .listModels())
                .expectNext(List.of())
                .verifyComplete();
    }

    @Test
    void customShouldApplyPricingOverrideAndReportMetadata() {
        PricingTable override = PricingTable.flat(PricingTable.ModelPricing.of("1.0", "2.0"));
        CustomAdapter adapter = new CustomAdapter("k", "https://llm.internal/v1", "vllm", override,
                transport, objectMapper);
        transport.respond("""
                {"choices":[{"message":{"content":"ok"},"finish_reason":"stop"}],
                 "usage":{"prompt_tokens":1000000,"completion_tokens":1000000,"total_tokens":2000000}}
                """);

        ChatCompletionResult result = adapter.chat(request("qwen2-72b")).block();

        assertThat(result.getCostUsd()).isCloseTo(3.0, within(1e-9));
        assertThat(result.getProviderMetadata())
                .containsEntry("base_url", "https://llm.internal/v1")
                .containsEntry("model_type", "vllm");
    }

    @Test
    void customShouldRequireSecretAndBaseUrl() {
        assertThatThrownBy(() -> new CustomAdapter(null, "https://llm.internal/v1", null, null, transport, objectMapper))
                .isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> new CustomAdapter("k", null, null, null, transport, objectMapper))
                .isInstanceOf(ConfigException.class);
    }
}
