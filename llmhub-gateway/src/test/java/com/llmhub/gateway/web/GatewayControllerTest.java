package com.llmhub.gateway.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmhub.gateway.config.GatewayProperties;
import com.llmhub.gateway.core.adapter.AdapterFactory;
import com.llmhub.gateway.core.cache.CaffeineTtlCache;
import com.llmhub.gateway.core.catalog.ModelCatalogService;
import com.llmhub.gateway.core.conversation.ConversationStore;
import com.llmhub.gateway.core.credential.CredentialStore;
import com.llmhub.gateway.core.model.Credential;
import com.llmhub.gateway.core.router.CredentialRateLimiter;
import com.llmhub.gateway.core.router.GatewayRouter;
import com.llmhub.gateway.core.router.PrefixProviderResolutionPolicy;
import com.llmhub.gateway.core.stream.StreamBridge;
import com.llmhub.gateway.core.transport.StubTransport;
import com.llmhub.gateway.core.transport.UpstreamTransports;
import com.llmhub.gateway.core.usage.UsageRecorder;
import com.llmhub.gateway.exception.UpstreamException;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

class GatewayControllerTest {

    private static final String TOKEN = "llmhub-client-token";
    private static final Long OWNER = 42L;

    private StubTransport transport;
    private CredentialStore credentialStore;
    private WebTestClient client;

    private final Credential gatewayClient = Credential.builder()
            .id(100L).ownerId(OWNER).provider(Credential.GATEWAY_CLIENT).isActive(true).build();
    private final Credential openai = Credential.builder()
            .id(1L).ownerId(OWNER).provider("openai").secret("blob").isActive(true).rateLimitRpm(60).build();

    @BeforeEach
    void setUp() {
        transport = new StubTransport();
        credentialStore = mock(CredentialStore.class);
        when(credentialStore.findGatewayClient(anyString())).thenReturn(Mono.empty());
        when(credentialStore.findGatewayClient(TOKEN)).thenReturn(Mono.just(gatewayClient));
        when(credentialStore.decryptSecret(anyString())).thenReturn("sk-upstream");
        when(credentialStore.touch(anyLong())).thenReturn(Mono.empty());
        when(credentialStore.findActiveByProvider(anyString(), anyLong())).thenReturn(Mono.just(List.of()));
        when(credentialStore.findActiveByProvider("openai", OWNER)).thenReturn(Mono.just(List.of(openai)));

        ObjectMapper objectMapper = new ObjectMapper();
        GatewayProperties properties = GatewayProperties.defaults();
        AdapterFactory factory = new AdapterFactory(UpstreamTransports.shared(transport), objectMapper,
                properties, credentialStore);
        GatewayRouter router = new GatewayRouter(new PrefixProviderResolutionPolicy(), credentialStore, factory,
                new CredentialRateLimiter(properties),
                new UsageRecorder(credentialStore, mock(ConversationStore.class)));
        ModelCatalogService catalog = new ModelCatalogService(credentialStore, factory, properties,
                new CaffeineTtlCache<>(100));
        GatewayController controller = new GatewayController(new GatewayAuthenticator(credentialStore), router,
                new StreamBridge(objectMapper, properties), catalog);

        client = WebTestClient.bindToController(controller)
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private WebTestClient.RequestHeadersSpec<?> post(String token, String body) {
        WebTestClient.RequestBodySpec spec = client.post().uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON);
        if (token != null) {
            spec = spec.header(HttpHeaders.AUTHORIZATION, "Bearer " + token);
        }
        return spec.bodyValue(body);
    }

    @Test
    void invalidBearerShouldBeRejectedWithoutUpstreamCall() {
        post("wrong", "{\"model\":\"gpt-4o\",\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}")
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.error.code").isEqualTo("invalid_api_key")
                .jsonPath("$.error.type").isEqualTo("authentication_error");

        assertThat(transport.calls()).isEmpty();
    }

    @Test
    void missingBearerShouldBeRejected() {
        post(null, "{\"model\":\"gpt-4o\",\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}")
                .exchange()
                .expectStatus().isUnauthorized();

        assertThat(transport.calls()).isEmpty();
    }

    @Test
    void bufferedCompletionShouldUseOpenAiShape() {
        transport.respond("""
                {"choices":[{"message":{"role":"assistant","content":"hello"},"finish_reason":"stop"}],
                 "usage":{"prompt_tokens":3,"completion_tokens":2,"total_tokens":5}}
                """);

        post(TOKEN, "{\"model\":\"gpt-4o-mini\",\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}],\"top_p\":0.5}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.object").isEqualTo("chat.completion")
                .jsonPath("$.model").isEqualTo("gpt-4o-mini")
                .jsonPath("$.choices[0].message.role").isEqualTo("assistant")
                .jsonPath("$.choices[0].message.content").isEqualTo("hello")
                .jsonPath("$.choices[0].finish_reason").isEqualTo("stop")
                .jsonPath("$.usage.total_tokens").isEqualTo(5);

        assertThat(transport.lastCall().getBody().path("top_p").asDouble()).isEqualTo(0.5);
    }

    @Test
    void streamingCompletionShouldEndWithDone() {
        transport.streamData(
                "{\"choices\":[{\"delta\":{\"content\":\"Hel\"}}]}",
                "{\"choices\":[{\"delta\":{\"content\":\"lo\"}}]}",
                "[DONE]");

        String body = post(TOKEN, "{\"model\":\"gpt-4o\",\"stream\":true,\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.TEXT_EVENT_STREAM)
                .expectBody(String.class)
                .returnResult()
                .getResponseBody();

        assertThat(body).contains("\"content\":\"Hel\"", "\"content\":\"lo\"", "chat.completion.chunk");
        assertThat(body.trim()).endsWith("[DONE]");
    }

    @Test
    void midStreamFailureShouldSendErrorEventWithoutDone() {
        transport.streamWith(Flux.concat(
                Flux.just("{\"choices\":[{\"delta\":{\"content\":\"par\"}}]}"),
                Flux.error(new UpstreamException(0, "connection reset"))));

        String body = post(TOKEN, "{\"model\":\"gpt-4o\",\"stream\":true,\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}")
                .exchange()
                .expectStatus().isOk()
                .expectBody(String.class)
                .returnResult()
                .getResponseBody();

        assertThat(body).contains("event:error", "upstream_error").doesNotContain("[DONE]");
    }

    @Test
    void missingCredentialShouldReturn429() {
        post(TOKEN, "{\"model\":\"claude-3-haiku\",\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}")
                .exchange()
                .expectStatus().isEqualTo(429)
                .expectBody()
                .jsonPath("$.error.code").isEqualTo("no_upstream_credential");
    }

    @Test
    void invalidBodyShouldReturn400() {
        post(TOKEN, "{\"model\":\"gpt-4o\",\"messages\":[]}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.type").isEqualTo("invalid_request_error");

        post(TOKEN, "{\"model\":\"gpt-4o\",\"messages\":[{\"role\":\"wizard\",\"content\":\"hi\"}]}")
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void upstreamFailureShouldReturn502() {
        transport.fail(new UpstreamException(500, "internal"));

        post(TOKEN, "{\"model\":\"gpt-4o\",\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}")
                .exchange()
                .expectStatus().isEqualTo(502)
                .expectBody()
                .jsonPath("$.error.code").isEqualTo("upstream_error");
    }

    @Test
    void modelsShouldListOwnerCatalogue() {
        when(credentialStore.listByOwner(OWNER)).thenReturn(Mono.just(List.of(gatewayClient, openai)));
        transport.respond("{\"data\":[{\"id\":\"gpt-4o\"}]}");

        client.get().uri("/v1/models")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + TOKEN)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.object").isEqualTo("list")
                .jsonPath("$.data[0].id").isEqualTo("gpt-4o")
                .jsonPath("$.data[0].owned_by").isEqualTo("openai")
                .jsonPath("$.data.length()").isEqualTo(1);
    }
}
