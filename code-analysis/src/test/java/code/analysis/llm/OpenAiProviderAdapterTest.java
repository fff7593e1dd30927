package code.analysis.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class OpenAiProviderAdapterTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private HttpServer server;

    @AfterEach
    void stopServer() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void shouldBeUnconfiguredWhenApiKeyMissing() {
        OpenAiProviderAdapter adapter = adapter("", "http://127.0.0.1:65535/v1");

        assertFalse(adapter.isConfigured());
        ProviderException ex = assertThrows(ProviderException.class,
                () -> adapter.generate(GenerationRequest.of("hello")));
        assertEquals(ProviderErrorKind.UNCONFIGURED, ex.kind());
        assertEquals(ProviderId.OPENAI, ex.provider());
    }

    @Test
    void shouldTreatPlaceholderKeyAsUnconfigured() {
        OpenAiProviderAdapter adapter = adapter(OpenAiProviderAdapter.PLACEHOLDER_API_KEY, "http://127.0.0.1:65535/v1");

        assertFalse(adapter.isConfigured());
        ProviderException ex = assertThrows(ProviderException.class, adapter::healthCheck);
        assertEquals(ProviderErrorKind.UNCONFIGURED, ex.kind());
    }

    @Test
    void shouldParseContentModelAndUsageOnSuccess() throws Exception {
        AtomicReference<String> authorization = new AtomicReference<>();
        AtomicReference<String> requestBody = new AtomicReference<>();
        startServer(200, """
                {"model":"gpt-3.5-turbo-0125",
                 "choices":[{"message":{"role":"assistant","content":"Looks fine."},"finish_reason":"stop"}],
                 "usage":{"prompt_tokens":12,"completion_tokens":3,"total_tokens":15}}
                """, authorization, requestBody);
        OpenAiProviderAdapter adapter = adapter("dummy-key", baseUrl());

        GenerationResult result = adapter.generate(new GenerationRequest(
                "review this", "You are a reviewer.", new GenerationOptions(0.7, 50, false)));

        assertEquals("Looks fine.", result.text());
        assertEquals(ProviderId.OPENAI, result.provider());
        assertEquals("gpt-3.5-turbo-0125", result.model());
        assertEquals(new TokenUsage(12, 3, 15), result.usage());
        assertEquals("Bearer dummy-key", authorization.get());

        JsonNode sent = objectMapper.readTree(requestBody.get());
        assertEquals("gpt-3.5-turbo", sent.path("model").asText());
        assertEquals("system", sent.path("messages").path(0).path("role").asText());
        assertEquals("You are a reviewer.", sent.path("messages").path(0).path("content").asText());
        assertEquals("user", sent.path("messages").path(1).path("role").asText());
        assertEquals("review this", sent.path("messages").path(1).path("content").asText());
        assertEquals(0.7, sent.path("temperature").asDouble(), 1e-9);
        assertEquals(50, sent.path("max_tokens").asInt());
    }

    @Test
    void shouldApplyAdapterDefaultsAndClampMaxTokens() {
        OpenAiProviderAdapter adapter = adapter("dummy-key", "http://127.0.0.1:65535/v1");

        JsonNode defaults = adapter.buildPayload(GenerationRequest.of("hi"));
        assertEquals(0.3, defaults.path("temperature").asDouble(), 1e-9);
        assertEquals(2000, defaults.path("max_tokens").asInt());
        assertEquals(1, defaults.path("messages").size());

        JsonNode clamped = adapter.buildPayload(new GenerationRequest("hi", null, new GenerationOptions(0.0, 10_000, false)));
        assertEquals(0.0, clamped.path("temperature").asDouble(), 1e-9);
        assertEquals(2000, clamped.path("max_tokens").asInt());
    }

    @Test
    void shouldReportAuthFailureOn401() throws Exception {
        startServer(401, "{\"error\":{\"message\":\"Incorrect API key provided\"}}", null, null);
        OpenAiProviderAdapter adapter = adapter("bad-key", baseUrl());

        ProviderException ex = assertThrows(ProviderException.class,
                () -> adapter.generate(GenerationRequest.of("hello")));
        assertEquals(ProviderErrorKind.AUTH_FAILURE, ex.kind());
        assertTrue(ex.getMessage().contains("401"));
    }

    @Test
    void shouldReportRateLimitOn429() throws Exception {
        startServer(429, "{\"error\":{\"message\":\"quota exceeded\"}}", null, null);
        OpenAiProviderAdapter adapter = adapter("dummy-key", baseUrl());

        ProviderException ex = assertThrows(ProviderException.class,
                () -> adapter.generate(GenerationRequest.of("hello")));
        assertEquals(ProviderErrorKind.RATE_LIMITED, ex.kind());
    }

    @Test
    void shouldReportProtocolErrorWhenChoicesMissing() throws Exception {
        startServer(200, "{\"id\":\"x\",\"choices\":[]}", null, null);
        OpenAiProviderAdapter adapter = adapter("dummy-key", baseUrl());

        ProviderException ex = assertThrows(ProviderException.class,
                () -> adapter.generate(GenerationRequest.of("hello")));
        assertEquals(ProviderErrorKind.PROTOCOL_ERROR, ex.kind());
    }

    @Test
    void shouldReportProtocolErrorOnNonJsonBody() throws Exception {
        startServer(200, "<html>gateway</html>", null, null);
        OpenAiProviderAdapter adapter = adapter("dummy-key", baseUrl());

        ProviderException ex = assertThrows(ProviderException.class,
                () -> adapter.generate(GenerationRequest.of("hello")));
        assertEquals(ProviderErrorKind.PROTOCOL_ERROR, ex.kind());
    }

    @Test
    void healthCheckShouldPropagateAuthFailure() throws Exception {
        startServer(401, "{}", null, null);
        OpenAiProviderAdapter adapter = adapter("bad-key", baseUrl());

        ProviderException ex = assertThrows(ProviderException.class, adapter::healthCheck);
        assertEquals(ProviderErrorKind.AUTH_FAILURE, ex.kind());
    }

    @Test
    void healthCheckShouldSucceedWhenModelsListed() throws Exception {
        startServer(200, "{\"data\":[{\"id\":\"gpt-3.5-turbo\"}]}", null, null);
        OpenAiProviderAdapter adapter = adapter("dummy-key", baseUrl());

        assertTrue(adapter.healthCheck());
    }

    private OpenAiProviderAdapter adapter(String apiKey, String baseUrl) {
        return new OpenAiProviderAdapter(objectMapper, apiKey, baseUrl, "gpt-3.5-turbo", 0.3, 2000, Duration.ofSeconds(5));
    }

    private String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort() + "/v1";
    }

    private void startServer(
            int status,
            String body,
            AtomicReference<String> authorization,
            AtomicReference<String> requestBody
    ) throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1", exchange -> {
            if (authorization != null) {
                authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            }
            String received = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            if (requestBody != null) {
                requestBody.set(received);
            }
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        server.start();
    }
}
