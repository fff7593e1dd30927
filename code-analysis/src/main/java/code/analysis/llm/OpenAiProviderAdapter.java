package code.analysis.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

public class OpenAiProviderAdapter extends HttpProviderAdapter {
    private static final Logger log = LoggerFactory.getLogger(OpenAiProviderAdapter.class);

    static final String PLACEHOLDER_API_KEY = "your_openai_api_key_here";
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration HEALTH_TIMEOUT = Duration.ofSeconds(15);

    private final String apiKey;
    private final String baseUrl;
    private final String model;
    private final double defaultTemperature;
    private final int maxTokens;

    public OpenAiProviderAdapter(
            ObjectMapper objectMapper,
            String apiKey,
            String baseUrl,
            String model,
            double defaultTemperature,
            int maxTokens,
            long timeoutSeconds
    ) {
        this(objectMapper, apiKey, baseUrl, model, defaultTemperature, maxTokens,
                Duration.ofSeconds(Math.max(1, timeoutSeconds)));
    }

    OpenAiProviderAdapter(
            ObjectMapper objectMapper,
            String apiKey,
            String baseUrl,
            String model,
            double defaultTemperature,
            int maxTokens,
            Duration requestTimeout
    ) {
        super(objectMapper, requestTimeout, CONNECT_TIMEOUT.compareTo(requestTimeout) < 0 ? CONNECT_TIMEOUT : requestTimeout);
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.baseUrl = trimTrailingSlash(baseUrl);
        this.model = model;
        this.defaultTemperature = clampTemperature(defaultTemperature);
        this.maxTokens = Math.max(1, maxTokens);
        if (!isConfigured()) {
            log.warn("OpenAI API key not configured");
        }
    }

    @Override
    public ProviderId id() {
        return ProviderId.OPENAI;
    }

    @Override
    public String model() {
        return model;
    }

    public boolean isConfigured() {
        return !apiKey.isEmpty() && !PLACEHOLDER_API_KEY.equals(apiKey) && !baseUrl.isEmpty();
    }

    @Override
    public GenerationResult generate(GenerationRequest request) {
        requireConfigured();
        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/chat/completions"))
                .timeout(requestTimeout)
                .header("Authorization", "Bearer " + apiKey)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(writeBody(buildPayload(request))))
                .build();

        log.info("Generating with OpenAI ({})", model);
        HttpResponse<String> response = send(httpRequest, requestTimeout);
        ensureSuccess(response);

        JsonNode root = readBody(response);
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new ProviderException(ProviderErrorKind.PROTOCOL_ERROR, id(),
                    "OpenAI response has no choices[0].message.content");
        }
        JsonNode usage = root.path("usage");
        return new GenerationResult(
                content.asText(),
                id(),
                root.path("model").asText(model),
                usageOf(usage.path("prompt_tokens"), usage.path("completion_tokens"), usage.path("total_tokens"))
        );
    }

    @Override
    public boolean healthCheck() {
        requireConfigured();
        Duration timeout = HEALTH_TIMEOUT.compareTo(requestTimeout) < 0 ? HEALTH_TIMEOUT : requestTimeout;
        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/models"))
                .timeout(timeout)
                .header("Authorization", "Bearer " + apiKey)
                .GET()
                .build();

        HttpResponse<String> response = send(httpRequest, timeout);
        int status = response.statusCode();
        if (status == 401 || status == 403) {
            log.error("OpenAI authentication failed (invalid API key)");
            ensureSuccess(response);
        }
        if (status == 200) {
            log.info("OpenAI API is accessible");
            return true;
        }
        log.warn("OpenAI API returned status {}", status);
        return false;
    }

    ObjectNode buildPayload(GenerationRequest request) {
        GenerationOptions options = request.options();
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);

        ArrayNode messages = body.putArray("messages");
        if (request.hasSystemPrompt()) {
            messages.addObject()
                    .put("role", "system")
                    .put("content", request.systemPrompt());
        }
        messages.addObject()
                .put("role", "user")
                .put("content", request.prompt());

        double temperature = options.temperature() != null ? clampTemperature(options.temperature()) : defaultTemperature;
        int tokens = options.maxTokens() != null ? Math.min(Math.max(1, options.maxTokens()), maxTokens) : maxTokens;
        body.put("temperature", temperature);
        body.put("max_tokens", tokens);
        return body;
    }

    private void requireConfigured() {
        if (!isConfigured()) {
            throw new ProviderException(ProviderErrorKind.UNCONFIGURED, id(),
                    "OpenAI client not configured (missing API key)");
        }
    }

    private static double clampTemperature(double temperature) {
        if (Double.isNaN(temperature)) {
            return GenerationOptions.MIN_TEMPERATURE;
        }
        return Math.min(GenerationOptions.MAX_TEMPERATURE, Math.max(GenerationOptions.MIN_TEMPERATURE, temperature));
    }
}
