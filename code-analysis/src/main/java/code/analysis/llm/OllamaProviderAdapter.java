package code.analysis.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

public class OllamaProviderAdapter extends HttpProviderAdapter {
    private static final Logger log = LoggerFactory.getLogger(OllamaProviderAdapter.class);

    static final double DEFAULT_TEMPERATURE = 0.3;
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration HEALTH_TIMEOUT = Duration.ofSeconds(10);

    private final String host;
    private final String model;

    public OllamaProviderAdapter(ObjectMapper objectMapper, String host, String model, long timeoutSeconds) {
        this(objectMapper, host, model, Duration.ofSeconds(Math.max(1, timeoutSeconds)));
    }

    OllamaProviderAdapter(ObjectMapper objectMapper, String host, String model, Duration requestTimeout) {
        super(objectMapper, requestTimeout, CONNECT_TIMEOUT.compareTo(requestTimeout) < 0 ? CONNECT_TIMEOUT : requestTimeout);
        this.host = trimTrailingSlash(host);
        this.model = model;
        log.info("Ollama adapter configured host={} model={} timeout_s={}", this.host, model, requestTimeout.toSeconds());
    }

    @Override
    public ProviderId id() {
        return ProviderId.OLLAMA;
    }

    @Override
    public String model() {
        return model;
    }

    @Override
    public GenerationResult generate(GenerationRequest request) {
        if (host.isEmpty()) {
            throw new ProviderException(ProviderErrorKind.UNCONFIGURED, id(), "Ollama host is not configured");
        }
        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(host + "/api/generate"))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(writeBody(buildPayload(request))))
                .build();

        log.info("Generating with Ollama ({})", model);
        HttpResponse<String> response = send(httpRequest, requestTimeout);
        ensureSuccess(response);

        JsonNode root = readBody(response);
        JsonNode text = root.path("response");
        if (!text.isTextual()) {
            throw new ProviderException(ProviderErrorKind.PROTOCOL_ERROR, id(),
                    "Ollama response has no 'response' text");
        }
        TokenUsage usage = usageOf(root.path("prompt_eval_count"), root.path("eval_count"), root.path("total_tokens"));
        return new GenerationResult(text.asText(), id(), root.path("model").asText(model), usage);
    }

    @Override
    public boolean healthCheck() {
        if (host.isEmpty()) {
            throw new ProviderException(ProviderErrorKind.UNCONFIGURED, id(), "Ollama host is not configured");
        }
        Duration timeout = HEALTH_TIMEOUT.compareTo(requestTimeout) < 0 ? HEALTH_TIMEOUT : requestTimeout;
        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(host + "/api/tags"))
                .timeout(timeout)
                .GET()
                .build();

        HttpResponse<String> response = send(httpRequest, timeout);
        if (response.statusCode() == 200) {
            log.info("Ollama server is healthy host={}", host);
            return true;
        }
        log.warn("Ollama server returned status {} host={}", response.statusCode(), host);
        return false;
    }

    ObjectNode buildPayload(GenerationRequest request) {
        GenerationOptions options = request.options();
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        body.put("prompt", request.prompt());
        if (request.hasSystemPrompt()) {
            body.put("system", request.systemPrompt());
        }
        body.put("stream", false);

        ObjectNode modelOptions = body.putObject("options");
        modelOptions.put("temperature", options.temperature() != null ? options.temperature() : DEFAULT_TEMPERATURE);
        if (options.maxTokens() != null) {
            modelOptions.put("num_predict", options.maxTokens());
        }
        return body;
    }
}
