package code.analysis.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

abstract class HttpProviderAdapter implements ProviderAdapter {
    private static final int MAX_ERROR_BODY_CHARS = 200;

    protected final ObjectMapper objectMapper;
    protected final Duration requestTimeout;
    private final Duration connectTimeout;
    private volatile HttpClient httpClient;

    protected HttpProviderAdapter(ObjectMapper objectMapper, Duration requestTimeout, Duration connectTimeout) {
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
        this.connectTimeout = connectTimeout;
    }

    protected HttpClient httpClient() {
        HttpClient client = httpClient;
        if (client == null) {
            synchronized (this) {
                client = httpClient;
                if (client == null) {
                    client = HttpClient.newBuilder()
                            .connectTimeout(connectTimeout)
                            .build();
                    httpClient = client;
                }
            }
        }
        return client;
    }

    protected boolean isOpen() {
        return httpClient != null;
    }

    @Override
    public void close() {
        httpClient = null;
    }

    protected HttpResponse<String> send(HttpRequest request, Duration timeout) {
        try {
            return httpClient().send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpConnectTimeoutException e) {
            throw new ProviderException(ProviderErrorKind.UNAVAILABLE, id(),
                    id().value() + " connect timed out: " + request.uri(), e);
        } catch (HttpTimeoutException e) {
            throw new ProviderException(ProviderErrorKind.TIMEOUT, id(),
                    id().value() + " request timed out after " + timeout.toSeconds() + "s", e);
        } catch (IOException e) {
            throw new ProviderException(ProviderErrorKind.UNAVAILABLE, id(),
                    id().value() + " request failed: " + describeIo(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(ProviderErrorKind.UNAVAILABLE, id(),
                    id().value() + " request interrupted", e);
        }
    }

    protected void ensureSuccess(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return;
        }
        String message = id().value() + " returned HTTP " + status + ": " + abbreviate(response.body());
        throw new ProviderException(classifyStatus(status), id(), message);
    }

    protected ProviderErrorKind classifyStatus(int status) {
        if (status == 401 || status == 403) {
            return ProviderErrorKind.AUTH_FAILURE;
        }
        if (status == 429) {
            return ProviderErrorKind.RATE_LIMITED;
        }
        if (status >= 500) {
            return ProviderErrorKind.UNAVAILABLE;
        }
        return ProviderErrorKind.PROTOCOL_ERROR;
    }

    protected JsonNode readBody(HttpResponse<String> response) {
        try {
            JsonNode root = objectMapper.readTree(response.body());
            if (root == null || !root.isObject()) {
                throw new ProviderException(ProviderErrorKind.PROTOCOL_ERROR, id(),
                        id().value() + " response is not a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new ProviderException(ProviderErrorKind.PROTOCOL_ERROR, id(),
                    id().value() + " response is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    protected String writeBody(Object body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException(ProviderErrorKind.PROTOCOL_ERROR, id(),
                    "could not serialize " + id().value() + " request", e);
        }
    }

    protected static TokenUsage usageOf(JsonNode promptCount, JsonNode completionCount, JsonNode totalCount) {
        if (promptCount.isMissingNode() && completionCount.isMissingNode()) {
            return null;
        }
        int prompt = promptCount.asInt(0);
        int completion = completionCount.asInt(0);
        int total = totalCount.isMissingNode() ? prompt + completion : totalCount.asInt(prompt + completion);
        return new TokenUsage(prompt, completion, total);
    }

    protected static String trimTrailingSlash(String url) {
        String value = url == null ? "" : url.trim();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }

    private static String describeIo(IOException e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private static String abbreviate(String body) {
        if (body == null || body.isBlank()) {
            return "<empty body>";
        }
        String compact = body.strip();
        return compact.length() <= MAX_ERROR_BODY_CHARS ? compact : compact.substring(0, MAX_ERROR_BODY_CHARS) + "...";
    }
}
