package code.analysis.api;

import code.analysis.llm.ProviderId;
import code.analysis.orchestrator.OrchestratorStatus;
import code.analysis.orchestrator.ProviderOrchestrator;
import code.analysis.orchestrator.ProviderStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {
    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    static final String SERVICE_NAME = "code-analysis-service";
    static final String VERSION = "1.0.0";

    private final ProviderOrchestrator orchestrator;

    public HealthController(ProviderOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping("/")
    public Map<String, Object> root() {
        Map<String, Object> providers = new LinkedHashMap<>();
        providers.put("primary", orchestrator.primaryId().value());
        providers.put("fallback", orchestrator.fallbackId() == null ? null : orchestrator.fallbackId().value());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", SERVICE_NAME);
        body.put("version", VERSION);
        body.put("status", "running");
        body.put("providers", providers);
        return body;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        try {
            OrchestratorStatus status = orchestrator.status();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", status.healthy() ? "healthy" : "degraded");
            body.put("service", SERVICE_NAME);
            body.put("version", VERSION);
            body.put("initialized", status.initialized());
            body.put("llmProviders", providerMap(status));
            body.put("primaryProvider", status.primaryProvider().value());
            body.put("fallbackProvider", status.fallbackProvider() == null ? null : status.fallbackProvider().value());
            return ResponseEntity.ok(body);
        } catch (RuntimeException e) {
            log.error("Health check failed: {}", e.getMessage(), e);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", "unhealthy");
            body.put("service", SERVICE_NAME);
            body.put("error", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }
    }

    @GetMapping("/health/ready")
    public ResponseEntity<Map<String, Object>> ready() {
        OrchestratorStatus status = orchestrator.status();
        if (!status.initialized()) {
            return notReady("LLM providers not initialized");
        }
        if (!status.anyProviderAvailable()) {
            return notReady("No LLM providers available");
        }
        return ResponseEntity.ok(Map.of("ready", true));
    }

    @GetMapping("/health/live")
    public Map<String, Object> live() {
        return Map.of("alive", true);
    }

    private static ResponseEntity<Map<String, Object>> notReady(String reason) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ready", false);
        body.put("reason", reason);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    private static Map<String, ProviderStatus> providerMap(OrchestratorStatus status) {
        Map<String, ProviderStatus> providers = new LinkedHashMap<>();
        for (Map.Entry<ProviderId, ProviderStatus> entry : status.providers().entrySet()) {
            providers.put(entry.getKey().value(), entry.getValue());
        }
        return providers;
    }
}
