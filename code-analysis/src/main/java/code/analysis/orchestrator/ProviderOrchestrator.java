package code.analysis.orchestrator;

import code.analysis.llm.GenerationRequest;
import code.analysis.llm.GenerationResult;
import code.analysis.llm.ProviderAdapter;
import code.analysis.llm.ProviderAdapterFactory;
import code.analysis.llm.ProviderErrorKind;
import code.analysis.llm.ProviderException;
import code.analysis.llm.ProviderId;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Component
public class ProviderOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(ProviderOrchestrator.class);

    enum LifecycleState {
        UNINITIALIZED,
        INITIALIZING,
        READY
    }

    private final ProviderAdapterFactory adapterFactory;
    private final ProviderId primaryId;
    private final ProviderId fallbackId;

    private volatile LifecycleState state = LifecycleState.UNINITIALIZED;
    private volatile Map<ProviderId, ProviderAdapter> constructed = Map.of();
    private volatile Map<ProviderId, ProviderAdapter> available = Map.of();

    @Autowired
    public ProviderOrchestrator(
            ProviderAdapterFactory adapterFactory,
            @Value("${code.analysis.llm.provider:ollama}") String primaryProvider,
            @Value("${code.analysis.llm.fallback:openai}") String fallbackProvider
    ) {
        this(adapterFactory, ProviderId.fromValue(primaryProvider),
                ProviderId.fromOptionalValue(fallbackProvider).orElse(null));
    }

    public ProviderOrchestrator(ProviderAdapterFactory adapterFactory, ProviderId primaryId, ProviderId fallbackId) {
        this.adapterFactory = Objects.requireNonNull(adapterFactory, "adapterFactory");
        this.primaryId = Objects.requireNonNull(primaryId, "primaryId");
        this.fallbackId = fallbackId == primaryId ? null : fallbackId;
    }

    @PostConstruct
    public synchronized void initialize() {
        if (state == LifecycleState.READY) {
            return;
        }
        state = LifecycleState.INITIALIZING;
        log.info("event=llm_init_start primary={} fallback={}", primaryId.value(), fallbackValue());

        Map<ProviderId, ProviderAdapter> built = new EnumMap<>(ProviderId.class);
        Map<ProviderId, ProviderAdapter> healthy = new EnumMap<>(ProviderId.class);
        for (ProviderId id : referencedProviders()) {
            ProviderAdapter adapter;
            try {
                adapter = adapterFactory.create(id);
            } catch (RuntimeException e) {
                recordInitFailure(id, describe(e), e, built);
                continue;
            }
            built.put(id, adapter);
            try {
                if (adapter.healthCheck()) {
                    healthy.put(id, adapter);
                    log.info("event=llm_provider_ready provider={} model={}", id.value(), adapter.model());
                } else {
                    recordInitFailure(id, "health check reported unhealthy", null, built);
                }
            } catch (RuntimeException e) {
                recordInitFailure(id, describe(e), e, built);
            }
        }

        constructed = Collections.unmodifiableMap(built);
        available = Collections.unmodifiableMap(healthy);
        state = LifecycleState.READY;
        log.info("event=llm_init_done primary={} fallback={} available={}",
                primaryId.value(), fallbackValue(), healthy.keySet());
    }

    public GenerationResult generate(GenerationRequest request) {
        Objects.requireNonNull(request, "request");
        if (state != LifecycleState.READY) {
            throw new ProviderException(ProviderErrorKind.NOT_INITIALIZED, null, "LLM orchestrator not initialized");
        }

        ProviderException primaryFailure;
        try {
            log.info("Generating with primary provider: {}", primaryId.value());
            return invoke(primaryId, request);
        } catch (ProviderException e) {
            primaryFailure = e;
            log.warn("Primary provider failed provider={} error={}", primaryId.value(), e.describe());
        }

        if (fallbackId == null) {
            throw new GenerationFailedException(primaryId, primaryFailure, null, null);
        }

        try {
            log.info("Trying fallback provider: {}", fallbackId.value());
            GenerationResult result = invoke(fallbackId, request);
            log.info("Fallback successful provider={}", fallbackId.value());
            return result;
        } catch (ProviderException e) {
            log.error("Fallback provider also failed provider={} error={}", fallbackId.value(), e.describe());
            throw new GenerationFailedException(primaryId, primaryFailure, fallbackId, e);
        }
    }

    public OrchestratorStatus status() {
        Map<ProviderId, ProviderAdapter> healthy = available;
        Map<ProviderId, ProviderAdapter> built = constructed;
        Map<ProviderId, ProviderStatus> providers = new LinkedHashMap<>();
        for (ProviderId id : ProviderId.values()) {
            ProviderAdapter adapter = built.get(id);
            providers.put(id, new ProviderStatus(healthy.containsKey(id), adapter == null ? null : adapter.model()));
        }
        return new OrchestratorStatus(
                state == LifecycleState.READY,
                primaryId,
                fallbackId,
                Collections.unmodifiableMap(providers)
        );
    }

    @PreDestroy
    public synchronized void cleanup() {
        log.info("Cleaning up LLM providers...");
        Map<ProviderId, ProviderAdapter> built = constructed;
        constructed = Map.of();
        available = Map.of();
        state = LifecycleState.UNINITIALIZED;
        closeAll(built);
        log.info("LLM cleanup complete");
    }

    public ProviderId primaryId() {
        return primaryId;
    }

    public ProviderId fallbackId() {
        return fallbackId;
    }

    LifecycleState state() {
        return state;
    }

    private GenerationResult invoke(ProviderId id, GenerationRequest request) {
        ProviderAdapter adapter = available.get(id);
        if (adapter == null) {
            throw new ProviderException(ProviderErrorKind.UNAVAILABLE, id, id.value() + " client not available");
        }
        try {
            return adapter.generate(request);
        } catch (ProviderException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProviderException(ProviderErrorKind.PROTOCOL_ERROR, id, describe(e), e);
        }
    }

    private void recordInitFailure(
            ProviderId id,
            String reason,
            RuntimeException cause,
            Map<ProviderId, ProviderAdapter> built
    ) {
        log.warn("event=llm_provider_unavailable provider={} reason={}", id.value(), reason);
        if (id == primaryId && fallbackId == null) {
            closeAll(built);
            state = LifecycleState.UNINITIALIZED;
            throw new ProviderInitializationException(
                    "Primary LLM provider (" + id.value() + ") unavailable and no fallback configured: " + reason,
                    cause
            );
        }
    }

    private List<ProviderId> referencedProviders() {
        List<ProviderId> ids = new ArrayList<>(2);
        ids.add(primaryId);
        if (fallbackId != null) {
            ids.add(fallbackId);
        }
        return ids;
    }

    private static void closeAll(Map<ProviderId, ProviderAdapter> adapters) {
        for (Map.Entry<ProviderId, ProviderAdapter> entry : adapters.entrySet()) {
            try {
                entry.getValue().close();
            } catch (RuntimeException e) {
                log.warn("Failed to close provider={} error={}", entry.getKey().value(), describe(e));
            }
        }
    }

    private String fallbackValue() {
        return fallbackId == null ? "none" : fallbackId.value();
    }

    private static String describe(RuntimeException e) {
        if (e instanceof ProviderException providerException) {
            return providerException.describe();
        }
        String message = e.getMessage();
        return message == null || message.isBlank()
                ? e.getClass().getSimpleName()
                : e.getClass().getSimpleName() + ": " + message;
    }
}
