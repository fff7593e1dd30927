package code.analysis.orchestrator;

import code.analysis.llm.ProviderId;

import java.util.Map;

public record OrchestratorStatus(
        boolean initialized,
        ProviderId primaryProvider,
        ProviderId fallbackProvider,
        Map<ProviderId, ProviderStatus> providers
) {
    public boolean available(ProviderId id) {
        ProviderStatus status = id == null ? null : providers.get(id);
        return status != null && status.available();
    }

    public boolean anyProviderAvailable() {
        return available(primaryProvider) || available(fallbackProvider);
    }

    public boolean healthy() {
        return initialized && anyProviderAvailable();
    }
}
