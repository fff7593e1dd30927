package code.analysis.orchestrator;

import code.analysis.llm.ProviderException;
import code.analysis.llm.ProviderId;

public class GenerationFailedException extends RuntimeException {
    private final ProviderId primaryProvider;
    private final ProviderException primaryFailure;
    private final ProviderId fallbackProvider;
    private final ProviderException fallbackFailure;

    public GenerationFailedException(
            ProviderId primaryProvider,
            ProviderException primaryFailure,
            ProviderId fallbackProvider,
            ProviderException fallbackFailure
    ) {
        super(messageFor(primaryFailure, fallbackFailure), primaryFailure);
        this.primaryProvider = primaryProvider;
        this.primaryFailure = primaryFailure;
        this.fallbackProvider = fallbackProvider;
        this.fallbackFailure = fallbackFailure;
        if (fallbackFailure != null) {
            addSuppressed(fallbackFailure);
        }
    }

    public ProviderId primaryProvider() {
        return primaryProvider;
    }

    public ProviderException primaryFailure() {
        return primaryFailure;
    }

    public ProviderId fallbackProvider() {
        return fallbackProvider;
    }

    public ProviderException fallbackFailure() {
        return fallbackFailure;
    }

    public boolean fallbackAttempted() {
        return fallbackFailure != null;
    }

    private static String messageFor(ProviderException primary, ProviderException fallback) {
        if (fallback == null) {
            return "LLM generation failed: " + primary.describe();
        }
        return "All LLM providers failed. Primary: " + primary.describe() + ", Fallback: " + fallback.describe();
    }
}
