package code.analysis.llm;

@FunctionalInterface
public interface ProviderAdapterFactory {
    ProviderAdapter create(ProviderId id);
}
