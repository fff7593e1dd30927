package code.analysis.llm;

public interface ProviderAdapter {

    ProviderId id();

    String model();

    GenerationResult generate(GenerationRequest request);

    boolean healthCheck();

    void close();
}
