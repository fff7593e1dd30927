package code.analysis.orchestrator;

public record ProviderStatus(
        boolean available,
        String model
) {}
