package code.analysis.orchestrator;

public class ProviderInitializationException extends RuntimeException {
    public ProviderInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
