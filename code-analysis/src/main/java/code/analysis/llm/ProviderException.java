package code.analysis.llm;

public class ProviderException extends RuntimeException {
    private final ProviderErrorKind kind;
    private final ProviderId provider;

    public ProviderException(ProviderErrorKind kind, ProviderId provider, String message) {
        super(message);
        this.kind = kind;
        this.provider = provider;
    }

    public ProviderException(ProviderErrorKind kind, ProviderId provider, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.provider = provider;
    }

    public ProviderErrorKind kind() {
        return kind;
    }

    public ProviderId provider() {
        return provider;
    }

    public String describe() {
        return kind + ": " + getMessage();
    }
}
