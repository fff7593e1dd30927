package code.analysis.llm;

public enum ProviderErrorKind {
    UNAVAILABLE,
    TIMEOUT,
    AUTH_FAILURE,
    RATE_LIMITED,
    PROTOCOL_ERROR,
    UNCONFIGURED,
    NOT_INITIALIZED
}
