package code.analysis.llm;

import java.util.Locale;
import java.util.Optional;

public enum ProviderId {
    OLLAMA("ollama"),
    OPENAI("openai");

    private final String value;

    ProviderId(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static ProviderId fromValue(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (ProviderId id : values()) {
            if (id.value.equals(normalized)) {
                return id;
            }
        }
        throw new IllegalArgumentException("Unknown LLM provider: " + value);
    }

    public static Optional<ProviderId> fromOptionalValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(fromValue(value));
    }
}
