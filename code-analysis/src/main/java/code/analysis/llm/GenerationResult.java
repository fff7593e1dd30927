package code.analysis.llm;

import java.util.Objects;

public record GenerationResult(
        String text,
        ProviderId provider,
        String model,
        TokenUsage usage
) {
    public GenerationResult {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(provider, "provider");
    }
}
