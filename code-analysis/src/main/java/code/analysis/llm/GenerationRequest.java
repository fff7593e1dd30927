package code.analysis.llm;

import java.util.Objects;

public record GenerationRequest(
        String prompt,
        String systemPrompt,
        GenerationOptions options
) {
    public GenerationRequest {
        Objects.requireNonNull(prompt, "prompt");
        options = options == null ? GenerationOptions.defaults() : options;
    }

    public static GenerationRequest of(String prompt) {
        return new GenerationRequest(prompt, null, GenerationOptions.defaults());
    }

    public boolean hasSystemPrompt() {
        return systemPrompt != null && !systemPrompt.isBlank();
    }
}
