package code.analysis.llm;

public record TokenUsage(
        int promptTokens,
        int completionTokens,
        int totalTokens
) {}
