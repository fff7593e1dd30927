package code.analysis.prompt;

import code.analysis.llm.GenerationRequest;

public record PreparedPrompt(
        TaskKind task,
        String language,
        GenerationRequest generationRequest
) {}
