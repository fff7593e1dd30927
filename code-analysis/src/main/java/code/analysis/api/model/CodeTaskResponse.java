package code.analysis.api.model;

import code.analysis.domain.ParsedFindings;
import code.analysis.llm.TokenUsage;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CodeTaskResponse(
        String requestId,
        boolean success,
        String task,
        String language,
        String provider,
        String model,
        String text,
        TokenUsage usage,
        ParsedFindings analysis,
        long processingMs
) {}
