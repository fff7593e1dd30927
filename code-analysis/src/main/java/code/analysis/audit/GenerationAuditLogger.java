package code.analysis.audit;

import code.analysis.llm.GenerationResult;
import code.analysis.prompt.PreparedPrompt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class GenerationAuditLogger {
    private static final Logger log = LoggerFactory.getLogger(GenerationAuditLogger.class);

    public void logCompleted(
            String requestId,
            PreparedPrompt prompt,
            GenerationResult result,
            Integer findings,
            long processingMs
    ) {
        log.info(
                "event=code_task request_id={} task={} language={} provider={} model={} prompt_chars={} output_chars={} total_tokens={} findings={} processing_ms={}",
                requestId,
                prompt.task().value(),
                prompt.language(),
                result.provider().value(),
                result.model(),
                prompt.generationRequest().prompt().length(),
                result.text().length(),
                result.usage() == null ? null : result.usage().totalTokens(),
                findings,
                processingMs
        );
    }

    public void logFailed(String requestId, PreparedPrompt prompt, String reason, String error, long processingMs) {
        log.warn(
                "event=code_task_failed request_id={} task={} language={} reason={} processing_ms={} error={}",
                requestId,
                prompt.task().value(),
                prompt.language(),
                reason,
                processingMs,
                error
        );
    }
}
