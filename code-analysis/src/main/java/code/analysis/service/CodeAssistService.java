package code.analysis.service;

import code.analysis.api.model.CodeTaskRequest;
import code.analysis.api.model.CodeTaskResponse;
import code.analysis.audit.GenerationAuditLogger;
import code.analysis.domain.AnalysisResponseParser;
import code.analysis.domain.ParsedFindings;
import code.analysis.domain.Severity;
import code.analysis.llm.GenerationResult;
import code.analysis.llm.ProviderException;
import code.analysis.orchestrator.GenerationFailedException;
import code.analysis.orchestrator.ProviderOrchestrator;
import code.analysis.prompt.PreparedPrompt;
import code.analysis.prompt.PromptFactory;
import code.analysis.prompt.TaskKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

@Service
public class CodeAssistService {
    private final PromptFactory promptFactory;
    private final ProviderOrchestrator orchestrator;
    private final AnalysisResponseParser parser;
    private final GenerationAuditLogger auditLogger;
    private final MeterRegistry meterRegistry;

    public CodeAssistService(
            PromptFactory promptFactory,
            ProviderOrchestrator orchestrator,
            AnalysisResponseParser parser,
            GenerationAuditLogger auditLogger,
            MeterRegistry meterRegistry
    ) {
        this.promptFactory = promptFactory;
        this.orchestrator = orchestrator;
        this.parser = parser;
        this.auditLogger = auditLogger;
        this.meterRegistry = meterRegistry;
    }

    public CodeTaskResponse execute(String requestId, TaskKind task, CodeTaskRequest request) {
        long startNs = System.nanoTime();
        PreparedPrompt prompt = promptFactory.build(task, request);

        GenerationResult result;
        try {
            result = orchestrator.generate(prompt.generationRequest());
        } catch (RuntimeException e) {
            long processingMs = elapsedMs(startNs);
            String reason = failureReason(e);
            recordFailure(task, reason, processingMs);
            auditLogger.logFailed(requestId, prompt, reason, e.getMessage(), processingMs);
            throw e;
        }

        ParsedFindings analysis = task == TaskKind.ANALYZE ? parser.parse(result.text()) : null;
        long processingMs = elapsedMs(startNs);

        recordSuccess(task, result, analysis, processingMs);
        auditLogger.logCompleted(
                requestId,
                prompt,
                result,
                analysis == null ? null : analysis.summary().totalIssues(),
                processingMs
        );

        return new CodeTaskResponse(
                requestId,
                true,
                task.value(),
                prompt.language(),
                result.provider().value(),
                result.model(),
                result.text(),
                result.usage(),
                analysis,
                processingMs
        );
    }

    static String failureReason(RuntimeException e) {
        if (e instanceof GenerationFailedException failed) {
            return failed.fallbackAttempted() ? "ALL_PROVIDERS_FAILED" : failed.primaryFailure().kind().name();
        }
        if (e instanceof ProviderException providerException) {
            return providerException.kind().name();
        }
        return e.getClass().getSimpleName();
    }

    private void recordSuccess(TaskKind task, GenerationResult result, ParsedFindings analysis, long processingMs) {
        Counter.builder("code_assist_task_total")
                .tag("task", task.value())
                .tag("provider", result.provider().value())
                .register(meterRegistry)
                .increment();

        if (result.provider() != orchestrator.primaryId()) {
            Counter.builder("code_assist_fallback_total")
                    .tag("provider", result.provider().value())
                    .register(meterRegistry)
                    .increment();
        }

        if (analysis != null) {
            for (Severity severity : Severity.values()) {
                int count = analysis.summary().count(severity);
                if (count > 0) {
                    Counter.builder("code_assist_findings_total")
                            .tag("severity", severity.label())
                            .register(meterRegistry)
                            .increment(count);
                }
            }
        }

        recordLatency(task, processingMs);
    }

    private void recordFailure(TaskKind task, String reason, long processingMs) {
        Counter.builder("code_assist_task_failure_total")
                .tag("task", task.value())
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
        recordLatency(task, processingMs);
    }

    private void recordLatency(TaskKind task, long processingMs) {
        Timer.builder("code_assist_task_latency")
                .tag("task", task.value())
                .publishPercentileHistogram()
                .register(meterRegistry)
                .record(processingMs, TimeUnit.MILLISECONDS);
    }

    private static long elapsedMs(long startNs) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
    }
}
