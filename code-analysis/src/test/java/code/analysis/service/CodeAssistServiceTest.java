package code.analysis.service;

import code.analysis.api.model.CodeTaskRequest;
import code.analysis.api.model.CodeTaskResponse;
import code.analysis.audit.GenerationAuditLogger;
import code.analysis.domain.AnalysisResponseParser;
import code.analysis.domain.Severity;
import code.analysis.llm.ProviderAdapter;
import code.analysis.llm.ProviderErrorKind;
import code.analysis.llm.ProviderException;
import code.analysis.llm.ProviderId;
import code.analysis.llm.StubProviderAdapter;
import code.analysis.orchestrator.GenerationFailedException;
import code.analysis.orchestrator.ProviderOrchestrator;
import code.analysis.prompt.InvalidTaskRequestException;
import code.analysis.prompt.PromptFactory;
import code.analysis.prompt.TaskKind;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CodeAssistServiceTest {
    private final StubProviderAdapter ollama = new StubProviderAdapter(ProviderId.OLLAMA, "codellama");
    private final StubProviderAdapter openai = new StubProviderAdapter(ProviderId.OPENAI, "gpt-3.5-turbo");
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    @Test
    void shouldParseFindingsForAnalyzeTask() {
        ollama.replying("1. CRITICAL security issue. Line: 7. Fix: sanitize input.\n"
                + "2. LOW style issue: variable naming is unclear on line 30.");
        CodeAssistService service = service();

        CodeTaskResponse response = service.execute("test-req-1", TaskKind.ANALYZE,
                CodeTaskRequest.forCode("query = 'SELECT * FROM t WHERE id=' + user_id", "python"));

        assertTrue(response.success());
        assertEquals("test-req-1", response.requestId());
        assertEquals("analyze", response.task());
        assertEquals("python", response.language());
        assertEquals("ollama", response.provider());
        assertEquals("codellama", response.model());
        assertEquals(2, response.analysis().summary().totalIssues());
        assertEquals(Severity.CRITICAL, response.analysis().findings().get(0).severity());

        assertEquals(1.0, meterRegistry.get("code_assist_task_total")
                .tag("task", "analyze").tag("provider", "ollama").counter().count());
        assertEquals(1.0, meterRegistry.get("code_assist_findings_total").tag("severity", "critical").counter().count());
        assertEquals(1, meterRegistry.get("code_assist_task_latency").tag("task", "analyze").timer().count());
        assertNull(meterRegistry.find("code_assist_fallback_total").counter());
    }

    @Test
    void shouldNotParseNonAnalysisTasks() {
        ollama.replying("1. CRITICAL looking explanation text that is long enough");
        CodeAssistService service = service();

        CodeTaskResponse response = service.execute("test-req-2", TaskKind.EXPLAIN,
                CodeTaskRequest.forCode("int main() { return 0; }", "c"));

        assertNull(response.analysis());
        assertEquals("1. CRITICAL looking explanation text that is long enough", response.text());
    }

    @Test
    void shouldCountFallbackUsage() {
        ollama.failing(ProviderErrorKind.TIMEOUT, "ollama request timed out after 120s");
        openai.replying("Here is the documentation.");
        CodeAssistService service = service();

        CodeTaskResponse response = service.execute("test-req-3", TaskKind.DOCUMENT,
                CodeTaskRequest.forCode("def f(): pass", "python"));

        assertEquals("openai", response.provider());
        assertEquals(1.0, meterRegistry.get("code_assist_fallback_total").tag("provider", "openai").counter().count());
    }

    @Test
    void shouldRecordFailureAndRethrowWhenAllProvidersFail() {
        ollama.failing(ProviderErrorKind.UNAVAILABLE, "connection refused");
        openai.failing(ProviderErrorKind.RATE_LIMITED, "openai returned HTTP 429");
        CodeAssistService service = service();

        GenerationFailedException ex = assertThrows(GenerationFailedException.class,
                () -> service.execute("test-req-4", TaskKind.FREE_PROMPT, CodeTaskRequest.forPrompt("hello", null)));

        assertTrue(ex.getMessage().contains("connection refused"));
        assertEquals(1.0, meterRegistry.get("code_assist_task_failure_total")
                .tag("task", "free-prompt").tag("reason", "ALL_PROVIDERS_FAILED").counter().count());
    }

    @Test
    void shouldRejectInvalidRequestBeforeCallingProviders() {
        CodeAssistService service = service();

        assertThrows(InvalidTaskRequestException.class,
                () -> service.execute("test-req-5", TaskKind.ANALYZE, CodeTaskRequest.forCode("", "python")));
        assertTrue(ollama.requests().isEmpty());
    }

    @Test
    void failureReasonShouldNameTheErrorKind() {
        ProviderException timeout = new ProviderException(ProviderErrorKind.TIMEOUT, ProviderId.OLLAMA, "slow");

        assertEquals("TIMEOUT", CodeAssistService.failureReason(
                new GenerationFailedException(ProviderId.OLLAMA, timeout, null, null)));
        assertEquals("NOT_INITIALIZED", CodeAssistService.failureReason(
                new ProviderException(ProviderErrorKind.NOT_INITIALIZED, null, "not ready")));
        assertEquals("IllegalStateException", CodeAssistService.failureReason(new IllegalStateException()));
    }

    private CodeAssistService service() {
        Map<ProviderId, ProviderAdapter> adapters = new EnumMap<>(ProviderId.class);
        adapters.put(ProviderId.OLLAMA, ollama);
        adapters.put(ProviderId.OPENAI, openai);
        ProviderOrchestrator orchestrator = new ProviderOrchestrator(adapters::get, ProviderId.OLLAMA, ProviderId.OPENAI);
        orchestrator.initialize();
        return new CodeAssistService(
                new PromptFactory(50_000, "python,javascript,typescript,java,go,rust,cpp,c"),
                orchestrator,
                new AnalysisResponseParser(),
                new GenerationAuditLogger(),
                meterRegistry
        );
    }
}
