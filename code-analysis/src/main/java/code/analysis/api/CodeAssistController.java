package code.analysis.api;

import code.analysis.api.model.CodeTaskRequest;
import code.analysis.api.model.CodeTaskResponse;
import code.analysis.prompt.TaskKind;
import code.analysis.service.CodeAssistService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api")
public class CodeAssistController {
    private final CodeAssistService service;

    public CodeAssistController(CodeAssistService service) {
        this.service = service;
    }

    @PostMapping("/analyze")
    public ResponseEntity<CodeTaskResponse> analyze(@RequestBody CodeTaskRequest request) {
        return run(TaskKind.ANALYZE, request);
    }

    @PostMapping("/optimize")
    public ResponseEntity<CodeTaskResponse> optimize(@RequestBody CodeTaskRequest request) {
        return run(TaskKind.OPTIMIZE, request);
    }

    @PostMapping("/document")
    public ResponseEntity<CodeTaskResponse> document(@RequestBody CodeTaskRequest request) {
        return run(TaskKind.DOCUMENT, request);
    }

    @PostMapping("/explain")
    public ResponseEntity<CodeTaskResponse> explain(@RequestBody CodeTaskRequest request) {
        return run(TaskKind.EXPLAIN, request);
    }

    @PostMapping("/generate-tests")
    public ResponseEntity<CodeTaskResponse> generateTests(@RequestBody CodeTaskRequest request) {
        return run(TaskKind.GENERATE_TESTS, request);
    }

    @PostMapping("/suggest-test-cases")
    public ResponseEntity<CodeTaskResponse> suggestTestCases(@RequestBody CodeTaskRequest request) {
        return run(TaskKind.SUGGEST_TEST_CASES, request);
    }

    @PostMapping("/generate-test-data")
    public ResponseEntity<CodeTaskResponse> generateTestData(@RequestBody CodeTaskRequest request) {
        return run(TaskKind.GENERATE_DATA, request);
    }

    @PostMapping("/prompt")
    public ResponseEntity<CodeTaskResponse> prompt(@RequestBody CodeTaskRequest request) {
        return run(TaskKind.FREE_PROMPT, request);
    }

    private ResponseEntity<CodeTaskResponse> run(TaskKind task, CodeTaskRequest request) {
        String requestId = "ca_" + UUID.randomUUID().toString().replace("-", "");
        return ResponseEntity.ok(service.execute(requestId, task, request));
    }
}
