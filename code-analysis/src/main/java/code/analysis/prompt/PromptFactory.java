package code.analysis.prompt;

import code.analysis.api.model.CodeTaskRequest;
import code.analysis.llm.GenerationOptions;
import code.analysis.llm.GenerationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Component
public class PromptFactory {
    private static final Logger log = LoggerFactory.getLogger(PromptFactory.class);

    static final int MAX_ANALYZED_LINES = 200;
    static final int MAX_ANALYZED_CHARS = 8000;
    static final String TRUNCATION_MARKER = "\n\n# ... (code truncated for analysis)";

    private static final Set<String> ANALYSIS_TYPES = Set.of("full", "security", "performance", "style", "bugs");
    private static final Set<String> DATA_FORMATS = Set.of("json", "csv", "sql");
    private static final int DEFAULT_DATA_COUNT = 10;
    private static final int MAX_DATA_COUNT = 100;

    private static final Map<String, String> FOCUS_INSTRUCTIONS = Map.of(
            "performance", "Optimize this code for maximum performance and efficiency.",
            "readability", "Refactor this code for better readability and maintainability.",
            "memory", "Optimize this code to reduce memory usage and prevent leaks."
    );

    private static final Map<String, String> DEFAULT_TEST_FRAMEWORKS = Map.of(
            "python", "pytest",
            "javascript", "jest",
            "typescript", "jest",
            "java", "junit",
            "go", "testing",
            "rust", "cargo test",
            "cpp", "googletest",
            "c", "unity"
    );

    private final int maxCodeLength;
    private final List<String> supportedLanguages;

    public PromptFactory(
            @Value("${code.analysis.max-code-length:50000}") int maxCodeLength,
            @Value("${code.analysis.supported-languages:python,javascript,typescript,java,go,rust,cpp,c}") String supportedLanguages
    ) {
        this.maxCodeLength = maxCodeLength;
        this.supportedLanguages = Arrays.stream(supportedLanguages.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> s.toLowerCase(Locale.ROOT))
                .toList();
    }

    public PreparedPrompt build(TaskKind task, CodeTaskRequest request) {
        if (request == null) {
            throw new InvalidTaskRequestException(List.of("request body is required"));
        }
        return switch (task) {
            case ANALYZE -> analyze(request);
            case OPTIMIZE -> optimize(request);
            case DOCUMENT -> document(request);
            case EXPLAIN -> explain(request);
            case GENERATE_TESTS -> generateTests(request);
            case SUGGEST_TEST_CASES -> suggestTestCases(request);
            case GENERATE_DATA -> generateData(request);
            case FREE_PROMPT -> freePrompt(request);
        };
    }

    public static String defaultTestFramework(String language) {
        return DEFAULT_TEST_FRAMEWORKS.getOrDefault(language.toLowerCase(Locale.ROOT), "pytest");
    }

    private PreparedPrompt analyze(CodeTaskRequest request) {
        List<String> errors = new ArrayList<>();
        String language = validateCode(request, errors);
        String analysisType = enumerated(request.analysisType(), "full", ANALYSIS_TYPES, "analysisType", errors);
        reject(errors);

        String code = truncateForAnalysis(request.code());
        String system = "You are an expert " + language + " code reviewer.";
        String focusLine = "full".equals(analysisType)
                ? ""
                : "Focus on " + analysisType + " issues.\n\n";
        String user = focusLine
                + "Analyze this " + language + " code and list specific issues in numbered format.\n\n"
                + "For each issue, provide:\n"
                + "- Severity (CRITICAL, HIGH, MEDIUM, or LOW)\n"
                + "- Type (bug, security, performance, or style)\n"
                + "- Line: [line number] (ALWAYS specify the line number where the issue occurs)\n"
                + "- Description\n"
                + "- Fix suggestion\n\n"
                + "Code with line numbers:\n"
                + fenced(language, code) + "\n\n"
                + "IMPORTANT: Always include \"Line: X\" where X is the actual line number in the code above.\n\n"
                + "List all issues found.";
        return prepared(TaskKind.ANALYZE, language, request, user, system, 0.1);
    }

    private PreparedPrompt optimize(CodeTaskRequest request) {
        List<String> errors = new ArrayList<>();
        String language = validateCode(request, errors);
        reject(errors);

        String focus = blankToDefault(request.focus(), "performance").toLowerCase(Locale.ROOT);
        String system = "You are an expert " + language + " developer specializing in code optimization.\n"
                + "Provide optimized code that maintains functionality while improving " + focus + ".";
        String user = FOCUS_INSTRUCTIONS.getOrDefault(focus, FOCUS_INSTRUCTIONS.get("performance")) + "\n\n"
                + "Original " + language + " code:\n"
                + fenced(language, request.code()) + "\n\n"
                + "Provide:\n"
                + "1. Optimized version of the code\n"
                + "2. Explanation of changes made\n"
                + "3. Expected impact/improvements\n\n"
                + "Format your response clearly with the optimized code in a code block.";
        return prepared(TaskKind.OPTIMIZE, language, request, user, system, 0.2);
    }

    private PreparedPrompt document(CodeTaskRequest request) {
        List<String> errors = new ArrayList<>();
        String language = validateCode(request, errors);
        reject(errors);

        String style = blankToDefault(request.style(), "detailed");
        String system = "You are an expert technical writer specializing in " + language + ".\n"
                + "Generate comprehensive documentation for the provided code including:\n"
                + "- Clear function/class descriptions\n"
                + "- Parameter documentation with types\n"
                + "- Return value documentation\n"
                + "- Usage examples\n"
                + "- Notes about edge cases or important behavior\n\n"
                + "Follow " + language + " documentation conventions.";
        String user = "Generate documentation for this " + language + " code:\n\n"
                + fenced(language, request.code()) + "\n\n"
                + "Provide " + style + " documentation following best practices.";
        return prepared(TaskKind.DOCUMENT, language, request, user, system, null);
    }

    private PreparedPrompt explain(CodeTaskRequest request) {
        List<String> errors = new ArrayList<>();
        String language = validateCode(request, errors);
        reject(errors);

        String level = blankToDefault(request.level(), "intermediate");
        String system = "You are an expert " + language + " developer and teacher.\n"
                + "Explain the provided code clearly for a " + level + " developer.\n"
                + "Include:\n"
                + "- What the code does (high-level)\n"
                + "- How it works (step-by-step)\n"
                + "- Key concepts used\n"
                + "- Potential use cases\n\n"
                + "Use clear, accessible language appropriate for " + level + " level.";
        String user = "Explain this " + language + " code:\n\n"
                + fenced(language, request.code()) + "\n\n"
                + "Provide a " + level + "-level explanation.";
        return prepared(TaskKind.EXPLAIN, language, request, user, system, null);
    }

    private PreparedPrompt generateTests(CodeTaskRequest request) {
        List<String> errors = new ArrayList<>();
        String language = validateCode(request, errors);
        reject(errors);

        String framework = blankToDefault(request.framework(), defaultTestFramework(language));
        String system = "You are an expert " + language + " developer specializing in test-driven development.\n"
                + "Generate comprehensive unit tests using " + framework + ".";
        String user = "Generate comprehensive unit tests for this " + language + " code using " + framework + ".\n\n"
                + "Code to test:\n"
                + fenced(language, request.code()) + "\n\n"
                + "Generate tests that cover:\n"
                + "- Happy path scenarios\n"
                + "- Edge cases\n"
                + "- Error conditions\n"
                + "- Boundary values\n"
                + "- All code paths\n\n"
                + "Provide complete, runnable test code with:\n"
                + "- Proper imports and setup\n"
                + "- Clear test names\n"
                + "- Assertions for expected behavior\n"
                + "- Mocks/fixtures where needed\n"
                + "- Comments explaining test purpose\n\n"
                + "Format the tests in a code block.";
        return prepared(TaskKind.GENERATE_TESTS, language, request, user, system, 0.3);
    }

    private PreparedPrompt suggestTestCases(CodeTaskRequest request) {
        List<String> errors = new ArrayList<>();
        String language = validateCode(request, errors);
        reject(errors);

        String system = "You are an expert QA engineer specializing in " + language + ".\n"
                + "Analyze the code and suggest test cases that should be added.\n"
                + "Focus on:\n"
                + "- Untested code paths\n"
                + "- Edge cases\n"
                + "- Error scenarios\n"
                + "- Boundary conditions";
        StringBuilder user = new StringBuilder()
                .append("Analyze this ").append(language).append(" code:\n\n")
                .append(fenced(language, request.code())).append('\n');
        if (!isBlank(request.existingTests())) {
            user.append("\nExisting tests:\n")
                    .append(fenced(language, request.existingTests())).append('\n');
        }
        user.append("\nSuggest additional test cases needed for comprehensive coverage.");
        return prepared(TaskKind.SUGGEST_TEST_CASES, language, request, user.toString(), system, null);
    }

    private PreparedPrompt generateData(CodeTaskRequest request) {
        List<String> errors = new ArrayList<>();
        if (isBlank(request.schema())) {
            errors.add("schema is required");
        }
        int count = request.count() == null ? DEFAULT_DATA_COUNT : request.count();
        if (count < 1 || count > MAX_DATA_COUNT) {
            errors.add("count must be between 1 and " + MAX_DATA_COUNT);
        }
        String format = enumerated(request.format(), "json", DATA_FORMATS, "format", errors);
        reject(errors);

        String system = "You are a test data generator.\n"
                + "Generate realistic, diverse test data based on the provided schema.\n"
                + "Ensure data is valid and covers various edge cases.";
        String user = "Generate " + count + " test data entries in " + format + " format for this schema:\n\n"
                + request.schema() + "\n\n"
                + "Make the data realistic and diverse.";
        return prepared(TaskKind.GENERATE_DATA, null, request, user, system, null);
    }

    private PreparedPrompt freePrompt(CodeTaskRequest request) {
        if (isBlank(request.prompt())) {
            throw new InvalidTaskRequestException(List.of("prompt is required"));
        }
        if (request.prompt().length() > maxCodeLength) {
            throw new InvalidTaskRequestException(List.of("prompt exceeds " + maxCodeLength + " characters"));
        }
        return prepared(TaskKind.FREE_PROMPT, null, request, request.prompt(), null, null);
    }

    private PreparedPrompt prepared(
            TaskKind task,
            String language,
            CodeTaskRequest request,
            String userPrompt,
            String systemPrompt,
            Double temperature
    ) {
        String system = isBlank(request.systemPrompt()) ? systemPrompt : request.systemPrompt();
        GenerationOptions options = new GenerationOptions(temperature, null, false);
        return new PreparedPrompt(task, language, new GenerationRequest(userPrompt, system, options));
    }

    private String validateCode(CodeTaskRequest request, List<String> errors) {
        if (isBlank(request.code())) {
            errors.add("code is required");
        } else if (request.code().length() > maxCodeLength) {
            errors.add("code exceeds " + maxCodeLength + " characters");
        }
        if (isBlank(request.language())) {
            errors.add("language is required");
            return null;
        }
        String language = request.language().trim().toLowerCase(Locale.ROOT);
        if (!supportedLanguages.contains(language)) {
            errors.add("Unsupported language. Supported: " + String.join(", ", supportedLanguages));
        }
        return language;
    }

    static String truncateForAnalysis(String code) {
        String[] lines = code.split("\n", -1);
        String result = code;
        if (lines.length > MAX_ANALYZED_LINES) {
            log.warn("Code too long ({} lines), truncating to first {} lines", lines.length, MAX_ANALYZED_LINES);
            result = String.join("\n", Arrays.copyOfRange(lines, 0, MAX_ANALYZED_LINES)) + TRUNCATION_MARKER;
        }
        if (result.length() > MAX_ANALYZED_CHARS) {
            log.warn("Code too long ({} chars), truncating to {} chars", result.length(), MAX_ANALYZED_CHARS);
            result = result.substring(0, MAX_ANALYZED_CHARS) + TRUNCATION_MARKER;
        }
        return result;
    }

    private static String enumerated(String value, String defaultValue, Set<String> allowed, String field, List<String> errors) {
        String normalized = blankToDefault(value, defaultValue).trim().toLowerCase(Locale.ROOT);
        if (!allowed.contains(normalized)) {
            errors.add("Invalid " + field + ". Allowed: " + String.join(", ", allowed.stream().sorted().toList()));
        }
        return normalized;
    }

    private static void reject(List<String> errors) {
        if (!errors.isEmpty()) {
            throw new InvalidTaskRequestException(errors);
        }
    }

    private static String fenced(String language, String code) {
        return "```" + language + "\n" + code + "\n```";
    }

    private static String blankToDefault(String value, String defaultValue) {
        return isBlank(value) ? defaultValue : value.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
