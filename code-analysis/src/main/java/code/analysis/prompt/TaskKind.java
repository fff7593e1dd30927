package code.analysis.prompt;

public enum TaskKind {
    ANALYZE("analyze"),
    OPTIMIZE("optimize"),
    DOCUMENT("document"),
    EXPLAIN("explain"),
    GENERATE_TESTS("generate-tests"),
    SUGGEST_TEST_CASES("suggest-test-cases"),
    GENERATE_DATA("generate-data"),
    FREE_PROMPT("free-prompt");

    private final String value;

    TaskKind(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
