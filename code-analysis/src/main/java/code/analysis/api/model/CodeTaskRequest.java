package code.analysis.api.model;

public record CodeTaskRequest(
        String code,
        String language,
        String analysisType,
        String focus,
        String framework,
        String existingTests,
        String style,
        String level,
        String schema,
        Integer count,
        String format,
        String prompt,
        String systemPrompt
) {
    public static CodeTaskRequest forCode(String code, String language) {
        return new CodeTaskRequest(code, language, null, null, null, null, null, null, null, null, null, null, null);
    }

    public static CodeTaskRequest forPrompt(String prompt, String systemPrompt) {
        return new CodeTaskRequest(null, null, null, null, null, null, null, null, null, null, null, prompt, systemPrompt);
    }
}
