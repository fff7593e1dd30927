package code.analysis.llm;

public record GenerationOptions(
        Double temperature,
        Integer maxTokens,
        boolean stream
) {
    public static final double MIN_TEMPERATURE = 0.0;
    public static final double MAX_TEMPERATURE = 2.0;

    public GenerationOptions {
        if (temperature != null && (temperature.isNaN()
                || temperature < MIN_TEMPERATURE || temperature > MAX_TEMPERATURE)) {
            throw new IllegalArgumentException("temperature must be between 0.0 and 2.0: " + temperature);
        }
        if (maxTokens != null && maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
        }
        if (stream) {
            throw new IllegalArgumentException("streaming generation is not supported");
        }
    }

    public static GenerationOptions defaults() {
        return new GenerationOptions(null, null, false);
    }
}
