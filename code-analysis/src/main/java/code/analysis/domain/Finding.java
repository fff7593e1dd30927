package code.analysis.domain;

public record Finding(
        Severity severity,
        Category category,
        Integer line,
        String message,
        String suggestion
) {}
