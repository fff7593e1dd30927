package code.analysis.domain;

import java.util.List;

public record ParsedFindings(
        List<Finding> findings,
        AnalysisSummary summary,
        List<String> recommendations,
        String rawText
) {
    public static ParsedFindings empty(String rawText) {
        return new ParsedFindings(List.of(), AnalysisSummary.EMPTY, List.of(), rawText == null ? "" : rawText);
    }
}
