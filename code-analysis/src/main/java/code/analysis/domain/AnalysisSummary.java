package code.analysis.domain;

import java.util.List;

public record AnalysisSummary(
        int totalIssues,
        int critical,
        int high,
        int medium,
        int low
) {
    public static final AnalysisSummary EMPTY = new AnalysisSummary(0, 0, 0, 0, 0);

    public static AnalysisSummary of(List<Finding> findings) {
        int critical = 0;
        int high = 0;
        int medium = 0;
        int low = 0;
        for (Finding finding : findings) {
            switch (finding.severity()) {
                case CRITICAL -> critical++;
                case HIGH -> high++;
                case MEDIUM -> medium++;
                case LOW -> low++;
            }
        }
        return new AnalysisSummary(findings.size(), critical, high, medium, low);
    }

    public int count(Severity severity) {
        return switch (severity) {
            case CRITICAL -> critical;
            case HIGH -> high;
            case MEDIUM -> medium;
            case LOW -> low;
        };
    }
}
