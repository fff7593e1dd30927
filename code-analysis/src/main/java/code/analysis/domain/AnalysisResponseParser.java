package code.analysis.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class AnalysisResponseParser {
    private static final Logger log = LoggerFactory.getLogger(AnalysisResponseParser.class);

    static final int MIN_SECTION_LENGTH = 20;
    static final int MAX_MESSAGE_LENGTH = 1000;
    static final int MAX_SUGGESTION_LENGTH = 1000;
    static final int MAX_RECOMMENDATIONS = 5;
    static final int MAX_RECOMMENDATION_LENGTH = 150;
    static final int MIN_RECOMMENDATION_LENGTH = 10;

    private static final Pattern SECTION_BOUNDARY = Pattern.compile("\\n(?:#+\\s+|\\d+\\.\\s+|[*\\-]\\s+)");

    static final List<ClassificationRule<Severity>> SEVERITY_RULES = List.of(
            ClassificationRule.of(Severity.CRITICAL, "critical|🔴"),
            ClassificationRule.of(Severity.HIGH, "high|🟠"),
            ClassificationRule.of(Severity.MEDIUM, "medium|🟡"),
            ClassificationRule.of(Severity.LOW, "low|🔵")
    );

    static final List<ClassificationRule<Category>> CATEGORY_RULES = List.of(
            ClassificationRule.of(Category.SECURITY, "security|vulnerability|vulnerabilities|XSS|SQL injection|authentication"),
            ClassificationRule.of(Category.BUG, "bug|error|logic error|incorrect"),
            ClassificationRule.of(Category.PERFORMANCE, "performance|latency|slow|N\\+1|resource|optimization"),
            ClassificationRule.of(Category.STYLE, "style|readability|maintainability|naming|convention")
    );

    private static final Pattern LINE_REFERENCE = Pattern.compile(
            "(?:at\\s+)?line[:\\s]+(\\d+)|line\\s*:\\s*(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SUGGESTION = Pattern.compile(
            "(?:recommendation|fix|should|use|implement)[:\\s]+([^\\n]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern RECOMMENDATION_BLOCK = Pattern.compile(
            "(?:recommendation|improve|suggest)s?[:\\s]+(.+?)(?:\\n\\n|\\z)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final String[] SUGGESTION_TRIGGERS = {"recommendation", "fix", "should"};
    private static final String BULLET_CHARS = "- •*";

    public ParsedFindings parse(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            return ParsedFindings.empty(rawText);
        }
        try {
            List<Finding> findings = new ArrayList<>();
            for (String section : SECTION_BOUNDARY.split(rawText)) {
                Finding finding = toFinding(section);
                if (finding != null) {
                    findings.add(finding);
                }
            }
            return new ParsedFindings(
                    List.copyOf(findings),
                    AnalysisSummary.of(findings),
                    extractRecommendations(rawText),
                    rawText
            );
        } catch (RuntimeException e) {
            log.warn("Could not parse analysis response, returning raw text only: {}", e.toString());
            return ParsedFindings.empty(rawText);
        }
    }

    Finding toFinding(String section) {
        if (section.strip().length() < MIN_SECTION_LENGTH) {
            return null;
        }
        String message = extractMessage(section);
        if (message.isEmpty()) {
            return null;
        }
        return new Finding(
                ClassificationRule.classify(SEVERITY_RULES, section, Severity.MEDIUM),
                ClassificationRule.classify(CATEGORY_RULES, section, Category.BUG),
                extractLine(section),
                message,
                extractSuggestion(section)
        );
    }

    static Integer extractLine(String section) {
        Matcher matcher = LINE_REFERENCE.matcher(section);
        if (!matcher.find()) {
            return null;
        }
        String digits = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
        try {
            return Integer.valueOf(digits);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static String extractMessage(String section) {
        for (String line : section.split("\n")) {
            String candidate = line.strip();
            if (!candidate.isEmpty() && !candidate.startsWith("#")) {
                return truncate(candidate, MAX_MESSAGE_LENGTH);
            }
        }
        return truncate(section, MAX_MESSAGE_LENGTH).strip();
    }

    static String extractSuggestion(String section) {
        String lower = section.toLowerCase(Locale.ROOT);
        boolean triggered = false;
        for (String trigger : SUGGESTION_TRIGGERS) {
            if (lower.contains(trigger)) {
                triggered = true;
                break;
            }
        }
        if (!triggered) {
            return null;
        }
        Matcher matcher = SUGGESTION.matcher(section);
        if (!matcher.find()) {
            return null;
        }
        return truncate(matcher.group(1).strip(), MAX_SUGGESTION_LENGTH);
    }

    static List<String> extractRecommendations(String rawText) {
        Matcher matcher = RECOMMENDATION_BLOCK.matcher(rawText);
        if (!matcher.find()) {
            return List.of();
        }
        List<String> lines = new ArrayList<>();
        for (String line : matcher.group(1).split("\n")) {
            if (!line.strip().isEmpty()) {
                lines.add(stripBullets(line));
            }
        }
        List<String> recommendations = new ArrayList<>();
        for (String line : lines.subList(0, Math.min(MAX_RECOMMENDATIONS, lines.size()))) {
            if (line.length() > MIN_RECOMMENDATION_LENGTH) {
                recommendations.add(truncate(line, MAX_RECOMMENDATION_LENGTH));
            }
        }
        return List.copyOf(recommendations);
    }

    private static String stripBullets(String line) {
        int start = 0;
        int end = line.length();
        while (start < end && BULLET_CHARS.indexOf(line.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && BULLET_CHARS.indexOf(line.charAt(end - 1)) >= 0) {
            end--;
        }
        return line.substring(start, end);
    }

    static String truncate(String value, int maxLength) {
        if (value.length() <= maxLength) {
            return value;
        }
        int end = Character.isHighSurrogate(value.charAt(maxLength - 1)) ? maxLength - 1 : maxLength;
        return value.substring(0, end);
    }
}
