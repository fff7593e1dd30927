package code.analysis.domain;

import java.util.List;
import java.util.regex.Pattern;

/**
 * One row of an ordered rule table: the first rule whose pattern occurs in the text wins.
 */
public record ClassificationRule<T>(T label, Pattern pattern) {

    public static <T> ClassificationRule<T> of(T label, String regex) {
        return new ClassificationRule<>(label, Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
    }

    public boolean matches(String text) {
        return pattern.matcher(text).find();
    }

    public static <T> T classify(List<ClassificationRule<T>> rules, String text, T defaultLabel) {
        for (ClassificationRule<T> rule : rules) {
            if (rule.matches(text)) {
                return rule.label();
            }
        }
        return defaultLabel;
    }
}
