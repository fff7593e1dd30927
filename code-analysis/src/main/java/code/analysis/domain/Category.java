package code.analysis.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Category {
    SECURITY,
    BUG,
    PERFORMANCE,
    STYLE;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
