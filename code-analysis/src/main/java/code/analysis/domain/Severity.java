package code.analysis.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
