package dev.chordshield.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * User-defined rule applied to the raw content.
 *
 * @param id          unique identifier
 * @param name        display name
 * @param description what the rule looks for
 * @param pattern     regular expression, matched case-insensitively
 * @param severity    severity of each match
 * @param category    finding type reported for each match
 * @param message     message reported for each match
 * @param enabled     disabled rules are skipped
 */
public record ValidationRule(
        String id,
        String name,
        String description,
        String pattern,
        Severity severity,
        ValidationErrorType category,
        String message,
        boolean enabled
) {

    public ValidationRule {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(pattern, "pattern");
        name = name == null ? id : name;
        description = description == null ? "" : description;
        severity = severity == null ? Severity.WARNING : severity;
        category = category == null ? ValidationErrorType.CUSTOM : category;
        message = message == null ? "Custom rule '" + id + "' matched" : message;
    }

    @JsonCreator
    public static ValidationRule fromJson(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("pattern") String pattern,
            @JsonProperty("severity") Severity severity,
            @JsonProperty("category") ValidationErrorType category,
            @JsonProperty("message") String message,
            @JsonProperty("enabled") Boolean enabled) {
        return new ValidationRule(id, name, description, pattern, severity, category, message,
                enabled == null || enabled);
    }

    public static ValidationRule of(String id, String pattern, Severity severity, String message) {
        return new ValidationRule(id, id, "", pattern, severity, ValidationErrorType.CUSTOM, message, true);
    }

    public ValidationRule withEnabled(boolean value) {
        return new ValidationRule(id, name, description, pattern, severity, category, message, value);
    }
}
