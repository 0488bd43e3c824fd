package dev.chordshield.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Types of validation findings.
 */
public enum ValidationErrorType {
    /**
     * Invalid bracketed chord token.
     */
    CHORD("chord"),

    /**
     * Unknown or misspelled directive keyword.
     */
    DIRECTIVE("directive"),

    /**
     * Mismatched opening/closing counts of brackets or braces.
     */
    BRACKET("bracket"),

    /**
     * Empty chord or directive.
     */
    FORMAT("format"),

    /**
     * Dangerous embedded markup or excessive special characters.
     */
    SECURITY("security"),

    /**
     * Match of a user-defined rule.
     */
    CUSTOM("custom");

    private final String id;

    ValidationErrorType(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static ValidationErrorType fromId(String id) {
        if (id == null) {
            throw new IllegalArgumentException("Validation error type must not be null");
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (ValidationErrorType type : values()) {
            if (type.id.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown validation error type: " + id);
    }
}
