package dev.chordshield.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of a finding. Only {@link #ERROR} makes a result invalid.
 */
public enum Severity {
    ERROR("error"),
    WARNING("warning"),
    INFO("info");

    private final String id;

    Severity(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public boolean isBlocking() {
        return this == ERROR;
    }

    @JsonCreator
    public static Severity fromId(String id) {
        if (id == null) {
            throw new IllegalArgumentException("Severity must not be null");
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (Severity severity : values()) {
            if (severity.id.equals(normalized)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + id);
    }
}
