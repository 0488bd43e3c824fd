package dev.chordshield.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Result of ChordPro content validation.
 *
 * @param valid    whether the content has no blocking findings
 * @param errors   findings with {@code error} severity
 * @param warnings all other findings ({@code warning} and {@code info})
 */
public record ValidationResult(boolean valid, List<ValidationError> errors, List<ValidationError> warnings) {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        if (valid != errors.isEmpty()) {
            throw new IllegalArgumentException("Result validity must match the absence of errors");
        }
    }

    public static ValidationResult success() {
        return new ValidationResult(true, List.of(), List.of());
    }

    public static ValidationResult of(List<ValidationError> errors, List<ValidationError> warnings) {
        return new ValidationResult(errors == null || errors.isEmpty(), errors, warnings);
    }

    /**
     * Split findings by severity, keeping their order.
     */
    public static ValidationResult fromFindings(Collection<ValidationError> findings) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationError> warnings = new ArrayList<>();
        for (ValidationError finding : findings) {
            if (finding.isError()) {
                errors.add(finding);
            } else {
                warnings.add(finding);
            }
        }
        return of(errors, warnings);
    }

    public boolean isValid() {
        return valid;
    }

    public int errorCount() {
        return errors.size();
    }

    public int warningCount() {
        return warnings.size();
    }

    /**
     * Errors followed by warnings.
     */
    public List<ValidationError> allFindings() {
        List<ValidationError> all = new ArrayList<>(errors.size() + warnings.size());
        all.addAll(errors);
        all.addAll(warnings);
        return all;
    }

    public List<ValidationError> findingsOfType(ValidationErrorType type) {
        return allFindings().stream()
                .filter(f -> f.type() == type)
                .toList();
    }
}
