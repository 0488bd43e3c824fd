package dev.chordshield.core.exception;

import dev.chordshield.core.ValidationResult;

/**
 * Exception thrown when content offered for import fails validation.
 */
public class ContentRejectedException extends ChordShieldException {

    private final ValidationResult validationResult;

    public ContentRejectedException(String message, ValidationResult validationResult) {
        super(message);
        this.validationResult = validationResult;
    }

    public ValidationResult getValidationResult() {
        return validationResult;
    }
}
