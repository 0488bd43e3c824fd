package dev.chordshield.core.exception;

/**
 * Exception thrown when a language rule table is missing required structure or cannot be read.
 */
public class LanguageRulesException extends ChordShieldException {

    public LanguageRulesException(String message) {
        super(message);
    }

    public LanguageRulesException(String message, Throwable cause) {
        super(message, cause);
    }
}
