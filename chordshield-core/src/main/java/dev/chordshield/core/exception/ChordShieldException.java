package dev.chordshield.core.exception;

/**
 * Raised when ChordShield cannot be set up or used as configured: malformed custom rules,
 * unreadable language tables, or content rejected at an import boundary.
 * <p>
 * {@link dev.chordshield.core.ChordProValidator#validateContent(String)} never throws it;
 * problems in the content are reported as findings.
 */
public class ChordShieldException extends RuntimeException {

    public ChordShieldException(String message) {
        super(message);
    }

    public ChordShieldException(String message, Throwable cause) {
        super(message, cause);
    }
}
