package dev.chordshield.core;

import java.util.List;
import java.util.Objects;

/**
 * Represents a single validation finding.
 *
 * @param type        category of the finding
 * @param message     human-readable message
 * @param severity    blocking ({@code error}) or advisory
 * @param position    location in the original, unmodified input
 * @param suggestion  optional correction, {@code null} when none applies
 * @param messageKey  built-in sub-case, {@code null} for custom-rule findings
 * @param messageArgs arguments the message was rendered with
 */
public record ValidationError(
        ValidationErrorType type,
        String message,
        Severity severity,
        Position position,
        String suggestion,
        MessageKey messageKey,
        List<String> messageArgs
) {

    public ValidationError {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(position, "position");
        messageArgs = messageArgs == null ? List.of() : List.copyOf(messageArgs);
    }

    /**
     * Create a built-in finding whose message is rendered from its key.
     */
    public static ValidationError of(ValidationErrorType type, Severity severity, MessageKey key,
                                     Position position, String suggestion, String... args) {
        List<String> arguments = List.of(args);
        return new ValidationError(type, key.format(arguments), severity, position, suggestion, key, arguments);
    }

    public static ValidationError chord(MessageKey key, Position position, String suggestion, String... args) {
        return of(ValidationErrorType.CHORD, Severity.ERROR, key, position, suggestion, args);
    }

    public static ValidationError directive(MessageKey key, Position position, String suggestion, String... args) {
        return of(ValidationErrorType.DIRECTIVE, Severity.WARNING, key, position, suggestion, args);
    }

    public static ValidationError bracket(MessageKey key, Position position, String... args) {
        return of(ValidationErrorType.BRACKET, Severity.WARNING, key, position, null, args);
    }

    public static ValidationError format(MessageKey key, Position position) {
        return of(ValidationErrorType.FORMAT, Severity.WARNING, key, position, null);
    }

    public static ValidationError security(MessageKey key, Position position, String... args) {
        return of(ValidationErrorType.SECURITY, Severity.ERROR, key, position, null, args);
    }

    /**
     * Create a finding for a user-defined rule; its message is used verbatim.
     */
    public static ValidationError custom(ValidationErrorType category, Severity severity, String message,
                                         Position position) {
        return new ValidationError(category, message, severity, position, null, null, List.of());
    }

    public boolean isError() {
        return severity.isBlocking();
    }

    public boolean hasSuggestion() {
        return suggestion != null && !suggestion.isEmpty();
    }

    public ValidationError withPosition(Position newPosition) {
        return new ValidationError(type, message, severity, newPosition, suggestion, messageKey, messageArgs);
    }

    public ValidationError withText(String newMessage, String newSuggestion) {
        return new ValidationError(type, newMessage, severity, position, newSuggestion, messageKey, messageArgs);
    }
}
