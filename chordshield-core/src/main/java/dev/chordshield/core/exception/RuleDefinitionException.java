package dev.chordshield.core.exception;

import java.util.List;

/**
 * Exception thrown when custom rule definitions cannot be loaded or compiled.
 */
public class RuleDefinitionException extends ChordShieldException {

    private final List<String> problems;

    public RuleDefinitionException(String message) {
        super(message);
        this.problems = List.of(message);
    }

    public RuleDefinitionException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of(message);
    }

    public RuleDefinitionException(String message, List<String> problems) {
        super(message + ": " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
