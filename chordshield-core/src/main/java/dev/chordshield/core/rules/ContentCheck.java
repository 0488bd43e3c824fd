package dev.chordshield.core.rules;

import dev.chordshield.core.ValidationConfig;
import dev.chordshield.core.ValidationError;

import java.util.List;

/**
 * One independent pass over the content.
 */
public interface ContentCheck {

    /**
     * Identifier used in diagnostics.
     */
    String id();

    /**
     * Whether this check runs under the given configuration.
     */
    default boolean isEnabled(ValidationConfig config) {
        return true;
    }

    /**
     * Append findings for the content to {@code findings}.
     */
    void apply(CheckContext context, List<ValidationError> findings);
}
