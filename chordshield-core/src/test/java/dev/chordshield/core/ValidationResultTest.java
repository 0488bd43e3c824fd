package dev.chordshield.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValidationResultTest {

    private static final Position ORIGIN = new Position(0, 1, 1, 1);

    @Test
    void fromFindingsSplitsBySeverityKeepingOrder() {
        ValidationError chord = ValidationError.chord(MessageKey.INVALID_CHORD, ORIGIN, null, "X");
        ValidationError empty = ValidationError.format(MessageKey.EMPTY_CHORD, ORIGIN);
        ValidationError info = ValidationError.of(ValidationErrorType.CUSTOM, Severity.INFO,
                MessageKey.RULE_FAILED, ORIGIN, null, "r");
        ValidationError script = ValidationError.security(MessageKey.SCRIPT_TAG, ORIGIN);

        ValidationResult result = ValidationResult.fromFindings(List.of(chord, empty, info, script));

        assertThat(result.isValid()).isFalse();
        assertThat(result.errors()).containsExactly(chord, script);
        assertThat(result.warnings()).containsExactly(empty, info);
        assertThat(result.allFindings()).containsExactly(chord, script, empty, info);
        assertThat(result.findingsOfType(ValidationErrorType.SECURITY)).containsExactly(script);
    }

    @Test
    void warningsOnlyIsValid() {
        ValidationResult result = ValidationResult.of(List.of(), List.of(ValidationError.format(MessageKey.EMPTY_CHORD, ORIGIN)));

        assertThat(result.isValid()).isTrue();
        assertThat(result.warningCount()).isEqualTo(1);
    }

    @Test
    void validityMustMatchErrors() {
        List<ValidationError> errors = List.of(ValidationError.security(MessageKey.SCRIPT_TAG, ORIGIN));

        assertThatThrownBy(() -> new ValidationResult(true, errors, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void messagesAreRenderedFromKeys() {
        ValidationError error = ValidationError.bracket(MessageKey.CHORD_BRACKET_MISMATCH, ORIGIN, "3", "2");

        assertThat(error.message()).isEqualTo("Mismatched chord brackets: 3 opening, 2 closing");
        assertThat(error.messageArgs()).containsExactly("3", "2");
        assertThat(ValidationError.format(MessageKey.EMPTY_DIRECTIVE, ORIGIN).message())
                .isEqualTo("Found empty directive {}");
    }
}
