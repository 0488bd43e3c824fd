package dev.chordshield.core.rules;

import dev.chordshield.core.MessageKey;
import dev.chordshield.core.ValidationError;
import dev.chordshield.core.pattern.ChordProPatterns;
import dev.chordshield.core.scan.Token;

import java.util.List;

/**
 * Validates every non-empty chord token.
 * <p>
 * Suggestions come from the call's language hooks first, then from
 * {@link ChordProPatterns#suggestChordCorrection(String)}.
 */
public class ChordCheck implements ContentCheck {

    @Override
    public String id() {
        return "chords";
    }

    @Override
    public void apply(CheckContext context, List<ValidationError> findings) {
        for (Token token : context.scan().chords()) {
            if (token.isBlank()) {
                continue;
            }
            String chord = token.trimmed();
            if (ChordProPatterns.isValidChord(chord)) {
                continue;
            }
            int start = token.trimmedStart();
            String suggestion = context.language().chordCorrector().correct(chord)
                    .or(() -> ChordProPatterns.suggestChordCorrection(chord))
                    .orElse(null);
            findings.add(ValidationError.chord(MessageKey.INVALID_CHORD,
                    context.position(start, start + chord.length()), suggestion, chord));
        }
    }
}
