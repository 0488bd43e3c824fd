package dev.chordshield.core.rules;

import dev.chordshield.core.MessageKey;
import dev.chordshield.core.ValidationConfig;
import dev.chordshield.core.ValidationError;
import dev.chordshield.core.scan.Token;
import dev.chordshield.core.scan.TokenKind;

import java.util.List;

/**
 * Reports chords and directives with nothing but whitespace inside.
 */
public class EmptyElementCheck implements ContentCheck {

    @Override
    public String id() {
        return "empty-elements";
    }

    @Override
    public boolean isEnabled(ValidationConfig config) {
        return config.checkEmptyElements();
    }

    @Override
    public void apply(CheckContext context, List<ValidationError> findings) {
        for (Token token : context.scan().tokens()) {
            if (!token.isBlank()) {
                continue;
            }
            MessageKey key = token.kind() == TokenKind.CHORD ? MessageKey.EMPTY_CHORD : MessageKey.EMPTY_DIRECTIVE;
            findings.add(ValidationError.format(key, context.position(token.open(), token.end())));
        }
    }
}
