package dev.chordshield.core.rules;

import dev.chordshield.core.MessageKey;
import dev.chordshield.core.ValidationConfig;
import dev.chordshield.core.ValidationError;
import dev.chordshield.core.scan.TokenScanner;

import java.util.List;

/**
 * Compares opening and closing counts of {@code []} and {@code {}}.
 */
public class BracketBalanceCheck implements ContentCheck {

    @Override
    public String id() {
        return "brackets";
    }

    @Override
    public boolean isEnabled(ValidationConfig config) {
        return config.checkBrackets();
    }

    @Override
    public void apply(CheckContext context, List<ValidationError> findings) {
        TokenScanner.ScanResult scan = context.scan();

        if (scan.openBraces() != scan.closeBraces()) {
            findings.add(ValidationError.bracket(MessageKey.DIRECTIVE_BRACKET_MISMATCH, context.wholeDocument(),
                    String.valueOf(scan.openBraces()), String.valueOf(scan.closeBraces())));
        }

        if (scan.openBrackets() != scan.closeBrackets()) {
            findings.add(ValidationError.bracket(MessageKey.CHORD_BRACKET_MISMATCH, context.wholeDocument(),
                    String.valueOf(scan.openBrackets()), String.valueOf(scan.closeBrackets())));
        }
    }
}
