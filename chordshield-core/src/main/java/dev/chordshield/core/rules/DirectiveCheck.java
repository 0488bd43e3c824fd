package dev.chordshield.core.rules;

import dev.chordshield.core.MessageKey;
import dev.chordshield.core.ValidationConfig;
import dev.chordshield.core.ValidationError;
import dev.chordshield.core.pattern.ChordProPatterns;
import dev.chordshield.core.scan.Token;

import java.util.List;
import java.util.Optional;

/**
 * Reports misspelled directives ({@code checkTypos}) and, failing that, unknown ones
 * ({@code strictMode}). A directive gets at most one of the two warnings.
 */
public class DirectiveCheck implements ContentCheck {

    @Override
    public String id() {
        return "directives";
    }

    @Override
    public boolean isEnabled(ValidationConfig config) {
        return config.strictMode() || config.checkTypos();
    }

    @Override
    public void apply(CheckContext context, List<ValidationError> findings) {
        ValidationConfig config = context.config();
        for (Token token : context.scan().directives()) {
            if (token.isBlank()) {
                continue;
            }
            String name = token.normalizedName();
            if (ChordProPatterns.isKnownDirective(name)) {
                continue;
            }
            int start = token.trimmedStart();

            if (config.checkTypos()) {
                Optional<String> fix = ChordProPatterns.suggestDirective(name, context.language().typoCorrections());
                if (fix.isPresent()) {
                    findings.add(ValidationError.directive(MessageKey.DIRECTIVE_TYPO,
                            context.position(start, start + token.name().length()), fix.get(), name));
                    continue;
                }
            }

            if (config.strictMode()) {
                findings.add(ValidationError.directive(MessageKey.UNKNOWN_DIRECTIVE,
                        context.position(start, start + token.trimmed().length()), null, name));
            }
        }
    }
}
