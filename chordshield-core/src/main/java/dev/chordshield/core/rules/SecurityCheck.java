package dev.chordshield.core.rules;

import dev.chordshield.core.MessageKey;
import dev.chordshield.core.ValidationConfig;
import dev.chordshield.core.ValidationError;
import dev.chordshield.core.scan.SecurityScanner;

import java.util.List;

/**
 * Dangerous markup and special-character density. Findings are always errors.
 */
public class SecurityCheck implements ContentCheck {

    @Override
    public String id() {
        return "security";
    }

    @Override
    public boolean isEnabled(ValidationConfig config) {
        return config.checkSecurity();
    }

    @Override
    public void apply(CheckContext context, List<ValidationError> findings) {
        for (SecurityScanner.MarkupMatch match : SecurityScanner.scan(context.content())) {
            findings.add(ValidationError.security(match.pattern().messageKey(),
                    context.position(match.start(), match.end())));
        }

        int length = context.content().length();
        int special = SecurityScanner.countSpecialCharacters(context.content());
        if (length > 0 && special > length * context.config().maxSpecialCharPercent()) {
            findings.add(ValidationError.security(MessageKey.SPECIAL_CHARACTERS, context.wholeDocument(),
                    String.valueOf(special), String.valueOf(length)));
        }
    }
}
