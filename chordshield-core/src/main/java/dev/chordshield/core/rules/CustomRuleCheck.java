package dev.chordshield.core.rules;

import dev.chordshield.core.ValidationError;
import dev.chordshield.core.ValidationRule;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies one user-defined rule. Every non-empty match becomes a finding carrying the
 * rule's own severity, category and message.
 * <p>
 * The pattern is compiled on first use and kept for the life of this check. A malformed
 * pattern is not cached and fails again on every use.
 */
public class CustomRuleCheck implements ContentCheck {

    static final int READS_PER_CHAR = 200;

    private final ValidationRule rule;
    private volatile Pattern pattern;

    public CustomRuleCheck(ValidationRule rule) {
        this.rule = rule;
    }

    /**
     * Compile a rule pattern the way it is matched.
     *
     * @throws java.util.regex.PatternSyntaxException if the pattern is malformed
     */
    public static Pattern compile(String pattern) {
        return Pattern.compile(pattern, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    public ValidationRule rule() {
        return rule;
    }

    private Pattern pattern() {
        Pattern compiled = pattern;
        if (compiled == null) {
            compiled = compile(rule.pattern());
            pattern = compiled;
        }
        return compiled;
    }

    @Override
    public String id() {
        return rule.id();
    }

    @Override
    public void apply(CheckContext context, List<ValidationError> findings) {
        Matcher matcher = pattern().matcher(BudgetedCharSequence.forInput(context.content(), READS_PER_CHAR));
        while (matcher.find()) {
            if (matcher.end() == matcher.start()) {
                continue;
            }
            findings.add(ValidationError.custom(rule.category(), rule.severity(), rule.message(),
                    context.position(matcher.start(), matcher.end())));
        }
    }
}
