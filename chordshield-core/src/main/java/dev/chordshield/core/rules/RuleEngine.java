package dev.chordshield.core.rules;

import dev.chordshield.core.MessageKey;
import dev.chordshield.core.Severity;
import dev.chordshield.core.ValidationError;
import dev.chordshield.core.ValidationErrorType;
import dev.chordshield.core.ValidationRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the built-in checks followed by the enabled custom rules.
 * <p>
 * Each check writes into its own buffer. A check that throws contributes nothing but a
 * single {@code info} diagnostic, and the remaining checks still run.
 */
public class RuleEngine {

    private static final Logger logger = LoggerFactory.getLogger(RuleEngine.class);

    private final List<ContentCheck> builtInChecks;
    // checks for the most recent rule list, so patterns compile once per configuration
    private volatile CompiledRules compiledRules = CompiledRules.EMPTY;

    public RuleEngine() {
        this(defaultChecks());
    }

    public RuleEngine(List<ContentCheck> builtInChecks) {
        this.builtInChecks = List.copyOf(builtInChecks);
    }

    /**
     * Built-in checks in reporting order.
     */
    public static List<ContentCheck> defaultChecks() {
        return List.of(
                new BracketBalanceCheck(),
                new EmptyElementCheck(),
                new ChordCheck(),
                new DirectiveCheck(),
                new SecurityCheck());
    }

    public List<ContentCheck> getBuiltInChecks() {
        return builtInChecks;
    }

    /**
     * Apply every enabled check to the content.
     *
     * @return findings in check order
     */
    public List<ValidationError> run(CheckContext context) {
        List<ValidationError> findings = new ArrayList<>();

        for (ContentCheck check : builtInChecks) {
            if (check.isEnabled(context.config())) {
                runIsolated(check, context, findings);
            }
        }

        for (CustomRuleCheck check : customChecks(context.config().customRules())) {
            runIsolated(check, context, findings);
        }

        return findings;
    }

    List<CustomRuleCheck> customChecks(List<ValidationRule> rules) {
        CompiledRules current = compiledRules;
        if (!current.rules().equals(rules)) {
            List<CustomRuleCheck> checks = new ArrayList<>();
            for (ValidationRule rule : rules) {
                if (rule.enabled()) {
                    checks.add(new CustomRuleCheck(rule));
                }
            }
            current = new CompiledRules(List.copyOf(rules), List.copyOf(checks));
            compiledRules = current;
        }
        return current.checks();
    }

    private void runIsolated(ContentCheck check, CheckContext context, List<ValidationError> findings) {
        List<ValidationError> buffer = new ArrayList<>();
        try {
            check.apply(context, buffer);
            findings.addAll(buffer);
        } catch (RuntimeException | StackOverflowError e) {
            logger.warn("Validation rule '{}' failed and was skipped: {}", check.id(), e.getMessage());
            logger.debug("Rule failure detail", e);
            findings.add(ValidationError.of(ValidationErrorType.CUSTOM, Severity.INFO, MessageKey.RULE_FAILED,
                    context.position(0, 0), null, check.id()));
        }
    }

    private record CompiledRules(List<ValidationRule> rules, List<CustomRuleCheck> checks) {

        static final CompiledRules EMPTY = new CompiledRules(List.of(), List.of());
    }
}
