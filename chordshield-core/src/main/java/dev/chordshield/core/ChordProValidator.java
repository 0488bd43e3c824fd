package dev.chordshield.core;

import dev.chordshield.core.pattern.ChordProPatterns;
import dev.chordshield.core.rules.CheckContext;
import dev.chordshield.core.rules.RuleEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * ChordPro content validator.
 * <p>
 * Runs bracket balance, empty element, chord, directive, security and custom rule checks
 * over the original text and reports every finding with its position in that text.
 * Validation never throws: a failing check becomes an {@code info} finding.
 * <p>
 * Instances are safe to share. The configuration is replaced as a whole through
 * {@link #updateConfig(ValidationConfig)} and each call reads one snapshot of it.
 */
public class ChordProValidator {

    private static final Logger logger = LoggerFactory.getLogger(ChordProValidator.class);

    private final RuleEngine ruleEngine;
    private volatile ValidationConfig config;

    /**
     * Create a validator with the default configuration.
     */
    public ChordProValidator() {
        this(ValidationConfig.defaults());
    }

    /**
     * Create a validator with the given configuration.
     *
     * @param config the configuration
     */
    public ChordProValidator(ValidationConfig config) {
        this(config, new RuleEngine());
    }

    /**
     * Create a validator with a custom rule engine.
     *
     * @param config     the configuration
     * @param ruleEngine the rule engine to use
     */
    public ChordProValidator(ValidationConfig config, RuleEngine ruleEngine) {
        this.config = Objects.requireNonNull(config, "config");
        this.ruleEngine = Objects.requireNonNull(ruleEngine, "ruleEngine");
    }

    public boolean isValidChord(String chord) {
        return ChordProPatterns.isValidChord(chord);
    }

    public boolean isValidDirective(String directive) {
        return ChordProPatterns.isValidDirective(directive);
    }

    /**
     * Validate content with the current configuration.
     *
     * @param content the text to validate, {@code null} is treated as empty
     * @return validation result
     */
    public ValidationResult validateContent(String content) {
        return validateContent(content, config, ValidationContext.defaults());
    }

    /**
     * Validate content with an explicit configuration.
     *
     * @param content the text to validate
     * @param config  configuration for this call only
     * @return validation result
     */
    public ValidationResult validateContent(String content, ValidationConfig config) {
        return validateContent(content, config, ValidationContext.defaults());
    }

    /**
     * Validate content with an explicit configuration and language hooks.
     *
     * @param content  the text to validate
     * @param config   configuration for this call only
     * @param language chord correction and typo hooks
     * @return validation result
     */
    public ValidationResult validateContent(String content, ValidationConfig config, ValidationContext language) {
        if (content == null || content.isEmpty()) {
            return ValidationResult.success();
        }
        ValidationConfig effective = config == null ? this.config : config;
        ValidationContext hooks = language == null ? ValidationContext.defaults() : language;

        CheckContext context = CheckContext.of(content, effective, hooks);
        List<ValidationError> findings = ruleEngine.run(context);

        ValidationResult result = ValidationResult.fromFindings(findings);
        logger.debug("Validated {} characters on {} line(s): {} error(s), {} warning(s)",
                content.length(), context.lines().lineCount(), result.errorCount(), result.warningCount());
        return result;
    }

    /**
     * Replace the configuration used by {@link #validateContent(String)}.
     *
     * @param config the new configuration
     */
    public void updateConfig(ValidationConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        logger.debug("Validation configuration replaced: {}", config);
    }

    public ValidationConfig getConfig() {
        return config;
    }
}
