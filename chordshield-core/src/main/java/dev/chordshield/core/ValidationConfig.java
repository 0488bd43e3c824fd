package dev.chordshield.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable validation settings.
 * <p>
 * A config is never changed during a validation call; callers replace it as a whole
 * through {@link ChordProValidator#updateConfig(ValidationConfig)}. Partial overrides are
 * expressed with {@link #toBuilder()}.
 *
 * @param strictMode            report unknown directives
 * @param checkSecurity         scan for dangerous markup and special-character density
 * @param checkBrackets         compare opening and closing bracket counts
 * @param checkEmptyElements    report {@code []} and {@code {}}
 * @param checkTypos            report directive names that look misspelled
 * @param maxSpecialCharPercent allowed share of special characters, in {@code [0, 1]}
 * @param customRules           user-defined rules
 */
public record ValidationConfig(
        boolean strictMode,
        boolean checkSecurity,
        boolean checkBrackets,
        boolean checkEmptyElements,
        boolean checkTypos,
        double maxSpecialCharPercent,
        List<ValidationRule> customRules
) {

    public static final double DEFAULT_MAX_SPECIAL_CHAR_PERCENT = 0.1;

    private static final ValidationConfig DEFAULTS =
            new ValidationConfig(false, true, true, true, true, DEFAULT_MAX_SPECIAL_CHAR_PERCENT, List.of());

    public ValidationConfig {
        if (Double.isNaN(maxSpecialCharPercent) || maxSpecialCharPercent < 0.0 || maxSpecialCharPercent > 1.0) {
            throw new IllegalArgumentException(
                    "maxSpecialCharPercent must be within [0, 1]: " + maxSpecialCharPercent);
        }
        customRules = customRules == null ? List.of() : List.copyOf(customRules);
    }

    public static ValidationConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Every check enabled, unknown directives reported, low special-character tolerance.
     */
    public static ValidationConfig strict() {
        return DEFAULTS.toBuilder()
                .strictMode(true)
                .maxSpecialCharPercent(0.05)
                .build();
    }

    /**
     * Security and bracket checks only.
     */
    public static ValidationConfig relaxed() {
        return DEFAULTS.toBuilder()
                .checkEmptyElements(false)
                .checkTypos(false)
                .maxSpecialCharPercent(0.2)
                .build();
    }

    /**
     * Bracket balance only.
     */
    public static ValidationConfig minimal() {
        return DEFAULTS.toBuilder()
                .checkSecurity(false)
                .checkEmptyElements(false)
                .checkTypos(false)
                .maxSpecialCharPercent(0.5)
                .build();
    }

    public static Builder builder() {
        return DEFAULTS.toBuilder();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Copy with an additional custom rule.
     */
    public ValidationConfig withCustomRule(ValidationRule rule) {
        return toBuilder().addCustomRule(rule).build();
    }

    /**
     * Fluent builder seeded from an existing config.
     */
    public static final class Builder {

        private boolean strictMode;
        private boolean checkSecurity;
        private boolean checkBrackets;
        private boolean checkEmptyElements;
        private boolean checkTypos;
        private double maxSpecialCharPercent;
        private final List<ValidationRule> customRules;

        private Builder(ValidationConfig base) {
            this.strictMode = base.strictMode;
            this.checkSecurity = base.checkSecurity;
            this.checkBrackets = base.checkBrackets;
            this.checkEmptyElements = base.checkEmptyElements;
            this.checkTypos = base.checkTypos;
            this.maxSpecialCharPercent = base.maxSpecialCharPercent;
            this.customRules = new ArrayList<>(base.customRules);
        }

        public Builder strictMode(boolean strictMode) {
            this.strictMode = strictMode;
            return this;
        }

        public Builder checkSecurity(boolean checkSecurity) {
            this.checkSecurity = checkSecurity;
            return this;
        }

        public Builder checkBrackets(boolean checkBrackets) {
            this.checkBrackets = checkBrackets;
            return this;
        }

        public Builder checkEmptyElements(boolean checkEmptyElements) {
            this.checkEmptyElements = checkEmptyElements;
            return this;
        }

        public Builder checkTypos(boolean checkTypos) {
            this.checkTypos = checkTypos;
            return this;
        }

        public Builder maxSpecialCharPercent(double maxSpecialCharPercent) {
            this.maxSpecialCharPercent = maxSpecialCharPercent;
            return this;
        }

        public Builder customRules(List<ValidationRule> rules) {
            this.customRules.clear();
            if (rules != null) {
                this.customRules.addAll(rules);
            }
            return this;
        }

        public Builder addCustomRule(ValidationRule rule) {
            this.customRules.add(rule);
            return this;
        }

        public ValidationConfig build() {
            return new ValidationConfig(strictMode, checkSecurity, checkBrackets, checkEmptyElements,
                    checkTypos, maxSpecialCharPercent, customRules);
        }
    }
}
