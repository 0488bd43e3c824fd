package dev.chordshield.spring;

import dev.chordshield.core.Severity;
import dev.chordshield.core.ValidationConfig;
import dev.chordshield.core.ValidationErrorType;
import dev.chordshield.core.ValidationRule;
import dev.chordshield.core.i18n.LanguageRules;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for ChordShield.
 */
@ConfigurationProperties(prefix = "chordshield")
public class ChordShieldProperties {

    /**
     * Enable/disable ChordShield validation.
     */
    private boolean enabled = true;

    /**
     * Language used for notation and messages.
     */
    private String language = "en";

    /**
     * Base settings the individual overrides below are applied to.
     */
    private Preset preset = Preset.DEFAULT;

    private Boolean strictMode;
    private Boolean checkSecurity;
    private Boolean checkBrackets;
    private Boolean checkEmptyElements;
    private Boolean checkTypos;
    private Double maxSpecialCharPercent;

    /**
     * Custom rules declared inline.
     */
    private List<RuleProperties> customRules = new ArrayList<>();

    /**
     * Classpath JSON document with additional custom rules.
     */
    private String rulesLocation;

    /**
     * Extra notation entries per language code.
     */
    private Map<String, LanguageProperties> languages = new LinkedHashMap<>();

    /**
     * Hide finding details in error responses.
     */
    private boolean sanitizeErrors = false;

    /**
     * Build the validation settings from the preset, the overrides and the given rules.
     *
     * @param loadedRules rules read from {@link #getRulesLocation()}
     */
    public ValidationConfig toValidationConfig(List<ValidationRule> loadedRules) {
        ValidationConfig.Builder builder = preset.config().toBuilder();
        if (strictMode != null) {
            builder.strictMode(strictMode);
        }
        if (checkSecurity != null) {
            builder.checkSecurity(checkSecurity);
        }
        if (checkBrackets != null) {
            builder.checkBrackets(checkBrackets);
        }
        if (checkEmptyElements != null) {
            builder.checkEmptyElements(checkEmptyElements);
        }
        if (checkTypos != null) {
            builder.checkTypos(checkTypos);
        }
        if (maxSpecialCharPercent != null) {
            builder.maxSpecialCharPercent(maxSpecialCharPercent);
        }

        List<ValidationRule> rules = new ArrayList<>();
        for (RuleProperties rule : customRules) {
            rules.add(rule.toRule());
        }
        rules.addAll(loadedRules);
        return builder.customRules(rules).build();
    }

    // Getters and setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }

    public Preset getPreset() {
        return preset;
    }

    public void setPreset(Preset preset) {
        this.preset = preset;
    }

    public Boolean getStrictMode() {
        return strictMode;
    }

    public void setStrictMode(Boolean strictMode) {
        this.strictMode = strictMode;
    }

    public Boolean getCheckSecurity() {
        return checkSecurity;
    }

    public void setCheckSecurity(Boolean checkSecurity) {
        this.checkSecurity = checkSecurity;
    }

    public Boolean getCheckBrackets() {
        return checkBrackets;
    }

    public void setCheckBrackets(Boolean checkBrackets) {
        this.checkBrackets = checkBrackets;
    }

    public Boolean getCheckEmptyElements() {
        return checkEmptyElements;
    }

    public void setCheckEmptyElements(Boolean checkEmptyElements) {
        this.checkEmptyElements = checkEmptyElements;
    }

    public Boolean getCheckTypos() {
        return checkTypos;
    }

    public void setCheckTypos(Boolean checkTypos) {
        this.checkTypos = checkTypos;
    }

    public Double getMaxSpecialCharPercent() {
        return maxSpecialCharPercent;
    }

    public void setMaxSpecialCharPercent(Double maxSpecialCharPercent) {
        this.maxSpecialCharPercent = maxSpecialCharPercent;
    }

    public List<RuleProperties> getCustomRules() {
        return customRules;
    }

    public void setCustomRules(List<RuleProperties> customRules) {
        this.customRules = customRules;
    }

    public String getRulesLocation() {
        return rulesLocation;
    }

    public void setRulesLocation(String rulesLocation) {
        this.rulesLocation = rulesLocation;
    }

    public Map<String, LanguageProperties> getLanguages() {
        return languages;
    }

    public void setLanguages(Map<String, LanguageProperties> languages) {
        this.languages = languages;
    }

    public boolean isSanitizeErrors() {
        return sanitizeErrors;
    }

    public void setSanitizeErrors(boolean sanitizeErrors) {
        this.sanitizeErrors = sanitizeErrors;
    }

    /**
     * Named starting points for the validation settings.
     */
    public enum Preset {
        DEFAULT,
        STRICT,
        RELAXED,
        MINIMAL;

        public ValidationConfig config() {
            return switch (this) {
                case DEFAULT -> ValidationConfig.defaults();
                case STRICT -> ValidationConfig.strict();
                case RELAXED -> ValidationConfig.relaxed();
                case MINIMAL -> ValidationConfig.minimal();
            };
        }
    }

    /**
     * Custom rule declared in configuration.
     */
    public static class RuleProperties {

        private String id;
        private String name;
        private String description;
        private String pattern;
        private Severity severity = Severity.WARNING;
        private ValidationErrorType category = ValidationErrorType.CUSTOM;
        private String message;
        private boolean enabled = true;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public String getPattern() {
            return pattern;
        }

        public void setPattern(String pattern) {
            this.pattern = pattern;
        }

        public Severity getSeverity() {
            return severity;
        }

        public void setSeverity(Severity severity) {
            this.severity = severity;
        }

        public ValidationErrorType getCategory() {
            return category;
        }

        public void setCategory(ValidationErrorType category) {
            this.category = category;
        }

        public String getMessage() {
            return message;
        }

        public void setMessage(String message) {
            this.message = message;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        /**
         * Convert to a core rule.
         */
        public ValidationRule toRule() {
            return new ValidationRule(id, name, description, pattern, severity, category, message, enabled);
        }
    }

    /**
     * Notation entries added to a language.
     */
    public static class LanguageProperties {

        private Map<String, String> chordNotations = new LinkedHashMap<>();
        private Map<String, String> directiveAliases = new LinkedHashMap<>();
        private Map<String, String> typoCorrections = new LinkedHashMap<>();

        public Map<String, String> getChordNotations() {
            return chordNotations;
        }

        public void setChordNotations(Map<String, String> chordNotations) {
            this.chordNotations = chordNotations;
        }

        public Map<String, String> getDirectiveAliases() {
            return directiveAliases;
        }

        public void setDirectiveAliases(Map<String, String> directiveAliases) {
            this.directiveAliases = directiveAliases;
        }

        public Map<String, String> getTypoCorrections() {
            return typoCorrections;
        }

        public void setTypoCorrections(Map<String, String> typoCorrections) {
            this.typoCorrections = typoCorrections;
        }

        /**
         * Convert to core language rules.
         */
        public LanguageRules toRules() {
            return new LanguageRules(chordNotations, directiveAliases, typoCorrections);
        }
    }
}
