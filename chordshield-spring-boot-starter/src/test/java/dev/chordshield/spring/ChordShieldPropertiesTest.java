package dev.chordshield.spring;

import dev.chordshield.core.Severity;
import dev.chordshield.core.ValidationConfig;
import dev.chordshield.core.ValidationErrorType;
import dev.chordshield.core.ValidationRule;
import dev.chordshield.core.i18n.LanguageRules;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ChordShieldPropertiesTest {

    @Test
    void defaultsMatchCoreDefaults() {
        ChordShieldProperties properties = new ChordShieldProperties();

        assertThat(properties.isEnabled()).isTrue();
        assertThat(properties.getLanguage()).isEqualTo("en");
        assertThat(properties.isSanitizeErrors()).isFalse();
        assertThat(properties.toValidationConfig(List.of())).isEqualTo(ValidationConfig.defaults());
    }

    @Test
    void presetsMapToCoreConfigs() {
        assertThat(ChordShieldProperties.Preset.STRICT.config()).isEqualTo(ValidationConfig.strict());
        assertThat(ChordShieldProperties.Preset.RELAXED.config()).isEqualTo(ValidationConfig.relaxed());
        assertThat(ChordShieldProperties.Preset.MINIMAL.config()).isEqualTo(ValidationConfig.minimal());
    }

    @Test
    void onlySetOverridesReplacePresetValues() {
        ChordShieldProperties properties = new ChordShieldProperties();
        properties.setPreset(ChordShieldProperties.Preset.MINIMAL);
        properties.setCheckSecurity(true);

        ValidationConfig config = properties.toValidationConfig(List.of());

        assertThat(config.checkSecurity()).isTrue();
        assertThat(config.checkEmptyElements()).isFalse();
        assertThat(config.maxSpecialCharPercent()).isEqualTo(0.5);
    }

    @Test
    void inlineRulesComeBeforeLoadedRules() {
        ChordShieldProperties.RuleProperties inline = new ChordShieldProperties.RuleProperties();
        inline.setId("inline");
        inline.setPattern("x");
        ChordShieldProperties properties = new ChordShieldProperties();
        properties.setCustomRules(List.of(inline));

        ValidationConfig config = properties.toValidationConfig(
                List.of(ValidationRule.of("loaded", "y", Severity.INFO, "y")));

        assertThat(config.customRules()).extracting(ValidationRule::id).containsExactly("inline", "loaded");
        ValidationRule rule = config.customRules().get(0);
        assertThat(rule.severity()).isEqualTo(Severity.WARNING);
        assertThat(rule.category()).isEqualTo(ValidationErrorType.CUSTOM);
        assertThat(rule.enabled()).isTrue();
    }

    @Test
    void languagePropertiesConvertToRules() {
        ChordShieldProperties.LanguageProperties language = new ChordShieldProperties.LanguageProperties();
        language.setChordNotations(Map.of("Ut", "C"));
        language.setTypoCorrections(Map.of("titl", "title"));

        LanguageRules rules = language.toRules();

        assertThat(rules.chordNotations()).containsOnly(Map.entry("Ut", "C"));
        assertThat(rules.directiveAliases()).isEmpty();
        assertThat(rules.typoCorrections()).containsOnly(Map.entry("titl", "title"));
    }
}
