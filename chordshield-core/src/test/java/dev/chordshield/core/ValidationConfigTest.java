package dev.chordshield.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValidationConfigTest {

    @Test
    void defaultsEnableEverythingButStrictMode() {
        ValidationConfig config = ValidationConfig.defaults();

        assertThat(config.strictMode()).isFalse();
        assertThat(config.checkSecurity()).isTrue();
        assertThat(config.checkBrackets()).isTrue();
        assertThat(config.checkEmptyElements()).isTrue();
        assertThat(config.checkTypos()).isTrue();
        assertThat(config.maxSpecialCharPercent()).isEqualTo(0.1);
        assertThat(config.customRules()).isEmpty();
    }

    @Test
    void presetsDifferAsDocumented() {
        assertThat(ValidationConfig.strict().strictMode()).isTrue();
        assertThat(ValidationConfig.strict().maxSpecialCharPercent()).isEqualTo(0.05);

        ValidationConfig relaxed = ValidationConfig.relaxed();
        assertThat(relaxed.checkSecurity()).isTrue();
        assertThat(relaxed.checkEmptyElements()).isFalse();
        assertThat(relaxed.checkTypos()).isFalse();

        ValidationConfig minimal = ValidationConfig.minimal();
        assertThat(minimal.checkSecurity()).isFalse();
        assertThat(minimal.checkBrackets()).isTrue();
    }

    @Test
    void thresholdOutsideUnitIntervalIsRejected() {
        ValidationConfig.Builder builder = ValidationConfig.builder();

        assertThatThrownBy(() -> builder.maxSpecialCharPercent(1.5).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.maxSpecialCharPercent(-0.1).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.maxSpecialCharPercent(Double.NaN).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void customRulesAreCopied() {
        List<ValidationRule> rules = new ArrayList<>();
        rules.add(ValidationRule.of("a", "a", Severity.INFO, "a"));
        ValidationConfig config = ValidationConfig.builder().customRules(rules).build();

        rules.add(ValidationRule.of("b", "b", Severity.INFO, "b"));

        assertThat(config.customRules()).hasSize(1);
    }

    @Test
    void withCustomRuleLeavesOriginalUntouched() {
        ValidationConfig base = ValidationConfig.defaults();
        ValidationConfig extended = base.withCustomRule(ValidationRule.of("a", "a", Severity.INFO, "a"));

        assertThat(base.customRules()).isEmpty();
        assertThat(extended.customRules()).extracting(ValidationRule::id).containsExactly("a");
    }
}
