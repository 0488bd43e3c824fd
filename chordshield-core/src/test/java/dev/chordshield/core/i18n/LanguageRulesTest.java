package dev.chordshield.core.i18n;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LanguageRulesTest {

    @Test
    void mergeLetsTheOtherTableWin() {
        LanguageRules base = new LanguageRules(Map.of("Do", "C"), Map.of("titulo", "title"), Map.of());
        LanguageRules extra = new LanguageRules(Map.of("Do", "C", "Ut", "C"), Map.of("titulo", "subtitle"),
                Map.of("titlo", "title"));

        LanguageRules merged = base.merge(extra);

        assertThat(merged.chordNotations()).containsOnly(Map.entry("Do", "C"), Map.entry("Ut", "C"));
        assertThat(merged.directiveAliases()).containsEntry("titulo", "subtitle");
        assertThat(merged.typoCorrections()).containsEntry("titlo", "title");
        assertThat(base.directiveAliases()).containsEntry("titulo", "title");
    }

    @Test
    void mergingNothingReturnsSameTable() {
        LanguageRules base = LanguageRules.ofChordNotations(Map.of("Do", "C"));

        assertThat(base.merge(null)).isSameAs(base);
        assertThat(base.merge(LanguageRules.empty())).isSameAs(base);
    }

    @Test
    void blankKeysAndNullValuesAreDropped() {
        Map<String, String> source = new HashMap<>();
        source.put("", "C");
        source.put("Re", null);
        source.put("Mi", "E");

        assertThat(LanguageRules.ofChordNotations(source).chordNotations()).containsOnly(Map.entry("Mi", "E"));
    }

    @Test
    void typosAloneNeedNoRewrite() {
        LanguageRules typos = LanguageRules.ofTypoCorrections(Map.of("titlo", "title"));

        assertThat(typos.isEmpty()).isFalse();
        assertThat(typos.hasPreprocessingRules()).isFalse();
        assertThat(LanguageRules.ofDirectiveAliases(Map.of("coro", "chorus")).hasPreprocessingRules()).isTrue();
        assertThat(LanguageRules.empty().isEmpty()).isTrue();
    }
}
