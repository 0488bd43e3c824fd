package dev.chordshield.core.i18n;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.chordshield.core.exception.LanguageRulesException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LanguageRuleRegistryTest {

    private final LanguageRuleRegistry registry = new LanguageRuleRegistry();

    @Test
    void builtInLanguagesAreLoaded() {
        assertThat(registry.languages()).containsExactly("de", "es", "fr", "it", "pt");
        assertThat(registry.get("es").chordNotations()).containsEntry("Do", "C").containsEntry("Sol", "G");
        assertThat(registry.get("es").directiveAliases()).containsEntry("titulo", "title");
        assertThat(registry.get("de").chordNotations()).containsEntry("H", "B");
        assertThat(registry.get("fr").chordNotations()).containsEntry("Ré", "D");
    }

    @Test
    void languageTagsAreReducedToPrimarySubtag() {
        assertThat(LanguageRuleRegistry.normalize("es-MX")).isEqualTo("es");
        assertThat(LanguageRuleRegistry.normalize("PT_br")).isEqualTo("pt");
        assertThat(LanguageRuleRegistry.normalize(" FR ")).isEqualTo("fr");
        assertThat(LanguageRuleRegistry.normalize(null)).isEqualTo("en");
        assertThat(LanguageRuleRegistry.normalize("  ")).isEqualTo("en");
        assertThat(registry.get("es-AR")).isEqualTo(registry.get("es"));
    }

    @Test
    void unknownLanguageHasEmptyRules() {
        assertThat(registry.contains("en")).isFalse();
        assertThat(registry.get("en").isEmpty()).isTrue();
        assertThat(registry.get("xx").isEmpty()).isTrue();
    }

    @Test
    void extendMergesIntoExistingTable() {
        LanguageRules result = registry.extend("es", LanguageRules.ofChordNotations(Map.of("Ut", "C")));

        assertThat(result.chordNotations()).containsEntry("Ut", "C").containsEntry("Do", "C");
        assertThat(registry.get("es")).isEqualTo(result);
    }

    @Test
    void registerReplacesTable() {
        registry.register("nl", LanguageRules.ofDirectiveAliases(Map.of("titel", "title")));

        assertThat(registry.contains("nl")).isTrue();
        assertThat(registry.get("NL").directiveAliases()).containsOnlyKeys("titel");
    }

    @Test
    void emptyRegistrySkipsBuiltIns() {
        LanguageRuleRegistry empty = new LanguageRuleRegistry(new ObjectMapper(), false);

        assertThat(empty.languages()).isEmpty();
    }

    @Test
    void parseReadsValidTables() {
        LanguageRules rules = registry.parse("{\"chordNotations\": {\"Do\": \"C\"}, \"typoCorrections\": {\"titl\": \"title\"}}");

        assertThat(rules.chordNotations()).containsOnly(Map.entry("Do", "C"));
        assertThat(rules.directiveAliases()).isEmpty();
        assertThat(rules.typoCorrections()).containsEntry("titl", "title");
    }

    @Test
    void parseRejectsMalformedJson() {
        assertThatThrownBy(() -> registry.parse("{\"chordNotations\": "))
                .isInstanceOf(LanguageRulesException.class)
                .hasMessage("Language rules are not valid JSON");
    }

    @Test
    void parseRejectsTablesOutsideTheSchema() {
        assertThatThrownBy(() -> registry.parse("{\"chords\": {\"Do\": \"C\"}}"))
                .isInstanceOf(LanguageRulesException.class)
                .hasMessageStartingWith("Invalid language rules in inline table");
        assertThatThrownBy(() -> registry.parse("{\"chordNotations\": {\"Do\": 1}}"))
                .isInstanceOf(LanguageRulesException.class);
    }

    @Test
    void missingResourceIsReported() {
        assertThatThrownBy(() -> registry.loadResource("chordshield/languages/xx.json"))
                .isInstanceOf(LanguageRulesException.class)
                .hasMessageContaining("not found");
    }
}
