package dev.chordshield.core.i18n;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Language-specific notation tables.
 *
 * @param chordNotations   local chord root to standard root, matched case-sensitively
 * @param directiveAliases local directive name to standard name, matched case-insensitively
 * @param typoCorrections  misspelled name or chord to its correct form
 */
public record LanguageRules(
        Map<String, String> chordNotations,
        Map<String, String> directiveAliases,
        Map<String, String> typoCorrections
) {

    private static final LanguageRules EMPTY = new LanguageRules(Map.of(), Map.of(), Map.of());

    public LanguageRules {
        chordNotations = freeze(chordNotations);
        directiveAliases = freeze(directiveAliases);
        typoCorrections = freeze(typoCorrections);
    }

    @JsonCreator
    public static LanguageRules fromJson(
            @JsonProperty("chordNotations") Map<String, String> chordNotations,
            @JsonProperty("directiveAliases") Map<String, String> directiveAliases,
            @JsonProperty("typoCorrections") Map<String, String> typoCorrections) {
        return new LanguageRules(chordNotations, directiveAliases, typoCorrections);
    }

    public static LanguageRules empty() {
        return EMPTY;
    }

    public static LanguageRules ofChordNotations(Map<String, String> chordNotations) {
        return new LanguageRules(chordNotations, null, null);
    }

    public static LanguageRules ofDirectiveAliases(Map<String, String> directiveAliases) {
        return new LanguageRules(null, directiveAliases, null);
    }

    public static LanguageRules ofTypoCorrections(Map<String, String> typoCorrections) {
        return new LanguageRules(null, null, typoCorrections);
    }

    /**
     * Combine two tables. Entries of {@code other} win on key collisions.
     */
    public LanguageRules merge(LanguageRules other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        return new LanguageRules(
                union(chordNotations, other.chordNotations),
                union(directiveAliases, other.directiveAliases),
                union(typoCorrections, other.typoCorrections));
    }

    @JsonIgnore
    public boolean isEmpty() {
        return chordNotations.isEmpty() && directiveAliases.isEmpty() && typoCorrections.isEmpty();
    }

    /**
     * Whether content has to be rewritten before a second validation pass.
     */
    public boolean hasPreprocessingRules() {
        return !chordNotations.isEmpty() || !directiveAliases.isEmpty();
    }

    private static Map<String, String> union(Map<String, String> base, Map<String, String> extra) {
        Map<String, String> merged = new LinkedHashMap<>(base);
        merged.putAll(extra);
        return merged;
    }

    private static Map<String, String> freeze(Map<String, String> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, String> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (key != null && !key.isEmpty() && value != null) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }
}
