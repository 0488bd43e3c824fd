package dev.chordshield.core;

import java.util.Map;

/**
 * Language hooks for a single validation call.
 *
 * @param chordCorrector  consulted before the built-in chord heuristics
 * @param typoCorrections extra directive misspellings, keyed in lower case
 */
public record ValidationContext(ChordCorrector chordCorrector, Map<String, String> typoCorrections) {

    private static final ValidationContext DEFAULT = new ValidationContext(ChordCorrector.none(), Map.of());

    public ValidationContext {
        chordCorrector = chordCorrector == null ? ChordCorrector.none() : chordCorrector;
        typoCorrections = typoCorrections == null ? Map.of() : Map.copyOf(typoCorrections);
    }

    public static ValidationContext defaults() {
        return DEFAULT;
    }
}
