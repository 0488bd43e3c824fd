package dev.chordshield.core;

import java.util.Optional;

/**
 * Suggests a replacement for a chord token the matcher rejected.
 */
@FunctionalInterface
public interface ChordCorrector {

    Optional<String> correct(String chord);

    static ChordCorrector none() {
        return chord -> Optional.empty();
    }
}
