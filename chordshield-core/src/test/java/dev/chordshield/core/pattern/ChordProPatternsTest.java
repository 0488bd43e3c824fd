package dev.chordshield.core.pattern;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ChordProPatternsTest {

    @ParameterizedTest
    @ValueSource(strings = {"C", "Am", "F#m7", "Bb", "Cmaj7", "CM7", "Dsus4", "Gsus2", "G/B", "D/F#",
            "Eadd9", "C#m7b5", "A7#9", "Bbdim", "Caug", "C°", "Cø", "C+", "Em11", " Am "})
    void acceptsStandardChords(String chord) {
        assertThat(ChordProPatterns.isValidChord(chord)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "c", "am", "H", "X", "123", "Cxyz", "Do", "Am/", "C/H"})
    void rejectsMalformedChords(String chord) {
        assertThat(ChordProPatterns.isValidChord(chord)).isFalse();
    }

    @Test
    void rejectsNullChord() {
        assertThat(ChordProPatterns.isValidChord(null)).isFalse();
    }

    @Test
    void enforcesMaximumChordLength() {
        String longest = "Csus" + "add9".repeat(7);
        assertThat(longest).hasSize(ChordProPatterns.MAX_CHORD_LENGTH);
        assertThat(ChordProPatterns.isValidChord(longest)).isTrue();
        assertThat(ChordProPatterns.isValidChord(longest + "7")).isFalse();
    }

    @Test
    void directiveNeedsBracesAndNonBlankInterior() {
        assertThat(ChordProPatterns.isValidDirective("{title: Test}")).isTrue();
        assertThat(ChordProPatterns.isValidDirective("{c}")).isTrue();
        assertThat(ChordProPatterns.isValidDirective("  {artist: Someone}  ")).isTrue();

        assertThat(ChordProPatterns.isValidDirective("{}")).isFalse();
        assertThat(ChordProPatterns.isValidDirective("{   }")).isFalse();
        assertThat(ChordProPatterns.isValidDirective("title: Test")).isFalse();
        assertThat(ChordProPatterns.isValidDirective("{title: Test")).isFalse();
        assertThat(ChordProPatterns.isValidDirective("{a}b}")).isFalse();
        assertThat(ChordProPatterns.isValidDirective(null)).isFalse();
    }

    @Test
    void knownDirectivesAreCaseInsensitive() {
        assertThat(ChordProPatterns.isKnownDirective("title")).isTrue();
        assertThat(ChordProPatterns.isKnownDirective("SOC")).isTrue();
        assertThat(ChordProPatterns.isKnownDirective("titulo")).isFalse();
    }

    @Test
    void suggestsChordCorrections() {
        assertThat(ChordProPatterns.suggestChordCorrection("c")).hasValue("C");
        assertThat(ChordProPatterns.suggestChordCorrection("am")).hasValue("Am");
        assertThat(ChordProPatterns.suggestChordCorrection("f#m7")).hasValue("F#m7");
        assertThat(ChordProPatterns.suggestChordCorrection("H")).hasValue("B");
        assertThat(ChordProPatterns.suggestChordCorrection("CB")).hasValue("C/B");
        assertThat(ChordProPatterns.suggestChordCorrection("X")).isEmpty();
        assertThat(ChordProPatterns.suggestChordCorrection("")).isEmpty();
    }

    @Test
    void suggestsDirectivesFromTablesBeforeEditDistance() {
        assertThat(ChordProPatterns.suggestDirective("titel", Map.of())).hasValue("title");
        assertThat(ChordProPatterns.suggestDirective("titulo", Map.of("titulo", "title"))).hasValue("title");
        assertThat(ChordProPatterns.suggestDirective("artst", Map.of())).hasValue("artist");
        assertThat(ChordProPatterns.suggestDirective("titl", Map.of())).hasValue("title");
    }

    @Test
    void noDirectiveSuggestionForKnownOrDistantNames() {
        assertThat(ChordProPatterns.suggestDirective("title", Map.of())).isEmpty();
        assertThat(ChordProPatterns.suggestDirective("xyzzyq", Map.of())).isEmpty();
        assertThat(ChordProPatterns.suggestDirective("", Map.of())).isEmpty();
    }

    @Test
    void chordSyntaxIsNotSpecial() {
        for (char c : "[]{}:#/|()+-.,;!?'".toCharArray()) {
            assertThat(ChordProPatterns.isSpecialCharacter(c)).as("'%s'", c).isFalse();
        }
        assertThat(ChordProPatterns.isSpecialCharacter('a')).isFalse();
        assertThat(ChordProPatterns.isSpecialCharacter(' ')).isFalse();
        assertThat(ChordProPatterns.isSpecialCharacter('$')).isTrue();
        assertThat(ChordProPatterns.isSpecialCharacter('<')).isTrue();
    }
}
