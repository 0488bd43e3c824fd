package dev.chordshield.core.pattern;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EditDistanceTest {

    @Test
    void computesDistanceWithinThreshold() {
        assertThat(EditDistance.bounded("kitten", "sitting", 3)).isEqualTo(3);
        assertThat(EditDistance.bounded("title", "title", 0)).isZero();
        assertThat(EditDistance.bounded("titel", "title", 2)).isEqualTo(2);
        assertThat(EditDistance.bounded("", "abc", 3)).isEqualTo(3);
    }

    @Test
    void returnsMinusOneAboveThreshold() {
        assertThat(EditDistance.bounded("kitten", "sitting", 2)).isEqualTo(-1);
        assertThat(EditDistance.bounded("a", "abcdef", 2)).isEqualTo(-1);
    }

    @Test
    void rejectsNegativeThreshold() {
        assertThatThrownBy(() -> EditDistance.bounded("a", "b", -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
