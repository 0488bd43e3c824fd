package dev.chordshield.core.i18n;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OffsetMapTest {

    // "[Do] [Re]" rewritten to "[C] [D]"
    private final OffsetMap map = OffsetMap.builder()
            .rewrite(1, 3, 1)
            .rewrite(6, 8, 1)
            .build();

    @Test
    void rewrittenSpansMapToTheWholeOriginalRegion() {
        assertThat(map.toOriginalStart(1)).isEqualTo(1);
        assertThat(map.toOriginalEnd(2)).isEqualTo(3);
        assertThat(map.toOriginalStart(5)).isEqualTo(6);
        assertThat(map.toOriginalEnd(6)).isEqualTo(8);
    }

    @Test
    void offsetsOutsideRewritesAreShifted() {
        assertThat(map.toOriginalStart(0)).isEqualTo(0);
        assertThat(map.toOriginalStart(3)).isEqualTo(4);
        assertThat(map.toOriginalEnd(7)).isEqualTo(9);
    }

    @Test
    void growingReplacementsShiftBackwards() {
        // "{tt}xyz" rewritten to "{title}xyz"
        OffsetMap growing = OffsetMap.builder()
                .rewrite(1, 3, 5)
                .build();

        assertThat(growing.toOriginalStart(1)).isEqualTo(1);
        assertThat(growing.toOriginalStart(4)).isEqualTo(1);
        assertThat(growing.toOriginalEnd(6)).isEqualTo(3);
        assertThat(growing.toOriginalStart(7)).isEqualTo(4);
    }

    @Test
    void overlapDetection() {
        assertThat(map.overlapsRewrite(0, 1)).isFalse();
        assertThat(map.overlapsRewrite(0, 2)).isTrue();
        assertThat(map.overlapsRewrite(3, 6)).isFalse();
        assertThat(map.overlapsRewrite(3, 7)).isTrue();
        assertThat(map.overlapsRewrite(8, 9)).isFalse();
    }

    @Test
    void identityLeavesOffsetsAlone() {
        OffsetMap identity = OffsetMap.builder().build();

        assertThat(identity.isIdentity()).isTrue();
        assertThat(identity.toOriginalStart(42)).isEqualTo(42);
        assertThat(identity.toOriginalEnd(42)).isEqualTo(42);
        assertThat(identity.overlapsRewrite(0, 100)).isFalse();
    }

    @Test
    void rewritesMustBeOrdered() {
        OffsetMap.Builder builder = OffsetMap.builder().rewrite(5, 7, 1);

        assertThatThrownBy(() -> builder.rewrite(6, 8, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.rewrite(1, 2, 1)).isInstanceOf(IllegalArgumentException.class);
    }
}
