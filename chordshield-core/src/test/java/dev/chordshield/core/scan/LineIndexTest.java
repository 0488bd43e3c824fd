package dev.chordshield.core.scan;

import dev.chordshield.core.Position;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LineIndexTest {

    private final LineIndex index = LineIndex.of("ab\ncd\n\nef");

    @Test
    void mapsOffsetsToOneBasedLineAndColumn() {
        assertThat(index.lineColumn(0)).isEqualTo(new LineIndex.LineColumn(1, 1));
        assertThat(index.lineColumn(1)).isEqualTo(new LineIndex.LineColumn(1, 2));
        assertThat(index.lineColumn(3)).isEqualTo(new LineIndex.LineColumn(2, 1));
        assertThat(index.lineColumn(4)).isEqualTo(new LineIndex.LineColumn(2, 2));
        assertThat(index.lineColumn(6)).isEqualTo(new LineIndex.LineColumn(3, 1));
        assertThat(index.lineColumn(7)).isEqualTo(new LineIndex.LineColumn(4, 1));
    }

    @Test
    void newlineBelongsToTheLineItEnds() {
        assertThat(index.lineColumn(2)).isEqualTo(new LineIndex.LineColumn(1, 3));
    }

    @Test
    void clampsOffsetsOutsideTheContent() {
        assertThat(index.lineColumn(-5)).isEqualTo(new LineIndex.LineColumn(1, 1));
        assertThat(index.lineColumn(100)).isEqualTo(new LineIndex.LineColumn(4, 3));
    }

    @Test
    void buildsClampedPositions() {
        assertThat(index.position(3, 5)).isEqualTo(new Position(3, 5, 2, 1));
        assertThat(index.position(5, 2)).isEqualTo(new Position(5, 5, 2, 3));
        assertThat(index.position(8, 50)).isEqualTo(new Position(8, 9, 4, 2));
    }

    @Test
    void countsLines() {
        assertThat(index.lineCount()).isEqualTo(4);
        assertThat(LineIndex.of("").lineCount()).isEqualTo(1);
        assertThat(LineIndex.toLineColumn("x\ny", 2)).isEqualTo(new LineIndex.LineColumn(2, 1));
    }
}
