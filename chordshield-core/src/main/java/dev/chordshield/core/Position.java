package dev.chordshield.core;

/**
 * Location of a finding in the original input.
 *
 * @param start  offset of the first character (inclusive)
 * @param end    offset after the last character (exclusive)
 * @param line   1-based line of {@code start}
 * @param column 1-based column of {@code start}
 */
public record Position(int start, int end, int line, int column) {

    public Position {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("Line and column are 1-based: " + line + ":" + column);
        }
    }

    public int length() {
        return end - start;
    }

    public boolean overlaps(int otherStart, int otherEnd) {
        return start < otherEnd && otherStart < end;
    }
}
