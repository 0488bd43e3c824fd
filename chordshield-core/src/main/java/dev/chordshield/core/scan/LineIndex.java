package dev.chordshield.core.scan;

import dev.chordshield.core.Position;

import java.util.Arrays;

/**
 * Maps character offsets to 1-based line and column numbers.
 * <p>
 * Newline offsets are collected once; each lookup is a binary search.
 */
public final class LineIndex {

    private final int length;
    private final int[] newlines;

    private LineIndex(int length, int[] newlines) {
        this.length = length;
        this.newlines = newlines;
    }

    public static LineIndex of(CharSequence content) {
        int length = content == null ? 0 : content.length();
        int[] offsets = new int[16];
        int count = 0;
        for (int i = 0; i < length; i++) {
            if (content.charAt(i) == '\n') {
                if (count == offsets.length) {
                    offsets = Arrays.copyOf(offsets, count * 2);
                }
                offsets[count++] = i;
            }
        }
        return new LineIndex(length, Arrays.copyOf(offsets, count));
    }

    /**
     * Line and column of {@code offset} in {@code content}.
     */
    public static LineColumn toLineColumn(CharSequence content, int offset) {
        return of(content).lineColumn(offset);
    }

    public LineColumn lineColumn(int offset) {
        int clamped = Math.max(0, Math.min(offset, length));
        // number of newlines strictly before the offset
        int before = insertionPoint(clamped);
        int lineStart = before == 0 ? 0 : newlines[before - 1] + 1;
        return new LineColumn(before + 1, clamped - lineStart + 1);
    }

    /**
     * Build a position for the span {@code [start, end)}, clamped to the content.
     */
    public Position position(int start, int end) {
        int clampedStart = Math.max(0, Math.min(start, length));
        int clampedEnd = Math.max(clampedStart, Math.min(end, length));
        LineColumn lc = lineColumn(clampedStart);
        return new Position(clampedStart, clampedEnd, lc.line(), lc.column());
    }

    public int lineCount() {
        return newlines.length + 1;
    }

    public int length() {
        return length;
    }

    private int insertionPoint(int offset) {
        int low = 0;
        int high = newlines.length;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (newlines[mid] < offset) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    /**
     * 1-based line and column.
     */
    public record LineColumn(int line, int column) {
    }
}
