package dev.chordshield.core.i18n;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps offsets in rewritten content back to offsets in the original text.
 * <p>
 * Rewrites are recorded in increasing, non-overlapping order. Offsets outside any rewrite
 * are shifted by the length change of the rewrites before them; offsets inside a rewrite
 * snap to the edge of the original region.
 */
public final class OffsetMap {

    private static final OffsetMap IDENTITY = new OffsetMap(List.of());

    private final List<Rewrite> rewrites;
    // cumulative (original - processed) length change after each rewrite
    private final int[] shifts;

    private OffsetMap(List<Rewrite> rewrites) {
        this.rewrites = List.copyOf(rewrites);
        this.shifts = new int[this.rewrites.size()];
        int shift = 0;
        for (int i = 0; i < this.rewrites.size(); i++) {
            Rewrite r = this.rewrites.get(i);
            shift += (r.originalEnd() - r.originalStart()) - (r.processedEnd() - r.processedStart());
            shifts[i] = shift;
        }
    }

    public static OffsetMap identity() {
        return IDENTITY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isIdentity() {
        return rewrites.isEmpty();
    }

    public List<Rewrite> rewrites() {
        return rewrites;
    }

    /**
     * Original offset for the start of a span in the rewritten content.
     */
    public int toOriginalStart(int processedOffset) {
        int index = lastRewriteStartingAtOrBefore(processedOffset);
        if (index < 0) {
            return processedOffset;
        }
        Rewrite r = rewrites.get(index);
        if (processedOffset < r.processedEnd()) {
            return r.originalStart();
        }
        return processedOffset + shifts[index];
    }

    /**
     * Original offset for the exclusive end of a span in the rewritten content.
     */
    public int toOriginalEnd(int processedOffset) {
        int index = lastRewriteStartingBefore(processedOffset);
        if (index < 0) {
            return processedOffset;
        }
        Rewrite r = rewrites.get(index);
        if (processedOffset <= r.processedEnd()) {
            return r.originalEnd();
        }
        return processedOffset + shifts[index];
    }

    /**
     * Whether the original span {@code [start, end)} touches any rewritten region.
     */
    public boolean overlapsRewrite(int start, int end) {
        for (Rewrite r : rewrites) {
            if (r.originalStart() >= end) {
                break;
            }
            if (start < r.originalEnd() && r.originalStart() < end) {
                return true;
            }
        }
        return false;
    }

    private int lastRewriteStartingAtOrBefore(int offset) {
        int low = 0;
        int high = rewrites.size() - 1;
        int found = -1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            if (rewrites.get(mid).processedStart() <= offset) {
                found = mid;
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        return found;
    }

    private int lastRewriteStartingBefore(int offset) {
        return lastRewriteStartingAtOrBefore(offset - 1);
    }

    /**
     * One replaced region.
     */
    public record Rewrite(int originalStart, int originalEnd, int processedStart, int processedEnd) {
    }

    public static final class Builder {

        private final List<Rewrite> rewrites = new ArrayList<>();
        private int shift;

        private Builder() {
        }

        /**
         * Record that {@code [originalStart, originalEnd)} was replaced by {@code replacementLength}
         * characters.
         */
        public Builder rewrite(int originalStart, int originalEnd, int replacementLength) {
            if (!rewrites.isEmpty() && originalStart < rewrites.get(rewrites.size() - 1).originalEnd()) {
                throw new IllegalArgumentException("Rewrites must be added in order without overlap");
            }
            int processedStart = originalStart - shift;
            rewrites.add(new Rewrite(originalStart, originalEnd, processedStart, processedStart + replacementLength));
            shift += (originalEnd - originalStart) - replacementLength;
            return this;
        }

        public OffsetMap build() {
            return rewrites.isEmpty() ? IDENTITY : new OffsetMap(rewrites);
        }
    }
}
