package dev.chordshield.core.pattern;

/**
 * Levenshtein distance with an early exit once a threshold is exceeded.
 */
public final class EditDistance {

    private EditDistance() {
    }

    /**
     * Compute the edit distance between two strings if it does not exceed {@code threshold}.
     *
     * @return the distance, or {@code -1} when it is greater than {@code threshold}
     */
    public static int bounded(CharSequence left, CharSequence right, int threshold) {
        if (threshold < 0) {
            throw new IllegalArgumentException("threshold must not be negative: " + threshold);
        }
        int n = left.length();
        int m = right.length();
        if (Math.abs(n - m) > threshold) {
            return -1;
        }
        if (n == 0 || m == 0) {
            return Math.max(n, m);
        }

        int[] previous = new int[m + 1];
        int[] current = new int[m + 1];
        for (int j = 0; j <= m; j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= n; i++) {
            current[0] = i;
            int rowMin = current[0];
            char c = left.charAt(i - 1);
            for (int j = 1; j <= m; j++) {
                int cost = c == right.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
                rowMin = Math.min(rowMin, current[j]);
            }
            if (rowMin > threshold) {
                return -1;
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }

        int distance = previous[m];
        return distance <= threshold ? distance : -1;
    }
}
