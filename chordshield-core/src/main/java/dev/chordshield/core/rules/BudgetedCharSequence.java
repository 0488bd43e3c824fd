package dev.chordshield.core.rules;

/**
 * Character sequence that aborts regex matching after a fixed number of reads.
 * <p>
 * {@link java.util.regex.Matcher} reads its input only through {@link #charAt(int)}, so a
 * backtracking pattern runs out of budget instead of running for an unbounded time.
 */
final class BudgetedCharSequence implements CharSequence {

    private final CharSequence delegate;
    private final long budget;
    private long reads;

    BudgetedCharSequence(CharSequence delegate, long budget) {
        this.delegate = delegate;
        this.budget = budget;
    }

    /**
     * Budget proportional to the input length.
     */
    static BudgetedCharSequence forInput(CharSequence input, int readsPerChar) {
        long budget = Math.max(100_000L, (long) input.length() * readsPerChar);
        return new BudgetedCharSequence(input, budget);
    }

    @Override
    public char charAt(int index) {
        if (++reads > budget) {
            throw new MatchBudgetExceededException(budget);
        }
        return delegate.charAt(index);
    }

    @Override
    public int length() {
        return delegate.length();
    }

    @Override
    public CharSequence subSequence(int start, int end) {
        return delegate.subSequence(start, end);
    }

    @Override
    public String toString() {
        return delegate.toString();
    }

    /**
     * Raised when a pattern reads more characters than it was allowed to.
     */
    static final class MatchBudgetExceededException extends RuntimeException {

        MatchBudgetExceededException(long budget) {
            super("Pattern exceeded its matching budget of " + budget + " character reads");
        }
    }
}
