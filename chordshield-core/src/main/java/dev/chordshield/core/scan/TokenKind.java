package dev.chordshield.core.scan;

/**
 * Delimited token kinds.
 */
public enum TokenKind {
    CHORD('[', ']'),
    DIRECTIVE('{', '}');

    private final char open;
    private final char close;

    TokenKind(char open, char close) {
        this.open = open;
        this.close = close;
    }

    public char open() {
        return open;
    }

    public char close() {
        return close;
    }
}
