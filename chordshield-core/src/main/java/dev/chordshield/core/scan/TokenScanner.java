package dev.chordshield.core.scan;

import java.util.ArrayList;
import java.util.List;

/**
 * Single-pass extraction of chord and directive tokens.
 * <p>
 * A token's interior cannot contain its own delimiters or a line break. An opener
 * without a matching closer on the same line is abandoned; bracket balance is reported
 * separately from the raw delimiter counts collected here.
 */
public final class TokenScanner {

    private TokenScanner() {
    }

    public static ScanResult scan(String content) {
        if (content == null || content.isEmpty()) {
            return ScanResult.EMPTY;
        }

        List<Token> tokens = new ArrayList<>();
        int openBrackets = 0;
        int closeBrackets = 0;
        int openBraces = 0;
        int closeBraces = 0;
        int chordOpen = -1;
        int directiveOpen = -1;

        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            switch (c) {
                case '[' -> {
                    openBrackets++;
                    chordOpen = i;
                }
                case ']' -> {
                    closeBrackets++;
                    if (chordOpen >= 0) {
                        tokens.add(new Token(TokenKind.CHORD, chordOpen, i, content.substring(chordOpen + 1, i)));
                        chordOpen = -1;
                    }
                }
                case '{' -> {
                    openBraces++;
                    directiveOpen = i;
                }
                case '}' -> {
                    closeBraces++;
                    if (directiveOpen >= 0) {
                        tokens.add(new Token(TokenKind.DIRECTIVE, directiveOpen, i,
                                content.substring(directiveOpen + 1, i)));
                        directiveOpen = -1;
                    }
                }
                case '\n' -> {
                    chordOpen = -1;
                    directiveOpen = -1;
                }
                default -> {
                    // plain text
                }
            }
        }

        return new ScanResult(List.copyOf(tokens), openBrackets, closeBrackets, openBraces, closeBraces);
    }

    /**
     * Tokens in order of their closing delimiter, plus raw delimiter counts.
     */
    public record ScanResult(
            List<Token> tokens,
            int openBrackets,
            int closeBrackets,
            int openBraces,
            int closeBraces
    ) {

        static final ScanResult EMPTY = new ScanResult(List.of(), 0, 0, 0, 0);

        public List<Token> chords() {
            return tokens.stream().filter(t -> t.kind() == TokenKind.CHORD).toList();
        }

        public List<Token> directives() {
            return tokens.stream().filter(t -> t.kind() == TokenKind.DIRECTIVE).toList();
        }
    }
}
