package dev.chordshield.core.scan;

import java.util.Locale;

/**
 * A delimited token found in the content.
 *
 * @param kind     chord or directive
 * @param open     offset of the opening delimiter
 * @param close    offset of the closing delimiter
 * @param interior text between the delimiters
 */
public record Token(TokenKind kind, int open, int close, String interior) {

    /**
     * Offset after the closing delimiter.
     */
    public int end() {
        return close + 1;
    }

    public int interiorStart() {
        return open + 1;
    }

    public boolean isBlank() {
        return interior.isBlank();
    }

    /**
     * Interior without surrounding whitespace.
     */
    public String trimmed() {
        return interior.trim();
    }

    /**
     * Offset of the first non-whitespace interior character.
     */
    public int trimmedStart() {
        return interiorStart() + leadingWhitespace();
    }

    /**
     * Directive name: the trimmed interior up to the first {@code :} or whitespace.
     */
    public String name() {
        String text = trimmed();
        int cut = nameLength(text);
        return text.substring(0, cut);
    }

    public String normalizedName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Directive value after the name, or an empty string.
     */
    public String value() {
        String text = trimmed();
        int cut = nameLength(text);
        String rest = text.substring(cut).trim();
        if (rest.startsWith(":")) {
            rest = rest.substring(1).trim();
        }
        return rest;
    }

    private int leadingWhitespace() {
        int i = 0;
        while (i < interior.length() && Character.isWhitespace(interior.charAt(i))) {
            i++;
        }
        return i;
    }

    private static int nameLength(String text) {
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == ':' || Character.isWhitespace(c)) {
                break;
            }
            i++;
        }
        return i;
    }
}
