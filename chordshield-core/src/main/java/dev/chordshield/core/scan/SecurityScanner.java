package dev.chordshield.core.scan;

import dev.chordshield.core.pattern.ChordProPatterns;
import dev.chordshield.core.pattern.MarkupPattern;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Linear-time detection of dangerous markup.
 * <p>
 * Recognizes:
 * <ul>
 *   <li>{@code <script ...>}, {@code <iframe ...>}, {@code <object ...>}, {@code <embed ...>},
 *       {@code <link ...>} and {@code <meta ...>} tags (case-insensitive, closing {@code >} required)</li>
 *   <li>the {@code javascript:} scheme</li>
 *   <li>inline handlers: a word {@code on<name>} followed by optional whitespace and {@code =}</li>
 * </ul>
 * Matches are returned grouped by pattern, each group in offset order.
 */
public final class SecurityScanner {

    private static final MarkupPattern[] TAGS = {
            MarkupPattern.SCRIPT_TAG,
            MarkupPattern.IFRAME_TAG,
            MarkupPattern.OBJECT_TAG,
            MarkupPattern.EMBED_TAG,
            MarkupPattern.LINK_TAG,
            MarkupPattern.META_TAG
    };

    private SecurityScanner() {
    }

    public static List<MarkupMatch> scan(String content) {
        if (content == null || content.isEmpty()) {
            return List.of();
        }

        List<MarkupMatch> matches = new ArrayList<>();
        int length = content.length();
        // next '>' at or after the current position; -1 once none remain
        int nextClose = content.indexOf('>');
        int i = 0;
        while (i < length) {
            char c = content.charAt(i);

            if (c == '<' && nextClose >= 0) {
                if (nextClose <= i) {
                    nextClose = content.indexOf('>', i + 1);
                }
                MarkupPattern tag = nextClose >= 0 ? matchTag(content, i + 1) : null;
                if (tag != null) {
                    matches.add(new MarkupMatch(tag, i, nextClose + 1));
                    i = nextClose + 1;
                    continue;
                }
            } else if ((c == 'j' || c == 'J') && regionMatches(content, i, MarkupPattern.JAVASCRIPT_PROTOCOL.literal())) {
                int end = i + MarkupPattern.JAVASCRIPT_PROTOCOL.literal().length();
                matches.add(new MarkupMatch(MarkupPattern.JAVASCRIPT_PROTOCOL, i, end));
                i = end;
                continue;
            }

            if (isWordChar(c) && (i == 0 || !isWordChar(content.charAt(i - 1)))) {
                int wordEnd = i;
                while (wordEnd < length && isWordChar(content.charAt(wordEnd))) {
                    wordEnd++;
                }
                if (wordEnd - i > 2 && regionMatches(content, i, MarkupPattern.EVENT_HANDLER.literal())) {
                    int j = wordEnd;
                    while (j < length && Character.isWhitespace(content.charAt(j))) {
                        j++;
                    }
                    if (j < length && content.charAt(j) == '=') {
                        matches.add(new MarkupMatch(MarkupPattern.EVENT_HANDLER, i, j + 1));
                    }
                }
                // words may still contain a scheme, e.g. "xjavascript:"
                i = containsScheme(content, i, wordEnd) ? i + 1 : wordEnd;
                continue;
            }
            i++;
        }

        matches.sort(Comparator.comparingInt((MarkupMatch m) -> m.pattern().ordinal())
                .thenComparingInt(MarkupMatch::start));
        return matches;
    }

    /**
     * Count characters that are neither alphanumeric, whitespace nor ChordPro syntax.
     */
    public static int countSpecialCharacters(String content) {
        if (content == null) {
            return 0;
        }
        int count = 0;
        for (int i = 0; i < content.length(); i++) {
            if (ChordProPatterns.isSpecialCharacter(content.charAt(i))) {
                count++;
            }
        }
        return count;
    }

    private static MarkupPattern matchTag(String content, int nameStart) {
        for (MarkupPattern tag : TAGS) {
            String name = tag.literal();
            int nameEnd = nameStart + name.length();
            if (regionMatches(content, nameStart, name)
                    && (nameEnd >= content.length() || !Character.isLetterOrDigit(content.charAt(nameEnd)))) {
                return tag;
            }
        }
        return null;
    }

    private static boolean containsScheme(String content, int from, int to) {
        String scheme = MarkupPattern.JAVASCRIPT_PROTOCOL.literal();
        for (int k = from + 1; k < to; k++) {
            char c = content.charAt(k);
            if ((c == 'j' || c == 'J') && regionMatches(content, k, scheme)) {
                return true;
            }
        }
        return false;
    }

    private static boolean regionMatches(String content, int offset, String literal) {
        return content.regionMatches(true, offset, literal, 0, literal.length());
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    /**
     * A dangerous markup occurrence.
     *
     * @param pattern what was found
     * @param start   offset of the first character
     * @param end     offset after the last character
     */
    public record MarkupMatch(MarkupPattern pattern, int start, int end) {
    }
}
