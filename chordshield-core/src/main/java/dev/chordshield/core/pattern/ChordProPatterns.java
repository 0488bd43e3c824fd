package dev.chordshield.core.pattern;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Grammar and vocabulary of ChordPro tokens.
 * <p>
 * Chord grammar:
 * <ul>
 *   <li>root {@code A-G} with optional {@code #} or {@code b}</li>
 *   <li>optional quality: {@code m}, {@code min}, {@code dim}, {@code aug}, {@code °}, {@code ø}, {@code +},
 *       optionally followed by {@code maj} or {@code M}</li>
 *   <li>optional extension: {@code 2, 4, 5, 6, 7, 9, 11, 13}</li>
 *   <li>any number of {@code sus}, {@code sus2}, {@code sus4}, {@code addN} and altered tones
 *       ({@code b5}, {@code #9}, ...)</li>
 *   <li>optional slash bass note ({@code C/E})</li>
 * </ul>
 */
public final class ChordProPatterns {

    /**
     * Chord tokens longer than this are rejected without running the grammar.
     */
    public static final int MAX_CHORD_LENGTH = 32;

    // Alternatives in the repeated group start with distinct characters, so matching is linear.
    private static final Pattern CHORD_PATTERN = Pattern.compile(
            "[A-G][#b]?"
                    + "(?:min|m|dim|aug|°|ø|\\+)?"
                    + "(?:maj|M)?"
                    + "(?:2|4|5|6|7|9|11|13)?"
                    + "(?:sus[24]?|add(?:2|4|9|11|13)|[#b](?:5|9|11|13))*"
                    + "(?:/[A-G][#b]?)?");

    /**
     * Directive names understood by ChordPro renderers.
     */
    public static final Set<String> KNOWN_DIRECTIVES = Set.of(
            // metadata
            "title", "t", "subtitle", "st", "artist", "composer", "lyricist", "arranger", "album",
            "year", "key", "capo", "tempo", "time", "duration", "copyright", "meta", "sorttitle",
            // comments
            "comment", "c", "comment_italic", "ci", "comment_box", "cb", "highlight",
            // sections
            "start_of_verse", "end_of_verse", "sov", "eov", "verse",
            "start_of_chorus", "end_of_chorus", "soc", "eoc", "chorus",
            "start_of_bridge", "end_of_bridge", "sob", "eob", "bridge",
            "start_of_tab", "end_of_tab", "sot", "eot",
            "start_of_grid", "end_of_grid", "sog", "eog",
            // chord definitions and layout
            "define", "chord", "new_page", "np", "column_break", "colb", "columns", "col",
            "textfont", "textsize", "chordfont", "chordsize");

    /**
     * Directive misspellings seen often enough to correct without an edit-distance search.
     */
    public static final Map<String, String> DIRECTIVE_TYPOS = Map.of(
            "titel", "title",
            "artis", "artist",
            "tite", "title",
            "albun", "album",
            "yesr", "year");

    /**
     * Chord spellings with a well-known standard form.
     */
    public static final Map<String, String> CHORD_ALIASES = Map.ofEntries(
            Map.entry("c", "C"),
            Map.entry("d", "D"),
            Map.entry("e", "E"),
            Map.entry("f", "F"),
            Map.entry("g", "G"),
            Map.entry("a", "A"),
            Map.entry("b", "B"),
            // German notation
            Map.entry("H", "B"),
            Map.entry("CB", "C/B"),
            Map.entry("DC", "D/C"));

    // Characters that belong to ChordPro syntax or ordinary lyric punctuation.
    private static final String SAFE_PUNCTUATION = "[]{}:#/|()+-.,;!?'_*~°ø";

    private ChordProPatterns() {
    }

    /**
     * Whether a token (without brackets) is a recognizable chord.
     */
    public static boolean isValidChord(String chord) {
        if (chord == null) {
            return false;
        }
        String trimmed = chord.trim();
        if (trimmed.isEmpty() || trimmed.length() > MAX_CHORD_LENGTH) {
            return false;
        }
        return CHORD_PATTERN.matcher(trimmed).matches();
    }

    /**
     * Whether a token is a complete brace-delimited directive.
     */
    public static boolean isValidDirective(String directive) {
        if (directive == null) {
            return false;
        }
        String trimmed = directive.trim();
        if (trimmed.length() < 3 || trimmed.charAt(0) != '{' || trimmed.charAt(trimmed.length() - 1) != '}') {
            return false;
        }
        String interior = trimmed.substring(1, trimmed.length() - 1);
        return !interior.isBlank() && interior.indexOf('}') < 0;
    }

    public static boolean isKnownDirective(String name) {
        return name != null && KNOWN_DIRECTIVES.contains(name.toLowerCase(Locale.ROOT));
    }

    /**
     * Built-in chord correction: alias table first, then upper-casing the root.
     */
    public static Optional<String> suggestChordCorrection(String chord) {
        if (chord == null || chord.isEmpty()) {
            return Optional.empty();
        }
        String alias = CHORD_ALIASES.get(chord);
        if (alias != null) {
            return Optional.of(alias);
        }
        char first = chord.charAt(0);
        if (first >= 'a' && first <= 'g') {
            String candidate = Character.toUpperCase(first) + chord.substring(1);
            if (isValidChord(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Suggest a known directive for a misspelled name.
     *
     * @param name  lower-cased directive name
     * @param typos extra misspellings to consult before the built-in table
     */
    public static Optional<String> suggestDirective(String name, Map<String, String> typos) {
        if (name == null || name.isEmpty() || KNOWN_DIRECTIVES.contains(name)) {
            return Optional.empty();
        }
        String fixed = typos.get(name);
        if (fixed == null) {
            fixed = DIRECTIVE_TYPOS.get(name);
        }
        if (fixed != null) {
            return Optional.of(fixed);
        }
        int threshold = name.length() <= 4 ? 1 : 2;
        String best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (String known : KNOWN_DIRECTIVES) {
            // single-letter abbreviations would match almost anything
            if (known.length() < 3) {
                continue;
            }
            int distance = EditDistance.bounded(name, known, threshold);
            if (distance >= 0 && (distance < bestDistance
                    || (distance == bestDistance && known.compareTo(best) < 0))) {
                best = known;
                bestDistance = distance;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Characters counted towards the special-character density check.
     */
    public static boolean isSpecialCharacter(char c) {
        return !Character.isLetterOrDigit(c)
                && !Character.isWhitespace(c)
                && SAFE_PUNCTUATION.indexOf(c) < 0;
    }
}
