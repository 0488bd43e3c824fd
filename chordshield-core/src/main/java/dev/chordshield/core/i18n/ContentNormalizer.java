package dev.chordshield.core.i18n;

import dev.chordshield.core.pattern.ChordProPatterns;
import dev.chordshield.core.scan.Token;
import dev.chordshield.core.scan.TokenKind;
import dev.chordshield.core.scan.TokenScanner;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Rewrites local chord and directive notation into standard ChordPro.
 * <p>
 * Only the inside of tokens changes. In a chord token that the standard matcher rejects,
 * a local root at the start and a local bass note after {@code /} are replaced, longest
 * key first. A directive whose name equals a local alias has its name replaced. Every
 * replacement is recorded in an {@link OffsetMap}.
 */
public class ContentNormalizer {

    private final List<Map.Entry<String, String>> roots;
    private final Map<String, String> aliases;

    public ContentNormalizer(LanguageRules rules) {
        List<Map.Entry<String, String>> sorted = new ArrayList<>(rules.chordNotations().entrySet());
        sorted.sort(Comparator.comparingInt((Map.Entry<String, String> e) -> e.getKey().length()).reversed());
        this.roots = List.copyOf(sorted);

        Map<String, String> lowered = new HashMap<>();
        rules.directiveAliases().forEach((local, standard) -> lowered.put(local.toLowerCase(Locale.ROOT), standard));
        this.aliases = Map.copyOf(lowered);
    }

    /**
     * Rewrite the content.
     *
     * @param content original text
     * @return the rewritten text and its offset map; unchanged content has an identity map
     */
    public NormalizedContent normalize(String content) {
        if (content == null || content.isEmpty() || (roots.isEmpty() && aliases.isEmpty())) {
            return NormalizedContent.unchanged(content == null ? "" : content);
        }

        List<Replacement> replacements = new ArrayList<>();
        for (Token token : TokenScanner.scan(content).tokens()) {
            if (token.isBlank()) {
                continue;
            }
            if (token.kind() == TokenKind.CHORD) {
                chordReplacements(token, replacements);
            } else {
                directiveReplacement(token).ifPresent(replacements::add);
            }
        }
        if (replacements.isEmpty()) {
            return NormalizedContent.unchanged(content);
        }

        replacements.sort(Comparator.comparingInt(Replacement::start));
        StringBuilder out = new StringBuilder(content.length() + 16);
        OffsetMap.Builder offsets = OffsetMap.builder();
        int copied = 0;
        for (Replacement r : replacements) {
            if (r.start() < copied) {
                continue;
            }
            out.append(content, copied, r.start()).append(r.text());
            offsets.rewrite(r.start(), r.end(), r.text().length());
            copied = r.end();
        }
        out.append(content, copied, content.length());
        return new NormalizedContent(content, out.toString(), offsets.build());
    }

    /**
     * Standard equivalent of a local chord, if its root or bass note is local notation.
     */
    public Optional<String> translateChord(String chord) {
        if (chord == null || chord.isBlank() || roots.isEmpty()) {
            return Optional.empty();
        }
        String text = chord.trim();
        List<Replacement> replacements = new ArrayList<>();
        collectChordReplacements(text, 0, replacements);
        if (replacements.isEmpty()) {
            return Optional.empty();
        }
        StringBuilder out = new StringBuilder(text.length());
        int copied = 0;
        for (Replacement r : replacements) {
            out.append(text, copied, r.start()).append(r.text());
            copied = r.end();
        }
        out.append(text, copied, text.length());
        return Optional.of(out.toString());
    }

    private void chordReplacements(Token token, List<Replacement> replacements) {
        String chord = token.trimmed();
        if (roots.isEmpty() || ChordProPatterns.isValidChord(chord)) {
            return;
        }
        collectChordReplacements(chord, token.trimmedStart(), replacements);
    }

    private void collectChordReplacements(String chord, int base, List<Replacement> replacements) {
        Optional<Map.Entry<String, String>> root = matchRoot(chord, 0);
        int rootEnd = root.map(r -> r.getKey().length()).orElse(0);
        root.ifPresent(r -> replacements.add(new Replacement(base, base + rootEnd, r.getValue())));

        int slash = chord.lastIndexOf('/');
        if (slash >= rootEnd && slash > 0 && slash < chord.length() - 1) {
            matchRoot(chord, slash + 1).ifPresent(bass ->
                    replacements.add(new Replacement(base + slash + 1,
                            base + slash + 1 + bass.getKey().length(), bass.getValue())));
        }
    }

    private Optional<Map.Entry<String, String>> matchRoot(String chord, int from) {
        for (Map.Entry<String, String> root : roots) {
            if (chord.startsWith(root.getKey(), from)) {
                return Optional.of(root);
            }
        }
        return Optional.empty();
    }

    private Optional<Replacement> directiveReplacement(Token token) {
        if (aliases.isEmpty()) {
            return Optional.empty();
        }
        String standard = aliases.get(token.normalizedName());
        if (standard == null) {
            return Optional.empty();
        }
        int start = token.trimmedStart();
        return Optional.of(new Replacement(start, start + token.name().length(), standard));
    }

    private record Replacement(int start, int end, String text) {
    }

    /**
     * Original text, rewritten text and the mapping between them.
     */
    public record NormalizedContent(String original, String processed, OffsetMap offsets) {

        static NormalizedContent unchanged(String content) {
            return new NormalizedContent(content, content, OffsetMap.identity());
        }

        public boolean changed() {
            return !offsets.isIdentity();
        }
    }
}
