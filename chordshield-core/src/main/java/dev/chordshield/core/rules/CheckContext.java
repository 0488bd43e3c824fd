package dev.chordshield.core.rules;

import dev.chordshield.core.Position;
import dev.chordshield.core.ValidationConfig;
import dev.chordshield.core.ValidationContext;
import dev.chordshield.core.scan.LineIndex;
import dev.chordshield.core.scan.TokenScanner;

/**
 * Everything a check reads during one validation call. Built once per call and never shared.
 *
 * @param content   original text
 * @param lines     line index of {@code content}
 * @param scan      tokens and delimiter counts of {@code content}
 * @param config    configuration snapshot for this call
 * @param language  language hooks for this call
 */
public record CheckContext(
        String content,
        LineIndex lines,
        TokenScanner.ScanResult scan,
        ValidationConfig config,
        ValidationContext language
) {

    public static CheckContext of(String content, ValidationConfig config, ValidationContext language) {
        String text = content == null ? "" : content;
        return new CheckContext(text, LineIndex.of(text), TokenScanner.scan(text), config, language);
    }

    public Position position(int start, int end) {
        return lines.position(start, end);
    }

    /**
     * Span covering the whole document.
     */
    public Position wholeDocument() {
        return lines.position(0, content.length());
    }
}
