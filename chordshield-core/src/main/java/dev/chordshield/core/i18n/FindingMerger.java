package dev.chordshield.core.i18n;

import dev.chordshield.core.Position;
import dev.chordshield.core.ValidationError;
import dev.chordshield.core.ValidationErrorType;
import dev.chordshield.core.i18n.ContentNormalizer.NormalizedContent;
import dev.chordshield.core.scan.LineIndex;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Combines the findings of the original and the rewritten validation pass.
 * <p>
 * Findings of the rewritten pass are moved back onto the original text first. Two findings
 * are equivalent when they have the same type, start within {@value #START_TOLERANCE}
 * characters of each other and cover the same original text.
 * <p>
 * Only chord and directive findings of the built-in checks can be resolved by the rewrite.
 * Such a finding is dropped when it touches a rewritten region and the rewritten pass has
 * no equivalent. Every other finding on the original text is always kept.
 */
public class FindingMerger {

    static final int START_TOLERANCE = 10;

    /**
     * Merge both passes.
     *
     * @param content           original and rewritten text
     * @param originalFindings  findings on the original text
     * @param processedFindings findings on the rewritten text
     * @return surviving original findings followed by new findings from the rewritten pass
     */
    public List<ValidationError> merge(NormalizedContent content,
                                       List<ValidationError> originalFindings,
                                       List<ValidationError> processedFindings) {
        String original = content.original();
        OffsetMap offsets = content.offsets();
        LineIndex lines = LineIndex.of(original);

        List<ValidationError> remapped = new ArrayList<>(processedFindings.size());
        for (ValidationError finding : processedFindings) {
            remapped.add(remap(finding, offsets, lines));
        }

        List<ValidationError> merged = new ArrayList<>();
        for (ValidationError finding : originalFindings) {
            if (!resolvedByRewrite(finding, offsets) || hasEquivalent(remapped, finding, original)) {
                merged.add(finding);
            }
        }
        for (ValidationError finding : remapped) {
            if (!hasEquivalent(originalFindings, finding, original)) {
                merged.add(finding);
            }
        }
        return removeDuplicates(merged);
    }

    static boolean resolvedByRewrite(ValidationError finding, OffsetMap offsets) {
        if (finding.messageKey() == null) {
            return false;
        }
        if (finding.type() != ValidationErrorType.CHORD && finding.type() != ValidationErrorType.DIRECTIVE) {
            return false;
        }
        Position p = finding.position();
        return offsets.overlapsRewrite(p.start(), Math.max(p.end(), p.start() + 1));
    }

    static ValidationError remap(ValidationError finding, OffsetMap offsets, LineIndex lines) {
        if (offsets.isIdentity()) {
            return finding;
        }
        Position p = finding.position();
        int start = offsets.toOriginalStart(p.start());
        int end = Math.max(start, offsets.toOriginalEnd(p.end()));
        return finding.withPosition(lines.position(start, end));
    }

    static boolean isEquivalent(ValidationError a, ValidationError b, String original) {
        if (a.type() != b.type()) {
            return false;
        }
        if (Math.abs(a.position().start() - b.position().start()) >= START_TOLERANCE) {
            return false;
        }
        return slice(original, a.position()).equals(slice(original, b.position()));
    }

    private static boolean hasEquivalent(List<ValidationError> candidates, ValidationError finding, String original) {
        for (ValidationError candidate : candidates) {
            if (isEquivalent(candidate, finding, original)) {
                return true;
            }
        }
        return false;
    }

    private static String slice(String text, Position position) {
        int start = Math.min(position.start(), text.length());
        int end = Math.min(Math.max(position.end(), start), text.length());
        return text.substring(start, end);
    }

    private static List<ValidationError> removeDuplicates(List<ValidationError> findings) {
        Set<DuplicateKey> seen = new HashSet<>();
        List<ValidationError> unique = new ArrayList<>(findings.size());
        for (ValidationError finding : findings) {
            if (seen.add(DuplicateKey.of(finding))) {
                unique.add(finding);
            }
        }
        return unique;
    }

    private record DuplicateKey(ValidationErrorType type, int start, int end, String message) {

        static DuplicateKey of(ValidationError finding) {
            return new DuplicateKey(finding.type(), finding.position().start(), finding.position().end(),
                    finding.message());
        }
    }
}
