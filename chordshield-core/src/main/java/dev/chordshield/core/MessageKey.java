package dev.chordshield.core;

import java.text.MessageFormat;
import java.util.List;
import java.util.Locale;

/**
 * Sub-case of a built-in finding.
 * <p>
 * Each key owns a bundle key used by the message catalog and the English
 * {@link MessageFormat} pattern the core validator renders. Arguments are always passed
 * pre-formatted as strings so that counts are not grouped by locale.
 */
public enum MessageKey {

    INVALID_CHORD("error.chord.invalid", "Invalid chord notation: \"{0}\""),
    UNKNOWN_DIRECTIVE("error.directive.unknown", "Unknown directive: \"{0}\""),
    DIRECTIVE_TYPO("error.directive.typo", "Possible typo in directive: \"{0}\""),
    CHORD_BRACKET_MISMATCH("error.bracket.chord", "Mismatched chord brackets: {0} opening, {1} closing"),
    DIRECTIVE_BRACKET_MISMATCH("error.bracket.directive", "Mismatched directive brackets: {0} opening, {1} closing"),
    EMPTY_CHORD("error.format.emptyChord", "Found empty chord notation []"),
    EMPTY_DIRECTIVE("error.format.emptyDirective", "Found empty directive '{}'"),
    SCRIPT_TAG("error.security.script", "Script tags are not allowed"),
    JAVASCRIPT_PROTOCOL("error.security.javascript", "JavaScript protocol is not allowed"),
    EVENT_HANDLER("error.security.eventHandler", "Event handlers are not allowed"),
    IFRAME_TAG("error.security.iframe", "Iframe tags are not allowed"),
    OBJECT_TAG("error.security.object", "Object tags are not allowed"),
    EMBED_TAG("error.security.embed", "Embed tags are not allowed"),
    LINK_TAG("error.security.link", "Link tags are not allowed"),
    META_TAG("error.security.meta", "Meta tags are not allowed"),
    SPECIAL_CHARACTERS("error.security.specialChars",
            "High concentration of special characters detected: {0} of {1} characters"),
    RULE_FAILED("error.custom.ruleFailed", "Custom rule \"{0}\" could not be applied and was skipped"),

    CHORD_SUGGESTION("suggestion.chord", "Try \"{0}\""),
    DIRECTIVE_SUGGESTION("suggestion.didYouMean", "Did you mean \"{0}\"?");

    private final String bundleKey;
    private final String defaultPattern;

    MessageKey(String bundleKey, String defaultPattern) {
        this.bundleKey = bundleKey;
        this.defaultPattern = defaultPattern;
    }

    public String bundleKey() {
        return bundleKey;
    }

    public String defaultPattern() {
        return defaultPattern;
    }

    /**
     * Render the English message.
     */
    public String format(List<String> args) {
        return new MessageFormat(defaultPattern, Locale.ROOT).format(args.toArray());
    }

    public String format(String... args) {
        return format(List.of(args));
    }
}
