package dev.chordshield.core.pattern;

import dev.chordshield.core.MessageKey;

/**
 * Security-sensitive markup the scanner looks for.
 */
public enum MarkupPattern {

    SCRIPT_TAG("script", MessageKey.SCRIPT_TAG),
    IFRAME_TAG("iframe", MessageKey.IFRAME_TAG),
    OBJECT_TAG("object", MessageKey.OBJECT_TAG),
    EMBED_TAG("embed", MessageKey.EMBED_TAG),
    LINK_TAG("link", MessageKey.LINK_TAG),
    META_TAG("meta", MessageKey.META_TAG),

    /**
     * {@code javascript:} URL scheme.
     */
    JAVASCRIPT_PROTOCOL("javascript:", MessageKey.JAVASCRIPT_PROTOCOL),

    /**
     * Inline handler attribute such as {@code onclick=}.
     */
    EVENT_HANDLER("on", MessageKey.EVENT_HANDLER);

    private final String literal;
    private final MessageKey messageKey;

    MarkupPattern(String literal, MessageKey messageKey) {
        this.literal = literal;
        this.messageKey = messageKey;
    }

    /**
     * Tag name, scheme or attribute prefix, lower case.
     */
    public String literal() {
        return literal;
    }

    public MessageKey messageKey() {
        return messageKey;
    }

    public boolean isTag() {
        return this != JAVASCRIPT_PROTOCOL && this != EVENT_HANDLER;
    }
}
