package dev.chordshield.core.i18n;

import dev.chordshield.core.MessageKey;
import dev.chordshield.core.ValidationError;
import dev.chordshield.core.ValidationErrorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.MessageFormat;
import java.util.List;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.Optional;
import java.util.ResourceBundle;

/**
 * Translates finding messages and suggestions through resource bundles.
 * <p>
 * Bundles live under {@code chordshield/i18n/messages}. A language without a bundle gets the
 * English base bundle, never the JVM default locale. Any lookup or formatting failure keeps the
 * untranslated text.
 */
public class MessageCatalog {

    private static final Logger logger = LoggerFactory.getLogger(MessageCatalog.class);

    public static final String DEFAULT_BASE_NAME = "chordshield.i18n.messages";

    private static final ResourceBundle.Control NO_FALLBACK =
            ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES);

    private final String baseName;

    public MessageCatalog() {
        this(DEFAULT_BASE_NAME);
    }

    public MessageCatalog(String baseName) {
        this.baseName = baseName;
    }

    /**
     * Translate a finding's message and suggestion.
     *
     * @param finding  the finding to translate
     * @param language language code such as {@code es}
     * @return the finding with translated text; custom-rule findings are returned unchanged
     */
    public ValidationError translate(ValidationError finding, String language) {
        MessageKey key = finding.messageKey();
        if (key == null) {
            return finding;
        }
        Locale locale = Locale.forLanguageTag(language);
        String message = format(key, locale, finding.messageArgs()).orElse(finding.message());
        String suggestion = finding.suggestion();
        if (finding.hasSuggestion()) {
            MessageKey suggestionKey = finding.type() == ValidationErrorType.DIRECTIVE
                    ? MessageKey.DIRECTIVE_SUGGESTION
                    : MessageKey.CHORD_SUGGESTION;
            suggestion = format(suggestionKey, locale, List.of(finding.suggestion())).orElse(suggestion);
        }
        return finding.withText(message, suggestion);
    }

    /**
     * Render one message in the given language.
     *
     * @return the rendered text, or empty if the bundle or key is missing or the pattern is broken
     */
    public Optional<String> format(MessageKey key, Locale locale, List<String> args) {
        try {
            ResourceBundle bundle = ResourceBundle.getBundle(baseName, locale, MessageCatalog.class.getClassLoader(),
                    NO_FALLBACK);
            String pattern = bundle.getString(key.bundleKey());
            return Optional.of(new MessageFormat(pattern, locale).format(args.toArray()));
        } catch (MissingResourceException | IllegalArgumentException e) {
            logger.warn("Could not translate message '{}' for locale '{}': {}", key.bundleKey(), locale,
                    e.getMessage());
            return Optional.empty();
        }
    }
}
