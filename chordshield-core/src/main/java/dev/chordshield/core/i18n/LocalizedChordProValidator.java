package dev.chordshield.core.i18n;

import dev.chordshield.core.ChordProValidator;
import dev.chordshield.core.ValidationConfig;
import dev.chordshield.core.ValidationContext;
import dev.chordshield.core.ValidationError;
import dev.chordshield.core.ValidationResult;
import dev.chordshield.core.i18n.ContentNormalizer.NormalizedContent;
import dev.chordshield.core.pattern.ChordProPatterns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Validator that understands local chord and directive notation and reports findings in the
 * active language.
 * <p>
 * Content is validated as written and, when the language has notation tables, once more after
 * rewriting local notation into standard ChordPro. Findings of the second pass are mapped back
 * onto the original text and merged with the first. Every finding is then translated.
 * <p>
 * The core validator, rule registry and message catalog may be shared between instances; the
 * active language and its rule overrides belong to this instance.
 */
public class LocalizedChordProValidator {

    private static final Logger logger = LoggerFactory.getLogger(LocalizedChordProValidator.class);

    private final ChordProValidator validator;
    private final LanguageRuleRegistry registry;
    private final MessageCatalog catalog;
    private final FindingMerger merger = new FindingMerger();
    private final Map<String, LanguageRules> overrides = new ConcurrentHashMap<>();

    private volatile ActiveLanguage active;

    public LocalizedChordProValidator() {
        this(LanguageRuleRegistry.DEFAULT_LANGUAGE);
    }

    public LocalizedChordProValidator(String language) {
        this(new ChordProValidator(), language);
    }

    public LocalizedChordProValidator(ChordProValidator validator, String language) {
        this(validator, new LanguageRuleRegistry(), new MessageCatalog(), language);
    }

    /**
     * Create an adapter over shared collaborators.
     *
     * @param validator core validator, its configuration is used for every call
     * @param registry  language rule tables
     * @param catalog   message translations
     * @param language  initial language code, {@code en} when blank
     */
    public LocalizedChordProValidator(ChordProValidator validator, LanguageRuleRegistry registry,
                                      MessageCatalog catalog, String language) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.active = activate(LanguageRuleRegistry.normalize(language));
    }

    /**
     * Validate content in the active language.
     *
     * @param content the text to validate, {@code null} is treated as empty
     * @return findings positioned in {@code content} with translated messages
     */
    public ValidationResult validateContent(String content) {
        ActiveLanguage snapshot = active;
        ValidationConfig config = validator.getConfig();
        String text = content == null ? "" : content;

        ValidationResult originalResult = validator.validateContent(text, config, snapshot.context());
        List<ValidationError> findings = originalResult.allFindings();

        if (snapshot.rules().hasPreprocessingRules()) {
            findings = mergeWithNormalized(text, config, snapshot, findings);
        }

        List<ValidationError> translated = new ArrayList<>(findings.size());
        for (ValidationError finding : findings) {
            translated.add(catalog.translate(finding, snapshot.language()));
        }
        return ValidationResult.fromFindings(translated);
    }

    private List<ValidationError> mergeWithNormalized(String text, ValidationConfig config,
                                                      ActiveLanguage snapshot, List<ValidationError> findings) {
        try {
            NormalizedContent normalized = snapshot.normalizer().normalize(text);
            if (!normalized.changed()) {
                return findings;
            }
            ValidationResult processedResult =
                    validator.validateContent(normalized.processed(), config, snapshot.context());
            logger.debug("Rewrote {} local notation(s) for language '{}'",
                    normalized.offsets().rewrites().size(), snapshot.language());
            return merger.merge(normalized, findings, processedResult.allFindings());
        } catch (RuntimeException e) {
            logger.warn("Local notation pass for language '{}' failed, keeping original findings: {}",
                    snapshot.language(), e.getMessage());
            return findings;
        }
    }

    /**
     * Switch the active language. Unknown languages validate with standard notation only.
     */
    public synchronized void setLanguage(String language) {
        this.active = activate(LanguageRuleRegistry.normalize(language));
        logger.debug("Validation language set to '{}'", active.language());
    }

    public String getLanguage() {
        return active.language();
    }

    /**
     * Merge notation entries into the active language's table on this validator only.
     * <p>
     * Entries for a language that is not active are ignored. Merged entries stay with the
     * language when switching away and back.
     */
    public synchronized void addLanguageRules(String language, LanguageRules rules) {
        if (rules == null || rules.isEmpty()) {
            return;
        }
        String code = LanguageRuleRegistry.normalize(language);
        if (!active.language().equals(code)) {
            logger.debug("Ignoring rules for inactive language '{}', active is '{}'", code, active.language());
            return;
        }
        overrides.merge(code, rules, LanguageRules::merge);
        active = activate(code);
    }

    /**
     * Standard form of a chord token: notation table, typo table, rewritten root, then the
     * built-in heuristics.
     */
    public Optional<String> getChordCorrection(String chord) {
        return active.correct(chord).or(() -> ChordProPatterns.suggestChordCorrection(chord));
    }

    /**
     * New validator for another language sharing this one's core, registry and catalog.
     * Rule overrides are copied.
     */
    public LocalizedChordProValidator withLanguage(String language) {
        LocalizedChordProValidator copy = new LocalizedChordProValidator(validator, registry, catalog, language);
        synchronized (copy) {
            copy.overrides.putAll(overrides);
            copy.active = copy.activate(copy.active.language());
        }
        return copy;
    }

    public ChordProValidator getValidator() {
        return validator;
    }

    public LanguageRules getLanguageRules() {
        return active.rules();
    }

    private ActiveLanguage activate(String language) {
        return ActiveLanguage.of(language, registry.get(language).merge(overrides.get(language)));
    }

    /**
     * Everything one call needs about the active language.
     */
    private record ActiveLanguage(String language, LanguageRules rules, ContentNormalizer normalizer,
                                  ValidationContext context) {

        static ActiveLanguage of(String language, LanguageRules rules) {
            ContentNormalizer normalizer = new ContentNormalizer(rules);
            Map<String, String> typos = new HashMap<>();
            rules.typoCorrections().forEach((typo, fix) -> typos.put(typo.toLowerCase(Locale.ROOT), fix));
            ValidationContext context = new ValidationContext(chord -> correct(rules, normalizer, chord), typos);
            return new ActiveLanguage(language, rules, normalizer, context);
        }

        Optional<String> correct(String chord) {
            return correct(rules, normalizer, chord);
        }

        private static Optional<String> correct(LanguageRules rules, ContentNormalizer normalizer, String chord) {
            if (chord == null || chord.isBlank()) {
                return Optional.empty();
            }
            String token = chord.trim();
            String mapped = rules.chordNotations().get(token);
            if (mapped == null) {
                mapped = rules.typoCorrections().get(token);
            }
            if (mapped != null) {
                return Optional.of(mapped);
            }
            return normalizer.translateChord(token).filter(ChordProPatterns::isValidChord);
        }
    }
}
