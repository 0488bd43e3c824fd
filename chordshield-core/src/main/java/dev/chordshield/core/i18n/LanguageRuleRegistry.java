package dev.chordshield.core.i18n;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import dev.chordshield.core.exception.LanguageRulesException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Language rule tables by language code.
 * <p>
 * The built-in tables are read from {@code chordshield/languages/<code>.json} and checked
 * against the language rules schema. Tables can be replaced or extended at runtime; every
 * update stores a new immutable {@link LanguageRules}.
 */
public class LanguageRuleRegistry {

    private static final Logger logger = LoggerFactory.getLogger(LanguageRuleRegistry.class);

    public static final String DEFAULT_LANGUAGE = "en";
    public static final List<String> BUILT_IN_LANGUAGES = List.of("es", "fr", "de", "pt", "it");

    static final String LANGUAGE_RESOURCE = "chordshield/languages/%s.json";
    static final String SCHEMA_RESOURCE = "chordshield/schema/language-rules.schema.json";

    private final Map<String, LanguageRules> rules = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;
    private final JsonSchema schema;

    /**
     * Create a registry holding the built-in tables.
     */
    public LanguageRuleRegistry() {
        this(new ObjectMapper(), true);
    }

    /**
     * Create a registry.
     *
     * @param objectMapper    mapper used to read tables
     * @param loadBuiltIns    whether to load the bundled tables
     */
    public LanguageRuleRegistry(ObjectMapper objectMapper, boolean loadBuiltIns) {
        this.objectMapper = objectMapper;
        this.schema = loadSchema(objectMapper);
        if (loadBuiltIns) {
            for (String language : BUILT_IN_LANGUAGES) {
                rules.put(language, loadResource(String.format(LANGUAGE_RESOURCE, language)));
            }
            logger.info("Loaded built-in language rules: {}", BUILT_IN_LANGUAGES);
        }
    }

    /**
     * Reduce a language tag to its lower-case primary subtag ({@code es-MX} becomes {@code es}).
     */
    public static String normalize(String language) {
        if (language == null || language.isBlank()) {
            return DEFAULT_LANGUAGE;
        }
        String code = language.trim().toLowerCase(Locale.ROOT);
        int cut = code.indexOf('-');
        if (cut < 0) {
            cut = code.indexOf('_');
        }
        return cut > 0 ? code.substring(0, cut) : code;
    }

    /**
     * Rules for a language, empty when none are registered.
     */
    public LanguageRules get(String language) {
        return rules.getOrDefault(normalize(language), LanguageRules.empty());
    }

    public boolean contains(String language) {
        return rules.containsKey(normalize(language));
    }

    public Set<String> languages() {
        return rules.keySet().stream().collect(Collectors.toCollection(TreeSet::new));
    }

    /**
     * Replace the table of a language.
     */
    public void register(String language, LanguageRules languageRules) {
        rules.put(normalize(language), languageRules == null ? LanguageRules.empty() : languageRules);
    }

    /**
     * Merge entries into the table of a language.
     *
     * @return the resulting table
     */
    public LanguageRules extend(String language, LanguageRules additions) {
        return rules.merge(normalize(language), additions == null ? LanguageRules.empty() : additions,
                LanguageRules::merge);
    }

    /**
     * Read and check a table from JSON.
     *
     * @throws LanguageRulesException if the JSON is malformed or does not match the schema
     */
    public LanguageRules parse(String json) {
        try {
            return toRules(objectMapper.readTree(json), "inline table");
        } catch (IOException e) {
            throw new LanguageRulesException("Language rules are not valid JSON", e);
        }
    }

    LanguageRules loadResource(String path) {
        try (InputStream input = LanguageRuleRegistry.class.getClassLoader().getResourceAsStream(path)) {
            if (input == null) {
                throw new LanguageRulesException("Language rules resource not found: " + path);
            }
            return toRules(objectMapper.readTree(input), path);
        } catch (IOException e) {
            throw new LanguageRulesException("Language rules resource could not be read: " + path, e);
        }
    }

    private LanguageRules toRules(JsonNode node, String source) {
        Set<ValidationMessage> errors = schema.validate(node);
        if (!errors.isEmpty()) {
            String detail = errors.stream().map(ValidationMessage::getMessage).collect(Collectors.joining("; "));
            throw new LanguageRulesException("Invalid language rules in " + source + ": " + detail);
        }
        return objectMapper.convertValue(node, LanguageRules.class);
    }

    private static JsonSchema loadSchema(ObjectMapper mapper) {
        try (InputStream input = LanguageRuleRegistry.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (input == null) {
                throw new LanguageRulesException("Language rules schema not found: " + SCHEMA_RESOURCE);
            }
            JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
            return factory.getSchema(mapper.readTree(input));
        } catch (IOException e) {
            throw new LanguageRulesException("Language rules schema could not be read", e);
        }
    }
}
