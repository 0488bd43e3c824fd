package dev.chordshield.core.rules;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import dev.chordshield.core.ValidationRule;
import dev.chordshield.core.exception.RuleDefinitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.PatternSyntaxException;

/**
 * Loads custom rules from JSON.
 * <p>
 * Accepts either a bare array of rules or an object with a {@code rules} array. The document
 * is checked against the bundled schema, then every rule id must be unique and every pattern
 * must compile.
 */
public class CustomRuleLoader {

    private static final Logger logger = LoggerFactory.getLogger(CustomRuleLoader.class);

    static final String SCHEMA_RESOURCE = "chordshield/schema/validation-rules.schema.json";

    private final ObjectMapper objectMapper;
    private final JsonSchema schema;

    public CustomRuleLoader() {
        this(new ObjectMapper());
    }

    public CustomRuleLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.schema = loadSchema(objectMapper);
    }

    /**
     * Parse rules from a JSON string.
     *
     * @throws RuleDefinitionException if the document or any rule is invalid
     */
    public List<ValidationRule> load(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RuleDefinitionException("Custom rules are not valid JSON", e);
        }
        return load(root);
    }

    /**
     * Parse rules from a stream. The stream is not closed.
     */
    public List<ValidationRule> load(InputStream input) {
        JsonNode root;
        try {
            root = objectMapper.readTree(input);
        } catch (IOException e) {
            throw new RuleDefinitionException("Custom rules could not be read", e);
        }
        return load(root);
    }

    /**
     * Parse rules from a classpath resource.
     */
    public List<ValidationRule> loadResource(String location) {
        String path = location.startsWith("classpath:") ? location.substring("classpath:".length()) : location;
        if (path.startsWith("/")) {
            path = path.substring(1);
        }
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = CustomRuleLoader.class.getClassLoader();
        }
        try (InputStream input = classLoader.getResourceAsStream(path)) {
            if (input == null) {
                throw new RuleDefinitionException("Custom rules resource not found: " + location);
            }
            List<ValidationRule> rules = load(input);
            logger.info("Loaded {} custom rule(s) from {}", rules.size(), location);
            return rules;
        } catch (IOException e) {
            throw new RuleDefinitionException("Custom rules resource could not be closed: " + location, e);
        }
    }

    public List<ValidationRule> load(JsonNode root) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new RuleDefinitionException("Custom rules document is empty");
        }

        Set<ValidationMessage> schemaErrors = schema.validate(root);
        if (!schemaErrors.isEmpty()) {
            List<String> problems = new ArrayList<>();
            for (ValidationMessage msg : schemaErrors) {
                problems.add(msg.getMessage());
            }
            throw new RuleDefinitionException("Custom rules do not match the rule schema", problems);
        }

        JsonNode array = root.isArray() ? root : root.get("rules");
        List<ValidationRule> rules = new ArrayList<>();
        for (JsonNode node : array) {
            rules.add(objectMapper.convertValue(node, ValidationRule.class));
        }

        validate(rules);
        return List.copyOf(rules);
    }

    /**
     * Check that ids are unique and patterns compile.
     *
     * @throws RuleDefinitionException listing every problem found
     */
    public static void validate(List<ValidationRule> rules) {
        List<String> problems = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (ValidationRule rule : rules) {
            if (!ids.add(rule.id())) {
                problems.add("Duplicate rule id '" + rule.id() + "'");
            }
            try {
                CustomRuleCheck.compile(rule.pattern());
            } catch (PatternSyntaxException e) {
                problems.add("Rule '" + rule.id() + "' has an invalid pattern: " + e.getDescription());
            }
        }
        if (!problems.isEmpty()) {
            throw new RuleDefinitionException("Invalid custom rules", problems);
        }
    }

    private static JsonSchema loadSchema(ObjectMapper mapper) {
        try (InputStream input = CustomRuleLoader.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (input == null) {
                throw new IllegalStateException("Rule schema not found on classpath: " + SCHEMA_RESOURCE);
            }
            JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
            return factory.getSchema(mapper.readTree(input));
        } catch (IOException e) {
            throw new IllegalStateException("Rule schema could not be read", e);
        }
    }
}
