package dev.chordshield.spring;

import dev.chordshield.core.ChordProValidator;
import dev.chordshield.core.ValidationConfig;
import dev.chordshield.core.ValidationRule;
import dev.chordshield.core.i18n.LanguageRuleRegistry;
import dev.chordshield.core.i18n.LocalizedChordProValidator;
import dev.chordshield.core.i18n.MessageCatalog;
import dev.chordshield.core.rules.CustomRuleLoader;
import dev.chordshield.spring.advice.ChordShieldExceptionHandler;
import dev.chordshield.spring.aspect.ChordProValidationAspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

import java.util.List;

/**
 * Auto-configuration for ChordShield.
 */
@AutoConfiguration
@EnableConfigurationProperties(ChordShieldProperties.class)
@EnableAspectJAutoProxy
@ConditionalOnProperty(prefix = "chordshield", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ChordShieldAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(ChordShieldAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public CustomRuleLoader customRuleLoader() {
        return new CustomRuleLoader();
    }

    @Bean
    @ConditionalOnMissingBean
    public LanguageRuleRegistry languageRuleRegistry(ChordShieldProperties properties) {
        LanguageRuleRegistry registry = new LanguageRuleRegistry();
        properties.getLanguages().forEach((language, rules) -> {
            logger.info("Extending language rules for '{}'", language);
            registry.extend(language, rules.toRules());
        });
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageCatalog messageCatalog() {
        return new MessageCatalog();
    }

    @Bean
    @ConditionalOnMissingBean
    public ChordProValidator chordProValidator(ChordShieldProperties properties, CustomRuleLoader ruleLoader) {
        List<ValidationRule> loaded = properties.getRulesLocation() == null
                ? List.of()
                : ruleLoader.loadResource(properties.getRulesLocation());
        ValidationConfig config = properties.toValidationConfig(loaded);
        CustomRuleLoader.validate(config.customRules());

        logger.info("Creating ChordProValidator with config: preset={}, strictMode={}, security={}, brackets={}, "
                        + "emptyElements={}, typos={}, maxSpecialCharPercent={}, customRules={}",
                properties.getPreset(),
                config.strictMode(),
                config.checkSecurity(),
                config.checkBrackets(),
                config.checkEmptyElements(),
                config.checkTypos(),
                config.maxSpecialCharPercent(),
                config.customRules().size());
        return new ChordProValidator(config);
    }

    @Bean
    @ConditionalOnMissingBean
    public LocalizedChordProValidator localizedChordProValidator(
            ChordProValidator chordProValidator,
            LanguageRuleRegistry languageRuleRegistry,
            MessageCatalog messageCatalog,
            ChordShieldProperties properties) {
        logger.info("Creating LocalizedChordProValidator for language '{}'", properties.getLanguage());
        return new LocalizedChordProValidator(chordProValidator, languageRuleRegistry, messageCatalog,
                properties.getLanguage());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnWebApplication
    public ChordShieldExceptionHandler chordShieldExceptionHandler(ChordShieldProperties properties) {
        return new ChordShieldExceptionHandler(properties);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnClass(name = "org.aspectj.lang.annotation.Aspect")
    public ChordProValidationAspect chordProValidationAspect(
            LocalizedChordProValidator localizedChordProValidator,
            ChordShieldProperties properties) {
        logger.info("Creating ChordProValidation aspect for annotation-based validation");
        return new ChordProValidationAspect(localizedChordProValidator, properties);
    }
}
