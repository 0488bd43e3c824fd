package dev.chordshield.spring.aspect;

import dev.chordshield.core.ValidationResult;
import dev.chordshield.core.exception.ContentRejectedException;
import dev.chordshield.core.i18n.LanguageRuleRegistry;
import dev.chordshield.core.i18n.LocalizedChordProValidator;
import dev.chordshield.spring.ChordShieldProperties;
import dev.chordshield.spring.annotation.ChordProContent;
import dev.chordshield.spring.annotation.ValidateChordPro;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.AnnotationUtils;

import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Aspect for processing {@link ValidateChordPro} annotations.
 */
@Aspect
public class ChordProValidationAspect {

    private static final Logger logger = LoggerFactory.getLogger(ChordProValidationAspect.class);

    private final LocalizedChordProValidator validator;
    private final ChordShieldProperties properties;
    private final Map<String, LocalizedChordProValidator> languageValidators = new ConcurrentHashMap<>();

    public ChordProValidationAspect(LocalizedChordProValidator validator, ChordShieldProperties properties) {
        this.validator = validator;
        this.properties = properties;
    }

    @Around("@annotation(dev.chordshield.spring.annotation.ValidateChordPro)"
            + " || @within(dev.chordshield.spring.annotation.ValidateChordPro)")
    public Object validateChordPro(ProceedingJoinPoint joinPoint) throws Throwable {
        if (!properties.isEnabled()) {
            return joinPoint.proceed();
        }

        // Method-level annotation takes precedence
        ValidateChordPro annotation = getAnnotation(joinPoint);
        if (annotation == null) {
            return joinPoint.proceed();
        }

        CharSequence content = extractContent(joinPoint);
        if (content == null) {
            logger.debug("No ChordPro content found for {}", joinPoint.getSignature().toShortString());
            return joinPoint.proceed();
        }

        ValidationResult result = validatorFor(annotation.language()).validateContent(content.toString());
        boolean rejected = !result.isValid() || (annotation.rejectOnWarnings() && result.warningCount() > 0);
        if (rejected) {
            logger.warn("ChordPro content rejected in {}: {} error(s), {} warning(s)",
                    joinPoint.getSignature().toShortString(), result.errorCount(), result.warningCount());
            throw new ContentRejectedException("ChordPro content failed validation", result);
        }

        return joinPoint.proceed();
    }

    private LocalizedChordProValidator validatorFor(String language) {
        if (language == null || language.isBlank()) {
            return validator;
        }
        String code = LanguageRuleRegistry.normalize(language);
        if (code.equals(validator.getLanguage())) {
            return validator;
        }
        return languageValidators.computeIfAbsent(code, validator::withLanguage);
    }

    private ValidateChordPro getAnnotation(ProceedingJoinPoint joinPoint) {
        Method method = ((MethodSignature) joinPoint.getSignature()).getMethod();
        ValidateChordPro annotation = AnnotationUtils.findAnnotation(method, ValidateChordPro.class);
        if (annotation == null) {
            Class<?> type = joinPoint.getTarget() != null ? joinPoint.getTarget().getClass() : method.getDeclaringClass();
            annotation = AnnotationUtils.findAnnotation(type, ValidateChordPro.class);
        }
        return annotation;
    }

    private CharSequence extractContent(ProceedingJoinPoint joinPoint) {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Parameter[] parameters = signature.getMethod().getParameters();
        Object[] args = joinPoint.getArgs();

        for (int i = 0; i < parameters.length; i++) {
            if (parameters[i].isAnnotationPresent(ChordProContent.class)) {
                return args[i] instanceof CharSequence text ? text : null;
            }
        }

        // If nothing is marked, use the first text argument
        for (Object arg : args) {
            if (arg instanceof CharSequence text) {
                return text;
            }
        }

        return null;
    }
}
