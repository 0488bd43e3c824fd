package dev.chordshield.spring.advice;

import dev.chordshield.core.ValidationError;
import dev.chordshield.core.ValidationResult;
import dev.chordshield.core.exception.ChordShieldException;
import dev.chordshield.core.exception.ContentRejectedException;
import dev.chordshield.spring.ChordShieldProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Global exception handler for ChordShield exceptions.
 */
@RestControllerAdvice
public class ChordShieldExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ChordShieldExceptionHandler.class);

    private final ChordShieldProperties properties;

    public ChordShieldExceptionHandler(ChordShieldProperties properties) {
        this.properties = properties;
    }

    @ExceptionHandler(ContentRejectedException.class)
    public ResponseEntity<Map<String, Object>> handleContentRejected(ContentRejectedException ex) {
        logger.warn("Content rejected: {}", ex.getMessage());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "Invalid ChordPro Content");
        body.put("code", "CHORDPRO_CONTENT_REJECTED");

        ValidationResult result = ex.getValidationResult();
        if (result != null) {
            body.put("errorCount", result.errorCount());
            body.put("warningCount", result.warningCount());
        }

        if (!properties.isSanitizeErrors()) {
            body.put("message", ex.getMessage());
            if (result != null) {
                body.put("errors", describe(result.errors()));
                body.put("warnings", describe(result.warnings()));
            }
        }

        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }

    @ExceptionHandler(ChordShieldException.class)
    public ResponseEntity<Map<String, Object>> handleChordShieldException(ChordShieldException ex) {
        logger.error("ChordShield error: {}", ex.getMessage(), ex);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "Validation Error");
        body.put("code", "CHORDSHIELD_ERROR");

        if (!properties.isSanitizeErrors()) {
            body.put("message", ex.getMessage());
        }

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private static List<Map<String, Object>> describe(List<ValidationError> findings) {
        return findings.stream().map(ChordShieldExceptionHandler::describe).toList();
    }

    private static Map<String, Object> describe(ValidationError finding) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("type", finding.type().id());
        entry.put("severity", finding.severity().id());
        entry.put("message", finding.message());
        entry.put("line", finding.position().line());
        entry.put("column", finding.position().column());
        entry.put("start", finding.position().start());
        entry.put("end", finding.position().end());
        if (finding.hasSuggestion()) {
            entry.put("suggestion", finding.suggestion());
        }
        return entry;
    }
}
