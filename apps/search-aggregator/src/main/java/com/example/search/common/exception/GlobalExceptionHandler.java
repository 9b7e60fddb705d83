package com.example.search.common.exception;

import com.example.search.aggregation.exception.DocumentAccessDeniedException;
import com.example.search.aggregation.exception.DocumentNotFoundException;
import com.example.search.aggregation.exception.MalformedInputException;
import com.example.search.aggregation.exception.UnauthenticatedException;
import com.example.search.common.util.StringSanitizer;
import com.example.search.source.exception.AdapterException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps aggregator failures to HTTP responses with an {@code {error, message, timestamp}} body.
 * Messages returned to clients are sanitized; upstream detail stays in the logs.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final int MAX_LOG_MESSAGE_LENGTH = 200;
    private static final int MAX_RESPONSE_MESSAGE_LENGTH = 100;

    @ExceptionHandler(UnauthenticatedException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleUnauthenticated(@NonNull UnauthenticatedException ex) {
        LOG.warn("Unauthenticated request: {}", sanitizeForLog(ex.getMessage()));
        return error(HttpStatus.UNAUTHORIZED, "unauthenticated", "Authentication required");
    }

    @ExceptionHandler(MalformedInputException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleMalformedInput(@NonNull MalformedInputException ex) {
        LOG.warn("Malformed input: {}", sanitizeForLog(ex.getMessage()));
        return error(HttpStatus.BAD_REQUEST, "invalid_request", sanitizeResponseMessage(ex.getMessage()));
    }

    @ExceptionHandler(DocumentNotFoundException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleNotFound(@NonNull DocumentNotFoundException ex) {
        LOG.info("Document not found: {}", sanitizeForLog(ex.getDocumentId()));
        return error(HttpStatus.NOT_FOUND, "not_found", "Document not found");
    }

    @ExceptionHandler(DocumentAccessDeniedException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleAccessDenied(@NonNull DocumentAccessDeniedException ex) {
        LOG.warn("Access denied: {}", sanitizeForLog(ex.getMessage()));
        return error(HttpStatus.FORBIDDEN, "access_denied", "Access denied");
    }

    /**
     * Only single-document fetches surface adapter failures; multi-source operations absorb them.
     */
    @ExceptionHandler(AdapterException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleAdapterFailure(@NonNull AdapterException ex) {
        LOG.warn("Upstream failure from {}: {}", ex.getSource(), sanitizeForLog(ex.getMessage()));
        return error(HttpStatus.BAD_GATEWAY, "upstream_error",
                "The " + ex.getSource() + " source could not be reached");
    }

    @ExceptionHandler(WebExchangeBindException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleValidationErrors(@NonNull WebExchangeBindException ex) {
        LOG.warn("Validation error: {} field errors", ex.getBindingResult().getFieldErrorCount());

        List<Map<String, String>> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> Map.of(
                        "field", sanitizeFieldName(error.getField()),
                        "message", sanitizeResponseMessage(error.getDefaultMessage())))
                .toList();
        return validationError(fieldErrors);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleConstraintViolation(@NonNull ConstraintViolationException ex) {
        LOG.warn("Constraint violation: {} violations", ex.getConstraintViolations().size());

        List<Map<String, String>> violations = ex.getConstraintViolations().stream()
                .map(violation -> Map.of(
                        "field", sanitizeFieldName(extractFieldName(violation)),
                        "message", sanitizeResponseMessage(violation.getMessage())))
                .toList();
        return validationError(violations);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleMethodValidation(@NonNull HandlerMethodValidationException ex) {
        LOG.warn("Parameter validation failed: {} parameters", ex.getAllValidationResults().size());

        List<Map<String, String>> violations = ex.getAllValidationResults().stream()
                .flatMap(result -> result.getResolvableErrors().stream()
                        .map(error -> Map.of(
                                "field", sanitizeFieldName(result.getMethodParameter().getParameterName()),
                                "message", sanitizeResponseMessage(error.getDefaultMessage()))))
                .toList();
        return validationError(violations);
    }

    @ExceptionHandler(ServerWebInputException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleInputException(@NonNull ServerWebInputException ex) {
        LOG.warn("Input error: {}", sanitizeForLog(ex.getMessage()));
        return error(HttpStatus.BAD_REQUEST, "invalid_request", "Invalid request format");
    }

    @ExceptionHandler(Exception.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleGeneral(@NonNull Exception ex) {
        LOG.error("Unhandled exception: {}", sanitizeForLog(ex.getMessage()), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "An unexpected error occurred");
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status)
                .body(Map.of(
                        "error", error,
                        "message", message,
                        "timestamp", Instant.now().toString()));
    }

    private static ResponseEntity<Map<String, Object>> validationError(List<Map<String, String>> details) {
        Map<String, Object> response = new HashMap<>();
        response.put("error", "validation_error");
        response.put("message", "Request validation failed");
        response.put("details", details);
        response.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @NonNull
    private static String extractFieldName(@NonNull ConstraintViolation<?> violation) {
        String path = violation.getPropertyPath().toString();
        // "search.maxResults" -> "maxResults"
        int lastDot = path.lastIndexOf('.');
        return lastDot >= 0 ? path.substring(lastDot + 1) : path;
    }

    @NonNull
    private static String sanitizeForLog(@Nullable String value) {
        return StringSanitizer.forLog(value, MAX_LOG_MESSAGE_LENGTH);
    }

    @NonNull
    private static String sanitizeFieldName(@Nullable String fieldName) {
        if (fieldName == null || fieldName.isBlank()) {
            return "unknown";
        }
        String cleaned = fieldName.replaceAll("[^a-zA-Z0-9._]", "");
        return cleaned.substring(0, Math.min(cleaned.length(), 50));
    }

    @NonNull
    private static String sanitizeResponseMessage(@Nullable String message) {
        if (message == null || message.isBlank()) {
            return "Invalid value";
        }
        String sanitized = message.replace('\n', ' ').replace('\r', ' ').replace('\t', ' ');
        if (sanitized.length() > MAX_RESPONSE_MESSAGE_LENGTH) {
            return sanitized.substring(0, MAX_RESPONSE_MESSAGE_LENGTH) + "...";
        }
        return sanitized;
    }
}
