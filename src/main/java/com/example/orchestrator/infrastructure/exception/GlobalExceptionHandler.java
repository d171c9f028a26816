package com.example.orchestrator.infrastructure.exception;

import com.example.orchestrator.application.exception.OrderNotFoundException;
import com.example.orchestrator.application.exception.PersistenceFailedException;
import com.example.orchestrator.application.exception.UserValidationFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(UserValidationFailedException.class)
    public ResponseEntity<Map<String, Object>> handleUserValidationFailed(UserValidationFailedException ex) {
        log.warn("User validation failed: {} - {}", ex.getUserId(), ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "USER_VALIDATION_FAILED", ex.getMessage());
    }

    @ExceptionHandler(PersistenceFailedException.class)
    public ResponseEntity<Map<String, Object>> handlePersistenceFailed(PersistenceFailedException ex) {
        log.error("Persistence failed: {}", ex.getMessage());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "PERSISTENCE_FAILED", ex.getMessage());
    }

    @ExceptionHandler(OrderNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleOrderNotFound(OrderNotFoundException ex) {
        log.debug("Order not found: {}", ex.getOrderId());
        return error(HttpStatus.NOT_FOUND, "ORDER_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(WebExchangeBindException ex) {
        String message = ex.getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining(", "));
        log.warn("Invalid request: {}", message);
        return error(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", message);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleServerWebInput(ServerWebInputException ex) {
        String message = ex.getReason() != null ? ex.getReason() : "Malformed request";
        log.warn("Malformed request: {}", message);
        return error(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", message);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleResponseStatus(ResponseStatusException ex) {
        log.warn("Request rejected: {} - {}", ex.getStatusCode(), ex.getReason());
        return error(ex.getStatusCode(), "REQUEST_REJECTED", ex.getReason());
    }

    /**
     * Failures surfacing from a composed future arrive wrapped.
     */
    @ExceptionHandler(CompletionException.class)
    public ResponseEntity<Map<String, Object>> handleCompletion(CompletionException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof UserValidationFailedException userValidation) {
            return handleUserValidationFailed(userValidation);
        }
        if (cause instanceof PersistenceFailedException persistence) {
            return handlePersistenceFailed(persistence);
        }
        if (cause instanceof OrderNotFoundException notFound) {
            return handleOrderNotFound(notFound);
        }
        return handleGenericException(ex);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred");
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatusCode status, String code, String message) {
        return ResponseEntity.status(status)
                .body(Map.of(
                        "error", code,
                        "message", message != null ? message : code,
                        "timestamp", Instant.now().toString()
                ));
    }
}
