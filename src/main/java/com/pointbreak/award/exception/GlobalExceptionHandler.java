package com.pointbreak.award.exception;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.method.ParameterValidationResult;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Maps search and upstream failures to HTTP responses.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(SearchValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(SearchValidationException ex) {
        log.warn("Validation error: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of("VALIDATION_ERROR", ex.getMessage()));
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorResponse> handleParameterValidation(HandlerMethodValidationException ex) {
        String message = ex.getAllValidationResults().stream()
                .map(this::describe)
                .collect(Collectors.joining("; "));
        log.warn("Parameter validation errors: {}", message);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of("VALIDATION_ERROR", message));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException ex) {
        String message = ex.getConstraintViolations().stream()
                .map(ConstraintViolation::getMessage)
                .collect(Collectors.joining("; "));
        log.warn("Constraint violations: {}", message);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of("VALIDATION_ERROR", message));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParam(MissingServletRequestParameterException ex) {
        log.warn("Missing parameter: {}", ex.getParameterName());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of("MISSING_PARAMETER",
                        "Required parameter missing: " + ex.getParameterName()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Type mismatch: parameter={}", ex.getName());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of("TYPE_MISMATCH", "Invalid value for parameter: " + ex.getName()));
    }

    @ExceptionHandler(UpstreamTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleTimeout(UpstreamTimeoutException ex) {
        log.warn("Upstream timeout: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
                .body(ErrorResponse.of("UPSTREAM_TIMEOUT", ex.getMessage(), true));
    }

    @ExceptionHandler(PoolExhaustedException.class)
    public ResponseEntity<ErrorResponse> handlePoolExhausted(PoolExhaustedException ex) {
        log.warn("No upstream session available: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(ErrorResponse.of("POOL_EXHAUSTED", ex.getMessage(), true));
    }

    @ExceptionHandler(UpstreamFailureException.class)
    public ResponseEntity<ErrorResponse> handleUpstreamFailure(UpstreamFailureException ex) {
        log.error("Upstream failure: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(ErrorResponse.of("UPSTREAM_UNAVAILABLE", ex.getMessage(), true));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of("INTERNAL_ERROR", "An unexpected error occurred"));
    }

    private String describe(ParameterValidationResult result) {
        String name = result.getMethodParameter().getParameterName();
        String errors = result.getResolvableErrors().stream()
                .map(MessageSourceResolvable::getDefaultMessage)
                .collect(Collectors.joining(", "));
        return name == null ? errors : name + ": " + errors;
    }

    /**
     * Standard error response format.
     */
    public static class ErrorResponse {
        private final String error;
        private final String message;
        private final boolean retryable;
        private final Instant timestamp;

        private ErrorResponse(String error, String message, boolean retryable) {
            this.error = error;
            this.message = message;
            this.retryable = retryable;
            this.timestamp = Instant.now();
        }

        public static ErrorResponse of(String error, String message) {
            return new ErrorResponse(error, message, false);
        }

        public static ErrorResponse of(String error, String message, boolean retryable) {
            return new ErrorResponse(error, message, retryable);
        }

        public String getError() { return error; }
        public String getMessage() { return message; }
        public boolean isRetryable() { return retryable; }
        public Instant getTimestamp() { return timestamp; }
    }
}
