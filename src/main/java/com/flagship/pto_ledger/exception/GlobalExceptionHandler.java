package com.flagship.pto_ledger.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps failures to HTTP responses with a consistent body. Domain failures use their error code
 * as {@code error}.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException e) {
        log.warn("Validation failed: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e, null);
    }

    @ExceptionHandler({InvalidEffectiveDateException.class, NoEffectiveVersionException.class,
            NotAccruableException.class})
    public ResponseEntity<ErrorResponse> handlePolicyRuleViolation(TimeOffException e) {
        log.warn("Rejected by policy rules: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e, null);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        log.warn("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, e, null);
    }

    @ExceptionHandler({InvalidTransitionException.class, ConcurrencyConflictException.class,
            DuplicateIdempotencyKeyException.class})
    public ResponseEntity<ErrorResponse> handleConflict(TimeOffException e) {
        log.warn("Conflict: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, e, null);
    }

    @ExceptionHandler(BalanceInvariantViolatedException.class)
    public ResponseEntity<ErrorResponse> handleBalance(BalanceInvariantViolatedException e) {
        log.info("Balance refused: {}", e.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, e, Map.of(
            "available_minutes", String.valueOf(e.getAvailableMinutes()),
            "required_minutes", String.valueOf(e.getRequiredMinutes())));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());

        ErrorResponse error = ErrorResponse.builder()
            .error("MISSING_HEADER")
            .message("Required header '" + e.getHeaderName() + "' is missing")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        ErrorResponse error = ErrorResponse.builder()
            .error("VALIDATION_ERROR")
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Unreadable JSON, including settings objects that reject their own values on construction.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        Throwable cause = e;
        while (cause != null && !(cause instanceof ValidationException)) {
            cause = cause.getCause();
        }
        String message = cause != null ? cause.getMessage() : "Malformed request body";
        log.warn("Unreadable request body: {}", message);

        ErrorResponse error = ErrorResponse.builder()
            .error("VALIDATION_ERROR")
            .message(message)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleBadParameter(Exception e) {
        log.warn("Invalid request parameter: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("VALIDATION_ERROR")
            .message(e.getMessage())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ErrorResponse error = ErrorResponse.builder()
            .error("INTERNAL_ERROR")
            .message("An unexpected error occurred")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, TimeOffException e,
                                                         Map<String, String> details) {
        ErrorResponse error = ErrorResponse.builder()
            .error(e.getErrorCode())
            .message(e.getMessage())
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(error);
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
