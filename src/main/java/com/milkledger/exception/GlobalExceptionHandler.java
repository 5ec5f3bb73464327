package com.milkledger.exception;

import com.milkledger.dto.ApiResponses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.HashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Centralized exception mapper for all REST endpoints.
 *
 * EXCEPTION → HTTP STATUS MAPPING:
 *
 * Exception Type                      | HTTP Status | When
 * ------------------------------------|-------------|------------------------------------------
 * IllegalArgumentException            | 400         | Negative quantity or price, missing quantity
 * MethodArgumentNotValidException     | 400         | Bean Validation failure on DTO fields
 * HttpMessageNotReadableException     | 400         | Malformed JSON, unparseable date or number
 * MethodArgumentTypeMismatchException | 400         | Non-numeric record id in the path
 * UnauthorizedException               | 401         | Bad credentials, rejected token
 * SecurityException                   | 403         | Email not verified at login
 * NoSuchElementException              | 404         | Record or user not found
 * NoResourceFoundException            | 404         | Unknown path
 * HttpRequestMethodNotSupported...    | 405         | Known path, wrong verb
 * IllegalStateException               | 409         | Email already registered
 * DataIntegrityViolationException     | 409         | Unique email index hit by a concurrent registration
 * Exception (fallback)                | 500         | Unexpected system errors
 *
 * RULES:
 * - No stack traces in responses
 * - All responses use ErrorResponse shape, except field-level validation maps
 * - 401 messages are uniform; the cause is logged, never returned
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    // ─────────────────────────────────────────────────────────────────────────
    // 400 BAD REQUEST: Invalid input
    // ─────────────────────────────────────────────────────────────────────────

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ApiResponses.ErrorResponse("BAD_REQUEST", ex.getMessage()));
    }

    /**
     * Handles @Valid/@NotBlank/@DecimalMin annotation failures on request DTOs.
     * Returns a field → message map instead of generic error for clearer API feedback.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String field = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.put(field, error.getDefaultMessage());
        });
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ApiResponses.ErrorResponse(
                        "BAD_REQUEST",
                        "Malformed request body. Dates must be YYYY-MM-DD and quantities numeric."));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ApiResponses.ErrorResponse(
                        "BAD_REQUEST",
                        "Invalid value for '" + ex.getName() + "': " + ex.getValue()));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // 401 UNAUTHORIZED: Credentials or token rejected
    // ─────────────────────────────────────────────────────────────────────────

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleUnauthorized(UnauthorizedException ex) {
        return ResponseEntity
                .status(HttpStatus.UNAUTHORIZED)
                .body(new ApiResponses.ErrorResponse("UNAUTHORIZED", ex.getMessage()));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // 403 FORBIDDEN: Account not allowed to log in
    // ─────────────────────────────────────────────────────────────────────────

    @ExceptionHandler(SecurityException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleForbidden(SecurityException ex) {
        return ResponseEntity
                .status(HttpStatus.FORBIDDEN)
                .body(new ApiResponses.ErrorResponse("FORBIDDEN", ex.getMessage()));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // 404 NOT FOUND: Resource does not exist (or is not the caller's)
    // ─────────────────────────────────────────────────────────────────────────

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleNotFound(NoSuchElementException ex) {
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(new ApiResponses.ErrorResponse("NOT_FOUND", ex.getMessage()));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleNoResource(NoResourceFoundException ex) {
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(new ApiResponses.ErrorResponse("NOT_FOUND", "No endpoint " + ex.getResourcePath()));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        return ResponseEntity
                .status(HttpStatus.METHOD_NOT_ALLOWED)
                .body(new ApiResponses.ErrorResponse("METHOD_NOT_ALLOWED", ex.getMessage()));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // 409 CONFLICT: Duplicate registration
    // ─────────────────────────────────────────────────────────────────────────

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleIllegalState(IllegalStateException ex) {
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(new ApiResponses.ErrorResponse("CONFLICT", ex.getMessage()));
    }

    /**
     * Two registrations with the same email can both pass the existsByEmail
     * check; the unique index on users.email rejects the second insert.
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleDataIntegrity(DataIntegrityViolationException ex) {
        log.warn("Data integrity violation: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(new ApiResponses.ErrorResponse("CONFLICT", "Email already registered"));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // 500 INTERNAL SERVER ERROR: Unexpected failures
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Safety net for any unhandled exception. The message is generic; details go to the log.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleGeneric(Exception ex) {
        log.error("Unhandled exception", ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiResponses.ErrorResponse(
                        "INTERNAL_SERVER_ERROR",
                        "An unexpected error occurred. Please contact support."
                ));
    }
}
