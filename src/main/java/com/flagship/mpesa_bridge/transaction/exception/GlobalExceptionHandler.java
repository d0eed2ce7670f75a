package com.flagship.mpesa_bridge.transaction.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flagship.mpesa_bridge.daraja.UpstreamRejectionException;
import com.flagship.mpesa_bridge.daraja.UpstreamTransientException;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps exceptions escaping the client-facing and admin endpoints to a uniform error body.
 * Daraja-facing endpoints answer in their own shapes and handle their failures locally.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION",
                "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));
        log.warn("Request validation failed: {}", errors);
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION", "Request validation failed", errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION", "Request body is missing or malformed", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION", e.getMessage(), null);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "CONFLICT", e.getMessage(), null);
    }

    /**
     * Two requests racing with the same Idempotency-Key: the loser hits the unique constraint.
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleDataIntegrity(DataIntegrityViolationException e) {
        log.warn("Constraint violation: {}", e.getMostSpecificCause().getMessage());
        return respond(HttpStatus.CONFLICT, "CONFLICT",
                "Request conflicts with an existing transaction; retry to fetch it", null);
    }

    @ExceptionHandler(UpstreamTransientException.class)
    public ResponseEntity<ErrorResponse> handleUpstreamTransient(UpstreamTransientException e) {
        log.warn("Upstream unavailable: {}", e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "UPSTREAM_UNAVAILABLE",
                "Payment provider temporarily unavailable", null);
    }

    @ExceptionHandler(UpstreamRejectionException.class)
    public ResponseEntity<ErrorResponse> handleUpstreamRejection(UpstreamRejectionException e) {
        log.warn("Upstream rejected request: errorCode={}, message={}", e.getErrorCode(), e.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, "UPSTREAM_REJECTED", e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL", "An unexpected error occurred", null);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                         Map<String, String> details) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
            .status("error")
            .error(error)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build());
    }

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorResponse {
        String status;
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
