package com.github.dimitryivaniuta.keyshop.fulfillment.web;

import com.github.dimitryivaniuta.keyshop.fulfillment.service.InsufficientBalanceException;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.LedgerContentionException;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.TrialUnavailableException;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.InvalidOrderMetadataException;
import com.github.dimitryivaniuta.keyshop.fulfillment.verification.PaymentVerificationException;
import com.github.dimitryivaniuta.keyshop.fulfillment.web.dto.ErrorResponse;
import jakarta.validation.ConstraintViolationException;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

/**
 * Global exception mapping for HTTP APIs.
 */
@Slf4j
@RestControllerAdvice
public class ErrorHandlingAdvice {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
        return ResponseEntity.badRequest().body(error("VALIDATION_ERROR", ex.getMessage()));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException ex) {
        return ResponseEntity.badRequest().body(error("VALIDATION_ERROR", ex.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest().body(error("MALFORMED_BODY", ex.getMostSpecificCause().getMessage()));
    }

    /**
     * Order metadata missing a field its action needs.
     */
    @ExceptionHandler(InvalidOrderMetadataException.class)
    public ResponseEntity<ErrorResponse> handleInvalidMetadata(InvalidOrderMetadataException ex) {
        return ResponseEntity.badRequest().body(error("INVALID_METADATA", ex.getMessage()));
    }

    /**
     * Unauthenticated provider notification. The detail stays in the logs.
     */
    @ExceptionHandler(PaymentVerificationException.class)
    public ResponseEntity<ErrorResponse> handleVerification(PaymentVerificationException ex) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(error("VERIFICATION_FAILED", "Notification rejected"));
    }

    /**
     * Ledger lock contention outlasted the retries; the provider should redeliver.
     */
    @ExceptionHandler(LedgerContentionException.class)
    public ResponseEntity<ErrorResponse> handleContention(LedgerContentionException ex) {
        log.warn("Answering 503: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, "5")
                .body(error("LEDGER_CONTENTION", ex.getMessage()));
    }

    @ExceptionHandler(InsufficientBalanceException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientBalance(InsufficientBalanceException ex) {
        return ResponseEntity.status(HttpStatus.PAYMENT_REQUIRED).body(error("INSUFFICIENT_BALANCE", ex.getMessage()));
    }

    @ExceptionHandler(TrialUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleTrialUnavailable(TrialUnavailableException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error("TRIAL_UNAVAILABLE", ex.getMessage()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatus(ResponseStatusException ex) {
        return ResponseEntity.status(ex.getStatusCode())
                .body(error(HttpStatus.valueOf(ex.getStatusCode().value()).name(), ex.getReason()));
    }

    @ExceptionHandler(ErrorResponseException.class)
    public ResponseEntity<ProblemDetail> handleErrorResponseException(ErrorResponseException ex) {
        return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleDataIntegrityViolation(DataIntegrityViolationException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(error("CONFLICT", "Conflict: " + ex.getMostSpecificCause().getMessage()));
    }

    /**
     * Storage failures: 5xx so that providers redeliver.
     */
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException ex) {
        log.error("Storage error", ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error("STORAGE_ERROR", "Storage unavailable"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleFallback(Exception ex) {
        log.error("Unhandled error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error("INTERNAL_ERROR", ex.getMessage()));
    }

    private static ErrorResponse error(String code, String message) {
        return new ErrorResponse(code, message, Instant.now());
    }
}
