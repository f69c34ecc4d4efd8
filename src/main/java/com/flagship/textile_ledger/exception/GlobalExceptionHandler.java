package com.flagship.textile_ledger.exception;

import com.flagship.textile_ledger.inventory.DuplicateAbsorptionException;
import com.flagship.textile_ledger.ledger.LedgerEntryNotFoundException;
import com.flagship.textile_ledger.ledger.PaymentRejectedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * 422: the request was well formed but the entry cannot take this payment.
     * Details carry the machine-readable reason and the exact remaining balance.
     */
    @ExceptionHandler(PaymentRejectedException.class)
    public ResponseEntity<ErrorResponse> handlePaymentRejected(PaymentRejectedException e) {
        Map<String, String> details = new LinkedHashMap<>();
        details.put("reason", e.getReason().name());
        if (e.getEntryId() != null) {
            details.put("entryId", e.getEntryId().toString());
        }
        if (e.getRemainingBalance() != null) {
            details.put("remainingBalance", e.getRemainingBalance().toBigDecimal().toPlainString());
        }
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Payment Rejected", e.getMessage(), details);
    }

    @ExceptionHandler(LedgerEntryNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(LedgerEntryNotFoundException e) {
        log.warn("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Not Found", e.getMessage(), null);
    }

    @ExceptionHandler(DuplicateAbsorptionException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateAbsorption(DuplicateAbsorptionException e) {
        log.warn("Duplicate absorption: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Already Absorbed", e.getMessage(),
            Map.of("source", e.getSource().toString()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());
        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", "Malformed request parameter or body", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Invalid State", e.getMessage(), null);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleDataIntegrity(DataIntegrityViolationException e) {
        log.warn("Constraint violation: {}", e.getMostSpecificCause().getMessage());
        return respond(HttpStatus.CONFLICT, "Conflict",
            "The request conflicts with a concurrent change; reload and retry", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred", null);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                         Map<String, String> details) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
            .error(error)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build());
    }

    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
