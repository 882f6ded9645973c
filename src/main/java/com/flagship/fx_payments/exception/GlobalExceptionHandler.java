package com.flagship.fx_payments.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps failures to a consistent error body.
 *
 * Business rejections carry their own code and a specific status. Store failures and anything
 * unexpected are reported generically; their detail only reaches the log.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException e) {
        log.warn("Validation failed: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", e, null);
    }

    @ExceptionHandler(QuoteExpiredException.class)
    public ResponseEntity<ErrorResponse> handleQuoteExpired(QuoteExpiredException e) {
        log.warn("Rejected expired quote {}", e.getQuoteId());
        return respond(HttpStatus.GONE, "Quote Expired", e,
            Map.of("quote_id", e.getQuoteId().toString(), "expired_at", e.getExpiredAt().toString()));
    }

    @ExceptionHandler(QuoteAlreadyUsedException.class)
    public ResponseEntity<ErrorResponse> handleQuoteAlreadyUsed(QuoteAlreadyUsedException e) {
        log.warn("Rejected reuse of single-use quote {}", e.getQuoteId());
        return respond(HttpStatus.CONFLICT, "Quote Already Used", e,
            Map.of("quote_id", e.getQuoteId().toString()));
    }

    @ExceptionHandler({QuoteNotFoundException.class, PaymentNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(FxPaymentsException e) {
        log.warn("Lookup failed: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Not Found", e, null);
    }

    @ExceptionHandler(SelfApprovalForbiddenException.class)
    public ResponseEntity<ErrorResponse> handleSelfApproval(SelfApprovalForbiddenException e) {
        log.warn("Maker-checker violation: {}", e.getMessage());
        return respond(HttpStatus.FORBIDDEN, "Self Approval Forbidden", e,
            Map.of("payment_id", e.getPaymentId().toString(), "actor_id", e.getActorId()));
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidTransition(InvalidTransitionException e) {
        log.warn("Invalid transition: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Invalid Transition", e,
            Map.of("current_status", e.getCurrentStatus().name(), "action", e.getAction().name()));
    }

    @ExceptionHandler(ConcurrentTransitionException.class)
    public ResponseEntity<ErrorResponse> handleConcurrentTransition(ConcurrentTransitionException e) {
        log.warn("Concurrent modification: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Concurrent Modification", e, null);
    }

    @ExceptionHandler({ObjectOptimisticLockingFailureException.class, PessimisticLockingFailureException.class})
    public ResponseEntity<ErrorResponse> handleLockFailure(DataAccessException e) {
        log.warn("Lock conflict while writing: {}", e.getMessage());
        ErrorResponse error = ErrorResponse.builder()
            .error("Concurrent Modification")
            .code("CONCURRENT_MODIFICATION")
            .message("The resource was modified concurrently; reload and retry")
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(PersistenceException.class)
    public ResponseEntity<ErrorResponse> handlePersistence(PersistenceException e) {
        log.error("Persistence failure: {}", e.getMessage(), e.getCause());
        return storeUnavailable();
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException e) {
        log.error("Data access failure", e);
        return storeUnavailable();
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());

        ErrorResponse error = ErrorResponse.builder()
            .error("Missing Required Header")
            .code("MISSING_HEADER")
            .message("Required header '" + e.getHeaderName() + "' is missing")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        log.warn("Request body validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        ErrorResponse error = ErrorResponse.builder()
            .error("Validation Failed")
            .code("VALIDATION_FAILED")
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("Malformed Request")
            .code("MALFORMED_REQUEST")
            .message("Request could not be read")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ErrorResponse error = ErrorResponse.builder()
            .error("Internal Server Error")
            .code("INTERNAL_ERROR")
            .message("An unexpected error occurred")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String error,
                                                  FxPaymentsException e, Map<String, String> details) {
        ErrorResponse body = ErrorResponse.builder()
            .error(error)
            .code(e.getCode())
            .message(e.getMessage())
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }

    private ResponseEntity<ErrorResponse> storeUnavailable() {
        ErrorResponse error = ErrorResponse.builder()
            .error("Service Unavailable")
            .code("PERSISTENCE_ERROR")
            .message("The request could not be stored; try again later")
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error);
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String code;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
