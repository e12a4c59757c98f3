package com.flagship.expense_ledger.transaction.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps exceptions to a uniform {@link ErrorResponse} body.
 *
 * 422 ledger rule violations, 404 unknown transaction, 403 not involved,
 * 409 edit of a deleted transaction, 400 malformed request, 503 database unavailable.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(TransactionValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(TransactionValidationException e) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Invalid Transaction",
            "Transaction violates ledger rules", e.asDetails());
    }

    @ExceptionHandler(UnresolvedCounterpartyException.class)
    public ResponseEntity<ErrorResponse> handleUnresolvedCounterparty(UnresolvedCounterpartyException e) {
        log.warn("Settlement counterparty not found: {}", e.getEmail());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Unknown Counterparty", e.getMessage(),
            Map.of("description", "no user with email " + e.getEmail()));
    }

    @ExceptionHandler(TransactionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(TransactionNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, "Not Found", e.getMessage(), null);
    }

    @ExceptionHandler(TransactionAccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(TransactionAccessDeniedException e) {
        log.warn("Access denied: {}", e.getMessage());
        return respond(HttpStatus.FORBIDDEN, "Forbidden", e.getMessage(), null);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Invalid State", e.getMessage(), null);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return respond(HttpStatus.BAD_REQUEST, "Missing Required Header",
            "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleBeanValidation(MethodArgumentNotValidException e) {
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

    @ExceptionHandler({
        IllegalArgumentException.class,
        HttpMessageNotReadableException.class,
        MethodArgumentTypeMismatchException.class,
        DateTimeParseException.class
    })
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        String message = e instanceof HttpMessageNotReadableException
            ? "Request body could not be read"
            : e.getMessage();
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", message, null);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException e) {
        log.error("Ledger storage unavailable", e);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Storage Unavailable",
            "The ledger could not be reached; retry the request", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
            "An unexpected error occurred", null);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                         Map<String, String> details) {
        ErrorResponse body = ErrorResponse.builder()
            .error(error)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
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
