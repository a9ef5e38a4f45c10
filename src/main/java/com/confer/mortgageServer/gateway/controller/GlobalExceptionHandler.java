package com.confer.mortgageServer.gateway.controller;

import com.confer.mortgageServer.catalog.exception.CatalogEntryNotFoundException;
import com.confer.mortgageServer.common.exception.ErrorKind;
import com.confer.mortgageServer.common.exception.MortgageServerException;
import com.confer.mortgageServer.document.exception.DocumentValidationException;
import com.confer.mortgageServer.gateway.exception.InvalidApiKeyException;
import com.confer.mortgageServer.gateway.exception.RateLimitExceededException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global exception handler for the API. Every failure is reported as an error envelope
 * {kind, reason, field, message}.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String SCHEMA_VIOLATION = ErrorKind.SCHEMA_VIOLATION.getCode();

    @ExceptionHandler(MortgageServerException.class)
    public ResponseEntity<ErrorResponse> handleOperationFailure(MortgageServerException ex) {
        HttpStatus status = ex.getKind() == ErrorKind.TRANSPORT_FAILURE ? HttpStatus.BAD_GATEWAY : HttpStatus.BAD_REQUEST;
        String field = ex instanceof DocumentValidationException validation ? validation.getField() : null;

        log.warn("Operation failed - kind: {}, reason: {}, message: {}", ex.getKind().getCode(), ex.getReason(), ex.getMessage());
        return ResponseEntity.status(status)
                .body(new ErrorResponse(ex.getKind().getCode(), ex.getReason(), field, ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException ex) {
        return ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> schemaViolation(error.getField(), error.getField() + ": " + error.getDefaultMessage()))
                .orElseGet(() -> schemaViolation(null, "Validation failed"));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException ex) {
        return schemaViolation(ex.getParameterName(), ex.getParameterName() + ": is required");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return schemaViolation(null, "Request body is not valid JSON");
    }

    @ExceptionHandler(CatalogEntryNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleCatalogEntryNotFound(CatalogEntryNotFoundException ex) {
        log.warn("Catalog entry not found: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("NotFound", null, null, ex.getMessage()));
    }

    @ExceptionHandler(InvalidApiKeyException.class)
    public ResponseEntity<ErrorResponse> handleInvalidApiKey(InvalidApiKeyException ex) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(new ErrorResponse("InvalidApiKey", null, null, ex.getMessage()));
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleRateLimitExceeded(RateLimitExceededException ex) {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .body(new ErrorResponse("RateLimitExceeded", null, null, ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("InternalError", null, null, "An unexpected error occurred"));
    }

    private ResponseEntity<ErrorResponse> schemaViolation(String field, String message) {
        log.warn("Request validation error: {}", message);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(SCHEMA_VIOLATION, null, field, message));
    }

    private record ErrorResponse(String kind, String reason, String field, String message) {}
}
