package com.ledgerradar.api.controller;

import com.ledgerradar.api.dto.ErrorBody;
import com.ledgerradar.common.ResourceNotFoundException;
import com.ledgerradar.ingestion.error.DuplicateUploadException;
import com.ledgerradar.ingestion.error.OversizedFileException;
import com.ledgerradar.ingestion.error.StatementImportException;
import com.ledgerradar.ingestion.error.UnsupportedFormatException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Optional;

/**
 * Maps validation failures and typed service exceptions to ErrorBody (error, message, timestamp).
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        String message = userFacingMessage(error, ex);
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleInput(ServerWebInputException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getReason()));
    }

    @ExceptionHandler(OversizedFileException.class)
    public ResponseEntity<ErrorBody> handleOversized(OversizedFileException ex) {
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).body(ErrorBody.of(ex.getCode().name(), ex.getMessage()));
    }

    @ExceptionHandler(UnsupportedFormatException.class)
    public ResponseEntity<ErrorBody> handleUnsupported(UnsupportedFormatException ex) {
        return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE).body(ErrorBody.of(ex.getCode().name(), ex.getMessage()));
    }

    @ExceptionHandler(DuplicateUploadException.class)
    public ResponseEntity<ErrorBody> handleDuplicate(DuplicateUploadException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorBody.of(ex.getCode().name(),
                ex.getMessage() + "; upload again with overwrite=true to replace job " + ex.getExistingJobId()));
    }

    @ExceptionHandler(StatementImportException.class)
    public ResponseEntity<ErrorBody> handleImport(StatementImportException ex) {
        return ResponseEntity.unprocessableEntity().body(ErrorBody.of(ex.getCode().name(), ex.getMessage()));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorBody> handleNotFound(ResourceNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorBody> handleConflict(IllegalStateException ex) {
        log.debug("Rejected request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorBody.of("CONFLICT", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorBody> handleBadArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getMessage()));
    }

    private static String userFacingMessage(String errorCode, WebExchangeBindException ex) {
        return switch (errorCode) {
            case "INVALID_AMOUNT" -> "Amount is missing or negative";
            case "INVALID_DATE" -> "Booking date is required";
            case "INVALID_INVOICE" -> "Invoice id is required";
            case "EMPTY_FEED" -> "Feed must contain at least one transaction";
            default -> ex.getFieldErrors().stream()
                    .findFirst()
                    .map(e -> e.getField() + ": " + e.getDefaultMessage())
                    .orElse("Validation failed");
        };
    }
}
