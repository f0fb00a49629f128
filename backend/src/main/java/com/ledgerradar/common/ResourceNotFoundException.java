package com.ledgerradar.common;

import lombok.Getter;

/**
 * Unknown id in a command or lookup. The API layer maps it to 404 with the error code as ErrorBody.error.
 */
@Getter
public class ResourceNotFoundException extends RuntimeException {

    /** IMPORT_JOB_NOT_FOUND, TRANSACTION_NOT_FOUND, INVOICE_NOT_FOUND, POTENTIAL_DUPLICATE_NOT_FOUND. */
    private final String errorCode;

    public ResourceNotFoundException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
