package com.ledgerradar.ingestion.error;

import com.ledgerradar.domain.ImportErrorCode;

/**
 * Retryable provider failure: network error, HTTP 429 or 5xx.
 */
public class ExtractionTransientException extends StatementImportException {

    public ExtractionTransientException(String message, Throwable cause) {
        super(ImportErrorCode.EXTRACTION_PROVIDER_ERROR, message, cause);
    }
}
