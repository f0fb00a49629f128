package com.ledgerradar.ingestion.error;

import com.ledgerradar.domain.ImportErrorCode;

/**
 * A model call exceeded its per-call timeout.
 */
public class ExtractionTimeoutException extends StatementImportException {

    public ExtractionTimeoutException(String message) {
        super(ImportErrorCode.EXTRACTION_TIMEOUT, message);
    }

    public ExtractionTimeoutException(String message, Throwable cause) {
        super(ImportErrorCode.EXTRACTION_TIMEOUT, message, cause);
    }
}
