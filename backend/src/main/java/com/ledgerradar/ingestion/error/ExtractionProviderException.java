package com.ledgerradar.ingestion.error;

import com.ledgerradar.domain.ImportErrorCode;

/**
 * Non-retryable provider failure (4xx other than 429, missing configuration, exhausted retries).
 */
public class ExtractionProviderException extends StatementImportException {

    public ExtractionProviderException(String message) {
        super(ImportErrorCode.EXTRACTION_PROVIDER_ERROR, message);
    }

    public ExtractionProviderException(String message, Throwable cause) {
        super(ImportErrorCode.EXTRACTION_PROVIDER_ERROR, message, cause);
    }
}
