package com.ledgerradar.ingestion.error;

import com.ledgerradar.domain.ImportErrorCode;

/**
 * Model output was not JSON or did not satisfy the page candidate schema.
 */
public class ExtractionSchemaViolationException extends StatementImportException {

    public ExtractionSchemaViolationException(String message) {
        super(ImportErrorCode.EXTRACTION_SCHEMA_VIOLATION, message);
    }

    public ExtractionSchemaViolationException(String message, Throwable cause) {
        super(ImportErrorCode.EXTRACTION_SCHEMA_VIOLATION, message, cause);
    }
}
