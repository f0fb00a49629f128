package com.ledgerradar.ingestion.error;

import com.ledgerradar.domain.ImportErrorCode;
import lombok.Getter;

/**
 * Base of all typed import failures. The code is what jobs and API error bodies report.
 */
@Getter
public class StatementImportException extends RuntimeException {

    private final ImportErrorCode code;

    public StatementImportException(ImportErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public StatementImportException(ImportErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
