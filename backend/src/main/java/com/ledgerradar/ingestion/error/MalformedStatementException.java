package com.ledgerradar.ingestion.error;

import com.ledgerradar.domain.ImportErrorCode;

/**
 * The document is structurally unusable as a statement (broken XML, missing balance codes, unreadable PDF).
 */
public class MalformedStatementException extends StatementImportException {

    public MalformedStatementException(String message) {
        super(ImportErrorCode.MALFORMED_STATEMENT, message);
    }

    public MalformedStatementException(String message, Throwable cause) {
        super(ImportErrorCode.MALFORMED_STATEMENT, message, cause);
    }
}
