package com.ledgerradar.ingestion.error;

import com.ledgerradar.domain.ImportErrorCode;

public class UnsupportedFormatException extends StatementImportException {

    public UnsupportedFormatException(String message) {
        super(ImportErrorCode.UNSUPPORTED_FORMAT, message);
    }

    public UnsupportedFormatException(String message, Throwable cause) {
        super(ImportErrorCode.UNSUPPORTED_FORMAT, message, cause);
    }
}
