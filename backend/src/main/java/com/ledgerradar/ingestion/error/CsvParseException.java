package com.ledgerradar.ingestion.error;

import com.ledgerradar.domain.ImportErrorCode;
import lombok.Getter;

/**
 * A CSV row or header could not be interpreted. Carries the offending column and raw value.
 */
@Getter
public class CsvParseException extends StatementImportException {

    private final String field;
    private final String value;

    public CsvParseException(String message, String field, String value) {
        super(ImportErrorCode.CSV_PARSE_ERROR, message);
        this.field = field;
        this.value = value;
    }

    public CsvParseException(String message, String field, String value, Throwable cause) {
        super(ImportErrorCode.CSV_PARSE_ERROR, message, cause);
        this.field = field;
        this.value = value;
    }
}
