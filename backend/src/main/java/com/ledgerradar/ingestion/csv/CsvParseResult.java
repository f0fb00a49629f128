package com.ledgerradar.ingestion.csv;

import com.ledgerradar.domain.StatementLine;

import java.util.List;

/**
 * Parsed rows of one CSV file plus the rows that were rejected.
 */
public record CsvParseResult(BankCsvFormat format, List<StatementLine> lines, List<RejectedRow> rejected) {

    /**
     * @param rowNumber 1-based data row, header excluded
     */
    public record RejectedRow(long rowNumber, String field, String value, String reason) {}

    public CsvParseResult {
        lines = List.copyOf(lines);
        rejected = List.copyOf(rejected);
    }
}
