package com.ledgerradar.ingestion.csv;

import com.ledgerradar.ingestion.dedup.DeduplicationSummary;

/**
 * Result of one CSV import job.
 */
public record CsvImportOutcome(BankCsvFormat format, DeduplicationSummary summary, int rowsRejected) {

    /** Rejected rows or flagged potential duplicates need a human. */
    public boolean needsReview() {
        return rowsRejected > 0 || summary.flagged() > 0;
    }
}
