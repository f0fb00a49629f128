package com.ledgerradar.ingestion.dedup;

/**
 * Outcome counters of one deduplicated batch.
 */
public record DeduplicationSummary(int received, int inserted, int strictDuplicates, int flagged) {

    public static DeduplicationSummary empty() {
        return new DeduplicationSummary(0, 0, 0, 0);
    }
}
