package com.ledgerradar.api.dto;

import com.ledgerradar.ingestion.dedup.DeduplicationSummary;

public record DeduplicationSummaryResponse(int received, int inserted, int strictDuplicates, int flagged) {

    public static DeduplicationSummaryResponse from(DeduplicationSummary s) {
        return new DeduplicationSummaryResponse(s.received(), s.inserted(), s.strictDuplicates(), s.flagged());
    }
}
