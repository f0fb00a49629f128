package com.ledgerradar.ingestion.extraction;

import java.time.LocalDate;

/**
 * Statement-level facts a page may show in its header. Every field is optional.
 */
public record CandidateMetadata(
        Long sequenceNumber,
        LocalDate statementDate,
        LocalDate periodStart,
        LocalDate periodEnd,
        String currency,
        String iban
) {

    public static final CandidateMetadata EMPTY = new CandidateMetadata(null, null, null, null, null, null);
}
