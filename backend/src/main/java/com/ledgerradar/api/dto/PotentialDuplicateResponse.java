package com.ledgerradar.api.dto;

import com.ledgerradar.domain.PotentialDuplicate;
import com.ledgerradar.domain.StatementLine;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Flagged fuzzy duplicate awaiting review, with the incoming row flattened.
 */
public record PotentialDuplicateResponse(
        String id,
        String accountId,
        String existingTransactionId,
        String importJobId,
        String source,
        double similarity,
        String status,
        String resolvedTransactionId,
        LocalDate bookingDate,
        String direction,
        BigDecimal amount,
        String currency,
        String counterpartyName,
        String description,
        String reference,
        Instant createdAt
) {

    public static PotentialDuplicateResponse from(PotentialDuplicate d) {
        StatementLine c = d.getCandidate() != null ? d.getCandidate() : new StatementLine();
        return new PotentialDuplicateResponse(
                d.getId(),
                d.getAccountId(),
                d.getExistingTransactionId(),
                d.getImportJobId(),
                d.getSource() != null ? d.getSource().name() : null,
                d.getSimilarity(),
                d.getStatus() != null ? d.getStatus().name() : null,
                d.getResolvedTransactionId(),
                c.getBookingDate(),
                c.getDirection() != null ? c.getDirection().name() : null,
                c.getAmount(),
                c.getCurrency(),
                c.getCounterpartyName(),
                c.getDescription(),
                c.getReference(),
                d.getCreatedAt());
    }
}
