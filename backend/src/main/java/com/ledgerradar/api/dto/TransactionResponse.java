package com.ledgerradar.api.dto;

import com.ledgerradar.domain.BankTransaction;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Ledger transaction as returned by the transactions and reconciliation endpoints.
 */
public record TransactionResponse(
        String id,
        String accountId,
        String statementId,
        String source,
        LocalDate bookingDate,
        LocalDate valueDate,
        String direction,
        BigDecimal amount,
        String currency,
        String counterpartyName,
        String counterpartyIban,
        String description,
        String reference,
        String externalId,
        String matchStatus,
        String matchedInvoiceId,
        Instant matchedAt,
        String matchedBy,
        Integer confidenceScore,
        String suggestedInvoiceId
) {

    public static TransactionResponse from(BankTransaction tx) {
        return new TransactionResponse(
                tx.getId(),
                tx.getAccountId(),
                tx.getStatementId(),
                tx.getSource() != null ? tx.getSource().name() : null,
                tx.getBookingDate(),
                tx.getValueDate(),
                tx.getDirection() != null ? tx.getDirection().name() : null,
                tx.getAmount(),
                tx.getCurrency(),
                tx.getCounterpartyName(),
                tx.getCounterpartyIban(),
                tx.getDescription(),
                tx.getReference(),
                tx.getExternalId(),
                tx.getMatchStatus() != null ? tx.getMatchStatus().name() : null,
                tx.getMatchedInvoiceId(),
                tx.getMatchedAt(),
                tx.getMatchedBy(),
                tx.getConfidenceScore(),
                tx.getSuggestedInvoiceId());
    }
}
