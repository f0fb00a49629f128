package com.ledgerradar.ingestion.extraction;

import com.ledgerradar.domain.StatementLine;
import com.ledgerradar.domain.TransactionDirection;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One transaction as a model reported it. Amount is absolute.
 */
public record CandidateTransaction(
        LocalDate date,
        TransactionDirection direction,
        BigDecimal amount,
        String payee,
        String description,
        String reference,
        String counterpartyIban
) {

    public BigDecimal signedAmount() {
        return direction.signed(amount);
    }

    public StatementLine toLine(String currency) {
        StatementLine line = new StatementLine();
        line.setBookingDate(date);
        line.setDirection(direction);
        line.setAmount(amount);
        line.setCurrency(currency);
        line.setCounterpartyName(payee);
        line.setCounterpartyIban(counterpartyIban);
        line.setDescription(description);
        line.setReference(reference);
        return line;
    }

    public static CandidateTransaction fromLine(StatementLine line) {
        return new CandidateTransaction(line.getBookingDate(), line.getDirection(), line.getAmount(),
                line.getCounterpartyName(), line.getDescription(), line.getReference(), line.getCounterpartyIban());
    }
}
