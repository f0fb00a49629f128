package com.ledgerradar.ingestion.sync;

import com.ledgerradar.domain.StatementLine;
import com.ledgerradar.domain.TransactionDirection;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One normalized entry of an open-banking provider feed.
 *
 * @param amount signed: positive = credit
 */
public record SyncedTransaction(
        String externalId,
        LocalDate bookingDate,
        LocalDate valueDate,
        BigDecimal amount,
        String currency,
        String counterpartyName,
        String counterpartyIban,
        String description,
        String reference
) {

    public StatementLine toLine(String defaultCurrency) {
        StatementLine line = new StatementLine();
        line.setExternalId(externalId);
        line.setBookingDate(bookingDate);
        line.setValueDate(valueDate);
        line.setDirection(TransactionDirection.ofSigned(amount));
        line.setAmount(amount.abs());
        line.setCurrency(currency != null ? currency : defaultCurrency);
        line.setCounterpartyName(counterpartyName);
        line.setCounterpartyIban(counterpartyIban);
        line.setDescription(description);
        line.setReference(reference);
        return line;
    }
}
