package com.ledgerradar.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One extracted transaction line before it becomes a ledger {@link BankTransaction}.
 * Embedded in page checkpoints and potential-duplicate records. Amount is absolute; direction carries the sign.
 */
@NoArgsConstructor
@Getter
@Setter
public class StatementLine {

    private LocalDate bookingDate;
    private LocalDate valueDate;
    private TransactionDirection direction;
    private BigDecimal amount;
    private String currency;
    private String counterpartyName;
    private String counterpartyIban;
    private String description;
    private String reference;
    private String externalId;

    public StatementLine copy() {
        StatementLine c = new StatementLine();
        c.bookingDate = bookingDate;
        c.valueDate = valueDate;
        c.direction = direction;
        c.amount = amount;
        c.currency = currency;
        c.counterpartyName = counterpartyName;
        c.counterpartyIban = counterpartyIban;
        c.description = description;
        c.reference = reference;
        c.externalId = externalId;
        return c;
    }

    public BigDecimal signedAmount() {
        return direction == null ? amount : direction.signed(amount);
    }
}
