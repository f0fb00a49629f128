package com.ledgerradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Canonical ledger entry. Owned by a statement (file imports) or directly by the account (CSV, sync feed).
 * Amount is stored absolute; {@link #getDirection()} carries the sign.
 */
@Document(collection = "bank_transactions")
@CompoundIndexes({
    @CompoundIndex(name = "account_date", def = "{'accountId': 1, 'bookingDate': 1}"),
    @CompoundIndex(name = "account_external_id", def = "{'accountId': 1, 'externalId': 1}", sparse = true),
    @CompoundIndex(name = "account_match_status", def = "{'accountId': 1, 'matchStatus': 1, 'direction': 1}"),
    @CompoundIndex(name = "statement", def = "{'statementId': 1}", sparse = true)
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class BankTransaction {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String accountId;
    private String statementId;
    private Integer pageNumber;
    private String importJobId;
    private TransactionSource source;
    private LocalDate bookingDate;
    private LocalDate valueDate;
    private TransactionDirection direction;
    private BigDecimal amount;
    private String currency;
    private String counterpartyName;
    private String counterpartyIban;
    private String description;
    private String reference;
    /** Provider or bank id (sync feed id, CAMT EndToEndId). */
    private String externalId;
    private MatchStatus matchStatus = MatchStatus.UNMATCHED;
    private String matchedInvoiceId;
    private Instant matchedAt;
    private String matchedBy;
    /** 0..100; for unmatched credits, the best suggestion score. */
    private Integer confidenceScore;
    private String suggestedInvoiceId;
    private Instant createdAt;
    private Instant updatedAt;

    public BigDecimal signedAmount() {
        return direction == null ? amount : direction.signed(amount);
    }

    /**
     * Corrects the booking fields of an extracted transaction. Matched transactions must be unmatched first.
     */
    public void correct(LocalDate newBookingDate, BigDecimal newAmount, TransactionDirection newDirection) {
        if (matchStatus != null && matchStatus.isMatched()) {
            throw new IllegalStateException("Transaction " + id + " is " + matchStatus + "; unmatch before changing amount or date");
        }
        if (newBookingDate != null) {
            bookingDate = newBookingDate;
        }
        if (newAmount != null) {
            if (newAmount.signum() < 0 && newDirection == null) {
                direction = TransactionDirection.OUTGOING;
            }
            amount = newAmount.abs();
        }
        if (newDirection != null) {
            direction = newDirection;
        }
        updatedAt = Instant.now();
    }

    public static BankTransaction fromLine(StatementLine line, String accountId, TransactionSource source) {
        BankTransaction tx = new BankTransaction();
        tx.setAccountId(accountId);
        tx.setSource(source);
        tx.setBookingDate(line.getBookingDate());
        tx.setValueDate(line.getValueDate());
        tx.setDirection(line.getDirection());
        tx.setAmount(line.getAmount() == null ? null : line.getAmount().abs());
        tx.setCurrency(line.getCurrency());
        tx.setCounterpartyName(line.getCounterpartyName());
        tx.setCounterpartyIban(line.getCounterpartyIban());
        tx.setDescription(line.getDescription());
        tx.setReference(line.getReference());
        tx.setExternalId(line.getExternalId());
        tx.setMatchStatus(MatchStatus.UNMATCHED);
        Instant now = Instant.now();
        tx.setCreatedAt(now);
        tx.setUpdatedAt(now);
        return tx;
    }
}
