package com.ledgerradar.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BankTransactionTest {

    @Test
    void negativeCorrectionFlipsToOutgoing() {
        BankTransaction tx = credit("100.00");

        tx.correct(LocalDate.of(2025, 3, 9), new BigDecimal("-80.00"), null);

        assertThat(tx.getDirection()).isEqualTo(TransactionDirection.OUTGOING);
        assertThat(tx.getAmount()).isEqualByComparingTo("80.00");
        assertThat(tx.signedAmount()).isEqualByComparingTo("-80.00");
        assertThat(tx.getBookingDate()).isEqualTo(LocalDate.of(2025, 3, 9));
    }

    @Test
    void explicitDirectionWinsOverSign() {
        BankTransaction tx = credit("100.00");

        tx.correct(null, new BigDecimal("-80.00"), TransactionDirection.INCOMING);

        assertThat(tx.getDirection()).isEqualTo(TransactionDirection.INCOMING);
        assertThat(tx.getBookingDate()).isEqualTo(LocalDate.of(2025, 3, 1));
    }

    @Test
    void matchedTransactionCannotBeCorrected() {
        BankTransaction tx = credit("100.00");
        tx.setMatchStatus(MatchStatus.AUTO_MATCHED);

        assertThatThrownBy(() -> tx.correct(null, new BigDecimal("1.00"), null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("unmatch");
        assertThat(tx.getAmount()).isEqualByComparingTo("100.00");
    }

    @Test
    void fromLineStoresAbsoluteAmountAsUnmatched() {
        StatementLine line = new StatementLine();
        line.setBookingDate(LocalDate.of(2025, 3, 2));
        line.setDirection(TransactionDirection.OUTGOING);
        line.setAmount(new BigDecimal("-12.50"));
        line.setReference("HR00 77");

        BankTransaction tx = BankTransaction.fromLine(line, "acc-1", TransactionSource.MANUAL_IMPORT);

        assertThat(tx.getAmount()).isEqualByComparingTo("12.50");
        assertThat(tx.signedAmount()).isEqualByComparingTo("-12.50");
        assertThat(tx.getMatchStatus()).isEqualTo(MatchStatus.UNMATCHED);
        assertThat(tx.getSource()).isEqualTo(TransactionSource.MANUAL_IMPORT);
        assertThat(tx.getCreatedAt()).isNotNull();
    }

    private static BankTransaction credit(String amount) {
        BankTransaction tx = new BankTransaction();
        tx.setId("tx-1");
        tx.setBookingDate(LocalDate.of(2025, 3, 1));
        tx.setDirection(TransactionDirection.INCOMING);
        tx.setAmount(new BigDecimal(amount));
        return tx;
    }
}
