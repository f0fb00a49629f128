package com.ledgerradar.reconciliation.engine;

import com.ledgerradar.domain.BankTransaction;
import com.ledgerradar.domain.Invoice;
import com.ledgerradar.domain.TransactionDirection;
import com.ledgerradar.reconciliation.config.ReconciliationProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InvoiceMatcherTest {

    private final ReconciliationProperties properties = new ReconciliationProperties();
    private final InvoiceMatcher matcher = new InvoiceMatcher(properties);

    @Test
    @DisplayName("reference, exact amount and close date auto-match (INV-2025-007, 500.00)")
    void referenceAndExactAmountAutoMatch() {
        BankTransaction tx = credit("500.00", "Uplata po racunu INV-2025-007", LocalDate.of(2025, 3, 10));
        Invoice invoice = invoice("inv-7", "INV-2025-007", "500.00", LocalDate.of(2025, 3, 8));

        List<MatchCandidate> candidates = matcher.match(tx, List.of(invoice));

        assertThat(candidates).singleElement().satisfies(c -> {
            assertThat(c.invoiceId()).isEqualTo("inv-7");
            assertThat(c.score()).isEqualTo(100);
            assertThat(c.reason()).isEqualTo("Reference match, Exact amount");
        });
        assertThat(matcher.shouldAutoMatch(candidates.get(0))).isTrue();
    }

    @Test
    @DisplayName("reference comparison ignores case and punctuation in either direction")
    void normalizedReference() {
        BankTransaction tx = credit("1.00", null, LocalDate.of(2025, 1, 1));
        tx.setReference("inv 2025/007");
        Invoice invoice = invoice("inv-7", "INV-2025-007", "999.00", null);

        MatchCandidate candidate = matcher.score(tx, invoice);

        assertThat(candidate.score()).isEqualTo(50);
        assertThat(matcher.shouldAutoMatch(candidate)).isFalse();
    }

    @Test
    @DisplayName("amount tolerance is strict: exactly 5% off scores nothing, just inside scores partial")
    void toleranceBoundary() {
        Invoice invoice = invoice("inv-1", "X-1", "100.00", null);

        assertThat(matcher.score(credit("95.00", null, null), invoice).score()).isZero();
        MatchCandidate inside = matcher.score(credit("95.01", null, null), invoice);
        assertThat(inside.score()).isEqualTo(25);
        assertThat(inside.reason()).isEqualTo("Amount within 5%");
    }

    @Test
    @DisplayName("date proximity uses the closer of issue and due date")
    void dateProximity() {
        Invoice invoice = invoice("inv-1", "X-1", "10.00", LocalDate.of(2025, 3, 20));
        invoice.setIssueDate(LocalDate.of(2025, 3, 1));

        assertThat(matcher.score(credit("1.00", null, LocalDate.of(2025, 3, 3)), invoice).score()).isEqualTo(10);
        assertThat(matcher.score(credit("1.00", null, LocalDate.of(2025, 3, 8)), invoice).score()).isEqualTo(5);
        assertThat(matcher.score(credit("1.00", null, LocalDate.of(2025, 3, 10)), invoice).score()).isZero();
    }

    @Test
    void counterpartySimilarityAddsPoints() {
        BankTransaction tx = credit("1.00", null, null);
        tx.setCounterpartyName("ACME D.O.O.");
        Invoice invoice = invoice("inv-1", "X-1", "10.00", null);
        invoice.setCustomerName("Acme d.o.o.");

        MatchCandidate candidate = matcher.score(tx, invoice);

        assertThat(candidate.score()).isEqualTo(10);
        assertThat(candidate.reason()).isEqualTo("Counterparty name");
    }

    @Test
    @DisplayName("ranking: score desc, then earlier due date, then invoice id; zero scores dropped")
    void ranking() {
        BankTransaction tx = credit("200.00", null, null);
        Invoice late = invoice("b", "A-1", "200.00", LocalDate.of(2025, 5, 1));
        Invoice early = invoice("c", "A-2", "200.00", LocalDate.of(2025, 4, 1));
        Invoice sameDue = invoice("a", "A-3", "200.00", LocalDate.of(2025, 4, 1));
        Invoice partial = invoice("d", "A-4", "205.00", null);
        Invoice unrelated = invoice("e", "A-5", "900.00", null);

        List<MatchCandidate> ranked = matcher.match(tx, List.of(late, partial, unrelated, early, sameDue));

        assertThat(ranked).extracting(MatchCandidate::invoiceId).containsExactly("a", "c", "b", "d");
    }

    @Test
    void scoreIsCappedAt100() {
        BankTransaction tx = credit("500.00", "INV-2025-007", LocalDate.of(2025, 3, 10));
        tx.setCounterpartyName("Acme");
        Invoice invoice = invoice("inv-7", "INV-2025-007", "500.00", LocalDate.of(2025, 3, 10));
        invoice.setCustomerName("Acme");

        assertThat(matcher.score(tx, invoice).score()).isEqualTo(100);
    }

    private static BankTransaction credit(String amount, String description, LocalDate bookingDate) {
        BankTransaction tx = new BankTransaction();
        tx.setId("tx-1");
        tx.setDirection(TransactionDirection.INCOMING);
        tx.setAmount(new BigDecimal(amount));
        tx.setDescription(description);
        tx.setBookingDate(bookingDate);
        return tx;
    }

    static Invoice invoice(String id, String number, String total, LocalDate dueDate) {
        Invoice invoice = new Invoice();
        invoice.setId(id);
        invoice.setAccountId("acc-1");
        invoice.setInvoiceNumber(number);
        invoice.setDirection(Invoice.InvoiceDirection.OUTBOUND);
        invoice.setTotalAmount(new BigDecimal(total));
        invoice.setDueDate(dueDate);
        return invoice;
    }
}
