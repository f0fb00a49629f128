package com.ledgerradar.reconciliation.service;

import com.ledgerradar.domain.BankTransaction;
import com.ledgerradar.domain.BankTransactionRepository;
import com.ledgerradar.domain.Invoice;
import com.ledgerradar.domain.MatchStatus;
import com.ledgerradar.domain.TransactionDirection;
import com.ledgerradar.domain.TransactionsIngestedEvent;
import com.ledgerradar.reconciliation.config.ReconciliationProperties;
import com.ledgerradar.reconciliation.engine.InvoiceMatcher;
import com.ledgerradar.reconciliation.ledger.InvoiceLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ReconciliationServiceTest {

    private static final String ACCOUNT = "acc-1";

    @Mock
    private BankTransactionRepository bankTransactionRepository;
    @Mock
    private InvoiceLedger invoiceLedger;

    private ReconciliationService service;

    @BeforeEach
    void setUp() {
        ReconciliationProperties properties = new ReconciliationProperties();
        service = new ReconciliationService(bankTransactionRepository, invoiceLedger, new InvoiceMatcher(properties), properties);
        when(invoiceLedger.markPaid(anyString(), anyString(), any())).thenReturn(true);
        when(bankTransactionRepository.claimMatch(anyString(), anyString(), any(), anyInt(), anyString(), any())).thenReturn(true);
    }

    @Test
    @DisplayName("credit with reference and exact amount is auto-matched; a weak one gets a suggestion")
    void autoMatchAndSuggestion() {
        BankTransaction strong = credit("tx-1", "500.00", "INV-2025-007");
        BankTransaction weak = credit("tx-2", "120.00", "unrelated text");
        givenCredits(strong, weak);
        Invoice inv7 = invoice("inv-7", "INV-2025-007", "500.00", LocalDate.of(2025, 3, 30));
        Invoice inv8 = invoice("inv-8", "INV-2025-008", "100.00", LocalDate.of(2025, 3, 11));
        when(invoiceLedger.findUnpaidOutbound(ACCOUNT)).thenReturn(List.of(inv7, inv8));

        ReconciliationSummary summary = service.reconcile(ACCOUNT);

        assertThat(summary).isEqualTo(new ReconciliationSummary(ACCOUNT, 2, 1, 1));
        verify(invoiceLedger).markPaid(eq("inv-7"), eq("tx-1"), any());
        verify(bankTransactionRepository).claimMatch(eq("tx-1"), eq("inv-7"), eq(MatchStatus.AUTO_MATCHED), eq(90),
                eq("reconciliation-engine"), any());
        verify(bankTransactionRepository).recordSuggestion("tx-2", "inv-8", 10);
        verify(invoiceLedger, never()).markPaid(eq("inv-8"), anyString(), any());
    }

    @Test
    @DisplayName("an invoice claimed by one credit is not offered to the next")
    void invoiceUsedOnce() {
        givenCredits(credit("tx-1", "500.00", "INV-2025-007"), credit("tx-2", "500.00", "INV-2025-007"));
        when(invoiceLedger.findUnpaidOutbound(ACCOUNT))
                .thenReturn(List.of(invoice("inv-7", "INV-2025-007", "500.00", null)));

        ReconciliationSummary summary = service.reconcile(ACCOUNT);

        assertThat(summary.autoMatched()).isEqualTo(1);
        assertThat(summary.belowThreshold()).isEqualTo(1);
        verify(invoiceLedger, never()).markPaid(eq("inv-7"), eq("tx-2"), any());
        verify(bankTransactionRepository, never()).recordSuggestion(eq("tx-2"), anyString(), anyInt());
    }

    @Test
    @DisplayName("invoice paid concurrently: the next qualifying candidate is tried")
    void fallsThroughToNextCandidate() {
        givenCredits(credit("tx-1", "500.00", "INV-2025-007"));
        Invoice first = invoice("inv-a", "INV-2025-007", "500.00", LocalDate.of(2025, 1, 1));
        Invoice second = invoice("inv-b", "X", "500.00", LocalDate.of(2025, 2, 1));
        second.setPaymentReference("INV-2025-007");
        when(invoiceLedger.findUnpaidOutbound(ACCOUNT)).thenReturn(List.of(first, second));
        when(invoiceLedger.markPaid(eq("inv-a"), eq("tx-1"), any())).thenReturn(false);

        ReconciliationSummary summary = service.reconcile(ACCOUNT);

        assertThat(summary.autoMatched()).isEqualTo(1);
        verify(bankTransactionRepository).claimMatch(eq("tx-1"), eq("inv-b"), eq(MatchStatus.AUTO_MATCHED), anyInt(), anyString(), any());
    }

    @Test
    @DisplayName("transaction matched elsewhere meanwhile: the invoice stamp is released")
    void transactionClaimLost() {
        givenCredits(credit("tx-1", "500.00", "INV-2025-007"));
        when(invoiceLedger.findUnpaidOutbound(ACCOUNT))
                .thenReturn(List.of(invoice("inv-7", "INV-2025-007", "500.00", null)));
        when(bankTransactionRepository.claimMatch(anyString(), anyString(), any(), anyInt(), anyString(), any())).thenReturn(false);

        ReconciliationSummary summary = service.reconcile(ACCOUNT);

        assertThat(summary.autoMatched()).isZero();
        verify(invoiceLedger).clearPaid("inv-7", "tx-1");
    }

    @Test
    void noCreditsSkipsInvoiceLookup() {
        givenCredits();

        assertThat(service.reconcile(ACCOUNT)).isEqualTo(new ReconciliationSummary(ACCOUNT, 0, 0, 0));
        verify(invoiceLedger, never()).findUnpaidOutbound(anyString());
    }

    @Test
    void ingestionEventTriggersReconcileAndContainsFailures() {
        when(bankTransactionRepository.findByAccountIdAndMatchStatusAndDirectionOrderByBookingDateAscIdAsc(
                ACCOUNT, MatchStatus.UNMATCHED, TransactionDirection.INCOMING)).thenThrow(new IllegalStateException("db down"));

        service.onTransactionsIngested(new TransactionsIngestedEvent(ACCOUNT, 3));

        verify(bankTransactionRepository).findByAccountIdAndMatchStatusAndDirectionOrderByBookingDateAscIdAsc(
                ACCOUNT, MatchStatus.UNMATCHED, TransactionDirection.INCOMING);
    }

    private void givenCredits(BankTransaction... credits) {
        when(bankTransactionRepository.findByAccountIdAndMatchStatusAndDirectionOrderByBookingDateAscIdAsc(
                ACCOUNT, MatchStatus.UNMATCHED, TransactionDirection.INCOMING)).thenReturn(List.of(credits));
    }

    private static BankTransaction credit(String id, String amount, String reference) {
        BankTransaction tx = new BankTransaction();
        tx.setId(id);
        tx.setAccountId(ACCOUNT);
        tx.setDirection(TransactionDirection.INCOMING);
        tx.setAmount(new BigDecimal(amount));
        tx.setReference(reference);
        tx.setBookingDate(LocalDate.of(2025, 3, 10));
        return tx;
    }

    private static Invoice invoice(String id, String number, String total, LocalDate dueDate) {
        Invoice invoice = new Invoice();
        invoice.setId(id);
        invoice.setAccountId(ACCOUNT);
        invoice.setInvoiceNumber(number);
        invoice.setDirection(Invoice.InvoiceDirection.OUTBOUND);
        invoice.setTotalAmount(new BigDecimal(total));
        invoice.setDueDate(dueDate);
        return invoice;
    }
}
