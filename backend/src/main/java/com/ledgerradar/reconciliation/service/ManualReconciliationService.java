package com.ledgerradar.reconciliation.service;

import com.ledgerradar.common.ResourceNotFoundException;
import com.ledgerradar.domain.BankTransaction;
import com.ledgerradar.domain.BankTransactionRepository;
import com.ledgerradar.domain.Invoice;
import com.ledgerradar.domain.MatchStatus;
import com.ledgerradar.reconciliation.ledger.InvoiceLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * User reconciliation actions: match to a chosen invoice, unmatch, ignore.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ManualReconciliationService {

    public static final String TRANSACTION_NOT_FOUND = "TRANSACTION_NOT_FOUND";
    public static final String INVOICE_NOT_FOUND = "INVOICE_NOT_FOUND";

    private final BankTransactionRepository bankTransactionRepository;
    private final InvoiceLedger invoiceLedger;

    /**
     * Links the transaction to the invoice with confidence 100 and stamps the invoice paid.
     *
     * @throws IllegalStateException transaction already matched elsewhere, or invoice paid by another transaction
     */
    public BankTransaction match(String transactionId, String invoiceId, String actor) {
        BankTransaction tx = requireTransaction(transactionId);
        Invoice invoice = invoiceLedger.findById(invoiceId)
                .orElseThrow(() -> new ResourceNotFoundException(INVOICE_NOT_FOUND, "Invoice not found: " + invoiceId));
        if (tx.getMatchStatus() == MatchStatus.MANUALLY_MATCHED && invoiceId.equals(tx.getMatchedInvoiceId())) {
            return tx;
        }
        if (tx.getMatchStatus() != MatchStatus.UNMATCHED) {
            throw new IllegalStateException("Transaction " + transactionId + " is " + tx.getMatchStatus() + "; unmatch first");
        }
        if (invoice.isPaid()) {
            throw new IllegalStateException("Invoice " + invoiceId + " is already paid by " + invoice.getPaidByTransactionId());
        }
        Instant now = Instant.now();
        if (!invoiceLedger.markPaid(invoiceId, transactionId, now)) {
            throw new IllegalStateException("Invoice " + invoiceId + " was paid concurrently");
        }
        if (!bankTransactionRepository.claimMatch(transactionId, invoiceId, MatchStatus.MANUALLY_MATCHED, 100, actor, now)) {
            invoiceLedger.clearPaid(invoiceId, transactionId);
            throw new IllegalStateException("Transaction " + transactionId + " was matched concurrently");
        }
        log.info("Transaction {} manually matched to invoice {} by {}", transactionId, invoiceId, actor);
        return requireTransaction(transactionId);
    }

    /** Releases a match (auto or manual) or an ignore; the invoice loses its payment stamp. */
    public BankTransaction unmatch(String transactionId) {
        BankTransaction tx = requireTransaction(transactionId);
        if (tx.getMatchStatus() == MatchStatus.UNMATCHED) {
            return tx;
        }
        String previousInvoice = tx.getMatchedInvoiceId();
        if (!bankTransactionRepository.releaseMatch(transactionId, tx.getMatchStatus(), previousInvoice, Instant.now())) {
            throw new IllegalStateException("Transaction " + transactionId + " changed concurrently; reload and retry");
        }
        if (tx.getMatchStatus().isMatched() && previousInvoice != null) {
            invoiceLedger.clearPaid(previousInvoice, transactionId);
        }
        log.info("Transaction {} unmatched (was invoice {})", transactionId, previousInvoice);
        return requireTransaction(transactionId);
    }

    /** Excludes the transaction from reconciliation. Matched transactions must be unmatched first. */
    public BankTransaction ignore(String transactionId) {
        BankTransaction tx = requireTransaction(transactionId);
        if (tx.getMatchStatus() == MatchStatus.IGNORED) {
            return tx;
        }
        if (tx.getMatchStatus().isMatched()) {
            throw new IllegalStateException("Transaction " + transactionId + " is " + tx.getMatchStatus() + "; unmatch first");
        }
        if (!bankTransactionRepository.markIgnored(transactionId, Instant.now())) {
            throw new IllegalStateException("Transaction " + transactionId + " was matched concurrently; unmatch first");
        }
        return requireTransaction(transactionId);
    }

    private BankTransaction requireTransaction(String transactionId) {
        return bankTransactionRepository.findById(transactionId)
                .orElseThrow(() -> new ResourceNotFoundException(TRANSACTION_NOT_FOUND, "Transaction not found: " + transactionId));
    }
}
