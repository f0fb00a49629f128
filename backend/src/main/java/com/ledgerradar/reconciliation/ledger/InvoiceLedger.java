package com.ledgerradar.reconciliation.ledger;

import com.ledgerradar.domain.Invoice;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Invoice collaborator consumed by reconciliation. Reconciliation never creates or edits invoices beyond
 * the payment stamp.
 */
public interface InvoiceLedger {

    List<Invoice> findUnpaidOutbound(String accountId);

    Optional<Invoice> findById(String invoiceId);

    /**
     * Stamps the invoice as paid by the given transaction if it is still unpaid.
     *
     * @return true when this call stamped the invoice
     */
    boolean markPaid(String invoiceId, String transactionId, Instant paidAt);

    /** Removes the payment stamp left by the given transaction; no-op if another transaction paid it. */
    void clearPaid(String invoiceId, String transactionId);
}
