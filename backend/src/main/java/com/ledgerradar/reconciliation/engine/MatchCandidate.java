package com.ledgerradar.reconciliation.engine;

import com.ledgerradar.domain.Invoice;

/**
 * One scored invoice for a credit transaction.
 *
 * @param score  0..100
 * @param reason which signals contributed, e.g. "Reference match, Exact amount"
 */
public record MatchCandidate(Invoice invoice, int score, String reason) {

    public String invoiceId() {
        return invoice.getId();
    }
}
