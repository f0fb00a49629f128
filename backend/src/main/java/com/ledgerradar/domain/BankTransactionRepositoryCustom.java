package com.ledgerradar.domain;

import java.time.Instant;

/**
 * Conditional updates on bank_transactions that must not race with concurrent reconciliation.
 */
public interface BankTransactionRepositoryCustom {

    /**
     * Links the transaction to an invoice only if it is still UNMATCHED.
     *
     * @return true when this call performed the match
     */
    boolean claimMatch(String transactionId, String invoiceId, MatchStatus status, int confidence,
                       String actor, Instant matchedAt);

    /** Stores the best below-threshold suggestion on an UNMATCHED transaction. */
    void recordSuggestion(String transactionId, String invoiceId, int confidence);

    /**
     * Writes corrected booking date, amount and direction only while the stored match status is still
     * {@code expectedStatus}.
     *
     * @return false when the transaction changed status since it was read
     */
    boolean applyCorrection(BankTransaction corrected, MatchStatus expectedStatus);

    /**
     * Returns a matched or ignored transaction to UNMATCHED if it still has the status and invoice it was read with.
     *
     * @return true when this call released the transaction
     */
    boolean releaseMatch(String transactionId, MatchStatus expectedStatus, String expectedInvoiceId, Instant releasedAt);

    /** UNMATCHED to IGNORED; false when the transaction is no longer UNMATCHED. */
    boolean markIgnored(String transactionId, Instant ignoredAt);
}
