package com.ledgerradar.reconciliation.service;

/**
 * Outcome of one reconciliation pass over an account.
 *
 * @param belowThreshold credits left UNMATCHED (no candidate reached the auto-match threshold)
 */
public record ReconciliationSummary(String accountId, int scanned, int autoMatched, int belowThreshold) {
}
