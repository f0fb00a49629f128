package com.ledgerradar.domain;

/**
 * Application event: new ledger transactions were written for an account (statement, CSV or sync feed).
 * Consumed by reconciliation.
 */
public record TransactionsIngestedEvent(String accountId, int inserted) {
}
