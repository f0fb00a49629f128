package com.ledgerradar.domain;

/**
 * Where a ledger transaction came from.
 */
public enum TransactionSource {
    /** CSV upload. */
    MANUAL_IMPORT,
    /** CAMT.053 XML or PDF statement. */
    FILE_IMPORT,
    /** Open-banking provider feed. */
    PROVIDER_SYNC
}
