package com.ledgerradar.ingestion.dedup;

import com.ledgerradar.domain.BankTransaction;

/**
 * Classification of one incoming row against the existing ledger.
 *
 * @param match      the existing transaction it duplicates, null for NEW
 * @param similarity description similarity 0..100, only meaningful for FUZZY
 */
public record DuplicateVerdict(Kind kind, BankTransaction match, double similarity, String rule) {

    public enum Kind {
        STRICT,
        FUZZY,
        NEW
    }

    public static DuplicateVerdict strict(BankTransaction match, String rule) {
        return new DuplicateVerdict(Kind.STRICT, match, 100.0, rule);
    }

    public static DuplicateVerdict fuzzy(BankTransaction match, double similarity) {
        return new DuplicateVerdict(Kind.FUZZY, match, similarity, "fuzzy");
    }

    public static DuplicateVerdict newTransaction() {
        return new DuplicateVerdict(Kind.NEW, null, 0.0, null);
    }
}
