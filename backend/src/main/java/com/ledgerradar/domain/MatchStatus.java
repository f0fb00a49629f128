package com.ledgerradar.domain;

public enum MatchStatus {
    UNMATCHED,
    AUTO_MATCHED,
    MANUALLY_MATCHED,
    IGNORED;

    public boolean isMatched() {
        return this == AUTO_MATCHED || this == MANUALLY_MATCHED;
    }
}
