package com.ledgerradar.domain;

/**
 * Page lifecycle: PENDING → VERIFIED, or PENDING → NEEDS_VISION → VERIFIED | FAILED. Never regresses.
 */
public enum PageStatus {
    PENDING,
    NEEDS_VISION,
    VERIFIED,
    FAILED;

    public boolean isTerminal() {
        return this == VERIFIED || this == FAILED;
    }

    public boolean canTransitionTo(PageStatus next) {
        return switch (this) {
            case PENDING -> next == NEEDS_VISION || next == VERIFIED;
            case NEEDS_VISION -> next == VERIFIED || next == FAILED;
            case VERIFIED, FAILED -> false;
        };
    }
}
