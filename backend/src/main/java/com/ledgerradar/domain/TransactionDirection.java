package com.ledgerradar.domain;

import java.math.BigDecimal;

/**
 * Money flow relative to the account: INCOMING = credit, OUTGOING = debit.
 */
public enum TransactionDirection {
    INCOMING,
    OUTGOING;

    /** Absolute amount with the sign of this direction. */
    public BigDecimal signed(BigDecimal absoluteAmount) {
        if (absoluteAmount == null) {
            return null;
        }
        BigDecimal abs = absoluteAmount.abs();
        return this == INCOMING ? abs : abs.negate();
    }

    public static TransactionDirection ofSigned(BigDecimal signedAmount) {
        return signedAmount.signum() < 0 ? OUTGOING : INCOMING;
    }
}
