package com.ledgerradar.ingestion.audit;

import java.math.BigDecimal;

/**
 * Result of one balance audit. {@code expectedClosing} and {@code discrepancy} are null when balances were missing.
 *
 * @param discrepancy absolute difference between claimed and computed closing balance
 */
public record AuditVerdict(boolean verified, Failure failure, BigDecimal expectedClosing, BigDecimal discrepancy) {

    public enum Failure {
        MISSING_BALANCES,
        MATH_MISMATCH
    }

    public static AuditVerdict verified(BigDecimal expectedClosing, BigDecimal discrepancy) {
        return new AuditVerdict(true, null, expectedClosing, discrepancy);
    }

    public static AuditVerdict mismatch(BigDecimal expectedClosing, BigDecimal discrepancy) {
        return new AuditVerdict(false, Failure.MATH_MISMATCH, expectedClosing, discrepancy);
    }

    public static AuditVerdict missingBalances() {
        return new AuditVerdict(false, Failure.MISSING_BALANCES, null, null);
    }
}
