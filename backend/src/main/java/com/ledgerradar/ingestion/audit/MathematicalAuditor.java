package com.ledgerradar.ingestion.audit;

import com.ledgerradar.ingestion.config.AuditProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Recomputes a page's closing balance from its opening balance and signed transactions and compares it with the
 * claimed closing balance. Exact decimal arithmetic; tolerance is inclusive. Stateless.
 */
@Component
public class MathematicalAuditor {

    private final BigDecimal tolerance;

    @Autowired
    public MathematicalAuditor(AuditProperties properties) {
        this(properties.getTolerance());
    }

    public MathematicalAuditor(BigDecimal tolerance) {
        this.tolerance = Objects.requireNonNull(tolerance, "tolerance").abs();
    }

    /**
     * @param signedAmounts incoming positive, outgoing negative
     */
    public AuditVerdict audit(BigDecimal opening, List<BigDecimal> signedAmounts, BigDecimal claimedClosing) {
        if (opening == null || claimedClosing == null) {
            return AuditVerdict.missingBalances();
        }
        BigDecimal expected = opening;
        for (BigDecimal amount : signedAmounts) {
            expected = expected.add(amount);
        }
        BigDecimal discrepancy = claimedClosing.subtract(expected).abs();
        return discrepancy.compareTo(tolerance) <= 0
                ? AuditVerdict.verified(expected, discrepancy)
                : AuditVerdict.mismatch(expected, discrepancy);
    }

    public BigDecimal getTolerance() {
        return tolerance;
    }
}
