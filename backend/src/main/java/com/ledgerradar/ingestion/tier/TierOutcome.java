package com.ledgerradar.ingestion.tier;

import com.ledgerradar.ingestion.audit.AuditVerdict;
import com.ledgerradar.ingestion.extraction.PageCandidate;
import lombok.Getter;

/**
 * Result of running one tier on one page: a verified candidate, or a failure. A failed outcome still carries
 * the candidate and verdict when extraction succeeded but the audit did not.
 */
@Getter
public class TierOutcome {

    private final PageCandidate candidate;
    private final AuditVerdict verdict;
    private final TierFailure failure;
    private final String detail;

    private TierOutcome(PageCandidate candidate, AuditVerdict verdict, TierFailure failure, String detail) {
        this.candidate = candidate;
        this.verdict = verdict;
        this.failure = failure;
        this.detail = detail;
    }

    public static TierOutcome verified(PageCandidate candidate, AuditVerdict verdict) {
        return new TierOutcome(candidate, verdict, null, null);
    }

    public static TierOutcome auditFailed(PageCandidate candidate, AuditVerdict verdict) {
        String detail = verdict.failure() == AuditVerdict.Failure.MISSING_BALANCES
                ? "page balances missing"
                : "expected closing " + verdict.expectedClosing().toPlainString()
                        + ", discrepancy " + verdict.discrepancy().toPlainString();
        return new TierOutcome(candidate, verdict, TierFailure.fromAudit(verdict.failure()), detail);
    }

    public static TierOutcome extractionFailed(TierFailure failure, String detail) {
        return new TierOutcome(null, null, failure, detail);
    }

    public boolean isVerified() {
        return failure == null;
    }
}
