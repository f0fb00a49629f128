package com.ledgerradar.ingestion.tier;

import com.ledgerradar.domain.ImportErrorCode;
import com.ledgerradar.ingestion.audit.AuditVerdict;

/**
 * Why a tier did not verify a page. Extraction failures never reach the auditor; audit failures carry a verdict.
 */
public enum TierFailure {
    TIMEOUT(ImportErrorCode.EXTRACTION_TIMEOUT),
    SCHEMA_VIOLATION(ImportErrorCode.EXTRACTION_SCHEMA_VIOLATION),
    PROVIDER_ERROR(ImportErrorCode.EXTRACTION_PROVIDER_ERROR),
    RENDER_FAILED(ImportErrorCode.MALFORMED_STATEMENT),
    MISSING_BALANCES(ImportErrorCode.MISSING_PAGE_BALANCES),
    MATH_MISMATCH(ImportErrorCode.MATH_MISMATCH);

    private final ImportErrorCode errorCode;

    TierFailure(ImportErrorCode errorCode) {
        this.errorCode = errorCode;
    }

    public ImportErrorCode errorCode() {
        return errorCode;
    }

    public static TierFailure fromErrorCode(ImportErrorCode code) {
        if (code == ImportErrorCode.EXTRACTION_TIMEOUT) {
            return TIMEOUT;
        }
        if (code == ImportErrorCode.EXTRACTION_SCHEMA_VIOLATION) {
            return SCHEMA_VIOLATION;
        }
        return PROVIDER_ERROR;
    }

    public static TierFailure fromAudit(AuditVerdict.Failure failure) {
        return failure == AuditVerdict.Failure.MISSING_BALANCES ? MISSING_BALANCES : MATH_MISMATCH;
    }
}
