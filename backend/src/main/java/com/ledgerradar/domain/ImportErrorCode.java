package com.ledgerradar.domain;

/**
 * Error and advisory codes surfaced on import jobs and API error bodies.
 */
public enum ImportErrorCode {
    UNSUPPORTED_FORMAT,
    OVERSIZED_FILE,
    DUPLICATE_UPLOAD,
    EXTRACTION_TIMEOUT,
    EXTRACTION_SCHEMA_VIOLATION,
    EXTRACTION_PROVIDER_ERROR,
    MISSING_PAGE_BALANCES,
    MATH_MISMATCH,
    SEQUENCE_GAP_DETECTED,
    STATEMENT_SEQUENCE_CONFLICT,
    RECONCILIATION_BELOW_THRESHOLD,
    MALFORMED_STATEMENT,
    CSV_PARSE_ERROR,
    JOB_CANCELLED
}
