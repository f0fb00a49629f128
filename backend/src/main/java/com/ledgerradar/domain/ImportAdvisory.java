package com.ledgerradar.domain;

/**
 * Non-blocking conditions reported on a job even when it otherwise succeeds.
 */
public enum ImportAdvisory {
    /** A previous upload with the same checksum was replaced on explicit request. */
    DUPLICATE_UPLOAD_OVERWRITTEN,
    SEQUENCE_GAP_DETECTED,
    POTENTIAL_DUPLICATES_FLAGGED,
    /** Some CSV rows could not be parsed and were skipped. */
    ROWS_REJECTED
}
