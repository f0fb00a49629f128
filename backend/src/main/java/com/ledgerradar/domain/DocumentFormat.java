package com.ledgerradar.domain;

/**
 * Uploaded statement file format as decided by the format router.
 */
public enum DocumentFormat {
    CAMT053_XML,
    PDF,
    CSV
}
