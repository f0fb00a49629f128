package com.ledgerradar.domain;

/**
 * Application event: an import job was created in PENDING. Consumed by the import job runner.
 */
public record ImportJobQueuedEvent(String jobId) {
}
