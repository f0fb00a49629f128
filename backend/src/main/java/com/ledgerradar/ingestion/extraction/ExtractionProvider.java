package com.ledgerradar.ingestion.extraction;

/**
 * Structured page extraction capability. Implementations may call any model vendor but must fail with
 * the typed extraction exceptions, never with raw client errors.
 */
public interface ExtractionProvider {

    String name();

    /**
     * @throws com.ledgerradar.ingestion.error.ExtractionTimeoutException         call exceeded its timeout
     * @throws com.ledgerradar.ingestion.error.ExtractionSchemaViolationException output did not match the page schema
     * @throws com.ledgerradar.ingestion.error.ExtractionTransientException       retryable network/HTTP failure
     * @throws com.ledgerradar.ingestion.error.ExtractionProviderException        non-retryable provider failure
     */
    PageCandidate extract(PageContext context);
}
