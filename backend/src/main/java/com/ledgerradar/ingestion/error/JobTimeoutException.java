package com.ledgerradar.ingestion.error;

import com.ledgerradar.domain.ImportErrorCode;

import java.time.Duration;

/**
 * The whole job ran past its time limit. Distinct from per-call {@link ExtractionTimeoutException}s, which
 * only demote a page.
 */
public class JobTimeoutException extends StatementImportException {

    public JobTimeoutException(String jobId, Duration limit) {
        super(ImportErrorCode.EXTRACTION_TIMEOUT, "Import job " + jobId + " exceeded its time limit of " + limit.toMinutes() + " min");
    }
}
