package com.ledgerradar.ingestion.error;

import com.ledgerradar.domain.ImportErrorCode;

/**
 * Thrown at a cancellation checkpoint once the job was deleted; unwinds in-flight work without writing.
 */
public class JobCancelledException extends StatementImportException {

    public JobCancelledException(String jobId) {
        super(ImportErrorCode.JOB_CANCELLED, "Import job " + jobId + " was cancelled");
    }
}
