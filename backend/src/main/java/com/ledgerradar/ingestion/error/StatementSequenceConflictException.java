package com.ledgerradar.ingestion.error;

import com.ledgerradar.domain.ImportErrorCode;
import lombok.Getter;

/**
 * The account already has a statement with this sequence number from a different upload.
 * Recoverable by deleting that statement first.
 */
@Getter
public class StatementSequenceConflictException extends StatementImportException {

    private final long sequenceNumber;
    private final String existingJobId;

    public StatementSequenceConflictException(String accountId, long sequenceNumber, String existingJobId) {
        super(ImportErrorCode.STATEMENT_SEQUENCE_CONFLICT,
                "Account " + accountId + " already has statement #" + sequenceNumber + " (job " + existingJobId
                        + "); delete it before importing a replacement");
        this.sequenceNumber = sequenceNumber;
        this.existingJobId = existingJobId;
    }
}
