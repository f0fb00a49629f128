package com.ledgerradar.ingestion.error;

import com.ledgerradar.domain.ImportErrorCode;
import lombok.Getter;

/**
 * Same file content already uploaded for the account. Recoverable by resubmitting with overwrite.
 */
@Getter
public class DuplicateUploadException extends StatementImportException {

    private final String existingJobId;

    public DuplicateUploadException(String existingJobId) {
        super(ImportErrorCode.DUPLICATE_UPLOAD,
                "This file was already uploaded for the account (job " + existingJobId + "); resubmit with overwrite to replace it");
        this.existingJobId = existingJobId;
    }
}
