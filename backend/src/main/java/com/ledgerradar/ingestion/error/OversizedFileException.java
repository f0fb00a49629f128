package com.ledgerradar.ingestion.error;

import com.ledgerradar.domain.ImportErrorCode;
import lombok.Getter;

@Getter
public class OversizedFileException extends StatementImportException {

    /** -1 when the upload was cut off before its size was known. */
    private final long sizeBytes;
    private final long maxBytes;

    public OversizedFileException(long sizeBytes, long maxBytes) {
        super(ImportErrorCode.OVERSIZED_FILE, "File is " + sizeBytes + " bytes; limit is " + maxBytes);
        this.sizeBytes = sizeBytes;
        this.maxBytes = maxBytes;
    }

    public OversizedFileException(long maxBytes) {
        super(ImportErrorCode.OVERSIZED_FILE, "File exceeds the limit of " + maxBytes + " bytes");
        this.sizeBytes = -1;
        this.maxBytes = maxBytes;
    }
}
