package com.ledgerradar.ingestion.store;

import com.ledgerradar.domain.ImportErrorCode;
import com.ledgerradar.domain.PageStatus;
import com.ledgerradar.domain.StatementLine;
import com.ledgerradar.domain.TierType;

import java.math.BigDecimal;
import java.util.List;

/**
 * A resolved page waiting to be written with its statement.
 */
public record PageDraft(
        int pageNumber,
        PageStatus status,
        TierType tierUsed,
        ImportErrorCode failureCode,
        BigDecimal pageStartBalance,
        BigDecimal pageEndBalance,
        BigDecimal discrepancy,
        String rawText,
        List<StatementLine> lines
) {
    public PageDraft {
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    public boolean failed() {
        return status == PageStatus.FAILED;
    }
}
