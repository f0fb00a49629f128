package com.ledgerradar.ingestion.store;

import com.ledgerradar.domain.TierType;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Everything the persistence layer needs to write one statement atomically.
 * A null sequence number means "next in the account's chain".
 */
public record StatementDraft(
        String externalStatementId,
        Long sequenceNumber,
        LocalDate periodStart,
        LocalDate periodEnd,
        LocalDate statementDate,
        BigDecimal openingBalance,
        BigDecimal closingBalance,
        String currency,
        String iban,
        TierType tierUsed,
        List<PageDraft> pages
) {
    public StatementDraft {
        pages = pages == null ? List.of() : List.copyOf(pages);
    }

    public int failedPages() {
        return (int) pages.stream().filter(PageDraft::failed).count();
    }

    public int lineCount() {
        return pages.stream().mapToInt(p -> p.lines().size()).sum();
    }
}
