package com.ledgerradar.ingestion.extraction;

import java.math.BigDecimal;
import java.util.List;

/**
 * Structured extraction result for one page: transactions plus the balances printed at the page boundaries.
 */
public record PageCandidate(
        List<CandidateTransaction> transactions,
        BigDecimal pageStartBalance,
        BigDecimal pageEndBalance,
        CandidateMetadata metadata
) {

    public PageCandidate {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
        metadata = metadata == null ? CandidateMetadata.EMPTY : metadata;
    }

    public List<BigDecimal> signedAmounts() {
        return transactions.stream().map(CandidateTransaction::signedAmount).toList();
    }

    /**
     * Repair responses may leave out balances that were already right; keep the prior ones in that case.
     */
    public PageCandidate withMissingBalancesFrom(PageCandidate prior) {
        if (prior == null) {
            return this;
        }
        return new PageCandidate(
                transactions,
                pageStartBalance != null ? pageStartBalance : prior.pageStartBalance(),
                pageEndBalance != null ? pageEndBalance : prior.pageEndBalance(),
                metadata);
    }
}
