package com.ledgerradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;

/**
 * One physical page of a statement, with the balances the extraction reported for it.
 * Status follows {@link PageStatus#canTransitionTo(PageStatus)}.
 */
@Document(collection = "statement_pages")
@CompoundIndex(name = "statement_page_uniq", def = "{'statementId': 1, 'pageNumber': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class StatementPage {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String statementId;
    private int pageNumber;
    private BigDecimal pageStartBalance;
    private BigDecimal pageEndBalance;
    private PageStatus status = PageStatus.PENDING;
    private TierType tierUsed;
    /** Audit or extraction failure code for FAILED pages. */
    private ImportErrorCode failureCode;
    private BigDecimal discrepancy;
    private String rawText;

    public void transitionTo(PageStatus next) {
        if (status == next) {
            return;
        }
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Page " + pageNumber + " cannot move from " + status + " to " + next);
        }
        status = next;
    }
}
