package com.ledgerradar.ingestion.tier;

import com.ledgerradar.ingestion.audit.AuditVerdict;
import com.ledgerradar.ingestion.audit.MathematicalAuditor;
import com.ledgerradar.ingestion.extraction.ExtractionProvider;
import com.ledgerradar.ingestion.extraction.PageCandidate;
import com.ledgerradar.ingestion.extraction.PageContext;
import com.ledgerradar.ingestion.error.StatementImportException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Tier 2: page text through the text model, then the auditor.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TextExtractionTier {

    @Qualifier("textExtractionProvider")
    private final ExtractionProvider textExtractionProvider;
    private final MathematicalAuditor auditor;

    public TierOutcome run(PageContext context) {
        PageCandidate candidate;
        try {
            candidate = textExtractionProvider.extract(context);
        } catch (StatementImportException e) {
            log.warn("Text tier extraction failed on page {}: {} {}", context.pageNumber(), e.getCode(), e.getMessage());
            return TierOutcome.extractionFailed(TierFailure.fromErrorCode(e.getCode()), e.getMessage());
        }
        AuditVerdict verdict = auditor.audit(candidate.pageStartBalance(), candidate.signedAmounts(), candidate.pageEndBalance());
        if (verdict.verified()) {
            return TierOutcome.verified(candidate, verdict);
        }
        TierOutcome outcome = TierOutcome.auditFailed(candidate, verdict);
        log.info("Text tier audit failed on page {}: {} ({})", context.pageNumber(), outcome.getFailure(), outcome.getDetail());
        return outcome;
    }
}
