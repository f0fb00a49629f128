package com.ledgerradar.ingestion.tier;

import com.ledgerradar.ingestion.audit.AuditVerdict;
import com.ledgerradar.ingestion.audit.MathematicalAuditor;
import com.ledgerradar.ingestion.extraction.ExtractionProvider;
import com.ledgerradar.ingestion.extraction.PageCandidate;
import com.ledgerradar.ingestion.extraction.PageCandidateParser;
import com.ledgerradar.ingestion.extraction.PageContext;
import com.ledgerradar.ingestion.error.StatementImportException;
import com.ledgerradar.ingestion.pdf.PdfPageRenderer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Tier 3: repairs a page that failed tier 2. The vision model gets the rendered page, its text and the failed
 * candidate, and the repaired candidate is audited again.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VisionFallbackTier {

    @Qualifier("visionExtractionProvider")
    private final ExtractionProvider visionExtractionProvider;
    private final MathematicalAuditor auditor;
    private final PdfPageRenderer renderer;
    private final PageCandidateParser parser;

    /**
     * @param prior failed text-tier candidate, or null when tier 2 produced none
     */
    public TierOutcome run(PageContext context, byte[] pdf, PageCandidate prior) {
        String image;
        try {
            image = renderer.renderPngBase64(pdf, context.pageNumber());
        } catch (StatementImportException e) {
            log.warn("Cannot render page {} for vision repair: {}", context.pageNumber(), e.getMessage());
            return TierOutcome.extractionFailed(TierFailure.RENDER_FAILED, e.getMessage());
        }
        PageContext visionContext = context.withImage(image, prior == null ? null : parser.toJson(prior));

        PageCandidate repaired;
        try {
            repaired = visionExtractionProvider.extract(visionContext).withMissingBalancesFrom(prior);
        } catch (StatementImportException e) {
            log.warn("Vision tier extraction failed on page {}: {} {}", context.pageNumber(), e.getCode(), e.getMessage());
            return TierOutcome.extractionFailed(TierFailure.fromErrorCode(e.getCode()), e.getMessage());
        }
        AuditVerdict verdict = auditor.audit(repaired.pageStartBalance(), repaired.signedAmounts(), repaired.pageEndBalance());
        if (verdict.verified()) {
            log.info("Vision tier repaired page {} ({} transactions)", context.pageNumber(), repaired.transactions().size());
            return TierOutcome.verified(repaired, verdict);
        }
        TierOutcome outcome = TierOutcome.auditFailed(repaired, verdict);
        log.warn("Vision tier could not repair page {}: {} ({})", context.pageNumber(), outcome.getFailure(), outcome.getDetail());
        return outcome;
    }
}
