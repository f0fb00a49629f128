package com.ledgerradar.ingestion.pipeline;

import com.ledgerradar.config.AsyncConfig;
import com.ledgerradar.domain.ImportJob;
import com.ledgerradar.domain.PageCheckpoint;
import com.ledgerradar.domain.PageCheckpointRepository;
import com.ledgerradar.domain.PageStatus;
import com.ledgerradar.domain.StatementLine;
import com.ledgerradar.domain.TierType;
import com.ledgerradar.ingestion.config.ExtractionProperties;
import com.ledgerradar.ingestion.error.MalformedStatementException;
import com.ledgerradar.ingestion.error.StatementImportException;
import com.ledgerradar.ingestion.extraction.CandidateMetadata;
import com.ledgerradar.ingestion.extraction.CandidateTransaction;
import com.ledgerradar.ingestion.extraction.PageCandidate;
import com.ledgerradar.ingestion.extraction.PageContext;
import com.ledgerradar.ingestion.pdf.PdfPageTextExtractor;
import com.ledgerradar.ingestion.store.JobCancellationRegistry;
import com.ledgerradar.ingestion.store.PageDraft;
import com.ledgerradar.ingestion.store.StatementDraft;
import com.ledgerradar.ingestion.tier.TextExtractionTier;
import com.ledgerradar.ingestion.tier.TierOutcome;
import com.ledgerradar.ingestion.tier.VisionFallbackTier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * PDF path: text tier, auditor and vision repair per page, pages in parallel up to the configured cap.
 * Every resolved page is checkpointed so a resumed job skips it; a page stuck at NEEDS_VISION resumes at the
 * vision tier with its checkpointed candidate. Failed pages are isolated: they keep their best candidate and
 * only make the job need review.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PdfStatementPipeline {

    private record ResolvedPage(PageDraft draft, CandidateMetadata metadata) {}

    private final PdfPageTextExtractor textExtractor;
    private final TextExtractionTier textTier;
    private final VisionFallbackTier visionTier;
    private final PageCheckpointRepository checkpointRepository;
    private final JobCancellationRegistry cancellationRegistry;
    private final ExtractionProperties properties;
    @Qualifier(AsyncConfig.PAGE_EXECUTOR)
    private final Executor pageExecutor;

    /**
     * @throws MalformedStatementException the PDF cannot be read, or no page yielded a transaction or balance
     */
    public StatementDraft process(ImportJob job, byte[] pdf, PageProgressCallback progress) {
        String jobId = job.getId();
        List<String> texts = textExtractor.extractPages(pdf);
        int pageCount = texts.size();

        Map<Integer, PageCheckpoint> checkpoints = new ConcurrentHashMap<>(checkpointRepository.findByImportJobId(jobId).stream()
                .collect(Collectors.toMap(PageCheckpoint::getPageNumber, Function.identity(), (a, b) -> a)));
        AtomicInteger resolved = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();
        List<ResolvedPage> pages = new ArrayList<>(pageCount);
        List<CompletableFuture<ResolvedPage>> futures = new ArrayList<>();
        Semaphore permits = new Semaphore(Math.max(1, properties.getPageConcurrency()));

        for (int pageNumber = 1; pageNumber <= pageCount; pageNumber++) {
            PageContext context = PageContext.forText(pageNumber, pageCount, texts.get(pageNumber - 1), properties.getDefaultCurrency());
            PageCheckpoint checkpoint = checkpoints.get(pageNumber);
            if (checkpoint != null && checkpoint.getStatus().isTerminal()) {
                ResolvedPage page = fromCheckpoint(checkpoint, context.text());
                pages.add(page);
                count(page, resolved, failed, pageCount, progress);
                continue;
            }
            cancellationRegistry.checkpoint(jobId);
            acquire(permits);
            CompletableFuture<ResolvedPage> future;
            try {
                future = CompletableFuture.supplyAsync(() -> resolvePage(jobId, pdf, context, checkpoints), pageExecutor);
            } catch (RuntimeException e) {
                permits.release();
                throw e;
            }
            futures.add(future.whenComplete((page, error) -> {
                permits.release();
                if (page != null) {
                    count(page, resolved, failed, pageCount, progress);
                }
            }));
        }
        if (!pages.isEmpty()) {
            log.info("Job {}: resumed {} of {} page(s) from checkpoints", jobId, pages.size(), pageCount);
        }
        for (CompletableFuture<ResolvedPage> future : futures) {
            pages.add(join(future));
        }
        pages.sort(Comparator.comparingInt(p -> p.draft().pageNumber()));
        return toStatement(jobId, pages);
    }

    private ResolvedPage resolvePage(String jobId, byte[] pdf, PageContext context, Map<Integer, PageCheckpoint> checkpoints) {
        PageCheckpoint existing = checkpoints.get(context.pageNumber());
        PageCandidate prior;
        CandidateMetadata metadata;
        if (existing != null && existing.getStatus() == PageStatus.NEEDS_VISION) {
            prior = candidateOf(existing);
            metadata = metadataOf(existing);
        } else {
            cancellationRegistry.checkpoint(jobId);
            TierOutcome text = textTier.run(context);
            if (text.isVerified()) {
                return save(jobId, context, checkpoints, PageStatus.VERIFIED, TierType.TEXT_LLM, text, text.getCandidate());
            }
            prior = text.getCandidate();
            metadata = prior == null ? CandidateMetadata.EMPTY : prior.metadata();
            save(jobId, context, checkpoints, PageStatus.NEEDS_VISION, TierType.TEXT_LLM, text, prior);
        }

        cancellationRegistry.checkpoint(jobId);
        TierOutcome vision = visionTier.run(context, pdf, prior);
        PageCandidate best = vision.getCandidate() != null ? vision.getCandidate() : prior;
        if (best != null && best.metadata() == CandidateMetadata.EMPTY && metadata != CandidateMetadata.EMPTY) {
            best = new PageCandidate(best.transactions(), best.pageStartBalance(), best.pageEndBalance(), metadata);
        }
        PageStatus status = vision.isVerified() ? PageStatus.VERIFIED : PageStatus.FAILED;
        if (status == PageStatus.FAILED) {
            log.warn("Job {}: page {} failed after vision repair ({}: {})",
                    jobId, context.pageNumber(), vision.getFailure(), vision.getDetail());
        }
        return save(jobId, context, checkpoints, status, TierType.VISION_LLM, vision, best);
    }

    private ResolvedPage save(String jobId, PageContext context, Map<Integer, PageCheckpoint> checkpoints,
                              PageStatus status, TierType tier, TierOutcome outcome, PageCandidate candidate) {
        String currency = candidate != null && candidate.metadata().currency() != null
                ? candidate.metadata().currency()
                : context.defaultCurrency();
        List<StatementLine> lines = candidate == null ? List.of()
                : candidate.transactions().stream().map(t -> t.toLine(currency)).toList();
        PageDraft draft = new PageDraft(
                context.pageNumber(),
                status,
                tier,
                outcome.isVerified() ? null : outcome.getFailure().errorCode(),
                candidate == null ? null : candidate.pageStartBalance(),
                candidate == null ? null : candidate.pageEndBalance(),
                outcome.getVerdict() == null ? null : outcome.getVerdict().discrepancy(),
                context.text(),
                lines);
        CandidateMetadata metadata = candidate == null ? CandidateMetadata.EMPTY : candidate.metadata();

        PageCheckpoint checkpoint = checkpoints.getOrDefault(context.pageNumber(), new PageCheckpoint());
        checkpoint.setImportJobId(jobId);
        checkpoint.setPageNumber(context.pageNumber());
        checkpoint.setStatus(status);
        checkpoint.setTierUsed(tier);
        checkpoint.setFailureCode(draft.failureCode());
        checkpoint.setPageStartBalance(draft.pageStartBalance());
        checkpoint.setPageEndBalance(draft.pageEndBalance());
        checkpoint.setDiscrepancy(draft.discrepancy());
        checkpoint.setSequenceNumber(metadata.sequenceNumber());
        checkpoint.setStatementDate(metadata.statementDate());
        checkpoint.setPeriodStart(metadata.periodStart());
        checkpoint.setPeriodEnd(metadata.periodEnd());
        checkpoint.setCurrency(metadata.currency());
        checkpoint.setIban(metadata.iban());
        checkpoint.setLines(new ArrayList<>(lines));
        checkpoint.setUpdatedAt(Instant.now());
        checkpoints.put(context.pageNumber(), checkpointRepository.save(checkpoint));
        return new ResolvedPage(draft, metadata);
    }

    private static ResolvedPage fromCheckpoint(PageCheckpoint checkpoint, String rawText) {
        PageDraft draft = new PageDraft(
                checkpoint.getPageNumber(),
                checkpoint.getStatus(),
                checkpoint.getTierUsed(),
                checkpoint.getFailureCode(),
                checkpoint.getPageStartBalance(),
                checkpoint.getPageEndBalance(),
                checkpoint.getDiscrepancy(),
                rawText,
                checkpoint.getLines());
        return new ResolvedPage(draft, metadataOf(checkpoint));
    }

    private static PageCandidate candidateOf(PageCheckpoint checkpoint) {
        List<CandidateTransaction> transactions = checkpoint.getLines().stream().map(CandidateTransaction::fromLine).toList();
        return new PageCandidate(transactions, checkpoint.getPageStartBalance(), checkpoint.getPageEndBalance(), metadataOf(checkpoint));
    }

    private static CandidateMetadata metadataOf(PageCheckpoint checkpoint) {
        return new CandidateMetadata(checkpoint.getSequenceNumber(), checkpoint.getStatementDate(),
                checkpoint.getPeriodStart(), checkpoint.getPeriodEnd(), checkpoint.getCurrency(), checkpoint.getIban());
    }

    /**
     * Statement balances come from the first page that shows an opening balance and the last page that shows a
     * closing one; header facts from the first page that carries them.
     */
    private StatementDraft toStatement(String jobId, List<ResolvedPage> pages) {
        boolean coherent = pages.stream().anyMatch(p -> !p.draft().lines().isEmpty()
                || p.draft().pageStartBalance() != null || p.draft().pageEndBalance() != null);
        if (!coherent) {
            throw new MalformedStatementException("No page of the PDF yielded a transaction or balance");
        }
        BigDecimal opening = pages.stream().map(p -> p.draft().pageStartBalance()).filter(Objects::nonNull).findFirst().orElse(null);
        BigDecimal closing = null;
        for (int i = pages.size() - 1; i >= 0 && closing == null; i--) {
            closing = pages.get(i).draft().pageEndBalance();
        }
        List<LocalDate> dates = pages.stream().flatMap(p -> p.draft().lines().stream())
                .map(StatementLine::getBookingDate).filter(Objects::nonNull).sorted().toList();
        LocalDate periodStart = firstMeta(pages, CandidateMetadata::periodStart);
        LocalDate periodEnd = firstMeta(pages, CandidateMetadata::periodEnd);
        if (periodStart == null && !dates.isEmpty()) {
            periodStart = dates.get(0);
        }
        if (periodEnd == null && !dates.isEmpty()) {
            periodEnd = dates.get(dates.size() - 1);
        }
        LocalDate statementDate = firstMeta(pages, CandidateMetadata::statementDate);
        String currency = firstMeta(pages, CandidateMetadata::currency);
        boolean visionUsed = pages.stream().anyMatch(p -> p.draft().tierUsed() == TierType.VISION_LLM);

        StatementDraft draft = new StatementDraft(
                null,
                firstMeta(pages, CandidateMetadata::sequenceNumber),
                periodStart,
                periodEnd,
                statementDate != null ? statementDate : periodEnd,
                opening,
                closing,
                currency != null ? currency : properties.getDefaultCurrency(),
                firstMeta(pages, CandidateMetadata::iban),
                visionUsed ? TierType.VISION_LLM : TierType.TEXT_LLM,
                pages.stream().map(ResolvedPage::draft).toList());
        log.info("Job {}: {} page(s) resolved, {} failed, {} transaction(s), tier {}",
                jobId, pages.size(), draft.failedPages(), draft.lineCount(), draft.tierUsed());
        return draft;
    }

    private static <T> T firstMeta(List<ResolvedPage> pages, Function<CandidateMetadata, T> field) {
        return pages.stream().map(ResolvedPage::metadata).map(field).filter(Objects::nonNull).findFirst().orElse(null);
    }

    private static void count(ResolvedPage page, AtomicInteger resolved, AtomicInteger failed, int pageCount,
                              PageProgressCallback progress) {
        int failedNow = page.draft().failed() ? failed.incrementAndGet() : failed.get();
        progress.reportProgress(pageCount, resolved.incrementAndGet(), failedNow);
    }

    private static void acquire(Semaphore permits) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for a page slot", e);
        }
    }

    /** Unwraps page failures; cancellation and job timeouts surface as themselves. */
    private static ResolvedPage join(CompletableFuture<ResolvedPage> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof StatementImportException sie) {
                throw sie;
            }
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw e;
        }
    }
}
