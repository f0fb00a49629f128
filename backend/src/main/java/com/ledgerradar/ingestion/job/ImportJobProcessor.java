package com.ledgerradar.ingestion.job;

import com.ledgerradar.domain.ImportAdvisory;
import com.ledgerradar.domain.ImportJob;
import com.ledgerradar.domain.ImportJob.ImportStatus;
import com.ledgerradar.domain.ImportJobRepository;
import com.ledgerradar.domain.TierType;
import com.ledgerradar.ingestion.config.ExtractionProperties;
import com.ledgerradar.ingestion.config.ImportJobProperties;
import com.ledgerradar.ingestion.csv.CsvImportOutcome;
import com.ledgerradar.ingestion.csv.CsvImportProcessor;
import com.ledgerradar.ingestion.error.JobCancelledException;
import com.ledgerradar.ingestion.error.StatementImportException;
import com.ledgerradar.ingestion.pipeline.PdfStatementPipeline;
import com.ledgerradar.ingestion.store.JobCancellationRegistry;
import com.ledgerradar.ingestion.store.PageDraft;
import com.ledgerradar.ingestion.store.PersistedStatement;
import com.ledgerradar.ingestion.store.StatementDraft;
import com.ledgerradar.ingestion.store.StatementFileStore;
import com.ledgerradar.ingestion.store.StatementPersistenceService;
import com.ledgerradar.ingestion.xml.Camt053Extractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Runs one import job end to end: claim, route by format, extract, persist, terminal state.
 * Typed import failures fail the job with their reason; cancellation abandons it without writes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ImportJobProcessor {

    private final ImportJobRepository importJobRepository;
    private final ImportProgressTracker importProgressTracker;
    private final JobCancellationRegistry jobCancellationRegistry;
    private final StatementFileStore statementFileStore;
    private final Camt053Extractor camt053Extractor;
    private final PdfStatementPipeline pdfStatementPipeline;
    private final CsvImportProcessor csvImportProcessor;
    private final StatementPersistenceService statementPersistenceService;
    private final ImportJobProperties importJobProperties;
    private final ExtractionProperties extractionProperties;

    public void process(String jobId) {
        Optional<ImportJob> found = importJobRepository.findById(jobId);
        if (found.isEmpty()) {
            log.debug("Import job {} no longer exists", jobId);
            return;
        }
        ImportJob job = found.get();
        if (job.getStatus().isTerminal()) {
            log.debug("Import job {} already {}", jobId, job.getStatus());
            return;
        }
        if (jobCancellationRegistry.isCancelled(jobId)) {
            log.debug("Import job {} was cancelled before start", jobId);
            return;
        }
        if (job.getStatus() == ImportStatus.PENDING) {
            if (!importProgressTracker.claim(jobId)) {
                log.debug("Import job {} claimed elsewhere", jobId);
                return;
            }
            job.setStatus(ImportStatus.PROCESSING);
            log.info("Import job {} PROCESSING: account {}, {} {}", jobId, job.getAccountId(), job.getFormat(), job.getFileName());
        } else {
            log.info("Import job {} resumed after restart", jobId);
        }

        jobCancellationRegistry.startClock(jobId, Duration.ofMillis(importJobProperties.getJobTimeoutMs()));
        try {
            run(job);
            if (importProgressTracker.finish(job)) {
                log.info("Import job {} {}: tier {}, {} transaction(s), {} page(s) failed",
                        jobId, job.getStatus(), job.getTierUsed(), job.getTransactionsInserted(), job.getPagesFailed());
            }
        } catch (JobCancelledException e) {
            log.info("Import job {} abandoned: cancelled while processing", jobId);
        } catch (StatementImportException e) {
            log.warn("Import job {} FAILED ({}): {}", jobId, e.getCode(), e.getMessage());
            importProgressTracker.fail(jobId, e.getCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Import job {} failed unexpectedly: {}", jobId, e.getMessage(), e);
            importProgressTracker.fail(jobId, null, "Unexpected processing error: " + e.getMessage());
        } finally {
            jobCancellationRegistry.release(jobId);
        }
    }

    private void run(ImportJob job) {
        byte[] content = statementFileStore.load(job.getStorageKey());
        jobCancellationRegistry.checkpoint(job.getId());
        switch (job.getFormat()) {
            case CAMT053_XML -> applyStatement(job,
                    camt053Extractor.extract(content, extractionProperties.getDefaultCurrency()));
            case PDF -> applyStatement(job, pdfStatementPipeline.process(job, content,
                    (total, resolved, failed) -> importProgressTracker.reportPages(job.getId(), total, resolved, failed)));
            case CSV -> applyCsv(job, csvImportProcessor.process(job, content));
        }
    }

    private void applyStatement(ImportJob job, StatementDraft draft) {
        PersistedStatement persisted = statementPersistenceService.persist(job, draft);
        int failedPages = draft.failedPages();
        job.setStatementId(persisted.statement().getId());
        job.setTierUsed(draft.tierUsed());
        job.setPagesTotal(draft.pages().size());
        job.setPagesProcessed(draft.pages().size());
        job.setPagesFailed(failedPages);
        job.setTransactionsInserted(persisted.transactionsWritten());
        if (persisted.statement().isGapDetected()) {
            job.addAdvisory(ImportAdvisory.SEQUENCE_GAP_DETECTED);
        }
        if (failedPages > 0) {
            job.setStatus(ImportStatus.NEEDS_REVIEW);
            job.setFailureReason(describeFailedPages(draft));
        } else {
            job.setStatus(ImportStatus.VERIFIED);
        }
    }

    private void applyCsv(ImportJob job, CsvImportOutcome outcome) {
        job.setTierUsed(TierType.CSV);
        job.setTransactionsInserted(outcome.summary().inserted());
        job.setDuplicatesSkipped(outcome.summary().strictDuplicates());
        job.setDuplicatesFlagged(outcome.summary().flagged());
        job.setRowsRejected(outcome.rowsRejected());
        if (outcome.rowsRejected() > 0) {
            job.addAdvisory(ImportAdvisory.ROWS_REJECTED);
        }
        if (outcome.summary().flagged() > 0) {
            job.addAdvisory(ImportAdvisory.POTENTIAL_DUPLICATES_FLAGGED);
        }
        if (outcome.needsReview()) {
            job.setStatus(ImportStatus.NEEDS_REVIEW);
            job.setFailureReason(outcome.rowsRejected() + " row(s) rejected, "
                    + outcome.summary().flagged() + " potential duplicate(s) flagged for review");
        } else {
            job.setStatus(ImportStatus.VERIFIED);
        }
    }

    static String describeFailedPages(StatementDraft draft) {
        return draft.pages().stream()
                .filter(PageDraft::failed)
                .map(p -> "page " + p.pageNumber() + ": " + p.failureCode()
                        + (p.discrepancy() != null ? " (discrepancy " + p.discrepancy().toPlainString() + ")" : ""))
                .collect(Collectors.joining("; ", "Pages failed audit after vision repair: ", ""));
    }
}
