package com.ledgerradar.ingestion.job;

import com.ledgerradar.common.ResourceNotFoundException;
import com.ledgerradar.domain.ImportJob;
import com.ledgerradar.domain.ImportJob.Acceptance;
import com.ledgerradar.domain.ImportJob.ImportStatus;
import com.ledgerradar.domain.ImportJobRepository;
import com.ledgerradar.domain.StatementRepository;
import com.ledgerradar.ingestion.config.ImportJobProperties;
import com.ledgerradar.ingestion.store.ImportJobRemover;
import com.ledgerradar.ingestion.store.StatementFileStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Pull interface and user actions on import jobs: status, listing, confirm/reject, delete.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ImportJobService {

    public static final String JOB_NOT_FOUND = "IMPORT_JOB_NOT_FOUND";

    private final ImportJobRepository importJobRepository;
    private final StatementRepository statementRepository;
    private final ImportJobRemover importJobRemover;
    private final StatementFileStore statementFileStore;
    private final ImportJobProperties importJobProperties;

    public Optional<ImportJob> status(String jobId) {
        return importJobRepository.findById(jobId);
    }

    public List<ImportJob> listForAccount(String accountId) {
        return importJobRepository.findByAccountIdOrderByCreatedAtDesc(accountId);
    }

    /**
     * Accepts a finished job. The statement it produced is locked against deletion and overwrite.
     * Repeating a confirmation is a no-op.
     */
    public ImportJob confirm(String jobId) {
        ImportJob job = require(jobId);
        if (job.getStatus() != ImportStatus.NEEDS_REVIEW && job.getStatus() != ImportStatus.VERIFIED) {
            throw new IllegalStateException("Import job " + jobId + " is " + job.getStatus() + " and cannot be confirmed");
        }
        if (!decide(job, Acceptance.CONFIRMED)) {
            return job;
        }
        Instant now = Instant.now();
        statementRepository.findByImportJobId(jobId).ifPresent(statement -> {
            statement.setLocked(true);
            statement.setLockedAt(now);
            statementRepository.save(statement);
        });
        log.info("Import job {} CONFIRMED; statement {} locked", jobId, job.getStatementId());
        return job;
    }

    /** Rejects a job waiting for review. Its data stays until the job is deleted. */
    public ImportJob reject(String jobId) {
        ImportJob job = require(jobId);
        if (job.getStatus() != ImportStatus.NEEDS_REVIEW) {
            throw new IllegalStateException("Only NEEDS_REVIEW jobs can be rejected; job " + jobId + " is " + job.getStatus());
        }
        if (decide(job, Acceptance.REJECTED)) {
            log.info("Import job {} REJECTED", jobId);
        }
        return job;
    }

    /**
     * Deletes the job and the statement data it owns. A running job is cancelled at its next checkpoint.
     *
     * @throws IllegalStateException the job's statement is confirmed and locked
     */
    public void delete(String jobId) {
        importJobRemover.remove(require(jobId));
    }

    /** Drops stored upload files of jobs finished longer than the retention period ago. Runs every hour. */
    @Scheduled(fixedRate = 3600_000)
    public void purgeExpiredUploads() {
        Instant cutoff = Instant.now().minus(Duration.ofHours(importJobProperties.getFileRetentionHours()));
        List<ImportJob> expired = importJobRepository.findByStatusInAndCompletedAtBefore(
                Set.of(ImportStatus.VERIFIED, ImportStatus.NEEDS_REVIEW, ImportStatus.FAILED), cutoff);
        int purged = 0;
        for (ImportJob job : expired) {
            if (job.getStorageKey() == null) continue;
            statementFileStore.delete(job.getStorageKey());
            job.setStorageKey(null);
            importJobRepository.save(job);
            purged++;
        }
        if (purged > 0) {
            log.info("Purged {} stored upload(s) finished before {}", purged, cutoff);
        }
    }

    /** @return false when the same decision was already recorded */
    private boolean decide(ImportJob job, Acceptance decision) {
        if (job.getAcceptance() == decision) {
            return false;
        }
        if (job.getAcceptance() != null) {
            throw new IllegalStateException("Import job " + job.getId() + " was already " + job.getAcceptance());
        }
        job.setAcceptance(decision);
        job.setAcceptedAt(Instant.now());
        importJobRepository.save(job);
        return true;
    }

    private ImportJob require(String jobId) {
        return importJobRepository.findById(jobId)
                .orElseThrow(() -> new ResourceNotFoundException(JOB_NOT_FOUND, "Import job not found: " + jobId));
    }
}
