package com.ledgerradar.ingestion.job;

import com.ledgerradar.domain.ImportErrorCode;
import com.ledgerradar.domain.ImportJob;
import com.ledgerradar.domain.ImportJob.ImportStatus;
import com.ledgerradar.domain.PageCheckpoint;
import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Instant;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Writes import job state with conditional updates: each write names the status it expects, so a job
 * deleted or finished elsewhere is never resurrected or moved backwards.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ImportProgressTracker {

    private final MongoTemplate mongoTemplate;

    /**
     * PENDING to PROCESSING. Happens once per job.
     *
     * @return false when another worker claimed it or it left PENDING
     */
    public boolean claim(String jobId) {
        Query query = new Query(where("_id").is(jobId).and("status").is(ImportStatus.PENDING));
        Update update = new Update()
                .set("status", ImportStatus.PROCESSING)
                .set("startedAt", Instant.now());
        return modified(mongoTemplate.updateFirst(query, update, ImportJob.class));
    }

    public void reportPages(String jobId, int pagesTotal, int pagesProcessed, int pagesFailed) {
        Query query = new Query(where("_id").is(jobId).and("status").is(ImportStatus.PROCESSING));
        Update update = new Update()
                .set("pagesTotal", pagesTotal)
                .set("pagesProcessed", pagesProcessed)
                .set("pagesFailed", pagesFailed);
        mongoTemplate.updateFirst(query, update, ImportJob.class);
    }

    /**
     * Writes the terminal outcome carried by {@code job} (status, tier, counters, advisories).
     *
     * @return false when the job is gone or no longer PROCESSING
     */
    public boolean finish(ImportJob job) {
        ImportJobStateMachine.requireTransition(ImportStatus.PROCESSING, job.getStatus());
        Instant now = Instant.now();
        job.setCompletedAt(now);
        Query query = new Query(where("_id").is(job.getId()).and("status").is(ImportStatus.PROCESSING));
        Update update = new Update()
                .set("status", job.getStatus())
                .set("tierUsed", job.getTierUsed())
                .set("pagesTotal", job.getPagesTotal())
                .set("pagesProcessed", job.getPagesProcessed())
                .set("pagesFailed", job.getPagesFailed())
                .set("statementId", job.getStatementId())
                .set("transactionsInserted", job.getTransactionsInserted())
                .set("duplicatesSkipped", job.getDuplicatesSkipped())
                .set("duplicatesFlagged", job.getDuplicatesFlagged())
                .set("rowsRejected", job.getRowsRejected())
                .set("advisories", job.getAdvisories())
                .set("failureReason", job.getFailureReason())
                .set("completedAt", now);
        boolean written = modified(mongoTemplate.updateFirst(query, update, ImportJob.class));
        if (!written) {
            log.warn("Import job {} outcome {} not written: job no longer PROCESSING", job.getId(), job.getStatus());
        }
        return written;
    }

    /**
     * Marks the job FAILED from PENDING or PROCESSING with a human-readable reason and drops its page checkpoints;
     * failed jobs are never resumed.
     */
    public boolean fail(String jobId, ImportErrorCode code, String reason) {
        Instant now = Instant.now();
        Query query = new Query(where("_id").is(jobId)
                .and("status").in(ImportJobStateMachine.sourcesOf(ImportStatus.FAILED)));
        Update update = new Update()
                .set("status", ImportStatus.FAILED)
                .set("failureCode", code)
                .set("failureReason", reason)
                .set("completedAt", now);
        boolean written = modified(mongoTemplate.updateFirst(query, update, ImportJob.class));
        if (written) {
            mongoTemplate.remove(new Query(where("importJobId").is(jobId)), PageCheckpoint.class);
        }
        return written;
    }

    private static boolean modified(UpdateResult result) {
        return result.getModifiedCount() == 1;
    }
}
