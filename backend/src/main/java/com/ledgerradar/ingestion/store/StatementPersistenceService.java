package com.ledgerradar.ingestion.store;

import com.ledgerradar.domain.ImportJob;
import com.ledgerradar.domain.PageCheckpointRepository;
import com.ledgerradar.domain.TransactionsIngestedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Persists a fully resolved statement: serialized per account, written atomically, then announced.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatementPersistenceService {

    private final AccountLockRegistry accountLockRegistry;
    private final StatementChainWriter statementChainWriter;
    private final JobCancellationRegistry jobCancellationRegistry;
    private final PageCheckpointRepository pageCheckpointRepository;
    private final ApplicationEventPublisher applicationEventPublisher;

    public PersistedStatement persist(ImportJob job, StatementDraft draft) {
        jobCancellationRegistry.checkpoint(job.getId());
        PersistedStatement result = accountLockRegistry.withAccountLock(job.getAccountId(), () -> {
            jobCancellationRegistry.checkpoint(job.getId());
            return statementChainWriter.write(job, draft);
        });
        pageCheckpointRepository.deleteByImportJobId(job.getId());

        var statement = result.statement();
        if (statement.isGapDetected()) {
            log.warn("Sequence gap on account {}: statement {} (seq {}) does not continue seq {}",
                    job.getAccountId(), statement.getId(), statement.getSequenceNumber(), statement.getPreviousSequenceNumber());
        }
        log.info("Statement {} persisted for job {}: seq {}, {} page(s), {} transaction(s)",
                statement.getId(), job.getId(), statement.getSequenceNumber(), draft.pages().size(), result.transactionsWritten());
        if (result.transactionsWritten() > 0) {
            applicationEventPublisher.publishEvent(
                    new TransactionsIngestedEvent(job.getAccountId(), result.transactionsWritten()));
        }
        return result;
    }
}
