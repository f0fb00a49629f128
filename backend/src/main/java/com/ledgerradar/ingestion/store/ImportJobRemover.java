package com.ledgerradar.ingestion.store;

import com.ledgerradar.domain.ImportJob;
import com.ledgerradar.domain.ImportJobRepository;
import com.ledgerradar.domain.PageCheckpointRepository;
import com.ledgerradar.domain.PotentialDuplicateRepository;
import com.ledgerradar.domain.Statement;
import com.ledgerradar.domain.StatementRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Deletes an import job with the statement data it owns. In-flight work is cancelled first so it
 * cannot write after the removal. Locked statements block deletion.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ImportJobRemover {

    private final ImportJobRepository importJobRepository;
    private final StatementRepository statementRepository;
    private final PageCheckpointRepository pageCheckpointRepository;
    private final PotentialDuplicateRepository potentialDuplicateRepository;
    private final StatementChainWriter statementChainWriter;
    private final AccountLockRegistry accountLockRegistry;
    private final JobCancellationRegistry jobCancellationRegistry;
    private final StatementFileStore statementFileStore;

    public void remove(ImportJob job) {
        statementRepository.findByImportJobId(job.getId())
                .filter(Statement::isLocked)
                .ifPresent(s -> {
                    throw new IllegalStateException("Statement " + s.getId() + " of job " + job.getId() + " is confirmed and locked");
                });
        jobCancellationRegistry.cancel(job.getId());

        accountLockRegistry.withAccountLock(job.getAccountId(), () -> {
            Optional<Statement> statement = statementRepository.findByImportJobId(job.getId());
            statement.ifPresent(statementChainWriter::remove);
            return statement.isPresent();
        });
        pageCheckpointRepository.deleteByImportJobId(job.getId());
        potentialDuplicateRepository.deleteByImportJobId(job.getId());
        statementFileStore.delete(job.getStorageKey());
        importJobRepository.deleteById(job.getId());
        log.info("Import job {} removed (account {}, status {})", job.getId(), job.getAccountId(), job.getStatus());
    }
}
