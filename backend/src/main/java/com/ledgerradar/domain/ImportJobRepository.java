package com.ledgerradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for import_jobs.
 */
public interface ImportJobRepository extends MongoRepository<ImportJob, String> {

    Optional<ImportJob> findByAccountIdAndChecksum(String accountId, String checksum);

    List<ImportJob> findByStatusIn(Collection<ImportJob.ImportStatus> statuses);

    List<ImportJob> findByAccountIdOrderByCreatedAtDesc(String accountId);

    List<ImportJob> findByStatusInAndCompletedAtBefore(Collection<ImportJob.ImportStatus> statuses, Instant cutoff);
}
