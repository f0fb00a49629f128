package com.ledgerradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for statements.
 */
public interface StatementRepository extends MongoRepository<Statement, String> {

    Optional<Statement> findByImportJobId(String importJobId);

    Optional<Statement> findByAccountIdAndSequenceNumber(String accountId, long sequenceNumber);

    /** Most recent statement strictly before the given sequence number. */
    Optional<Statement> findFirstByAccountIdAndSequenceNumberLessThanOrderBySequenceNumberDesc(
            String accountId, long sequenceNumber);

    /** Nearest statement strictly after the given sequence number. */
    Optional<Statement> findFirstByAccountIdAndSequenceNumberGreaterThanOrderBySequenceNumberAsc(
            String accountId, long sequenceNumber);

    Optional<Statement> findFirstByAccountIdOrderBySequenceNumberDesc(String accountId);

    List<Statement> findByAccountIdOrderBySequenceNumberAsc(String accountId);
}
