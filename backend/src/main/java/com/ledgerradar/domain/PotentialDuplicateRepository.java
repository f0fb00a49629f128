package com.ledgerradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface PotentialDuplicateRepository extends MongoRepository<PotentialDuplicate, String> {

    List<PotentialDuplicate> findByAccountIdAndStatusOrderByCreatedAtDesc(
            String accountId, PotentialDuplicate.ReviewStatus status);

    boolean existsByAccountIdAndExistingTransactionIdAndCandidateKeyAndStatus(
            String accountId, String existingTransactionId, String candidateKey, PotentialDuplicate.ReviewStatus status);

    void deleteByImportJobId(String importJobId);
}
