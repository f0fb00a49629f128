package com.ledgerradar.ingestion.dedup;

import com.ledgerradar.common.ResourceNotFoundException;
import com.ledgerradar.domain.BankTransaction;
import com.ledgerradar.domain.BankTransactionRepository;
import com.ledgerradar.domain.PotentialDuplicate;
import com.ledgerradar.domain.PotentialDuplicate.ReviewStatus;
import com.ledgerradar.domain.PotentialDuplicateRepository;
import com.ledgerradar.domain.TransactionsIngestedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Manual resolution of flagged fuzzy duplicates. Repeating a resolution is a no-op; reversing one is refused.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DuplicateReviewService {

    private final PotentialDuplicateRepository potentialDuplicateRepository;
    private final BankTransactionRepository bankTransactionRepository;
    private final ApplicationEventPublisher applicationEventPublisher;

    public List<PotentialDuplicate> pending(String accountId) {
        return potentialDuplicateRepository.findByAccountIdAndStatusOrderByCreatedAtDesc(accountId, ReviewStatus.PENDING_REVIEW);
    }

    /** Inserts the held-back candidate as a new unmatched transaction. */
    public PotentialDuplicate keep(String potentialDuplicateId) {
        PotentialDuplicate duplicate = load(potentialDuplicateId);
        if (duplicate.getStatus() == ReviewStatus.KEPT) {
            return duplicate;
        }
        requirePending(duplicate, ReviewStatus.KEPT);
        BankTransaction tx = BankTransaction.fromLine(duplicate.getCandidate(), duplicate.getAccountId(), duplicate.getSource());
        tx.setImportJobId(duplicate.getImportJobId());
        tx = bankTransactionRepository.save(tx);

        duplicate.setStatus(ReviewStatus.KEPT);
        duplicate.setResolvedTransactionId(tx.getId());
        duplicate.setResolvedAt(Instant.now());
        duplicate = potentialDuplicateRepository.save(duplicate);
        log.info("Potential duplicate {} kept as transaction {}", potentialDuplicateId, tx.getId());
        applicationEventPublisher.publishEvent(new TransactionsIngestedEvent(duplicate.getAccountId(), 1));
        return duplicate;
    }

    public PotentialDuplicate dismiss(String potentialDuplicateId) {
        PotentialDuplicate duplicate = load(potentialDuplicateId);
        if (duplicate.getStatus() == ReviewStatus.DISMISSED) {
            return duplicate;
        }
        requirePending(duplicate, ReviewStatus.DISMISSED);
        duplicate.setStatus(ReviewStatus.DISMISSED);
        duplicate.setResolvedAt(Instant.now());
        log.info("Potential duplicate {} dismissed", potentialDuplicateId);
        return potentialDuplicateRepository.save(duplicate);
    }

    private PotentialDuplicate load(String id) {
        return potentialDuplicateRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("POTENTIAL_DUPLICATE_NOT_FOUND", "Potential duplicate not found: " + id));
    }

    private static void requirePending(PotentialDuplicate duplicate, ReviewStatus target) {
        if (duplicate.getStatus() != ReviewStatus.PENDING_REVIEW) {
            throw new IllegalStateException("Potential duplicate " + duplicate.getId() + " is already "
                    + duplicate.getStatus() + " and cannot become " + target);
        }
    }
}
