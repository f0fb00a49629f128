package com.ledgerradar.ingestion.dedup;

import com.ledgerradar.common.ReferenceNormalizer;
import com.ledgerradar.domain.BankTransaction;
import com.ledgerradar.domain.BankTransactionRepository;
import com.ledgerradar.domain.PotentialDuplicate;
import com.ledgerradar.domain.PotentialDuplicateRepository;
import com.ledgerradar.domain.StatementLine;
import com.ledgerradar.domain.TransactionSource;
import com.ledgerradar.domain.TransactionsIngestedEvent;
import com.ledgerradar.ingestion.config.DeduplicationProperties;
import com.ledgerradar.ingestion.store.AccountLockRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs CSV and sync-feed batches through the {@link TransactionDeduplicator} and writes the outcome: NEW rows become
 * unmatched transactions, FUZZY rows become potential duplicates (once per pending review), STRICT rows are counted
 * and dropped. Rows inserted earlier in the same batch take part in the comparison, so in-batch repeats are strict
 * duplicates.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeduplicationService {

    private final TransactionDeduplicator deduplicator;
    private final BankTransactionRepository bankTransactionRepository;
    private final PotentialDuplicateRepository potentialDuplicateRepository;
    private final AccountLockRegistry accountLockRegistry;
    private final DeduplicationProperties properties;
    private final ApplicationEventPublisher applicationEventPublisher;

    /**
     * @param importJobId owning import job, null for sync-feed batches
     */
    public DeduplicationSummary ingest(String accountId, TransactionSource source, String importJobId, List<StatementLine> incoming) {
        if (incoming == null || incoming.isEmpty()) {
            return DeduplicationSummary.empty();
        }
        DeduplicationSummary summary = accountLockRegistry.withAccountLock(accountId,
                () -> ingestLocked(accountId, source, importJobId, incoming));
        log.info("Dedup {} batch for account {}: {} received, {} inserted, {} strict duplicate(s) skipped, {} flagged",
                source, accountId, summary.received(), summary.inserted(), summary.strictDuplicates(), summary.flagged());
        if (summary.inserted() > 0) {
            applicationEventPublisher.publishEvent(new TransactionsIngestedEvent(accountId, summary.inserted()));
        }
        return summary;
    }

    private DeduplicationSummary ingestLocked(String accountId, TransactionSource source, String importJobId,
                                              List<StatementLine> incoming) {
        Map<String, BankTransaction> pool = loadPool(accountId, incoming);
        int inserted = 0;
        int strict = 0;
        int flagged = 0;
        for (StatementLine line : incoming) {
            DuplicateVerdict verdict = deduplicator.classify(line, pool.values());
            switch (verdict.kind()) {
                case STRICT -> {
                    strict++;
                    log.debug("Strict duplicate of {} by {}: {} {} {}", verdict.match().getId(), verdict.rule(),
                            line.getBookingDate(), line.signedAmount(), line.getReference());
                }
                case FUZZY -> {
                    flagged++;
                    String key = candidateKey(line);
                    if (potentialDuplicateRepository.existsByAccountIdAndExistingTransactionIdAndCandidateKeyAndStatus(
                            accountId, verdict.match().getId(), key, PotentialDuplicate.ReviewStatus.PENDING_REVIEW)) {
                        log.debug("Potential duplicate of {} already awaits review: {}", verdict.match().getId(), key);
                        continue;
                    }
                    potentialDuplicateRepository.save(potentialDuplicate(accountId, source, importJobId, line, key, verdict));
                    log.debug("Potential duplicate of {} ({}% similar): {} {}", verdict.match().getId(),
                            Math.round(verdict.similarity()), line.getBookingDate(), line.signedAmount());
                }
                case NEW -> {
                    BankTransaction tx = BankTransaction.fromLine(line, accountId, source);
                    tx.setImportJobId(importJobId);
                    tx = bankTransactionRepository.save(tx);
                    pool.put(tx.getId(), tx);
                    inserted++;
                }
            }
        }
        return new DeduplicationSummary(incoming.size(), inserted, strict, flagged);
    }

    /** Existing transactions the batch can collide with: its date span widened by the window, plus external-id hits. */
    private Map<String, BankTransaction> loadPool(String accountId, List<StatementLine> incoming) {
        Map<String, BankTransaction> pool = new LinkedHashMap<>();
        List<LocalDate> dates = incoming.stream().map(StatementLine::getBookingDate).filter(Objects::nonNull).toList();
        if (!dates.isEmpty()) {
            int window = properties.getDateWindowDays() + 1;
            LocalDate from = dates.stream().min(Comparator.naturalOrder()).orElseThrow().minusDays(window);
            LocalDate to = dates.stream().max(Comparator.naturalOrder()).orElseThrow().plusDays(window);
            bankTransactionRepository.findByAccountIdAndBookingDateBetween(accountId, from, to)
                    .forEach(tx -> pool.put(tx.getId(), tx));
        }
        List<String> externalIds = incoming.stream()
                .map(StatementLine::getExternalId)
                .filter(id -> id != null && !id.isBlank())
                .map(String::strip)
                .distinct()
                .toList();
        if (!externalIds.isEmpty()) {
            bankTransactionRepository.findByAccountIdAndExternalIdIn(accountId, externalIds)
                    .forEach(tx -> pool.putIfAbsent(tx.getId(), tx));
        }
        return pool;
    }

    /** Identifies a held-back row across repeated feeds, so one pending review covers every redelivery. */
    static String candidateKey(StatementLine line) {
        String externalId = line.getExternalId();
        if (externalId != null && !externalId.isBlank()) {
            return "ext:" + externalId.strip();
        }
        BigDecimal signed = line.signedAmount();
        String description = ReferenceNormalizer.key(TransactionDeduplicator.similarityText(
                line.getDescription(), line.getCounterpartyName(), line.getReference()));
        return "line:" + line.getBookingDate()
                + "|" + (signed == null ? "" : signed.stripTrailingZeros().toPlainString())
                + "|" + (description == null ? "" : description);
    }

    private static PotentialDuplicate potentialDuplicate(String accountId, TransactionSource source, String importJobId,
                                                         StatementLine line, String candidateKey, DuplicateVerdict verdict) {
        PotentialDuplicate duplicate = new PotentialDuplicate();
        duplicate.setAccountId(accountId);
        duplicate.setExistingTransactionId(verdict.match().getId());
        duplicate.setCandidate(line.copy());
        duplicate.setCandidateKey(candidateKey);
        duplicate.setSource(source);
        duplicate.setImportJobId(importJobId);
        duplicate.setSimilarity(verdict.similarity());
        duplicate.setCreatedAt(Instant.now());
        return duplicate;
    }
}
