package com.ledgerradar.ingestion.sync;

import com.ledgerradar.domain.StatementLine;
import com.ledgerradar.domain.TransactionSource;
import com.ledgerradar.ingestion.config.ExtractionProperties;
import com.ledgerradar.ingestion.dedup.DeduplicationService;
import com.ledgerradar.ingestion.dedup.DeduplicationSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for transaction feeds pushed by the bank-connection layer. Every entry goes through deduplication.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProviderSyncService {

    private final DeduplicationService deduplicationService;
    private final ExtractionProperties extractionProperties;

    public DeduplicationSummary ingest(String accountId, List<SyncedTransaction> feed) {
        if (accountId == null || accountId.isBlank()) {
            throw new IllegalArgumentException("accountId is required");
        }
        List<StatementLine> lines = feed.stream()
                .peek(ProviderSyncService::requireComplete)
                .map(t -> t.toLine(extractionProperties.getDefaultCurrency()))
                .toList();
        log.debug("Sync feed for account {}: {} entr(ies)", accountId, lines.size());
        return deduplicationService.ingest(accountId, TransactionSource.PROVIDER_SYNC, null, lines);
    }

    private static void requireComplete(SyncedTransaction t) {
        if (t.bookingDate() == null || t.amount() == null) {
            throw new IllegalArgumentException("Feed entry " + t.externalId() + " lacks booking date or amount");
        }
    }
}
