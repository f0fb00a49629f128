package com.ledgerradar.api.controller;

import com.ledgerradar.api.dto.DeduplicationSummaryResponse;
import com.ledgerradar.api.dto.SyncFeedRequest;
import com.ledgerradar.ingestion.sync.ProviderSyncService;
import com.ledgerradar.ingestion.sync.SyncedTransaction;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * POST /accounts/{accountId}/sync-feed: normalized provider transactions, deduplicated into the ledger.
 */
@RestController
@RequestMapping("/api/v1/accounts/{accountId}/sync-feed")
@RequiredArgsConstructor
public class SyncFeedController {

    private final ProviderSyncService providerSyncService;

    @PostMapping
    public ResponseEntity<DeduplicationSummaryResponse> ingest(@PathVariable String accountId,
                                                               @Valid @RequestBody SyncFeedRequest request) {
        List<SyncedTransaction> feed = request.transactions().stream()
                .map(e -> new SyncedTransaction(e.externalId(), e.bookingDate(), e.valueDate(), e.amount(), e.currency(),
                        e.counterpartyName(), e.counterpartyIban(), e.description(), e.reference()))
                .toList();
        return ResponseEntity.ok(DeduplicationSummaryResponse.from(providerSyncService.ingest(accountId, feed)));
    }
}
