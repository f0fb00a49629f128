package com.ledgerradar.api.controller;

import com.ledgerradar.api.dto.ReconciliationResponse;
import com.ledgerradar.reconciliation.service.ReconciliationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * On-demand reconciliation pass; the same pass also runs after every ingestion.
 */
@RestController
@RequestMapping("/api/v1/accounts/{accountId}/reconciliation")
@RequiredArgsConstructor
public class ReconciliationController {

    private final ReconciliationService reconciliationService;

    @PostMapping
    public ResponseEntity<ReconciliationResponse> reconcile(@PathVariable String accountId) {
        return ResponseEntity.ok(ReconciliationResponse.from(reconciliationService.reconcile(accountId)));
    }
}
