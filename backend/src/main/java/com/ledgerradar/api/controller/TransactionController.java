package com.ledgerradar.api.controller;

import com.ledgerradar.api.dto.ManualMatchRequest;
import com.ledgerradar.api.dto.TransactionCorrectionRequest;
import com.ledgerradar.api.dto.TransactionResponse;
import com.ledgerradar.domain.MatchStatus;
import com.ledgerradar.ingestion.correction.TransactionCorrectionService;
import com.ledgerradar.reconciliation.service.ManualReconciliationService;
import com.ledgerradar.reconciliation.service.TransactionQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Ledger transactions: listing, booking corrections and manual reconciliation actions.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class TransactionController {

    private static final String DEFAULT_ACTOR = "user";

    private final TransactionQueryService transactionQueryService;
    private final TransactionCorrectionService transactionCorrectionService;
    private final ManualReconciliationService manualReconciliationService;

    @GetMapping("/accounts/{accountId}/transactions")
    public ResponseEntity<List<TransactionResponse>> list(
            @PathVariable String accountId,
            @RequestParam(required = false) MatchStatus matchStatus
    ) {
        return ResponseEntity.ok(transactionQueryService.findByAccount(accountId, matchStatus).stream()
                .map(TransactionResponse::from)
                .toList());
    }

    @PatchMapping("/transactions/{transactionId}")
    public ResponseEntity<TransactionResponse> correct(@PathVariable String transactionId,
                                                       @Valid @RequestBody TransactionCorrectionRequest request) {
        return ResponseEntity.ok(TransactionResponse.from(transactionCorrectionService.correct(
                transactionId, request.bookingDate(), request.amount(), request.direction())));
    }

    @PostMapping("/transactions/{transactionId}/match")
    public ResponseEntity<TransactionResponse> match(@PathVariable String transactionId,
                                                     @Valid @RequestBody ManualMatchRequest request) {
        String actor = request.actor() == null || request.actor().isBlank() ? DEFAULT_ACTOR : request.actor().trim();
        return ResponseEntity.ok(TransactionResponse.from(
                manualReconciliationService.match(transactionId, request.invoiceId().trim(), actor)));
    }

    @PostMapping("/transactions/{transactionId}/unmatch")
    public ResponseEntity<TransactionResponse> unmatch(@PathVariable String transactionId) {
        return ResponseEntity.ok(TransactionResponse.from(manualReconciliationService.unmatch(transactionId)));
    }

    @PostMapping("/transactions/{transactionId}/ignore")
    public ResponseEntity<TransactionResponse> ignore(@PathVariable String transactionId) {
        return ResponseEntity.ok(TransactionResponse.from(manualReconciliationService.ignore(transactionId)));
    }
}
