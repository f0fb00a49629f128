package com.ledgerradar.api.controller;

import com.ledgerradar.api.dto.PotentialDuplicateResponse;
import com.ledgerradar.ingestion.dedup.DuplicateReviewService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Review queue of fuzzy duplicates.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class PotentialDuplicateController {

    private final DuplicateReviewService duplicateReviewService;

    @GetMapping("/accounts/{accountId}/potential-duplicates")
    public ResponseEntity<List<PotentialDuplicateResponse>> pending(@PathVariable String accountId) {
        return ResponseEntity.ok(duplicateReviewService.pending(accountId).stream()
                .map(PotentialDuplicateResponse::from)
                .toList());
    }

    /** Not a duplicate after all: insert the incoming row as a ledger transaction. */
    @PostMapping("/potential-duplicates/{id}/keep")
    public ResponseEntity<PotentialDuplicateResponse> keep(@PathVariable String id) {
        return ResponseEntity.ok(PotentialDuplicateResponse.from(duplicateReviewService.keep(id)));
    }

    @PostMapping("/potential-duplicates/{id}/dismiss")
    public ResponseEntity<PotentialDuplicateResponse> dismiss(@PathVariable String id) {
        return ResponseEntity.ok(PotentialDuplicateResponse.from(duplicateReviewService.dismiss(id)));
    }
}
