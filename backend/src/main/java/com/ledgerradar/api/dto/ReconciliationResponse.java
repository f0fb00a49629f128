package com.ledgerradar.api.dto;

import com.ledgerradar.reconciliation.service.ReconciliationSummary;

public record ReconciliationResponse(String accountId, int scanned, int autoMatched, int belowThreshold) {

    public static ReconciliationResponse from(ReconciliationSummary s) {
        return new ReconciliationResponse(s.accountId(), s.scanned(), s.autoMatched(), s.belowThreshold());
    }
}
