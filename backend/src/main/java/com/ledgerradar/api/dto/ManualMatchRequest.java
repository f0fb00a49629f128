package com.ledgerradar.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * POST /api/v1/transactions/{id}/match body.
 */
public record ManualMatchRequest(
        @NotBlank(message = "INVALID_INVOICE")
        String invoiceId,

        String actor
) {
}
