package com.ledgerradar.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * POST /api/v1/accounts/{accountId}/sync-feed body, pushed by the bank-connection layer.
 */
public record SyncFeedRequest(
        @NotEmpty(message = "EMPTY_FEED")
        List<@Valid Entry> transactions
) {

    /**
     * @param amount signed: positive = credit
     */
    public record Entry(
            String externalId,

            @NotNull(message = "INVALID_DATE")
            LocalDate bookingDate,

            LocalDate valueDate,

            @NotNull(message = "INVALID_AMOUNT")
            BigDecimal amount,

            String currency,
            String counterpartyName,
            String counterpartyIban,
            String description,
            String reference
    ) {
    }
}
