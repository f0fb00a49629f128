package com.ledgerradar.api.dto;

import com.ledgerradar.domain.TransactionDirection;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * PATCH /api/v1/transactions/{id} body. Null fields are left unchanged.
 */
public record TransactionCorrectionRequest(
        LocalDate bookingDate,

        @PositiveOrZero(message = "INVALID_AMOUNT")
        BigDecimal amount,

        TransactionDirection direction
) {
}
