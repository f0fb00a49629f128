package com.ledgerradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Fuzzy duplicate window for CSV and sync-feed ingestion.
 */
@ConfigurationProperties(prefix = "ledgerradar.dedup")
@NoArgsConstructor
@Getter
@Setter
public class DeduplicationProperties {

    /** Max booking-date distance in days. */
    private int dateWindowDays = 2;

    /** Max absolute amount difference. */
    private BigDecimal amountTolerance = new BigDecimal("0.01");

    /** Minimum bigram similarity (0..100) of descriptions. */
    private double similarityThreshold = 70.0;
}
