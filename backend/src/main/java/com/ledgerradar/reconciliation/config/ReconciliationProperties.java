package com.ledgerradar.reconciliation.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Invoice matching configuration. Documented in application.yml under ledgerradar.reconciliation.
 */
@ConfigurationProperties(prefix = "ledgerradar.reconciliation")
@Getter
@Setter
public class ReconciliationProperties {

    /**
     * Minimum score (inclusive, 0..100) for an automatic match.
     */
    private int autoMatchThreshold = 80;

    /**
     * Actor recorded on automatic matches.
     */
    private String autoMatchActor = "reconciliation-engine";

    /**
     * Amount difference allowed for the partial amount score, as a percentage of the invoice total (exclusive).
     */
    private double amountTolerancePct = 5.0;

    /**
     * Minimum bigram similarity (0..100) between counterparty and invoice customer names.
     */
    private double counterpartySimilarityThreshold = 70.0;

    private Weights weights = new Weights();

    @Getter
    @Setter
    public static class Weights {
        private int reference = 50;
        private int exactAmount = 40;
        private int amountWithinTolerance = 25;
        /** Booking date within {@code nearDays} of the invoice date. */
        private int dateNear = 10;
        private int dateFar = 5;
        private int counterparty = 10;
        private int nearDays = 3;
        private int farDays = 7;
    }
}
