package com.ledgerradar.ingestion.dedup;

import com.ledgerradar.common.BigramSimilarity;
import com.ledgerradar.common.ReferenceNormalizer;
import com.ledgerradar.domain.BankTransaction;
import com.ledgerradar.domain.StatementLine;
import com.ledgerradar.ingestion.config.DeduplicationProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.Objects;

/**
 * Three-tier duplicate classification, first match wins:
 * STRICT (same external id; or same date, amount and reference; or same date, amount and counterparty),
 * FUZZY (same direction, dates within the window, amounts within tolerance, similar descriptions), NEW.
 */
@Component
@RequiredArgsConstructor
public class TransactionDeduplicator {

    private final DeduplicationProperties properties;

    public DuplicateVerdict classify(StatementLine incoming, Collection<BankTransaction> existing) {
        for (BankTransaction tx : existing) {
            String rule = strictRule(incoming, tx);
            if (rule != null) {
                return DuplicateVerdict.strict(tx, rule);
            }
        }
        BankTransaction best = null;
        double bestSimilarity = -1;
        String incomingText = similarityText(incoming.getDescription(), incoming.getCounterpartyName(), incoming.getReference());
        for (BankTransaction tx : existing) {
            if (!withinWindow(incoming, tx)) {
                continue;
            }
            double similarity = BigramSimilarity.similarity(incomingText,
                    similarityText(tx.getDescription(), tx.getCounterpartyName(), tx.getReference()));
            if (similarity >= properties.getSimilarityThreshold() && similarity > bestSimilarity) {
                best = tx;
                bestSimilarity = similarity;
            }
        }
        return best != null ? DuplicateVerdict.fuzzy(best, bestSimilarity) : DuplicateVerdict.newTransaction();
    }

    private static String strictRule(StatementLine incoming, BankTransaction tx) {
        String externalId = trimToNull(incoming.getExternalId());
        if (externalId != null && externalId.equals(trimToNull(tx.getExternalId()))) {
            return "external-id";
        }
        if (!Objects.equals(incoming.getBookingDate(), tx.getBookingDate())
                || !sameAmount(incoming.signedAmount(), tx.signedAmount())) {
            return null;
        }
        // absent on both sides counts as the same reference
        if (Objects.equals(ReferenceNormalizer.key(incoming.getReference()), ReferenceNormalizer.key(tx.getReference()))) {
            return "date-amount-reference";
        }
        String counterparty = ReferenceNormalizer.key(incoming.getCounterpartyName());
        if (counterparty != null && counterparty.equals(ReferenceNormalizer.key(tx.getCounterpartyName()))) {
            return "date-amount-counterparty";
        }
        return null;
    }

    private boolean withinWindow(StatementLine incoming, BankTransaction tx) {
        if (incoming.getDirection() != tx.getDirection()
                || incoming.getBookingDate() == null || tx.getBookingDate() == null
                || incoming.getAmount() == null || tx.getAmount() == null) {
            return false;
        }
        long days = Math.abs(ChronoUnit.DAYS.between(incoming.getBookingDate(), tx.getBookingDate()));
        if (days > properties.getDateWindowDays()) {
            return false;
        }
        return incoming.getAmount().subtract(tx.getAmount()).abs().compareTo(properties.getAmountTolerance()) <= 0;
    }

    /** Description, or counterparty plus reference when the description is blank. */
    static String similarityText(String description, String counterpartyName, String reference) {
        if (description != null && !description.isBlank()) {
            return description.strip();
        }
        StringBuilder text = new StringBuilder();
        if (counterpartyName != null && !counterpartyName.isBlank()) {
            text.append(counterpartyName.strip());
        }
        if (reference != null && !reference.isBlank()) {
            if (text.length() > 0) {
                text.append(' ');
            }
            text.append(reference.strip());
        }
        return text.toString();
    }

    private static boolean sameAmount(BigDecimal a, BigDecimal b) {
        return a != null && b != null && a.compareTo(b) == 0;
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }
}
