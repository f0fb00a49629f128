package com.ledgerradar.reconciliation.engine;

import com.ledgerradar.common.BigramSimilarity;
import com.ledgerradar.common.ReferenceNormalizer;
import com.ledgerradar.domain.BankTransaction;
import com.ledgerradar.domain.Invoice;
import com.ledgerradar.reconciliation.config.ReconciliationProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Scores a credit transaction against unpaid invoices. Pure: same inputs give the same ranked list.
 * <p>
 * Signals: reference (transaction reference or description contains the invoice number or payment reference,
 * or the other way round, after normalizing to lowercase alphanumerics), amount (exact, or within the
 * tolerance percentage of the invoice total), date proximity to issue or due date, counterparty name similarity.
 */
@Component
@RequiredArgsConstructor
public class InvoiceMatcher {

    static final String PARTIAL_MATCH = "Partial match";

    private static final Comparator<MatchCandidate> RANKING = Comparator
            .comparingInt(MatchCandidate::score).reversed()
            .thenComparing(c -> c.invoice().getDueDate(), Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(MatchCandidate::invoiceId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final ReconciliationProperties properties;

    /**
     * @return candidates with a positive score, best first
     */
    public List<MatchCandidate> match(BankTransaction tx, Collection<Invoice> invoices) {
        return invoices.stream()
                .map(invoice -> score(tx, invoice))
                .filter(c -> c.score() > 0)
                .sorted(RANKING)
                .toList();
    }

    public boolean shouldAutoMatch(MatchCandidate candidate) {
        return candidate.score() >= properties.getAutoMatchThreshold();
    }

    MatchCandidate score(BankTransaction tx, Invoice invoice) {
        ReconciliationProperties.Weights w = properties.getWeights();
        int score = 0;
        List<String> reasons = new ArrayList<>();

        if (referenceMatches(tx, invoice)) {
            score += w.getReference();
            reasons.add("Reference match");
        }

        BigDecimal amount = tx.getAmount();
        BigDecimal total = invoice.getTotalAmount();
        if (amount != null && total != null) {
            if (amount.compareTo(total) == 0) {
                score += w.getExactAmount();
                reasons.add("Exact amount");
            } else if (withinTolerance(amount, total)) {
                score += w.getAmountWithinTolerance();
                reasons.add("Amount within " + stripZeros(properties.getAmountTolerancePct()) + "%");
            }
        }

        Long days = closestDays(tx.getBookingDate(), invoice.getIssueDate(), invoice.getDueDate());
        if (days != null && days <= w.getNearDays()) {
            score += w.getDateNear();
        } else if (days != null && days <= w.getFarDays()) {
            score += w.getDateFar();
        }

        if (counterpartyMatches(tx.getCounterpartyName(), invoice.getCustomerName())) {
            score += w.getCounterparty();
            reasons.add("Counterparty name");
        }

        String reason = reasons.isEmpty() ? PARTIAL_MATCH : String.join(", ", reasons);
        return new MatchCandidate(invoice, Math.min(100, score), reason);
    }

    private static boolean referenceMatches(BankTransaction tx, Invoice invoice) {
        List<String> txKeys = Stream.of(tx.getReference(), tx.getDescription())
                .map(ReferenceNormalizer::alphanumeric).filter(Objects::nonNull).toList();
        List<String> invoiceKeys = Stream.of(invoice.getInvoiceNumber(), invoice.getPaymentReference())
                .map(ReferenceNormalizer::alphanumeric).filter(Objects::nonNull).toList();
        for (String t : txKeys) {
            for (String i : invoiceKeys) {
                if (t.contains(i) || i.contains(t)) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean withinTolerance(BigDecimal amount, BigDecimal total) {
        BigDecimal tolerance = total.abs()
                .multiply(BigDecimal.valueOf(properties.getAmountTolerancePct()))
                .divide(BigDecimal.valueOf(100), 6, RoundingMode.HALF_UP);
        return amount.subtract(total).abs().compareTo(tolerance) < 0;
    }

    private static Long closestDays(LocalDate booking, LocalDate issue, LocalDate due) {
        if (booking == null) {
            return null;
        }
        return Stream.of(issue, due)
                .filter(Objects::nonNull)
                .map(d -> Math.abs(ChronoUnit.DAYS.between(booking, d)))
                .min(Long::compare)
                .orElse(null);
    }

    private boolean counterpartyMatches(String counterparty, String customer) {
        if (counterparty == null || counterparty.isBlank() || customer == null || customer.isBlank()) {
            return false;
        }
        return BigramSimilarity.similarity(counterparty.strip(), customer.strip())
                >= properties.getCounterpartySimilarityThreshold();
    }

    private static String stripZeros(double pct) {
        return BigDecimal.valueOf(pct).stripTrailingZeros().toPlainString();
    }
}
