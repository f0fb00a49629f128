package com.ledgerradar.reconciliation.service;

import com.ledgerradar.config.AsyncConfig;
import com.ledgerradar.domain.BankTransaction;
import com.ledgerradar.domain.BankTransactionRepository;
import com.ledgerradar.domain.Invoice;
import com.ledgerradar.domain.MatchStatus;
import com.ledgerradar.domain.TransactionDirection;
import com.ledgerradar.domain.TransactionsIngestedEvent;
import com.ledgerradar.reconciliation.config.ReconciliationProperties;
import com.ledgerradar.reconciliation.engine.InvoiceMatcher;
import com.ledgerradar.reconciliation.engine.MatchCandidate;
import com.ledgerradar.reconciliation.ledger.InvoiceLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Auto-matches unmatched credit transactions to unpaid outbound invoices. Idempotent: matched transactions and
 * paid invoices drop out of scope, and both sides are claimed with conditional updates.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationService {

    private final BankTransactionRepository bankTransactionRepository;
    private final InvoiceLedger invoiceLedger;
    private final InvoiceMatcher invoiceMatcher;
    private final ReconciliationProperties properties;

    @EventListener
    @Async(AsyncConfig.RECONCILE_EXECUTOR)
    public void onTransactionsIngested(TransactionsIngestedEvent event) {
        try {
            reconcile(event.accountId());
        } catch (Exception e) {
            log.error("Reconciliation after ingestion failed for account {}: {}", event.accountId(), e.getMessage(), e);
        }
    }

    public ReconciliationSummary reconcile(String accountId) {
        List<BankTransaction> credits = bankTransactionRepository
                .findByAccountIdAndMatchStatusAndDirectionOrderByBookingDateAscIdAsc(
                        accountId, MatchStatus.UNMATCHED, TransactionDirection.INCOMING);
        if (credits.isEmpty()) {
            return new ReconciliationSummary(accountId, 0, 0, 0);
        }
        Map<String, Invoice> available = new LinkedHashMap<>();
        for (Invoice invoice : invoiceLedger.findUnpaidOutbound(accountId)) {
            available.put(invoice.getId(), invoice);
        }

        int autoMatched = 0;
        int belowThreshold = 0;
        for (BankTransaction tx : credits) {
            List<MatchCandidate> candidates = invoiceMatcher.match(tx, available.values());
            if (tryAutoMatch(tx, candidates, available)) {
                autoMatched++;
                continue;
            }
            belowThreshold++;
            if (!candidates.isEmpty()) {
                MatchCandidate best = candidates.get(0);
                bankTransactionRepository.recordSuggestion(tx.getId(), best.invoiceId(), best.score());
                log.debug("Transaction {} below threshold: best invoice {} scored {}", tx.getId(), best.invoiceId(), best.score());
            }
        }
        log.info("Reconciliation for account {}: {} credit(s) scanned, {} auto-matched, {} below threshold",
                accountId, credits.size(), autoMatched, belowThreshold);
        return new ReconciliationSummary(accountId, credits.size(), autoMatched, belowThreshold);
    }

    private boolean tryAutoMatch(BankTransaction tx, List<MatchCandidate> candidates, Map<String, Invoice> available) {
        for (MatchCandidate candidate : candidates) {
            if (!invoiceMatcher.shouldAutoMatch(candidate)) {
                return false;
            }
            Instant now = Instant.now();
            if (!invoiceLedger.markPaid(candidate.invoiceId(), tx.getId(), now)) {
                // paid in the meantime; try the next candidate
                available.remove(candidate.invoiceId());
                continue;
            }
            if (!bankTransactionRepository.claimMatch(tx.getId(), candidate.invoiceId(), MatchStatus.AUTO_MATCHED,
                    candidate.score(), properties.getAutoMatchActor(), now)) {
                invoiceLedger.clearPaid(candidate.invoiceId(), tx.getId());
                log.debug("Transaction {} left UNMATCHED before auto-match; invoice {} released", tx.getId(), candidate.invoiceId());
                return false;
            }
            available.remove(candidate.invoiceId());
            log.info("Transaction {} auto-matched to invoice {} (score {}: {})",
                    tx.getId(), candidate.invoiceId(), candidate.score(), candidate.reason());
            return true;
        }
        return false;
    }
}
