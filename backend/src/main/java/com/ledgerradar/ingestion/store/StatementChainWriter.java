package com.ledgerradar.ingestion.store;

import com.ledgerradar.domain.BankAccount;
import com.ledgerradar.domain.BankAccountRepository;
import com.ledgerradar.domain.BankTransaction;
import com.ledgerradar.domain.BankTransactionRepository;
import com.ledgerradar.domain.ImportJob;
import com.ledgerradar.domain.PageStatus;
import com.ledgerradar.domain.Statement;
import com.ledgerradar.domain.StatementLine;
import com.ledgerradar.domain.StatementPage;
import com.ledgerradar.domain.StatementPageRepository;
import com.ledgerradar.domain.StatementRepository;
import com.ledgerradar.domain.TierType;
import com.ledgerradar.domain.TransactionSource;
import com.ledgerradar.ingestion.config.AuditProperties;
import com.ledgerradar.ingestion.error.StatementSequenceConflictException;
import com.ledgerradar.reconciliation.ledger.InvoiceLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Transactional writes of the statement chain. Callers must hold the account lock from {@link AccountLockRegistry}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StatementChainWriter {

    private final StatementRepository statementRepository;
    private final StatementPageRepository statementPageRepository;
    private final BankTransactionRepository bankTransactionRepository;
    private final BankAccountRepository bankAccountRepository;
    private final InvoiceLedger invoiceLedger;
    private final AuditProperties auditProperties;

    /**
     * Writes statement, pages and transactions and advances the account cursor in one transaction.
     * A job whose statement is already stored (resumed after a crash past the commit) gets that statement back.
     *
     * @throws StatementSequenceConflictException if another statement of the account already holds the sequence number
     */
    @Transactional
    public PersistedStatement write(ImportJob job, StatementDraft draft) {
        Optional<Statement> existing = statementRepository.findByImportJobId(job.getId());
        if (existing.isPresent()) {
            Statement stored = existing.get();
            log.info("Job {} already persisted statement {} (seq {}); reusing it", job.getId(), stored.getId(), stored.getSequenceNumber());
            return new PersistedStatement(stored, bankTransactionRepository.findByStatementId(stored.getId()).size());
        }
        String accountId = job.getAccountId();
        BankAccount account = bankAccountRepository.findById(accountId).orElseGet(() -> BankAccount.open(accountId));
        long sequence = draft.sequenceNumber() != null && draft.sequenceNumber() > 0
                ? draft.sequenceNumber()
                : account.getNextSequenceNumber();
        statementRepository.findByAccountIdAndSequenceNumber(accountId, sequence).ifPresent(taken -> {
            throw new StatementSequenceConflictException(accountId, sequence, taken.getImportJobId());
        });

        Optional<Statement> previous = statementRepository
                .findFirstByAccountIdAndSequenceNumberLessThanOrderBySequenceNumberDesc(accountId, sequence);

        Statement statement = new Statement();
        statement.setAccountId(accountId);
        statement.setImportJobId(job.getId());
        statement.setSequenceNumber(sequence);
        statement.setPreviousSequenceNumber(previous.map(Statement::getSequenceNumber).orElse(null));
        statement.setExternalStatementId(draft.externalStatementId());
        statement.setPeriodStart(draft.periodStart());
        statement.setPeriodEnd(draft.periodEnd());
        statement.setStatementDate(draft.statementDate());
        statement.setOpeningBalance(draft.openingBalance());
        statement.setClosingBalance(draft.closingBalance());
        statement.setCurrency(draft.currency());
        statement.setIban(draft.iban());
        statement.setTierUsed(draft.tierUsed());
        statement.setGapDetected(previous.map(p -> isGap(p.getSequenceNumber(), p.getClosingBalance(), sequence, draft.openingBalance()))
                .orElse(false));
        statement.setCreatedAt(Instant.now());
        statement = statementRepository.save(statement);

        List<StatementPage> pages = new ArrayList<>();
        List<BankTransaction> transactions = new ArrayList<>();
        for (PageDraft pageDraft : draft.pages()) {
            pages.add(toPage(statement.getId(), pageDraft));
            for (StatementLine line : pageDraft.lines()) {
                BankTransaction tx = BankTransaction.fromLine(line, accountId, TransactionSource.FILE_IMPORT);
                tx.setStatementId(statement.getId());
                tx.setPageNumber(pageDraft.pageNumber());
                tx.setImportJobId(job.getId());
                if (tx.getCurrency() == null) {
                    tx.setCurrency(draft.currency());
                }
                transactions.add(tx);
            }
        }
        statementPageRepository.saveAll(pages);
        bankTransactionRepository.saveAll(transactions);

        relinkSuccessor(accountId, sequence, statement);
        advanceCursor(account, statement, draft);
        return new PersistedStatement(statement, transactions.size());
    }

    /**
     * Removes an unlocked statement with its pages and transactions, releasing any invoice payment stamps
     * those transactions held, and rewinds the account cursor.
     */
    @Transactional
    public void remove(Statement statement) {
        if (statement.isLocked()) {
            throw new IllegalStateException("Statement " + statement.getId() + " is locked");
        }
        for (BankTransaction tx : bankTransactionRepository.findByStatementId(statement.getId())) {
            if (tx.getMatchedInvoiceId() != null) {
                invoiceLedger.clearPaid(tx.getMatchedInvoiceId(), tx.getId());
            }
        }
        bankTransactionRepository.deleteByStatementId(statement.getId());
        statementPageRepository.deleteByStatementId(statement.getId());
        statementRepository.delete(statement);

        String accountId = statement.getAccountId();
        Optional<Statement> before = statementRepository
                .findFirstByAccountIdAndSequenceNumberLessThanOrderBySequenceNumberDesc(accountId, statement.getSequenceNumber());
        relinkSuccessor(accountId, statement.getSequenceNumber(), before.orElse(null));
        bankAccountRepository.findById(accountId).ifPresent(account -> {
            Optional<Statement> latest = statementRepository.findFirstByAccountIdOrderBySequenceNumberDesc(accountId);
            account.setLastStatementSequence(latest.map(Statement::getSequenceNumber).orElse(null));
            account.setLastClosingBalance(latest.map(Statement::getClosingBalance).orElse(null));
            account.setNextSequenceNumber(latest.map(s -> s.getSequenceNumber() + 1).orElse(1L));
            account.setUpdatedAt(Instant.now());
            bankAccountRepository.save(account);
        });
    }

    /**
     * A gap is a skipped sequence number or an opening balance that does not continue the previous closing.
     * Missing balances on either side are not reported as a gap.
     */
    boolean isGap(long previousSequence, BigDecimal previousClosing, long sequence, BigDecimal opening) {
        if (previousSequence + 1 != sequence) {
            return true;
        }
        if (previousClosing == null || opening == null) {
            return false;
        }
        return previousClosing.subtract(opening).abs().compareTo(auditProperties.getTolerance()) > 0;
    }

    /** Re-evaluates the statement that follows {@code sequence}, whose predecessor is now {@code predecessor}. */
    private void relinkSuccessor(String accountId, long sequence, Statement predecessor) {
        statementRepository.findFirstByAccountIdAndSequenceNumberGreaterThanOrderBySequenceNumberAsc(accountId, sequence)
                .filter(next -> !next.isLocked())
                .ifPresent(next -> {
                    next.setPreviousSequenceNumber(predecessor == null ? null : predecessor.getSequenceNumber());
                    next.setGapDetected(predecessor != null && isGap(predecessor.getSequenceNumber(),
                            predecessor.getClosingBalance(), next.getSequenceNumber(), next.getOpeningBalance()));
                    statementRepository.save(next);
                });
    }

    private void advanceCursor(BankAccount account, Statement statement, StatementDraft draft) {
        long sequence = statement.getSequenceNumber();
        if (account.getNextSequenceNumber() <= sequence) {
            account.setNextSequenceNumber(sequence + 1);
        }
        if (account.getLastStatementSequence() == null || account.getLastStatementSequence() <= sequence) {
            account.setLastStatementSequence(sequence);
            account.setLastClosingBalance(statement.getClosingBalance());
        }
        if (account.getIban() == null) {
            account.setIban(draft.iban());
        }
        if (account.getCurrency() == null) {
            account.setCurrency(draft.currency());
        }
        account.setUpdatedAt(Instant.now());
        bankAccountRepository.save(account);
    }

    private static StatementPage toPage(String statementId, PageDraft draft) {
        StatementPage page = new StatementPage();
        page.setStatementId(statementId);
        page.setPageNumber(draft.pageNumber());
        page.setPageStartBalance(draft.pageStartBalance());
        page.setPageEndBalance(draft.pageEndBalance());
        if (draft.status() == PageStatus.FAILED || draft.tierUsed() == TierType.VISION_LLM) {
            page.transitionTo(PageStatus.NEEDS_VISION);
        }
        page.transitionTo(draft.status());
        page.setTierUsed(draft.tierUsed());
        page.setFailureCode(draft.failureCode());
        page.setDiscrepancy(draft.discrepancy());
        page.setRawText(draft.rawText());
        return page;
    }
}
