package com.ledgerradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

/**
 * Persistence for bank_transactions.
 */
public interface BankTransactionRepository extends MongoRepository<BankTransaction, String>, BankTransactionRepositoryCustom {

    List<BankTransaction> findByAccountIdAndBookingDateBetween(String accountId, LocalDate from, LocalDate to);

    List<BankTransaction> findByAccountIdAndExternalIdIn(String accountId, Collection<String> externalIds);

    List<BankTransaction> findByAccountIdAndMatchStatusAndDirectionOrderByBookingDateAscIdAsc(
            String accountId, MatchStatus matchStatus, TransactionDirection direction);

    List<BankTransaction> findByAccountIdOrderByBookingDateDesc(String accountId);

    List<BankTransaction> findByAccountIdAndMatchStatusOrderByBookingDateDesc(String accountId, MatchStatus matchStatus);

    List<BankTransaction> findByStatementId(String statementId);

    void deleteByStatementId(String statementId);
}
