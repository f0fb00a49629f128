package com.ledgerradar.reconciliation.service;

import com.ledgerradar.domain.BankTransaction;
import com.ledgerradar.domain.BankTransactionRepository;
import com.ledgerradar.domain.MatchStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read side of the ledger for the API, newest booking first.
 */
@Service
@RequiredArgsConstructor
public class TransactionQueryService {

    private final BankTransactionRepository bankTransactionRepository;

    public List<BankTransaction> findByAccount(String accountId, MatchStatus matchStatus) {
        if (matchStatus == null) {
            return bankTransactionRepository.findByAccountIdOrderByBookingDateDesc(accountId);
        }
        return bankTransactionRepository.findByAccountIdAndMatchStatusOrderByBookingDateDesc(accountId, matchStatus);
    }
}
