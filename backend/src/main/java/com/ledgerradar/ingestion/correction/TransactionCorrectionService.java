package com.ledgerradar.ingestion.correction;

import com.ledgerradar.common.ResourceNotFoundException;
import com.ledgerradar.domain.BankTransaction;
import com.ledgerradar.domain.BankTransactionRepository;
import com.ledgerradar.domain.MatchStatus;
import com.ledgerradar.domain.TransactionDirection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * User corrections of extracted booking data. Matched transactions must be unmatched first.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionCorrectionService {

    public static final String TRANSACTION_NOT_FOUND = "TRANSACTION_NOT_FOUND";

    private final BankTransactionRepository bankTransactionRepository;

    /**
     * @throws ResourceNotFoundException unknown transaction
     * @throws IllegalStateException     transaction is auto- or manually matched, or became matched while correcting
     */
    public BankTransaction correct(String transactionId, LocalDate bookingDate, BigDecimal amount, TransactionDirection direction) {
        BankTransaction tx = bankTransactionRepository.findById(transactionId)
                .orElseThrow(() -> new ResourceNotFoundException(TRANSACTION_NOT_FOUND, "Transaction not found: " + transactionId));
        MatchStatus readStatus = tx.getMatchStatus();
        tx.correct(bookingDate, amount, direction);
        if (!bankTransactionRepository.applyCorrection(tx, readStatus)) {
            throw new IllegalStateException("Transaction " + transactionId + " was matched concurrently; unmatch before correcting");
        }
        log.info("Transaction {} corrected: date {}, {} {}", transactionId, tx.getBookingDate(), tx.getDirection(), tx.getAmount());
        return tx;
    }
}
