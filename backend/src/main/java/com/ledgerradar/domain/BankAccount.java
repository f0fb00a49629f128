package com.ledgerradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Statement-chain cursor for one bank account. Id is the external account identifier.
 * Written only under the per-account chain lock.
 */
@Document(collection = "bank_accounts")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class BankAccount {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String iban;
    private String currency;
    private long nextSequenceNumber = 1;
    private Long lastStatementSequence;
    private BigDecimal lastClosingBalance;
    @Version
    private Long version;
    private Instant createdAt;
    private Instant updatedAt;

    public static BankAccount open(String accountId) {
        BankAccount account = new BankAccount();
        account.setId(accountId);
        account.setNextSequenceNumber(1);
        account.setCreatedAt(Instant.now());
        account.setUpdatedAt(account.getCreatedAt());
        return account;
    }
}
