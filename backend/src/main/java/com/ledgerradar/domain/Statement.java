package com.ledgerradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * One parsed statement document, chained per account by sequence number.
 * The previous statement is referenced by (accountId, previousSequenceNumber) and resolved by query.
 * Immutable once locked.
 */
@Document(collection = "statements")
@CompoundIndexes({
    @CompoundIndex(name = "account_sequence", def = "{'accountId': 1, 'sequenceNumber': -1}", unique = true)
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Statement {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String accountId;
    @Indexed(unique = true)
    private String importJobId;
    private long sequenceNumber;
    /** Bank-issued statement identifier, e.g. CAMT Stmt/Id. */
    private String externalStatementId;
    private Long previousSequenceNumber;
    private LocalDate periodStart;
    private LocalDate periodEnd;
    private LocalDate statementDate;
    private BigDecimal openingBalance;
    private BigDecimal closingBalance;
    private String currency;
    private String iban;
    private TierType tierUsed;
    private boolean gapDetected;
    private boolean locked;
    private Instant createdAt;
    private Instant lockedAt;
}
