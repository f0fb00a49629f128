package com.ledgerradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Incoming transaction held back as a probable duplicate of an existing one, awaiting manual review.
 */
@Document(collection = "potential_duplicates")
@CompoundIndexes({
    @CompoundIndex(name = "account_status", def = "{'accountId': 1, 'status': 1}"),
    @CompoundIndex(name = "account_existing_candidate", def = "{'accountId': 1, 'existingTransactionId': 1, 'candidateKey': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PotentialDuplicate {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String accountId;
    private String existingTransactionId;
    private StatementLine candidate;
    /** External id of the candidate, else booking date, signed amount and normalized description. */
    private String candidateKey;
    private TransactionSource source;
    private String importJobId;
    private double similarity;
    private ReviewStatus status = ReviewStatus.PENDING_REVIEW;
    /** Transaction created when the reviewer kept the candidate. */
    private String resolvedTransactionId;
    private Instant createdAt;
    private Instant resolvedAt;

    public enum ReviewStatus {
        PENDING_REVIEW,
        KEPT,
        DISMISSED
    }
}
