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
import java.util.ArrayList;
import java.util.List;

/**
 * One uploaded statement file. Persisted in import_jobs; (accountId, checksum) is unique so the same file
 * cannot be queued twice for an account without an explicit overwrite.
 * Status is mutated only by the job orchestrator; acceptance only by user confirm/reject.
 */
@Document(collection = "import_jobs")
@CompoundIndexes({
    @CompoundIndex(name = "account_checksum_uniq", def = "{'accountId': 1, 'checksum': 1}", unique = true),
    @CompoundIndex(name = "status_created", def = "{'status': 1, 'createdAt': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ImportJob {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String accountId;
    private String fileName;
    /** SHA-256 hex of the file content. */
    private String checksum;
    private long sizeBytes;
    /** Opaque key returned by the statement file store. */
    private String storageKey;
    private DocumentFormat format;
    private ImportStatus status;
    private TierType tierUsed;
    private int pagesTotal;
    private int pagesProcessed;
    private int pagesFailed;
    private String failureReason;
    private ImportErrorCode failureCode;
    private List<ImportAdvisory> advisories = new ArrayList<>();
    /** Set once the statement rows are written. */
    private String statementId;
    private int transactionsInserted;
    private int duplicatesSkipped;
    private int duplicatesFlagged;
    private int rowsRejected;
    private Acceptance acceptance;
    private Instant acceptedAt;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;

    public void addAdvisory(ImportAdvisory advisory) {
        if (!advisories.contains(advisory)) {
            advisories.add(advisory);
        }
    }

    public enum ImportStatus {
        PENDING,
        PROCESSING,
        VERIFIED,
        NEEDS_REVIEW,
        FAILED;

        public boolean isTerminal() {
            return this == VERIFIED || this == NEEDS_REVIEW || this == FAILED;
        }
    }

    /** User decision on a finished job; separate from the extraction state machine. */
    public enum Acceptance {
        CONFIRMED,
        REJECTED
    }
}
