package com.ledgerradar.api.dto;

import com.ledgerradar.domain.ImportJob;

import java.time.Instant;
import java.util.List;

/**
 * GET /api/v1/imports/{jobId} body. Polled by the UI; no push.
 */
public record ImportJobResponse(
        String jobId,
        String accountId,
        String fileName,
        String format,
        String status,
        String tierUsed,
        int pagesTotal,
        int pagesProcessed,
        int pagesFailed,
        String failureCode,
        String failureReason,
        List<String> advisories,
        String acceptance,
        String statementId,
        int transactionsInserted,
        int duplicatesSkipped,
        int duplicatesFlagged,
        int rowsRejected,
        Instant createdAt,
        Instant completedAt
) {

    public static ImportJobResponse from(ImportJob job) {
        return new ImportJobResponse(
                job.getId(),
                job.getAccountId(),
                job.getFileName(),
                job.getFormat() != null ? job.getFormat().name() : null,
                job.getStatus() != null ? job.getStatus().name() : null,
                job.getTierUsed() != null ? job.getTierUsed().name() : null,
                job.getPagesTotal(),
                job.getPagesProcessed(),
                job.getPagesFailed(),
                job.getFailureCode() != null ? job.getFailureCode().name() : null,
                job.getFailureReason(),
                job.getAdvisories().stream().map(Enum::name).toList(),
                job.getAcceptance() != null ? job.getAcceptance().name() : null,
                job.getStatementId(),
                job.getTransactionsInserted(),
                job.getDuplicatesSkipped(),
                job.getDuplicatesFlagged(),
                job.getRowsRejected(),
                job.getCreatedAt(),
                job.getCompletedAt());
    }
}
