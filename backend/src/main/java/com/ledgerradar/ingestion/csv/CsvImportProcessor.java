package com.ledgerradar.ingestion.csv;

import com.ledgerradar.domain.ImportJob;
import com.ledgerradar.domain.TransactionSource;
import com.ledgerradar.ingestion.config.ExtractionProperties;
import com.ledgerradar.ingestion.dedup.DeduplicationService;
import com.ledgerradar.ingestion.dedup.DeduplicationSummary;
import com.ledgerradar.ingestion.store.JobCancellationRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * CSV path of an import job: parse, then deduplicate into the account ledger as manual-import transactions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CsvImportProcessor {

    private final CsvStatementParser parser;
    private final DeduplicationService deduplicationService;
    private final JobCancellationRegistry cancellationRegistry;
    private final ExtractionProperties extractionProperties;

    public CsvImportOutcome process(ImportJob job, byte[] content) {
        CsvParseResult parsed = parser.parse(content, extractionProperties.getDefaultCurrency());
        if (!parsed.rejected().isEmpty()) {
            CsvParseResult.RejectedRow first = parsed.rejected().get(0);
            log.warn("Job {}: {} CSV row(s) rejected, first at row {}: {}",
                    job.getId(), parsed.rejected().size(), first.rowNumber(), first.reason());
        }
        cancellationRegistry.checkpoint(job.getId());
        DeduplicationSummary summary = deduplicationService.ingest(
                job.getAccountId(), TransactionSource.MANUAL_IMPORT, job.getId(), parsed.lines());
        return new CsvImportOutcome(parsed.format(), summary, parsed.rejected().size());
    }
}
