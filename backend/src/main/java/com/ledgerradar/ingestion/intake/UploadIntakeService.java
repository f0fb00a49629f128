package com.ledgerradar.ingestion.intake;

import com.ledgerradar.common.ContentChecksum;
import com.ledgerradar.domain.DocumentFormat;
import com.ledgerradar.domain.ImportAdvisory;
import com.ledgerradar.domain.ImportJob;
import com.ledgerradar.domain.ImportJobQueuedEvent;
import com.ledgerradar.domain.ImportJobRepository;
import com.ledgerradar.ingestion.config.IntakeProperties;
import com.ledgerradar.ingestion.error.DuplicateUploadException;
import com.ledgerradar.ingestion.error.OversizedFileException;
import com.ledgerradar.ingestion.error.UnsupportedFormatException;
import com.ledgerradar.ingestion.store.ImportJobRemover;
import com.ledgerradar.ingestion.store.StatementFileStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;

/**
 * Accepts an uploaded statement file: size and extension limits, format routing, checksum duplicate check,
 * storage, and a PENDING import job.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UploadIntakeService {

    private final IntakeProperties intakeProperties;
    private final FormatRouter formatRouter;
    private final StatementFileStore statementFileStore;
    private final ImportJobRepository importJobRepository;
    private final ImportJobRemover importJobRemover;
    private final ApplicationEventPublisher applicationEventPublisher;

    /**
     * @param overwrite replace an earlier upload of the same content for this account instead of rejecting
     * @throws OversizedFileException     file exceeds the configured ceiling
     * @throws UnsupportedFormatException extension not allowed or content not recognized
     * @throws DuplicateUploadException   same content already uploaded and {@code overwrite} is false
     */
    public ImportJob submit(String accountId, String fileName, byte[] content, boolean overwrite) {
        if (accountId == null || accountId.isBlank()) {
            throw new IllegalArgumentException("accountId is required");
        }
        if (content == null || content.length == 0) {
            throw new UnsupportedFormatException("Empty file");
        }
        if (content.length > intakeProperties.getMaxFileBytes()) {
            throw new OversizedFileException(content.length, intakeProperties.getMaxFileBytes());
        }
        String extension = FormatRouter.extensionOf(fileName);
        if (!intakeProperties.getAllowedExtensions().contains(extension)) {
            throw new UnsupportedFormatException("Extension '" + extension + "' is not accepted");
        }
        DocumentFormat format = formatRouter.route(fileName, content);
        String checksum = ContentChecksum.sha256Hex(content);

        boolean overwritten = false;
        Optional<ImportJob> existing = importJobRepository.findByAccountIdAndChecksum(accountId, checksum);
        if (existing.isPresent()) {
            if (!overwrite) {
                log.warn("Duplicate upload of {} for account {} (job {})", fileName, accountId, existing.get().getId());
                throw new DuplicateUploadException(existing.get().getId());
            }
            importJobRemover.remove(existing.get());
            overwritten = true;
        }

        String storageKey = statementFileStore.store(accountId, checksum, fileName, content);
        ImportJob job = new ImportJob();
        job.setAccountId(accountId);
        job.setFileName(fileName);
        job.setChecksum(checksum);
        job.setSizeBytes(content.length);
        job.setStorageKey(storageKey);
        job.setFormat(format);
        job.setStatus(ImportJob.ImportStatus.PENDING);
        job.setCreatedAt(Instant.now());
        if (overwritten) {
            job.addAdvisory(ImportAdvisory.DUPLICATE_UPLOAD_OVERWRITTEN);
        }
        try {
            job = importJobRepository.save(job);
        } catch (DuplicateKeyException e) {
            // concurrent upload of the same file won the unique index
            String winner = importJobRepository.findByAccountIdAndChecksum(accountId, checksum)
                    .map(ImportJob::getId).orElse("unknown");
            throw new DuplicateUploadException(winner);
        }
        log.info("Import job {} queued: account {}, file {}, format {}, {} bytes{}",
                job.getId(), accountId, fileName, format, content.length, overwritten ? " (overwrite)" : "");
        applicationEventPublisher.publishEvent(new ImportJobQueuedEvent(job.getId()));
        return job;
    }
}
