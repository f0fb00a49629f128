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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UploadIntakeServiceTest {

    private static final String ACCOUNT = "acc-1";
    private static final byte[] CSV = "Datum;Iznos;Opis\n01.03.2025;500,00;INV-0042\n".getBytes(StandardCharsets.UTF_8);

    @Mock
    StatementFileStore statementFileStore;
    @Mock
    ImportJobRepository importJobRepository;
    @Mock
    ImportJobRemover importJobRemover;
    @Mock
    ApplicationEventPublisher applicationEventPublisher;

    private IntakeProperties intakeProperties;
    private UploadIntakeService service;

    @BeforeEach
    void setUp() {
        intakeProperties = new IntakeProperties();
        service = new UploadIntakeService(intakeProperties, new FormatRouter(), statementFileStore,
                importJobRepository, importJobRemover, applicationEventPublisher);
    }

    @Test
    @DisplayName("new upload is stored, saved as PENDING and announced")
    void submit_newUpload() {
        String checksum = ContentChecksum.sha256Hex(CSV);
        when(importJobRepository.findByAccountIdAndChecksum(ACCOUNT, checksum)).thenReturn(Optional.empty());
        when(statementFileStore.store(ACCOUNT, checksum, "izvod.csv", CSV)).thenReturn("acc-1/key");
        when(importJobRepository.save(any(ImportJob.class))).thenAnswer(inv -> {
            ImportJob j = inv.getArgument(0);
            j.setId("job-1");
            return j;
        });

        ImportJob job = service.submit(ACCOUNT, "izvod.csv", CSV, false);

        assertThat(job.getId()).isEqualTo("job-1");
        assertThat(job.getStatus()).isEqualTo(ImportJob.ImportStatus.PENDING);
        assertThat(job.getFormat()).isEqualTo(DocumentFormat.CSV);
        assertThat(job.getChecksum()).isEqualTo(checksum);
        assertThat(job.getStorageKey()).isEqualTo("acc-1/key");
        assertThat(job.getSizeBytes()).isEqualTo(CSV.length);
        assertThat(job.getAdvisories()).isEmpty();

        ArgumentCaptor<ImportJobQueuedEvent> event = ArgumentCaptor.forClass(ImportJobQueuedEvent.class);
        verify(applicationEventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().jobId()).isEqualTo("job-1");
    }

    @Test
    @DisplayName("same content without overwrite is rejected with the existing job id")
    void submit_duplicateRejected() {
        ImportJob existing = new ImportJob();
        existing.setId("job-0");
        when(importJobRepository.findByAccountIdAndChecksum(eq(ACCOUNT), anyString())).thenReturn(Optional.of(existing));

        assertThatThrownBy(() -> service.submit(ACCOUNT, "izvod.csv", CSV, false))
                .isInstanceOf(DuplicateUploadException.class)
                .satisfies(e -> assertThat(((DuplicateUploadException) e).getExistingJobId()).isEqualTo("job-0"));

        verify(importJobRemover, never()).remove(any());
        verifyNoInteractions(statementFileStore, applicationEventPublisher);
    }

    @Test
    @DisplayName("overwrite removes the earlier job and flags the new one")
    void submit_overwrite() {
        ImportJob existing = new ImportJob();
        existing.setId("job-0");
        when(importJobRepository.findByAccountIdAndChecksum(eq(ACCOUNT), anyString())).thenReturn(Optional.of(existing));
        when(statementFileStore.store(eq(ACCOUNT), anyString(), eq("izvod.csv"), eq(CSV))).thenReturn("k");
        when(importJobRepository.save(any(ImportJob.class))).thenAnswer(inv -> inv.getArgument(0));

        ImportJob job = service.submit(ACCOUNT, "izvod.csv", CSV, true);

        verify(importJobRemover).remove(existing);
        assertThat(job.getAdvisories()).containsExactly(ImportAdvisory.DUPLICATE_UPLOAD_OVERWRITTEN);
    }

    @Test
    @DisplayName("oversized file is rejected before any routing or storage")
    void submit_oversized() {
        intakeProperties.setMaxFileBytes(10);

        assertThatThrownBy(() -> service.submit(ACCOUNT, "izvod.csv", CSV, false))
                .isInstanceOf(OversizedFileException.class);
        verifyNoInteractions(importJobRepository, statementFileStore);
    }

    @Test
    @DisplayName("disallowed extension and unrecognizable content are UnsupportedFormat")
    void submit_unsupported() {
        assertThatThrownBy(() -> service.submit(ACCOUNT, "izvod.docx", CSV, false))
                .isInstanceOf(UnsupportedFormatException.class);
        assertThatThrownBy(() -> service.submit(ACCOUNT, "izvod.pdf", "plain words".getBytes(StandardCharsets.UTF_8), false))
                .isInstanceOf(UnsupportedFormatException.class);
        verifyNoInteractions(importJobRepository);
    }

    @Test
    void submit_blankAccount_rejected() {
        assertThatThrownBy(() -> service.submit(" ", "izvod.csv", CSV, false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
