package com.ledgerradar.ingestion.pipeline;

import com.ledgerradar.domain.ImportErrorCode;
import com.ledgerradar.domain.ImportJob;
import com.ledgerradar.domain.PageCheckpoint;
import com.ledgerradar.domain.PageCheckpointRepository;
import com.ledgerradar.domain.PageStatus;
import com.ledgerradar.domain.StatementLine;
import com.ledgerradar.domain.TierType;
import com.ledgerradar.domain.TransactionDirection;
import com.ledgerradar.ingestion.audit.AuditVerdict;
import com.ledgerradar.ingestion.config.ExtractionProperties;
import com.ledgerradar.ingestion.error.JobCancelledException;
import com.ledgerradar.ingestion.error.MalformedStatementException;
import com.ledgerradar.ingestion.extraction.CandidateMetadata;
import com.ledgerradar.ingestion.extraction.CandidateTransaction;
import com.ledgerradar.ingestion.extraction.PageCandidate;
import com.ledgerradar.ingestion.extraction.PageContext;
import com.ledgerradar.ingestion.pdf.PdfPageTextExtractor;
import com.ledgerradar.ingestion.store.JobCancellationRegistry;
import com.ledgerradar.ingestion.store.StatementDraft;
import com.ledgerradar.ingestion.tier.TextExtractionTier;
import com.ledgerradar.ingestion.tier.TierFailure;
import com.ledgerradar.ingestion.tier.TierOutcome;
import com.ledgerradar.ingestion.tier.VisionFallbackTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class PdfStatementPipelineTest {

    private static final String JOB_ID = "job-1";
    private static final byte[] PDF = new byte[]{1, 2, 3};

    @Mock private PdfPageTextExtractor textExtractor;
    @Mock private TextExtractionTier textTier;
    @Mock private VisionFallbackTier visionTier;
    @Mock private PageCheckpointRepository checkpointRepository;
    @Mock private JobCancellationRegistry cancellationRegistry;

    private PdfStatementPipeline pipeline;
    private ImportJob job;
    private final List<int[]> progress = new ArrayList<>();
    private final List<PageStatus> savedStatuses = new ArrayList<>();

    @BeforeEach
    void setUp() {
        Executor direct = Runnable::run;
        pipeline = new PdfStatementPipeline(textExtractor, textTier, visionTier, checkpointRepository,
                cancellationRegistry, new ExtractionProperties(), direct);
        job = new ImportJob();
        job.setId(JOB_ID);
        when(textExtractor.extractPages(PDF)).thenReturn(List.of("page one", "page two"));
        when(checkpointRepository.findByImportJobId(JOB_ID)).thenReturn(List.of());
        when(checkpointRepository.save(any(PageCheckpoint.class))).thenAnswer(inv -> {
            PageCheckpoint saved = inv.getArgument(0);
            savedStatuses.add(saved.getStatus());
            return saved;
        });
    }

    @Test
    @DisplayName("page 1 verified by text, page 2 repaired by vision: statement assembled across pages")
    void process_textThenVisionRepair() {
        PageCandidate page1 = page1();
        PageCandidate page2Bad = page2("1250.00");
        PageCandidate page2Fixed = page2("1200.00");
        when(textTier.run(argThat(c -> c != null && c.pageNumber() == 1)))
                .thenReturn(TierOutcome.verified(page1, AuditVerdict.verified(new BigDecimal("1250.00"), BigDecimal.ZERO)));
        when(textTier.run(argThat(c -> c != null && c.pageNumber() == 2)))
                .thenReturn(TierOutcome.auditFailed(page2Bad, AuditVerdict.mismatch(new BigDecimal("1200.00"), new BigDecimal("50.00"))));
        when(visionTier.run(any(PageContext.class), eq(PDF), eq(page2Bad)))
                .thenReturn(TierOutcome.verified(page2Fixed, AuditVerdict.verified(new BigDecimal("1200.00"), BigDecimal.ZERO)));

        StatementDraft draft = pipeline.process(job, PDF, this::record);

        assertThat(draft.pages()).hasSize(2);
        assertThat(draft.failedPages()).isZero();
        assertThat(draft.openingBalance()).isEqualByComparingTo("1000.00");
        assertThat(draft.closingBalance()).isEqualByComparingTo("1200.00");
        assertThat(draft.tierUsed()).isEqualTo(TierType.VISION_LLM);
        assertThat(draft.sequenceNumber()).isEqualTo(7L);
        assertThat(draft.currency()).isEqualTo("EUR");
        assertThat(draft.periodStart()).isEqualTo(LocalDate.of(2025, 3, 10));
        assertThat(draft.periodEnd()).isEqualTo(LocalDate.of(2025, 3, 15));
        assertThat(draft.pages().get(0).tierUsed()).isEqualTo(TierType.TEXT_LLM);
        assertThat(draft.pages().get(1).tierUsed()).isEqualTo(TierType.VISION_LLM);
        assertThat(draft.lineCount()).isEqualTo(2);

        assertThat(progress).hasSize(2);
        assertThat(progress.get(1)).containsExactly(2, 2, 0);
        verify(visionTier, never()).run(argThat(c -> c != null && c.pageNumber() == 1), any(), any());
    }

    @Test
    @DisplayName("a page still unbalanced after vision fails alone and keeps its best candidate")
    void process_pageFailsAfterVision() {
        PageCandidate page2Bad = page2("1250.00");
        when(textTier.run(argThat(c -> c != null && c.pageNumber() == 1)))
                .thenReturn(TierOutcome.verified(page1(), AuditVerdict.verified(new BigDecimal("1250.00"), BigDecimal.ZERO)));
        when(textTier.run(argThat(c -> c != null && c.pageNumber() == 2)))
                .thenReturn(TierOutcome.auditFailed(page2Bad, AuditVerdict.mismatch(new BigDecimal("1200.00"), new BigDecimal("50.00"))));
        when(visionTier.run(any(PageContext.class), eq(PDF), eq(page2Bad)))
                .thenReturn(TierOutcome.auditFailed(page2Bad, AuditVerdict.mismatch(new BigDecimal("1200.00"), new BigDecimal("50.00"))));

        StatementDraft draft = pipeline.process(job, PDF, this::record);

        assertThat(draft.failedPages()).isEqualTo(1);
        assertThat(draft.pages().get(0).status()).isEqualTo(PageStatus.VERIFIED);
        assertThat(draft.pages().get(1).status()).isEqualTo(PageStatus.FAILED);
        assertThat(draft.pages().get(1).failureCode()).isEqualTo(ImportErrorCode.MATH_MISMATCH);
        assertThat(draft.pages().get(1).discrepancy()).isEqualByComparingTo("50.00");
        assertThat(draft.pages().get(1).lines()).hasSize(1);
        assertThat(progress.get(1)).containsExactly(2, 2, 1);
        assertThat(savedStatuses).containsExactly(PageStatus.VERIFIED, PageStatus.NEEDS_VISION, PageStatus.FAILED);
    }

    @Test
    @DisplayName("resume: terminal checkpoints are reused, NEEDS_VISION resumes at the vision tier")
    void process_resumesFromCheckpoints() {
        PageCheckpoint done = checkpoint(1, PageStatus.VERIFIED, "1000.00", "1250.00",
                line(LocalDate.of(2025, 3, 10), TransactionDirection.INCOMING, "250.00"));
        PageCheckpoint pending = checkpoint(2, PageStatus.NEEDS_VISION, "1250.00", "1250.00",
                line(LocalDate.of(2025, 3, 15), TransactionDirection.OUTGOING, "50.00"));
        when(checkpointRepository.findByImportJobId(JOB_ID)).thenReturn(List.of(done, pending));
        when(visionTier.run(any(PageContext.class), eq(PDF), any()))
                .thenReturn(TierOutcome.verified(page2("1200.00"), AuditVerdict.verified(new BigDecimal("1200.00"), BigDecimal.ZERO)));

        StatementDraft draft = pipeline.process(job, PDF, this::record);

        verify(textTier, never()).run(any());
        ArgumentCaptor<PageCandidate> prior = ArgumentCaptor.forClass(PageCandidate.class);
        verify(visionTier).run(argThat(c -> c != null && c.pageNumber() == 2), eq(PDF), prior.capture());
        assertThat(prior.getValue().transactions()).hasSize(1);
        assertThat(prior.getValue().pageEndBalance()).isEqualByComparingTo("1250.00");
        assertThat(draft.failedPages()).isZero();
        assertThat(draft.pages().get(0).lines()).hasSize(1);
    }

    @Test
    void process_noUsablePage_isMalformed() {
        when(textTier.run(any())).thenReturn(TierOutcome.extractionFailed(TierFailure.SCHEMA_VIOLATION, "not json"));
        when(visionTier.run(any(), any(), any())).thenReturn(TierOutcome.extractionFailed(TierFailure.PROVIDER_ERROR, "down"));

        assertThatThrownBy(() -> pipeline.process(job, PDF, this::record))
                .isInstanceOf(MalformedStatementException.class);
    }

    @Test
    void process_cancelledJob_stopsBeforeAnyTier() {
        doThrow(new JobCancelledException(JOB_ID)).when(cancellationRegistry).checkpoint(JOB_ID);

        assertThatThrownBy(() -> pipeline.process(job, PDF, this::record))
                .isInstanceOf(JobCancelledException.class);
        verify(textTier, never()).run(any());
        verify(checkpointRepository, never()).save(any());
    }

    private void record(int total, int resolved, int failed) {
        progress.add(new int[]{total, resolved, failed});
    }

    private static PageCandidate page1() {
        return new PageCandidate(
                List.of(new CandidateTransaction(LocalDate.of(2025, 3, 10), TransactionDirection.INCOMING,
                        new BigDecimal("250.00"), "Acme d.o.o.", "INV-2025-007", null, null)),
                new BigDecimal("1000.00"), new BigDecimal("1250.00"),
                new CandidateMetadata(7L, null, null, null, "EUR", "HR1210010051863000160"));
    }

    private static PageCandidate page2(String closing) {
        return new PageCandidate(
                List.of(new CandidateTransaction(LocalDate.of(2025, 3, 15), TransactionDirection.OUTGOING,
                        new BigDecimal("50.00"), "Bank", "Fee", null, null)),
                new BigDecimal("1250.00"), new BigDecimal(closing), null);
    }

    private static PageCheckpoint checkpoint(int pageNumber, PageStatus status, String start, String end, StatementLine line) {
        PageCheckpoint c = new PageCheckpoint();
        c.setImportJobId(JOB_ID);
        c.setPageNumber(pageNumber);
        c.setStatus(status);
        c.setTierUsed(TierType.TEXT_LLM);
        c.setPageStartBalance(new BigDecimal(start));
        c.setPageEndBalance(new BigDecimal(end));
        c.setCurrency("EUR");
        c.setLines(new ArrayList<>(List.of(line)));
        return c;
    }

    private static StatementLine line(LocalDate date, TransactionDirection direction, String amount) {
        StatementLine l = new StatementLine();
        l.setBookingDate(date);
        l.setDirection(direction);
        l.setAmount(new BigDecimal(amount));
        l.setCurrency("EUR");
        return l;
    }
}
