package com.ledgerradar.api.controller;

import com.ledgerradar.api.dto.ImportAcceptedResponse;
import com.ledgerradar.api.dto.ImportJobResponse;
import com.ledgerradar.domain.ImportJob;
import com.ledgerradar.ingestion.config.IntakeProperties;
import com.ledgerradar.ingestion.error.OversizedFileException;
import com.ledgerradar.ingestion.intake.UploadIntakeService;
import com.ledgerradar.ingestion.job.ImportJobService;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Statement uploads and the import job pull interface.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ImportController {

    private final UploadIntakeService uploadIntakeService;
    private final ImportJobService importJobService;
    private final IntakeProperties intakeProperties;

    /**
     * Multipart upload ({@code file}); 202 with the queued job. {@code overwrite=true} replaces an earlier upload
     * of the same content.
     */
    @PostMapping(path = "/accounts/{accountId}/imports", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<ResponseEntity<ImportAcceptedResponse>> upload(
            @PathVariable String accountId,
            @RequestPart("file") FilePart file,
            @RequestParam(defaultValue = "false") boolean overwrite
    ) {
        long maxBytes = intakeProperties.getMaxFileBytes();
        return DataBufferUtils.join(file.content(), (int) Math.min(Integer.MAX_VALUE, maxBytes))
                .onErrorMap(DataBufferLimitException.class, e -> new OversizedFileException(maxBytes))
                .map(ImportController::toBytes)
                .defaultIfEmpty(new byte[0])
                .publishOn(Schedulers.boundedElastic())
                .map(bytes -> uploadIntakeService.submit(accountId, file.filename(), bytes, overwrite))
                .map(job -> ResponseEntity.accepted().body(new ImportAcceptedResponse(
                        job.getId(),
                        job.getStatus().name(),
                        job.getFormat().name(),
                        job.getAdvisories().stream().map(Enum::name).toList())));
    }

    @GetMapping("/imports/{jobId}")
    public ResponseEntity<ImportJobResponse> getStatus(@PathVariable String jobId) {
        return importJobService.status(jobId)
                .map(job -> ResponseEntity.ok(ImportJobResponse.from(job)))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/accounts/{accountId}/imports")
    public ResponseEntity<List<ImportJobResponse>> list(@PathVariable String accountId) {
        List<ImportJob> jobs = importJobService.listForAccount(accountId);
        return ResponseEntity.ok(jobs.stream().map(ImportJobResponse::from).toList());
    }

    @DeleteMapping("/imports/{jobId}")
    public ResponseEntity<Void> delete(@PathVariable String jobId) {
        importJobService.delete(jobId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/imports/{jobId}/confirm")
    public ResponseEntity<ImportJobResponse> confirm(@PathVariable String jobId) {
        return ResponseEntity.ok(ImportJobResponse.from(importJobService.confirm(jobId)));
    }

    @PostMapping("/imports/{jobId}/reject")
    public ResponseEntity<ImportJobResponse> reject(@PathVariable String jobId) {
        return ResponseEntity.ok(ImportJobResponse.from(importJobService.reject(jobId)));
    }

    private static byte[] toBytes(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }
}
