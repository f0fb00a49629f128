package com.ledgerradar.ingestion.job;

import com.ledgerradar.config.AsyncConfig;
import com.ledgerradar.domain.ImportJob;
import com.ledgerradar.domain.ImportJob.ImportStatus;
import com.ledgerradar.domain.ImportJobQueuedEvent;
import com.ledgerradar.domain.ImportJobRepository;
import com.ledgerradar.ingestion.config.ImportJobProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Orchestrator: job queue, worker loops, resume on startup and a sweep for PENDING jobs that were missed.
 * At most {@code worker-threads} jobs run at once; a job id is never processed by two workers.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ImportJobRunner {

    private final BlockingQueue<String> jobQueue = new LinkedBlockingQueue<>();
    private final Set<String> inFlightJobs = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean workersStarted = new AtomicBoolean(false);

    private final ImportJobRepository importJobRepository;
    private final ImportJobProcessor importJobProcessor;
    private final ImportJobProperties importJobProperties;
    @Qualifier(AsyncConfig.IMPORT_JOB_EXECUTOR)
    private final Executor importJobExecutor;

    @EventListener
    public void onJobQueued(ImportJobQueuedEvent event) {
        enqueue(event.jobId());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady(ApplicationReadyEvent event) {
        startWorkersIfNeeded();
        List<ImportJob> unfinished = importJobRepository.findByStatusIn(Set.of(ImportStatus.PENDING, ImportStatus.PROCESSING));
        int enqueued = 0;
        for (ImportJob job : unfinished) {
            if (enqueue(job.getId())) {
                enqueued++;
            }
        }
        if (enqueued > 0) {
            log.info("Resuming imports: {} job(s) enqueued (PENDING/PROCESSING)", enqueued);
        }
    }

    @Scheduled(fixedDelayString = "${ledgerradar.jobs.pending-sweep-interval-ms:60000}")
    public void sweepPendingJobs() {
        int enqueued = 0;
        for (ImportJob job : importJobRepository.findByStatusIn(Set.of(ImportStatus.PENDING))) {
            if (enqueue(job.getId())) {
                enqueued++;
            }
        }
        if (enqueued > 0) {
            log.info("Pending sweep: {} job(s) enqueued", enqueued);
        }
    }

    boolean enqueue(String jobId) {
        if (!inFlightJobs.add(jobId)) {
            log.debug("Skipping enqueue for job {}: already queued or running", jobId);
            return false;
        }
        jobQueue.offer(jobId);
        return true;
    }

    public boolean isIdle() {
        return jobQueue.isEmpty() && inFlightJobs.isEmpty();
    }

    private void startWorkersIfNeeded() {
        if (!workersStarted.compareAndSet(false, true)) return;
        int n = Math.max(1, importJobProperties.getWorkerThreads());
        for (int i = 0; i < n; i++) {
            importJobExecutor.execute(this::workerLoop);
        }
        log.info("Import worker loops started: {}", n);
    }

    private void workerLoop() {
        while (true) {
            try {
                String jobId = jobQueue.take();
                try {
                    importJobProcessor.process(jobId);
                } catch (RuntimeException e) {
                    log.error("Import worker error on job {}: {}", jobId, e.getMessage(), e);
                } finally {
                    inFlightJobs.remove(jobId);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("Import worker interrupted");
                break;
            }
        }
    }
}
