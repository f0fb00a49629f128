package com.ledgerradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Job orchestrator config: worker loops, job-level timeout, provider retry policy, housekeeping.
 */
@ConfigurationProperties(prefix = "ledgerradar.jobs")
@NoArgsConstructor
@Getter
@Setter
public class ImportJobProperties {

    /** Number of worker loops draining the job queue. Default 5 (match import-job-executor core size). */
    private int workerThreads = 5;

    /** Wall-clock budget for one job in ms; exceeded jobs fail. Default 15 min. */
    private long jobTimeoutMs = 15 * 60_000L;

    /** How often (ms) the sweeper re-enqueues PENDING jobs that are not in flight. */
    private long pendingSweepIntervalMs = 60_000L;

    /** Stored upload files of finished jobs are deleted after this many hours. */
    private long fileRetentionHours = 72;

    private Retry retry = new Retry();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Retry {
        /** Base delay in ms for first retry; doubles each attempt. Default 1000. */
        private long baseDelayMs = 1000L;
        /** Jitter factor 0..1 (e.g. 0.2 = ±20%). Default 0.2. */
        private double jitterFactor = 0.2;
        /** Total attempts per model call, the first included. Default 5. */
        private int maxAttempts = 5;
        /** Ceiling for a single backoff delay in ms. Default 30s. */
        private long maxDelayMs = 30_000L;
    }
}
