package com.ledgerradar.ingestion.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.ledgerradar.config.CaffeineConfig;
import com.ledgerradar.ingestion.error.JobCancelledException;
import com.ledgerradar.ingestion.error.JobTimeoutException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ids of deleted jobs and deadlines of running ones. In-flight work calls {@link #checkpoint(String)} before
 * every tier transition and before writing, and unwinds once its job was cancelled or ran out of time.
 */
@Component
public class JobCancellationRegistry {

    private record Deadline(Instant at, Duration limit) {}

    private final Cache<String, Instant> cancelled;
    private final Map<String, Deadline> deadlines = new ConcurrentHashMap<>();

    public JobCancellationRegistry(@Qualifier(CaffeineConfig.CANCELLED_JOB_CACHE) Cache<String, Instant> cancelled) {
        this.cancelled = cancelled;
    }

    public void cancel(String jobId) {
        cancelled.put(jobId, Instant.now());
    }

    public boolean isCancelled(String jobId) {
        return cancelled.getIfPresent(jobId) != null;
    }

    /** Starts the job-level clock; {@link #release(String)} must follow when the job finishes. */
    public void startClock(String jobId, Duration limit) {
        deadlines.put(jobId, new Deadline(Instant.now().plus(limit), limit));
    }

    public void release(String jobId) {
        deadlines.remove(jobId);
    }

    /**
     * @throws JobCancelledException the job was deleted
     * @throws JobTimeoutException   the job ran past its deadline
     */
    public void checkpoint(String jobId) {
        if (isCancelled(jobId)) {
            throw new JobCancelledException(jobId);
        }
        Deadline deadline = deadlines.get(jobId);
        if (deadline != null && Instant.now().isAfter(deadline.at())) {
            throw new JobTimeoutException(jobId, deadline.limit());
        }
    }
}
