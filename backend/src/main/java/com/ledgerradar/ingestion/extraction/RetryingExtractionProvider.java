package com.ledgerradar.ingestion.extraction;

import com.ledgerradar.common.RetryPolicy;
import com.ledgerradar.ingestion.error.ExtractionProviderException;
import com.ledgerradar.ingestion.error.ExtractionTransientException;
import lombok.extern.slf4j.Slf4j;

/**
 * Retries transient failures with exponential backoff. Timeouts and schema violations pass straight through;
 * exhausting the attempts surfaces the last transient failure.
 */
@Slf4j
public class RetryingExtractionProvider implements ExtractionProvider {

    private final ExtractionProvider delegate;
    private final RetryPolicy retryPolicy;

    public RetryingExtractionProvider(ExtractionProvider delegate, RetryPolicy retryPolicy) {
        this.delegate = delegate;
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public PageCandidate extract(PageContext context) {
        ExtractionTransientException last = null;
        for (int attempt = 0; attempt < retryPolicy.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                long delay = retryPolicy.delayMs(attempt - 1);
                log.warn("{} transient failure on page {} (attempt {}/{}), retrying in {} ms. cause={}",
                        name(), context.pageNumber(), attempt, retryPolicy.getMaxAttempts(), delay, last.getMessage());
                sleep(delay);
            }
            try {
                return delegate.extract(context);
            } catch (ExtractionTransientException e) {
                last = e;
            }
        }
        throw last != null ? last : new ExtractionProviderException(name() + " has no attempts configured");
    }

    private static void sleep(long delayMs) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionProviderException("Interrupted during retry backoff", e);
        }
    }
}
