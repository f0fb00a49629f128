package com.ledgerradar.ingestion.extraction;

import com.ledgerradar.ingestion.error.ExtractionProviderException;
import com.ledgerradar.ingestion.error.StatementImportException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Ordered provider chain: the first provider that returns a candidate wins. When every provider fails,
 * the last failure is rethrown.
 */
@Slf4j
public class FallbackExtractionProvider implements ExtractionProvider {

    private final List<ExtractionProvider> providers;

    public FallbackExtractionProvider(List<ExtractionProvider> providers) {
        if (providers == null || providers.isEmpty()) {
            throw new IllegalArgumentException("At least one extraction provider required");
        }
        this.providers = List.copyOf(providers);
    }

    @Override
    public String name() {
        return String.join(">", providers.stream().map(ExtractionProvider::name).toList());
    }

    @Override
    public PageCandidate extract(PageContext context) {
        StatementImportException last = null;
        for (ExtractionProvider provider : providers) {
            try {
                return provider.extract(context);
            } catch (StatementImportException e) {
                log.warn("Provider {} failed on page {} ({}: {})",
                        provider.name(), context.pageNumber(), e.getCode(), e.getMessage());
                last = e;
            }
        }
        throw last != null ? last : new ExtractionProviderException("No provider produced a candidate");
    }

    public List<ExtractionProvider> getProviders() {
        return providers;
    }
}
