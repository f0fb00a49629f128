package com.ledgerradar.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgerradar.common.RetryPolicy;
import com.ledgerradar.ingestion.config.ExtractionProperties.ProviderProperties;
import com.ledgerradar.ingestion.extraction.ExtractionProvider;
import com.ledgerradar.ingestion.extraction.FallbackExtractionProvider;
import com.ledgerradar.ingestion.extraction.OpenAiCompatibleExtractionProvider;
import com.ledgerradar.ingestion.extraction.PageCandidateParser;
import com.ledgerradar.ingestion.extraction.RetryingExtractionProvider;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

/**
 * Binds the ingestion properties and assembles the extraction provider chains:
 * text tier = retrying provider; vision tier = fallback over the enabled vision providers, each retrying.
 */
@Configuration
@EnableConfigurationProperties({ IntakeProperties.class, ExtractionProperties.class, AuditProperties.class, ImportJobProperties.class, DeduplicationProperties.class })
public class IngestionConfig {

    @Autowired
    private ImportJobProperties importJobProperties;

    @Bean
    public RetryPolicy extractionRetryPolicy() {
        ImportJobProperties.Retry retry = importJobProperties.getRetry();
        return new RetryPolicy(retry.getBaseDelayMs(), retry.getJitterFactor(), retry.getMaxAttempts(), retry.getMaxDelayMs());
    }

    @Bean(name = "textExtractionProvider")
    public ExtractionProvider textExtractionProvider(ExtractionProperties properties,
                                                     WebClient.Builder webClientBuilder,
                                                     PageCandidateParser parser,
                                                     ObjectMapper objectMapper,
                                                     RetryPolicy extractionRetryPolicy) {
        return retrying(properties.getText(), webClientBuilder, parser, objectMapper, extractionRetryPolicy);
    }

    @Bean(name = "visionExtractionProvider")
    public ExtractionProvider visionExtractionProvider(ExtractionProperties properties,
                                                       WebClient.Builder webClientBuilder,
                                                       PageCandidateParser parser,
                                                       ObjectMapper objectMapper,
                                                       RetryPolicy extractionRetryPolicy) {
        List<ExtractionProvider> chain = properties.getVision().stream()
                .filter(ProviderProperties::isEnabled)
                .map(p -> retrying(p, webClientBuilder, parser, objectMapper, extractionRetryPolicy))
                .toList();
        if (chain.isEmpty()) {
            throw new IllegalStateException("At least one vision provider must be enabled under ledgerradar.extraction.vision");
        }
        return new FallbackExtractionProvider(chain);
    }

    static RateLimiter rateLimiter(ProviderProperties p) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .limitForPeriod(Math.max(1, p.getRequestsPerMinute()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, p.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("extraction-" + p.getName(), config);
    }

    private static ExtractionProvider retrying(ProviderProperties p, WebClient.Builder webClientBuilder,
                                               PageCandidateParser parser, ObjectMapper objectMapper, RetryPolicy policy) {
        ExtractionProvider client = new OpenAiCompatibleExtractionProvider(
                p, webClientBuilder.clone(), rateLimiter(p), parser, objectMapper);
        return new RetryingExtractionProvider(client, policy);
    }
}
