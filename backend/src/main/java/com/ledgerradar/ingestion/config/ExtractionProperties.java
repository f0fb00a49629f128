package com.ledgerradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Model providers for the text tier and the vision repair tier. Both speak the OpenAI-compatible
 * chat-completions protocol (OpenAI, Ollama, vLLM, Groq, ...).
 */
@ConfigurationProperties(prefix = "ledgerradar.extraction")
@NoArgsConstructor
@Getter
@Setter
public class ExtractionProperties {

    private ProviderProperties text = ProviderProperties.of("openai-text", "https://api.openai.com/v1", "gpt-4o-mini", 60_000L);

    /** Vision providers in fallback order; the first one that answers wins. */
    private List<ProviderProperties> vision = new ArrayList<>(List.of(
            ProviderProperties.of("ollama-vision", "http://localhost:11434/v1", "llama3.2-vision", 90_000L),
            ProviderProperties.of("openai-vision", "https://api.openai.com/v1", "gpt-4o-mini", 90_000L)));

    /** Pages of one job extracted concurrently. */
    private int pageConcurrency = 3;

    /** Render resolution for page images sent to vision providers. */
    private float renderDpi = 150f;

    /** Currency assumed when neither document nor model reports one. */
    private String defaultCurrency = "EUR";

    @NoArgsConstructor
    @Getter
    @Setter
    public static class ProviderProperties {
        private String name;
        /** Base URL up to and including the API version, e.g. https://api.openai.com/v1. */
        private String baseUrl;
        /** Bearer token; blank for local providers. */
        private String apiKey;
        private String model;
        /** Per-call timeout in ms. */
        private long timeoutMs = 60_000L;
        /** Local token bucket per provider. */
        private int requestsPerMinute = 60;
        /** How long a call may wait for a rate-limiter permit before failing as transient. */
        private long limiterTimeoutMs = 30_000L;
        /** Disabled providers are skipped when building the chain. */
        private boolean enabled = true;

        static ProviderProperties of(String name, String baseUrl, String model, long timeoutMs) {
            ProviderProperties p = new ProviderProperties();
            p.setName(name);
            p.setBaseUrl(baseUrl);
            p.setModel(model);
            p.setTimeoutMs(timeoutMs);
            return p;
        }
    }
}
