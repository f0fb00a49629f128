package com.ledgerradar.ingestion.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgerradar.ingestion.config.ExtractionProperties.ProviderProperties;
import com.ledgerradar.ingestion.error.ExtractionProviderException;
import com.ledgerradar.ingestion.error.ExtractionSchemaViolationException;
import com.ledgerradar.ingestion.error.ExtractionTimeoutException;
import com.ledgerradar.ingestion.error.ExtractionTransientException;
import com.ledgerradar.ingestion.error.StatementImportException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.CodecException;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.UnsupportedMediaTypeException;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Chat-completions client for OpenAI-compatible endpoints (OpenAI, Ollama, vLLM, ...). Requests a strict
 * JSON-schema response; page images are sent as data-URL image parts.
 */
@Slf4j
public class OpenAiCompatibleExtractionProvider implements ExtractionProvider {

    private final ProviderProperties properties;
    private final WebClient webClient;
    private final RateLimiter rateLimiter;
    private final PageCandidateParser parser;
    private final Object responseFormat;

    public OpenAiCompatibleExtractionProvider(ProviderProperties properties,
                                              WebClient.Builder webClientBuilder,
                                              RateLimiter rateLimiter,
                                              PageCandidateParser parser,
                                              ObjectMapper objectMapper) {
        this.properties = properties;
        this.webClient = webClientBuilder.build();
        this.rateLimiter = rateLimiter;
        this.parser = parser;
        this.responseFormat = responseFormat(objectMapper);
    }

    @Override
    public String name() {
        return properties.getName();
    }

    @Override
    public PageCandidate extract(PageContext context) {
        if (!rateLimiter.acquirePermission()) {
            throw new ExtractionTransientException(
                    "Rate limiter " + rateLimiter.getName() + " denied a permit for page " + context.pageNumber(), null);
        }
        long start = System.nanoTime();
        JsonNode response = webClient.post()
                .uri(properties.getBaseUrl() + "/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .headers(h -> {
                    if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
                        h.setBearerAuth(properties.getApiKey());
                    }
                })
                .bodyValue(requestBody(context))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(Duration.ofMillis(properties.getTimeoutMs()))
                .onErrorMap(TimeoutException.class, e -> new ExtractionTimeoutException(
                        name() + " did not answer page " + context.pageNumber() + " within " + properties.getTimeoutMs() + " ms", e))
                .onErrorMap(WebClientResponseException.class, e -> classify(e, context))
                .onErrorMap(WebClientRequestException.class, e -> new ExtractionTransientException(
                        name() + " request failed: " + e.getMessage(), e))
                .onErrorMap(e -> e instanceof CodecException || e instanceof UnsupportedMediaTypeException,
                        e -> new ExtractionSchemaViolationException(
                                name() + " returned an unreadable body for page " + context.pageNumber() + ": " + e.getMessage(), e))
                .onErrorMap(e -> !(e instanceof StatementImportException), e -> new ExtractionProviderException(
                        name() + " failed on page " + context.pageNumber() + ": " + e.getMessage(), e))
                .block();
        log.debug("{} answered page {} in {} ms", name(), context.pageNumber(), (System.nanoTime() - start) / 1_000_000L);
        return parser.parse(content(response));
    }

    Map<String, Object> requestBody(PageContext context) {
        List<Map<String, Object>> messages = new ArrayList<>();
        if (context.hasImage()) {
            messages.add(Map.of("role", "system", "content", ExtractionPrompts.VISION_SYSTEM));
            messages.add(Map.of("role", "user", "content", List.of(
                    Map.of("type", "text", "text", ExtractionPrompts.visionUserMessage(context)),
                    Map.of("type", "image_url", "image_url", Map.of("url", "data:image/png;base64," + context.imageBase64())))));
        } else {
            messages.add(Map.of("role", "system", "content", ExtractionPrompts.TEXT_SYSTEM));
            messages.add(Map.of("role", "user", "content", ExtractionPrompts.textUserMessage(context)));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", properties.getModel());
        body.put("temperature", 0);
        body.put("messages", messages);
        body.put("response_format", responseFormat);
        return body;
    }

    private String content(JsonNode response) {
        JsonNode choice = response == null ? null : response.path("choices").path(0);
        if (choice == null || choice.isMissingNode()) {
            throw new ExtractionSchemaViolationException(name() + " returned no choices");
        }
        JsonNode message = choice.path("message");
        if (message.hasNonNull("refusal")) {
            throw new ExtractionSchemaViolationException(name() + " refused: " + message.get("refusal").asText());
        }
        if ("length".equals(choice.path("finish_reason").asText())) {
            throw new ExtractionSchemaViolationException(name() + " output was truncated");
        }
        JsonNode content = message.get("content");
        if (content == null || !content.isTextual()) {
            throw new ExtractionSchemaViolationException(name() + " returned no message content");
        }
        return content.asText();
    }

    private RuntimeException classify(WebClientResponseException e, PageContext context) {
        int status = e.getStatusCode().value();
        String message = name() + " returned HTTP " + status + " for page " + context.pageNumber();
        if (e.getStatusCode().is2xxSuccessful()) {
            return new ExtractionSchemaViolationException(
                    name() + " returned an unreadable body for page " + context.pageNumber() + ": " + e.getMessage(), e);
        }
        if (status == 429 || status >= 500) {
            return new ExtractionTransientException(message, e);
        }
        return new ExtractionProviderException(message + ": " + e.getResponseBodyAsString(), e);
    }

    private static Object responseFormat(ObjectMapper objectMapper) {
        try {
            JsonNode schema = objectMapper.readTree(ExtractionPrompts.RESPONSE_SCHEMA);
            return Map.of("type", "json_schema", "json_schema", Map.of(
                    "name", ExtractionPrompts.SCHEMA_NAME,
                    "strict", true,
                    "schema", schema));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Invalid built-in response schema", e);
        }
    }
}
