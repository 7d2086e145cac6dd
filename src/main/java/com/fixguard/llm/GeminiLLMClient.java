package com.fixguard.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Random;

@Component
@Profile("gemini")
public class GeminiLLMClient implements LLMClient {

    private static final Logger log =
            LoggerFactory.getLogger(GeminiLLMClient.class);

    private static final int  MAX_RETRIES     = 3;
    private static final long BASE_BACKOFF_MS = 500;
    private static final long MAX_JITTER_MS   = 250;

    private final WebClient webClient;
    private final Random jitterRandom = new Random();

    @Value("${gemini.api.key}")
    private String apiKey;

    @Value("${gemini.api.model:gemini-1.5-pro}")
    private String model;

    @Value("${gemini.api.base-url:https://generativelanguage.googleapis.com/v1beta}")
    private String baseUrl;

    @Value("${gemini.api.timeout-seconds:60}")
    private long timeoutSeconds;

    public GeminiLLMClient(WebClient.Builder builder) {
        this.webClient = builder.build();
    }

    @Override
    public LlmCompletion generate(String prompt, double temperature) {

        log.info("Using Gemini | model={}", model);

        Map<String, Object> body = Map.of(
            "contents", List.of(
                Map.of(
                    "parts", List.of(
                        Map.of("text", prompt)
                    )
                )
            ),
            "generationConfig", Map.of("temperature", temperature)
        );

        int attempt = 0;

        while (true) {
            try {
                attempt++;

                log.debug("[Gemini] Attempt {} sending request", attempt);

                Map<?, ?> response = webClient
                        .post()
                        .uri(baseUrl + "/models/" + model + ":generateContent?key=" + apiKey)
                        .contentType(MediaType.APPLICATION_JSON)
                        .accept(MediaType.APPLICATION_JSON)
                        .bodyValue(body)
                        .retrieve()
                        .bodyToMono(Map.class)
                        .timeout(Duration.ofSeconds(timeoutSeconds))
                        .block();

                log.info("[Gemini] Call succeeded | retries={}", attempt - 1);

                return toCompletion(response);

            } catch (LlmException ex) {
                throw ex;
            } catch (RuntimeException ex) {

                if (!isRetryable(ex) || attempt > MAX_RETRIES) {
                    log.error("[Gemini] Final failure | attempts={}", attempt, ex);
                    throw new LlmException("Gemini call failed: " + rootMessage(ex), ex);
                }

                long backoff = computeBackoff(attempt);

                log.warn(
                    "[Gemini] Transient failure on attempt {}. Retrying after {} ms. Cause: {}",
                    attempt,
                    backoff,
                    rootMessage(ex)
                );

                sleep(backoff);
            }
        }
    }

    @Override
    public String getModelName() {
        return model;
    }

    @SuppressWarnings("unchecked")
    private LlmCompletion toCompletion(Map<?, ?> response) {
        if (response == null) {
            throw new LlmException("Gemini returned an empty body");
        }
        long inputTokens  = 0;
        long outputTokens = 0;
        Object usage = response.get("usageMetadata");
        if (usage instanceof Map) {
            Map<?, ?> usageMap = (Map<?, ?>) usage;
            inputTokens  = asLong(usageMap.get("promptTokenCount"));
            outputTokens = asLong(usageMap.get("candidatesTokenCount"));
        }

        String text;
        try {
            var candidates = (List<Map<String, Object>>) response.get("candidates");
            var content = (Map<String, Object>) candidates.get(0).get("content");
            var parts = (List<Map<String, Object>>) content.get("parts");
            text = parts.get(0).get("text").toString();
        } catch (RuntimeException e) {
            log.error("Failed to parse Gemini response: {}", response, e);
            // The request was still billed
            throw new LlmException("Malformed Gemini response", e, inputTokens, outputTokens);
        }
        return new LlmCompletion(text, inputTokens, outputTokens, model);
    }

    private static long asLong(Object value) {
        return value instanceof Number ? ((Number) value).longValue() : 0L;
    }

    /** Retry only transient failures */
    private boolean isRetryable(Exception ex) {
        return ex instanceof WebClientResponseException.ServiceUnavailable   // 503
            || ex instanceof WebClientResponseException.TooManyRequests      // 429
            || ex.getCause() instanceof IOException;
    }

    /** Exponential backoff with jitter */
    private long computeBackoff(int attempt) {
        long exponential = BASE_BACKOFF_MS * (1L << (attempt - 1));
        long jitter = jitterRandom.nextLong(MAX_JITTER_MS + 1);
        return exponential + jitter;
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    private String rootMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }
}
