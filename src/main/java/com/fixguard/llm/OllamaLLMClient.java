package com.fixguard.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Default LLMClient backed by a local Ollama server.
 *
 * The system prompt lives here; callers send only the task prompt.
 * Token counts come from Ollama's prompt_eval_count / eval_count fields.
 */
@Component
@Profile("!mock & !gemini")
public class OllamaLLMClient implements LLMClient {

    private static final Logger log = LoggerFactory.getLogger(OllamaLLMClient.class);

    private static final String SYSTEM_PROMPT = """
            You are a precise test repair assistant for Playwright end-to-end tests.
            Apply the smallest possible change that fixes the reported failure.
            Always answer in the exact DIAGNOSIS / CONFIDENCE / FIX format you are given.
            """;

    @Value("${ollama.base-url:http://localhost:11434}")
    private String baseUrl;

    @Value("${ollama.model:llama3:8b}")
    private String model;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public OllamaLLMClient(ObjectMapper objectMapper) {
        this.restTemplate = new RestTemplate();
        this.objectMapper = objectMapper;
    }

    @Override
    public LlmCompletion generate(String prompt, double temperature) {
        log.debug("[Ollama] temperature={} promptLen={}", temperature, prompt.length());

        try {
            String url = baseUrl + "/api/generate";

            Map<String, Object> body = new HashMap<>();
            body.put("model",   model);
            body.put("system",  SYSTEM_PROMPT);
            body.put("prompt",  prompt);
            body.put("stream",  false);
            body.put("options", Map.of("temperature", temperature));

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);

            ResponseEntity<String> response =
                    restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);

            if (response.getBody() == null) {
                throw new LlmException("Ollama returned an empty body");
            }
            JsonNode root = objectMapper.readTree(response.getBody());

            String text   = root.path("response").asText("");
            long   input  = root.path("prompt_eval_count").asLong(0);
            long   output = root.path("eval_count").asLong(0);

            log.debug("[Ollama] responseLen={} in={} out={}", text.length(), input, output);
            return new LlmCompletion(text, input, output, model);

        } catch (RestClientException | IOException e) {
            log.error("[Ollama] Call failed: {}", e.getMessage());
            throw new LlmException("Ollama LLM call failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String getModelName() {
        return model;
    }
}
