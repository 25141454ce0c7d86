package com.vidnyan.tfguard.adapter.out.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Chat client for OpenAI-compatible endpoints (Groq by default).
 */
@Component
public class LlmClient {

    private static final Logger log = LoggerFactory.getLogger(LlmClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Value("${tfguard.ai.provider:groq}")
    private String provider;

    @Value("${tfguard.ai.api-url:https://api.groq.com/openai/v1/chat/completions}")
    private String apiUrl;

    @Value("${tfguard.ai.api-key:}")
    private String apiKey;

    @Value("${tfguard.ai.model:llama-3.3-70b-versatile}")
    private String model;

    public LlmClient(ObjectMapper objectMapper) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .build();
        this.objectMapper = objectMapper;
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * Send a prompt and return the first choice's text.
     *
     * @throws LlmException on transport errors or a non-200 answer
     */
    public String chat(String systemPrompt, String userPrompt) {
        if (!isConfigured()) {
            throw new LlmException("No API key configured for provider " + provider);
        }
        log.debug("LLM request - provider: {}, model: {}", provider, model);

        Map<String, Object> requestBody = Map.of(
                "model", model,
                "messages", List.of(
                        Map.of("role", "system", "content", systemPrompt),
                        Map.of("role", "user", "content", userPrompt)),
                "temperature", 0.2,
                "max_tokens", 2048);

        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(apiUrl))
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(requestBody)))
                    .timeout(Duration.ofSeconds(60))
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.error("{} API error: {} - {}", provider, response.statusCode(), response.body());
                throw new LlmException(provider + " API error: " + response.statusCode());
            }

            JsonNode root = objectMapper.readTree(response.body());
            String content = root.path("choices").path(0).path("message").path("content").asText();
            log.debug("{} response received: {} chars", provider, content.length());
            return content;
        } catch (IOException e) {
            throw new LlmException(provider + " call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException(provider + " call interrupted", e);
        }
    }

    public static class LlmException extends RuntimeException {
        public LlmException(String message) {
            super(message);
        }

        public LlmException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
