package com.shlawgathon.pulse.backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.pulse.backend.exception.LlmInvocationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Completion client for Fireworks AI (OpenAI-compatible chat completions).
 */
@Service
public class FireworksAIService implements LlmCompletionClient {

    private static final Logger log = LoggerFactory.getLogger(FireworksAIService.class);

    private static final String SYSTEM_PROMPT = "You analyze developer activity with an AI coding assistant. "
            + "Answer with a single JSON object that satisfies the provided schema and nothing else.";

    static final String DEFAULT_SCHEMA_NAME = "pulse_reply";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Value("${fireworks.api.url}")
    private String apiUrl;

    @Value("${fireworks.api.key}")
    private String apiKey;

    @Value("${fireworks.api.model}")
    private String model;

    @Value("${fireworks.api.max-tokens:1500}")
    private int maxTokens;

    @Value("${fireworks.api.temperature:0.2}")
    private double temperature;

    private final Duration timeout;

    public FireworksAIService(ObjectMapper objectMapper,
            @Value("${pulse.llm.timeout:PT20S}") Duration timeout) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    @Override
    public String complete(String prompt, JsonNode schema) throws LlmInvocationException {
        Map<String, Object> requestBody = requestBody(prompt, schema);

        HttpResponse<String> response;
        try {
            String jsonBody = objectMapper.writeValueAsString(requestBody);

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(apiUrl))
                    .timeout(timeout)
                    .header("Accept", "application/json")
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                    .build();

            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new LlmInvocationException("Fireworks AI request timed out after " + timeout, e);
        } catch (IOException e) {
            throw new LlmInvocationException("Fireworks AI request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmInvocationException("Fireworks AI request interrupted", e);
        }

        if (response.statusCode() != 200) {
            log.error("Fireworks AI API error: {} - {}", response.statusCode(), response.body());
            throw new LlmInvocationException("Fireworks AI API error: " + response.statusCode(),
                    response.statusCode(), null);
        }

        try {
            JsonNode responseJson = objectMapper.readTree(response.body());
            return responseJson
                    .path("choices")
                    .path(0)
                    .path("message")
                    .path("content")
                    .asText();
        } catch (IOException e) {
            throw new LlmInvocationException("Fireworks AI returned an unreadable envelope", e);
        }
    }

    /**
     * Chat completion body constraining the reply to {@code schema}. The schema's
     * {@code title} names it for the provider.
     */
    Map<String, Object> requestBody(String prompt, JsonNode schema) {
        List<Map<String, String>> messages = List.of(
                Map.of("role", "system", "content", SYSTEM_PROMPT),
                Map.of("role", "user", "content", prompt));

        return Map.of(
                "model", model,
                "max_tokens", maxTokens,
                "temperature", temperature,
                "messages", messages,
                "response_format", Map.of(
                        "type", "json_schema",
                        "json_schema", Map.of(
                                "name", schema.path("title").asText(DEFAULT_SCHEMA_NAME),
                                "schema", schema)));
    }

    @Override
    public String modelName() {
        return model;
    }
}
