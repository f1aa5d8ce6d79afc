package org.example.course.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Calls the OpenAI-compatible chat completions endpoint of xAI.
 */
public class XaiLlmProvider implements LlmProvider {

    private static final Logger log = LoggerFactory.getLogger(XaiLlmProvider.class);
    private static final String BASE_URL = "https://api.x.ai/v1";

    private final WebClient webClient;
    private final String model;
    private final String apiKey;
    private final Duration requestTimeout;
    private final ObjectMapper objectMapper;

    public XaiLlmProvider(String apiKey, String model, Duration requestTimeout, ObjectMapper objectMapper) {
        this.apiKey = apiKey;
        this.model = model;
        this.requestTimeout = requestTimeout;
        this.objectMapper = objectMapper;
        this.webClient = WebClient.builder()
                .baseUrl(BASE_URL)
                .defaultHeader("Authorization", "Bearer " + apiKey)
                .build();
        log.info("xAI generator configured: model={}", model);
    }

    @Override
    public LlmCompletion complete(String prompt, LlmOptions options) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("messages", List.of(Map.of("role", "user", "content", prompt)));
        body.put("temperature", options.temperature());
        if (options.maxTokens() != null) {
            body.put("max_tokens", options.maxTokens());
        }
        if (options.jsonOutput()) {
            body.put("response_format", Map.of("type", "json_object"));
        }

        String raw;
        try {
            raw = webClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(requestTimeout)
                    .block();
        } catch (WebClientResponseException e) {
            log.error("xAI returned {}: {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new LlmProviderException(getProviderName(), "xAI API error: " + e.getStatusCode(), e);
        } catch (RuntimeException e) {
            throw new LlmProviderException(getProviderName(), "xAI request failed: " + e.getMessage(), e);
        }
        return parseResponse(raw);
    }

    LlmCompletion parseResponse(String raw) {
        JsonNode root;
        try {
            root = objectMapper.readTree(raw == null ? "" : raw);
        } catch (Exception e) {
            throw new LlmProviderException(getProviderName(), "Unreadable xAI response", e);
        }
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new LlmProviderException(getProviderName(), "xAI response has no choices");
        }
        JsonNode content = choices.get(0).path("message").path("content");
        if (content.isMissingNode() || content.isNull()) {
            throw new LlmProviderException(getProviderName(), "xAI response has no message content");
        }
        JsonNode usage = root.path("usage");
        return new LlmCompletion(
                content.asText(),
                usage.path("prompt_tokens").asInt(0),
                usage.path("completion_tokens").asInt(0));
    }

    @Override
    public boolean isAvailable() {
        // availability is assumed once a key is configured
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String getProviderName() {
        return "xai";
    }
}
