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
import java.util.Map;

/**
 * Calls a local Ollama server through {@code /api/generate} without streaming.
 */
public class OllamaLlmProvider implements LlmProvider {

    private static final Logger log = LoggerFactory.getLogger(OllamaLlmProvider.class);

    private final WebClient webClient;
    private final String model;
    private final Duration requestTimeout;
    private final ObjectMapper objectMapper;

    public OllamaLlmProvider(String baseUrl, String model, Duration requestTimeout, ObjectMapper objectMapper) {
        this(WebClient.builder().baseUrl(baseUrl).build(), model, requestTimeout, objectMapper);
        log.info("Ollama generator configured: baseUrl={}, model={}", baseUrl, model);
    }

    OllamaLlmProvider(WebClient webClient, String model, Duration requestTimeout, ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.model = model;
        this.requestTimeout = requestTimeout;
        this.objectMapper = objectMapper;
    }

    @Override
    public LlmCompletion complete(String prompt, LlmOptions options) {
        Map<String, Object> sampling = new HashMap<>();
        sampling.put("temperature", options.temperature());
        if (options.maxTokens() != null) {
            sampling.put("num_predict", options.maxTokens());
        }

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("prompt", prompt);
        body.put("stream", false);
        body.put("options", sampling);
        if (options.jsonOutput()) {
            body.put("format", "json");
        }

        String raw;
        try {
            raw = webClient.post()
                    .uri("/api/generate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(requestTimeout)
                    .block();
        } catch (WebClientResponseException e) {
            log.error("Ollama returned {}: {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new LlmProviderException(getProviderName(), "Ollama API error: " + e.getStatusCode(), e);
        } catch (RuntimeException e) {
            throw new LlmProviderException(getProviderName(), "Ollama request failed: " + e.getMessage(), e);
        }
        return parseResponse(raw);
    }

    LlmCompletion parseResponse(String raw) {
        try {
            JsonNode root = objectMapper.readTree(raw == null ? "" : raw);
            JsonNode text = root.get("response");
            if (text == null || text.isNull()) {
                throw new LlmProviderException(getProviderName(), "Ollama response has no 'response' field");
            }
            return new LlmCompletion(
                    text.asText(),
                    root.path("prompt_eval_count").asInt(0),
                    root.path("eval_count").asInt(0));
        } catch (LlmProviderException e) {
            throw e;
        } catch (Exception e) {
            throw new LlmProviderException(getProviderName(), "Unreadable Ollama response", e);
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            webClient.get()
                    .uri("/api/tags")
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofSeconds(2));
            return true;
        } catch (Exception e) {
            log.debug("Ollama unavailable: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String getProviderName() {
        return "ollama";
    }
}
