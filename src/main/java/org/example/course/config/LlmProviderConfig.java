package org.example.course.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.course.service.llm.LlmProvider;
import org.example.course.service.llm.OllamaLlmProvider;
import org.example.course.service.llm.XaiLlmProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Generator providers. Content generation and memory compaction get separate beans so they can
 * point at different models.
 */
@Configuration
public class LlmProviderConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmProviderConfig.class);

    @Value("${ai.generation.provider:ollama}")
    private String generationProvider;

    @Value("${ai.generation.request-timeout-seconds:150}")
    private int generationTimeoutSeconds;

    @Value("${ai.generation.ollama.base-url:http://localhost:11434}")
    private String generationOllamaBaseUrl;

    @Value("${ai.generation.ollama.model:llama3.1:latest}")
    private String generationOllamaModel;

    @Value("${ai.generation.xai.api-key:}")
    private String generationXaiApiKey;

    @Value("${ai.generation.xai.model:grok-4-1-fast-reasoning}")
    private String generationXaiModel;

    // Compaction defaults to the generation settings
    @Value("${ai.compaction.provider:${ai.generation.provider:ollama}}")
    private String compactionProvider;

    @Value("${ai.compaction.request-timeout-seconds:60}")
    private int compactionTimeoutSeconds;

    @Value("${ai.compaction.ollama.base-url:${ai.generation.ollama.base-url:http://localhost:11434}}")
    private String compactionOllamaBaseUrl;

    @Value("${ai.compaction.ollama.model:${ai.generation.ollama.model:llama3.1:latest}}")
    private String compactionOllamaModel;

    @Value("${ai.compaction.xai.api-key:${ai.generation.xai.api-key:}}")
    private String compactionXaiApiKey;

    @Value("${ai.compaction.xai.model:grok-4-1-fast-non-reasoning}")
    private String compactionXaiModel;

    @Bean
    @Qualifier("generationLlmProvider")
    public LlmProvider generationLlmProvider(ObjectMapper objectMapper) {
        return createProvider(generationProvider,
                generationOllamaBaseUrl, generationOllamaModel,
                generationXaiApiKey, generationXaiModel,
                generationTimeoutSeconds, "generation", objectMapper);
    }

    @Bean
    @Qualifier("compactionLlmProvider")
    public LlmProvider compactionLlmProvider(ObjectMapper objectMapper) {
        return createProvider(compactionProvider,
                compactionOllamaBaseUrl, compactionOllamaModel,
                compactionXaiApiKey, compactionXaiModel,
                compactionTimeoutSeconds, "compaction", objectMapper);
    }

    private LlmProvider createProvider(
            String providerType,
            String ollamaBaseUrl, String ollamaModel,
            String xaiApiKey, String xaiModel,
            int timeoutSeconds,
            String purpose,
            ObjectMapper objectMapper) {
        Duration timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
        String type = providerType == null ? "" : providerType.trim().toLowerCase();

        if ("xai".equals(type)) {
            if (xaiApiKey == null || xaiApiKey.isBlank()) {
                log.warn("xAI selected for {} without an API key; using Ollama", purpose);
                return new OllamaLlmProvider(ollamaBaseUrl, ollamaModel, timeout, objectMapper);
            }
            log.info("Using xAI for {}: model={}", purpose, xaiModel);
            return new XaiLlmProvider(xaiApiKey, xaiModel, timeout, objectMapper);
        }
        if (!"ollama".equals(type)) {
            log.warn("Unknown provider '{}' for {}; using Ollama", providerType, purpose);
        }
        log.info("Using Ollama for {}: model={}", purpose, ollamaModel);
        return new OllamaLlmProvider(ollamaBaseUrl, ollamaModel, timeout, objectMapper);
    }
}
