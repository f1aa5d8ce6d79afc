package org.example.course.service.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class XaiLlmProviderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private XaiLlmProvider provider(String apiKey) {
        return new XaiLlmProvider(apiKey, "grok-3-mini", Duration.ofSeconds(5), objectMapper);
    }

    @Test
    void parseResponse_readsFirstChoiceAndUsage() {
        LlmCompletion completion = provider("key").parseResponse("""
                {"choices":[{"message":{"role":"assistant","content":"{\\"type\\":\\"quiz\\"}"}}],
                 "usage":{"prompt_tokens":300,"completion_tokens":90,"total_tokens":390}}
                """);

        assertEquals("{\"type\":\"quiz\"}", completion.text());
        assertEquals(390, completion.totalTokens());
    }

    @Test
    void parseResponse_noChoicesFails() {
        assertThrows(LlmProviderException.class, () -> provider("key").parseResponse("{\"choices\":[]}"));
    }

    @Test
    void parseResponse_nullContentFails() {
        assertThrows(LlmProviderException.class,
                () -> provider("key").parseResponse("{\"choices\":[{\"message\":{\"content\":null}}]}"));
    }

    @Test
    void availabilityFollowsApiKey() {
        assertTrue(provider("key").isAvailable());
        assertFalse(provider(" ").isAvailable());
    }
}
