package org.example.course.service.llm;

/**
 * Sampling options for a completion. {@code jsonOutput} asks the provider for a bare JSON object.
 */
public record LlmOptions(double temperature, Integer maxTokens, boolean jsonOutput) {

    public static LlmOptions structured(double temperature, int maxTokens) {
        return new LlmOptions(temperature, maxTokens, true);
    }
}
