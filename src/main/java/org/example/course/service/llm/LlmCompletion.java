package org.example.course.service.llm;

public record LlmCompletion(String text, int promptTokens, int completionTokens) {

    public int totalTokens() {
        return Math.max(0, promptTokens) + Math.max(0, completionTokens);
    }
}
