package org.example.course.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

public enum QuestionType {
    @JsonProperty("multiple_choice")
    MULTIPLE_CHOICE,
    @JsonProperty("true_false")
    TRUE_FALSE,
    @JsonProperty("fill_blank")
    FILL_BLANK,
    @JsonProperty("short_answer")
    SHORT_ANSWER,
    @JsonProperty("code")
    CODE;

    public static Optional<QuestionType> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(java.util.Locale.ROOT).replace('-', '_');
        for (QuestionType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
