package org.example.course.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;
import java.util.Optional;

public enum StepType {
    @JsonProperty("lesson")
    LESSON,
    @JsonProperty("quiz")
    QUIZ,
    @JsonProperty("exercise")
    EXERCISE;

    public static Optional<StepType> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
