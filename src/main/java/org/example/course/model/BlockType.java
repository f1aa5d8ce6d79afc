package org.example.course.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;
import java.util.Optional;

public enum BlockType {
    @JsonProperty("text")
    TEXT,
    @JsonProperty("code")
    CODE,
    @JsonProperty("question")
    QUESTION,
    @JsonProperty("task")
    TASK,
    @JsonProperty("flashcard")
    FLASHCARD,
    @JsonProperty("summary")
    SUMMARY;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<BlockType> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        for (BlockType type : values()) {
            if (type.value().equalsIgnoreCase(value.trim())) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
