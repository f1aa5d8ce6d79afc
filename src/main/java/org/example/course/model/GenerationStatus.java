package org.example.course.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lifecycle of a generated unit (lesson block set or a single block's content).
 */
public enum GenerationStatus {
    @JsonProperty("pending")
    PENDING,
    @JsonProperty("generating")
    GENERATING,
    @JsonProperty("ready")
    READY,
    @JsonProperty("error")
    ERROR;

    /**
     * Valid moves are pending → generating → {ready | error} and error → generating.
     * Anything else is reported by callers as a data-integrity warning, never rejected.
     */
    public static boolean isValidTransition(GenerationStatus from, GenerationStatus to) {
        if (from == null) {
            from = PENDING;
        }
        return switch (from) {
            case PENDING -> to == GENERATING;
            case GENERATING -> to == READY || to == ERROR;
            case ERROR -> to == GENERATING;
            case READY -> false;
        };
    }
}
