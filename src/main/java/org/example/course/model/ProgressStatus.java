package org.example.course.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ProgressStatus {
    @JsonProperty("pending")
    PENDING,
    @JsonProperty("in_progress")
    IN_PROGRESS,
    @JsonProperty("completed")
    COMPLETED,
    @JsonProperty("skipped")
    SKIPPED
}
