package org.example.course.entity;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum OutlineStatus {
    @JsonProperty("generating")
    GENERATING,
    @JsonProperty("ready")
    READY,
    @JsonProperty("failed")
    FAILED
}
