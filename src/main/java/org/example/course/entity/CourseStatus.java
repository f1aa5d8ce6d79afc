package org.example.course.entity;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum CourseStatus {
    @JsonProperty("active")
    ACTIVE,
    @JsonProperty("completed")
    COMPLETED,
    @JsonProperty("archived")
    ARCHIVED,
    @JsonProperty("deleted")
    DELETED
}
