package org.example.course.entity;

public enum GenerationTaskStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED
}
