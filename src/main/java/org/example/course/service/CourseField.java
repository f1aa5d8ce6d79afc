package org.example.course.service;

/**
 * Field groups of the course document that can be written independently.
 */
public enum CourseField {
    TITLE,
    /** Status plus the completed/archived/deleted stamps. */
    STATUS,
    /** Outline tree, outline status and error, total lesson count. */
    OUTLINE,
    POSITION,
    STEPS,
    MEMORY,
    /** Progress percentage and completed unit count. */
    PROGRESS,
    LAST_ACCESSED
}
