package org.example.course.entity;

/**
 * Which unit model drives progress for a course: the outline's lessons or the flat step list.
 */
public enum ProgressionMode {
    LESSONS,
    STEPS
}
