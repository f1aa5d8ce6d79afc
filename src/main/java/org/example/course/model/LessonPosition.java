package org.example.course.model;

/**
 * Cursor into the outline. The ids are denormalized copies of the ids at the index pair.
 */
public record LessonPosition(int sectionIndex, int lessonIndex, String sectionId, String lessonId) {
}
