package org.example.course.model;

/**
 * Background generation job for one unit of one course.
 */
public record GenerationWork(
        String courseId,
        String userId,
        String tier,
        UnitRequest request,
        WorkMode mode) {

    public String describe() {
        return mode + " " + request.kind() + " for course " + courseId;
    }
}
