package org.example.course.service;

public class CourseNotFoundException extends RuntimeException {

    private final String courseId;

    public CourseNotFoundException(String courseId) {
        super("Course not found: " + courseId);
        this.courseId = courseId;
    }

    public String getCourseId() {
        return courseId;
    }
}
