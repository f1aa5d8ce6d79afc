package org.example.course.service;

/**
 * The course's lifecycle status does not allow the requested operation.
 */
public class CourseStateException extends RuntimeException {

    public static final String COURSE_ARCHIVED = "COURSE_ARCHIVED";
    public static final String COURSE_COMPLETED = "COURSE_COMPLETED";
    public static final String INVALID_STATUS_TRANSITION = "INVALID_STATUS_TRANSITION";
    public static final String OUTLINE_NOT_READY = "OUTLINE_NOT_READY";

    private final String code;

    public CourseStateException(String code, String message) {
        super(message);
        this.code = code;
    }

    public static CourseStateException archived() {
        return new CourseStateException(COURSE_ARCHIVED,
                "This course is archived. Unarchive it to continue learning.");
    }

    public static CourseStateException completed() {
        return new CourseStateException(COURSE_COMPLETED, "This course is already completed.");
    }

    public String getCode() {
        return code;
    }
}
