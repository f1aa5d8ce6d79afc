package org.example.course.service;

import org.example.course.entity.ProgressionMode;
import org.example.course.model.Course;
import org.example.course.model.Lesson;
import org.example.course.model.LessonPosition;
import org.example.course.model.Outline;
import org.example.course.model.ProgressStatus;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PositionTrackerTest {

    private final PositionTracker tracker = new PositionTracker();

    @Test
    void initialize_pointsAtFirstLessonAndMarksItInProgress() {
        Outline outline = CourseFixtures.outline(2, 1);

        LessonPosition position = tracker.initialize(outline);

        assertEquals(new LessonPosition(0, 0, "s0", "s0-l0"), position);
        assertEquals(ProgressStatus.IN_PROGRESS, outline.getSections().get(0).getStatus());
        assertEquals(ProgressStatus.IN_PROGRESS, outline.getSections().get(0).getLessons().get(0).getStatus());
        assertEquals(ProgressStatus.PENDING, outline.getSections().get(1).getStatus());
    }

    @Test
    void initialize_skipsSectionsWithoutLessons() {
        Outline outline = CourseFixtures.outline(0, 1);

        assertEquals(new LessonPosition(1, 0, "s1", "s1-l0"), tracker.initialize(outline));
        assertNull(tracker.initialize(CourseFixtures.outline(0)));
    }

    @Test
    void advance_movesWithinSectionWithoutCompletingIt() {
        Course course = CourseFixtures.courseWithOutline(ProgressionMode.LESSONS, 2);

        assertTrue(tracker.advance(course, "s0-l0", true));

        assertEquals(new LessonPosition(0, 1, "s0", "s0-l1"), course.getCurrentPosition());
        assertEquals(ProgressStatus.IN_PROGRESS, course.getOutline().getSections().get(0).getStatus());
    }

    @Test
    void advance_completesSectionAndMovesToNextOne() {
        Course course = CourseFixtures.courseWithOutline(ProgressionMode.LESSONS, 1, 1);

        assertTrue(tracker.advance(course, "s0-l0", true));

        assertEquals(new LessonPosition(1, 0, "s1", "s1-l0"), course.getCurrentPosition());
        assertEquals(ProgressStatus.COMPLETED, course.getOutline().getSections().get(0).getStatus());
        assertEquals(ProgressStatus.IN_PROGRESS, course.getOutline().getSections().get(1).getStatus());
    }

    @Test
    void advance_ignoresStaleAndFailedCompletions() {
        Course course = CourseFixtures.courseWithOutline(ProgressionMode.LESSONS, 2);
        LessonPosition before = course.getCurrentPosition();

        assertFalse(tracker.advance(course, "s0-l1", true));
        assertFalse(tracker.advance(course, "s0-l0", false));

        assertEquals(before, course.getCurrentPosition());
    }

    @Test
    void advance_pastLastLessonExhaustsCursor() {
        Course course = CourseFixtures.courseWithOutline(ProgressionMode.LESSONS, 1);

        assertTrue(tracker.advance(course, "s0-l0", true));

        assertNull(course.getCurrentPosition());
        assertTrue(tracker.isExhausted(course));
        assertTrue(tracker.currentLesson(course).isEmpty());
        assertFalse(tracker.advance(course, "s0-l0", true));
    }

    @Test
    void advance_skipsLessonsAlreadyPassed() {
        Course course = CourseFixtures.courseWithOutline(ProgressionMode.LESSONS, 3, 2);
        lesson(course, 0, 1).setStatus(ProgressStatus.COMPLETED);
        lesson(course, 0, 2).setStatus(ProgressStatus.COMPLETED);
        lesson(course, 1, 0).setStatus(ProgressStatus.COMPLETED);

        assertTrue(tracker.advance(course, "s0-l0", true));

        assertEquals(new LessonPosition(1, 1, "s1", "s1-l1"), course.getCurrentPosition());
        assertEquals(ProgressStatus.COMPLETED, course.getOutline().getSections().get(0).getStatus());
        assertEquals(ProgressStatus.IN_PROGRESS, lesson(course, 1, 1).getStatus());
    }

    @Test
    void advance_exhaustsCursorWhenEveryRemainingLessonIsPassed() {
        Course course = CourseFixtures.courseWithOutline(ProgressionMode.LESSONS, 2);
        lesson(course, 0, 1).setStatus(ProgressStatus.COMPLETED);

        assertTrue(tracker.advance(course, "s0-l0", true));

        assertNull(course.getCurrentPosition());
        assertTrue(tracker.isExhausted(course));
    }

    private static Lesson lesson(Course course, int section, int lesson) {
        return course.getOutline().getSections().get(section).getLessons().get(lesson);
    }
}
