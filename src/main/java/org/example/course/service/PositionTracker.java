package org.example.course.service;

import org.example.course.model.Course;
import org.example.course.model.Lesson;
import org.example.course.model.LessonPosition;
import org.example.course.model.Outline;
import org.example.course.model.ProgressStatus;
import org.example.course.model.Section;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Maintains the single {section, lesson} cursor of an outline course. A {@code null} position on
 * a course with a ready outline means the cursor ran past the last lesson.
 */
@Component
public class PositionTracker {

    private static final Logger log = LoggerFactory.getLogger(PositionTracker.class);

    /**
     * Points the cursor at the first lesson and marks it and its section in progress.
     * Returns {@code null} when the outline has no lessons at all.
     */
    public LessonPosition initialize(Outline outline) {
        if (outline == null) {
            return null;
        }
        return positionFrom(outline, 0).orElse(null);
    }

    /**
     * Moves the cursor past {@code completedLessonId} to the next lesson not yet passed. Returns
     * {@code false} without touching anything when that lesson is not the one at the cursor, or
     * when it was not passed.
     */
    public boolean advance(Course course, String completedLessonId, boolean passed) {
        Outline outline = course.getOutline();
        LessonPosition position = course.getCurrentPosition();
        if (outline == null || position == null || completedLessonId == null) {
            return false;
        }
        if (!completedLessonId.equals(position.lessonId())) {
            log.debug("Ignoring stale advance for lesson {} on course {} (cursor at {})",
                    completedLessonId, course.getId(), position.lessonId());
            return false;
        }
        if (!passed) {
            log.debug("Lesson {} on course {} not passed; cursor stays", completedLessonId, course.getId());
            return false;
        }
        if (outline.lessonAt(position).isEmpty()) {
            log.warn("Cursor of course {} points outside the outline: {}", course.getId(), position);
            return false;
        }

        List<Section> sections = outline.getSections();
        int sectionIndex = position.sectionIndex();
        int lessonIndex = position.lessonIndex() + 1;
        while (sectionIndex < sections.size()) {
            Section section = sections.get(sectionIndex);
            List<Lesson> lessons = section.getLessons();
            // Lessons passed out of order are not revisited.
            while (lessonIndex < lessons.size() && LessonProgression.isPassed(lessons.get(lessonIndex))) {
                lessonIndex++;
            }
            if (lessonIndex < lessons.size()) {
                Lesson next = lessons.get(lessonIndex);
                if (section.getStatus() != ProgressStatus.COMPLETED) {
                    section.setStatus(ProgressStatus.IN_PROGRESS);
                }
                markInProgress(next);
                course.setCurrentPosition(new LessonPosition(sectionIndex, lessonIndex, section.getId(), next.getId()));
                return true;
            }
            if (!lessons.isEmpty()) {
                section.setStatus(ProgressStatus.COMPLETED);
            }
            sectionIndex++;
            lessonIndex = 0;
        }

        course.setCurrentPosition(null);
        log.info("Course {} reached the end of its outline", course.getId());
        return true;
    }

    public Optional<Lesson> currentLesson(Course course) {
        if (course.getOutline() == null) {
            return Optional.empty();
        }
        return course.getOutline().lessonAt(course.getCurrentPosition());
    }

    public boolean isExhausted(Course course) {
        return course.getOutline() != null
                && course.getCurrentPosition() == null
                && course.getOutline().countLessons() > 0;
    }

    private Optional<LessonPosition> positionFrom(Outline outline, int firstSectionIndex) {
        List<Section> sections = outline.getSections();
        for (int i = Math.max(0, firstSectionIndex); i < sections.size(); i++) {
            Section section = sections.get(i);
            if (section.getLessons().isEmpty()) {
                continue;
            }
            Lesson lesson = section.getLessons().get(0);
            if (section.getStatus() != ProgressStatus.COMPLETED) {
                section.setStatus(ProgressStatus.IN_PROGRESS);
            }
            markInProgress(lesson);
            return Optional.of(new LessonPosition(i, 0, section.getId(), lesson.getId()));
        }
        return Optional.empty();
    }

    private void markInProgress(Lesson lesson) {
        if (lesson.getStatus() == null || lesson.getStatus() == ProgressStatus.PENDING) {
            lesson.setStatus(ProgressStatus.IN_PROGRESS);
        }
    }
}
