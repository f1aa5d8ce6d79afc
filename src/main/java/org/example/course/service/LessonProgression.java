package org.example.course.service;

import org.example.course.entity.ProgressionMode;
import org.example.course.model.Course;
import org.example.course.model.Lesson;
import org.example.course.model.LessonPosition;
import org.example.course.model.Section;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class LessonProgression implements ProgressionStrategy {

    @Override
    public ProgressionMode mode() {
        return ProgressionMode.LESSONS;
    }

    @Override
    public Optional<String> currentUnitId(Course course) {
        return Optional.ofNullable(course.getCurrentPosition()).map(LessonPosition::lessonId);
    }

    @Override
    public int completedUnits(Course course) {
        return course.getOutline() == null ? 0 : course.getOutline().countCompletedLessons();
    }

    @Override
    public int totalUnits(Course course) {
        return course.getOutline() == null ? 0 : course.getOutline().countLessons();
    }

    @Override
    public boolean allUnitsPassed(Course course) {
        if (course.getOutline() == null) {
            return false;
        }
        for (Section section : course.getOutline().getSections()) {
            for (Lesson lesson : section.getLessons()) {
                if (!isPassed(lesson)) {
                    return false;
                }
            }
        }
        return true;
    }

    static boolean isPassed(Lesson lesson) {
        if (!lesson.isCompleted()) {
            return false;
        }
        if (!lesson.isQuiz()) {
            return true;
        }
        return lesson.getProgress() != null && lesson.getProgress().derivedScore() >= ProgressEngine.PASSING_SCORE;
    }
}
