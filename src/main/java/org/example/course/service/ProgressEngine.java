package org.example.course.service;

import org.example.course.entity.CourseStatus;
import org.example.course.entity.ProgressionMode;
import org.example.course.model.Course;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Recomputes progress and decides course completion. Progress never decreases while the course
 * is active, and completion is one-way. Mutates the course only; callers persist
 * {@link CourseField#PROGRESS} and {@link CourseField#STATUS}.
 */
@Service
public class ProgressEngine {

    private static final Logger log = LoggerFactory.getLogger(ProgressEngine.class);
    public static final double PASSING_SCORE = 70;

    public record Result(int progress, boolean courseComplete, boolean newlyCompleted) {
    }

    private final Map<ProgressionMode, ProgressionStrategy> strategies = new EnumMap<>(ProgressionMode.class);
    private final Clock clock;

    @Autowired
    public ProgressEngine(List<ProgressionStrategy> strategies) {
        this(strategies, Clock.systemUTC());
    }

    ProgressEngine(List<ProgressionStrategy> strategies, Clock clock) {
        for (ProgressionStrategy strategy : strategies) {
            this.strategies.put(strategy.mode(), strategy);
        }
        this.clock = clock;
    }

    public ProgressionStrategy strategyFor(Course course) {
        ProgressionMode mode = course.getProgressionMode() == null ? ProgressionMode.LESSONS : course.getProgressionMode();
        ProgressionStrategy strategy = strategies.get(mode);
        if (strategy == null) {
            throw new IllegalStateException("No progression strategy for " + mode);
        }
        return strategy;
    }

    public static int progressPercent(int completed, int total) {
        if (total <= 0) {
            return 0;
        }
        return (int) Math.min(100, Math.floor(100.0 * completed / total));
    }

    public Result recompute(Course course) {
        ProgressionStrategy strategy = strategyFor(course);
        int completed = strategy.completedUnits(course);
        int computed = progressPercent(completed, strategy.totalUnits(course));

        course.setLessonsCompleted(completed);
        if (course.getStatus() == CourseStatus.ACTIVE) {
            course.setProgress(Math.max(course.getProgress(), computed));
        }

        boolean newlyCompleted = false;
        if (course.getStatus() == CourseStatus.ACTIVE && computed == 100 && strategy.allUnitsPassed(course)) {
            course.setStatus(CourseStatus.COMPLETED);
            course.setCompletedAt(clock.instant());
            newlyCompleted = true;
            log.info("Course {} status: {} -> {}", course.getId(), CourseStatus.ACTIVE, CourseStatus.COMPLETED);
        }
        return new Result(course.getProgress(), course.getStatus() == CourseStatus.COMPLETED, newlyCompleted);
    }
}
