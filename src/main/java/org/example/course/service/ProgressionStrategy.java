package org.example.course.service;

import org.example.course.entity.ProgressionMode;
import org.example.course.model.Course;

import java.util.Optional;

/**
 * How a course counts its units. Step courses and outline courses keep different data shapes
 * and each gets its own strategy.
 */
public interface ProgressionStrategy {

    ProgressionMode mode();

    /**
     * Id of the unit the learner should work on next, if any.
     */
    Optional<String> currentUnitId(Course course);

    int completedUnits(Course course);

    int totalUnits(Course course);

    /**
     * Whether every unit meets its pass criterion: quiz units need a score of at least
     * {@link ProgressEngine#PASSING_SCORE}, all others only need to be completed.
     */
    boolean allUnitsPassed(Course course);
}
