package org.example.course.service;

import org.example.course.entity.ProgressionMode;
import org.example.course.model.Course;
import org.example.course.model.Step;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class StepProgression implements ProgressionStrategy {

    @Override
    public ProgressionMode mode() {
        return ProgressionMode.STEPS;
    }

    @Override
    public Optional<String> currentUnitId(Course course) {
        return course.firstIncompleteStep().map(Step::getId);
    }

    @Override
    public int completedUnits(Course course) {
        return (int) course.getSteps().stream().filter(Step::isCompleted).count();
    }

    // Steps are open-ended; the outline's lesson count is the target.
    @Override
    public int totalUnits(Course course) {
        return course.getTotalLessons();
    }

    @Override
    public boolean allUnitsPassed(Course course) {
        return course.getSteps().stream()
                .filter(Step::isCompleted)
                .allMatch(Step::isPassed);
    }
}
