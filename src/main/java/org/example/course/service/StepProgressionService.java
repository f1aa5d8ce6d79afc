package org.example.course.service;

import org.example.course.entity.CourseStatus;
import org.example.course.model.Course;
import org.example.course.model.GeneratedUnit;
import org.example.course.model.Lesson;
import org.example.course.model.LessonPosition;
import org.example.course.model.ProgressStatus;
import org.example.course.model.Step;
import org.example.course.model.UnitRequest;
import org.example.course.model.UserContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * Flat step model: one step at a time, generated on demand and charged against the daily
 * step limit.
 */
@Service
public class StepProgressionService {

    private static final Logger log = LoggerFactory.getLogger(StepProgressionService.class);

    public record StepCompletion(Step step, int progress, int lessonsCompleted, boolean courseComplete) {
    }

    private final CourseService courseService;
    private final CourseStore courseStore;
    private final GenerationOrchestrator orchestrator;
    private final UsageLimiter usageLimiter;
    private final MemoryCompactor memoryCompactor;
    private final PositionTracker positionTracker;
    private final ProgressEngine progressEngine;
    private final PregenerationService pregenerationService;
    private final Clock clock;

    @Autowired
    public StepProgressionService(
            CourseService courseService,
            CourseStore courseStore,
            GenerationOrchestrator orchestrator,
            UsageLimiter usageLimiter,
            MemoryCompactor memoryCompactor,
            PositionTracker positionTracker,
            ProgressEngine progressEngine,
            PregenerationService pregenerationService) {
        this(courseService, courseStore, orchestrator, usageLimiter, memoryCompactor, positionTracker,
                progressEngine, pregenerationService, Clock.systemUTC());
    }

    StepProgressionService(
            CourseService courseService,
            CourseStore courseStore,
            GenerationOrchestrator orchestrator,
            UsageLimiter usageLimiter,
            MemoryCompactor memoryCompactor,
            PositionTracker positionTracker,
            ProgressEngine progressEngine,
            PregenerationService pregenerationService,
            Clock clock) {
        this.courseService = courseService;
        this.courseStore = courseStore;
        this.orchestrator = orchestrator;
        this.usageLimiter = usageLimiter;
        this.memoryCompactor = memoryCompactor;
        this.positionTracker = positionTracker;
        this.progressEngine = progressEngine;
        this.pregenerationService = pregenerationService;
        this.clock = clock;
    }

    /**
     * Returns the first incomplete step, or generates a new one.
     *
     * @throws CourseStateException when the course is archived or completed
     * @throws UsageLimitExceededException when the daily step limit is spent
     */
    public Step nextStep(UserContext user, String courseId) {
        Course course = courseService.requireOwned(user, courseId);
        requireActive(course);

        Optional<Step> incomplete = course.firstIncompleteStep();
        if (incomplete.isPresent()) {
            return incomplete.get();
        }

        usageLimiter.reserveStep(user);
        try {
            GeneratedUnit unit = orchestrator.generate(course, UnitRequest.nextStep(course.getSteps().size()), user);
            Step step = ((GeneratedUnit.StepUnit) unit).step();
            log.info("Added step {} ({}) to course {}", step.getIndex(), step.getType(), courseId);
            return step;
        } catch (RuntimeException e) {
            usageLimiter.releaseStep(user);
            throw e;
        }
    }

    /**
     * Read-only; allowed for archived and completed courses.
     */
    public Step getStep(UserContext user, String courseId, String stepId) {
        Course course = courseService.requireOwned(user, courseId);
        return course.findStep(stepId)
                .orElseThrow(() -> new ValidationException("Unknown step " + stepId + " in course " + courseId));
    }

    /**
     * Completes a step. Completing an already completed step returns the stored outcome and
     * changes nothing.
     */
    public StepCompletion completeStep(UserContext user, String courseId, String stepId, String answer, Double score) {
        if (score != null && (score.isNaN() || score < 0 || score > 100)) {
            throw new ValidationException("Score must be between 0 and 100");
        }
        Course course = courseService.requireOwned(user, courseId);
        Step step = course.findStep(stepId)
                .orElseThrow(() -> new ValidationException("Unknown step " + stepId + " in course " + courseId));
        if (step.isCompleted()) {
            log.debug("Step {} of course {} already completed", stepId, courseId);
            return completionOf(course, step);
        }
        requireActive(course);

        step.setCompleted(true);
        step.setCompletedAt(clock.instant());
        step.setUserAnswer(answer);
        step.setScore(score);

        memoryCompactor.recordOutcome(course, step.getTopic());
        memoryCompactor.maybeCompact(course, step.getIndex());
        advanceOutline(course, step.isPassed());
        ProgressEngine.Result result = progressEngine.recompute(course);
        courseStore.update(course, CourseField.STEPS, CourseField.MEMORY, CourseField.OUTLINE,
                CourseField.POSITION, CourseField.PROGRESS, CourseField.STATUS);
        log.info("Completed step {} of course {} (score={}, progress={}%)", step.getIndex(), courseId, score,
                result.progress());

        if (course.getStatus() == CourseStatus.ACTIVE) {
            pregenerationService.pregenerateNextStep(course, user);
        }
        return completionOf(course, step);
    }

    private void advanceOutline(Course course, boolean passed) {
        LessonPosition position = course.getCurrentPosition();
        if (course.getOutline() == null || position == null || !passed) {
            return;
        }
        Optional<Lesson> lesson = course.getOutline().lessonAt(position);
        lesson.ifPresent(current -> current.setStatus(ProgressStatus.COMPLETED));
        positionTracker.advance(course, position.lessonId(), true);
    }

    private StepCompletion completionOf(Course course, Step step) {
        return new StepCompletion(step, course.getProgress(), course.getLessonsCompleted(),
                course.getStatus() == CourseStatus.COMPLETED);
    }

    private void requireActive(Course course) {
        if (course.getStatus() == CourseStatus.COMPLETED) {
            throw CourseStateException.completed();
        }
        if (course.getStatus() == CourseStatus.ARCHIVED) {
            throw CourseStateException.archived();
        }
    }
}
