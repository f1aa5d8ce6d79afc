package org.example.course.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.course.entity.CourseStatus;
import org.example.course.entity.ProgressionMode;
import org.example.course.model.Course;
import org.example.course.model.GeneratedUnit;
import org.example.course.model.LessonPosition;
import org.example.course.model.ProgressStatus;
import org.example.course.model.Step;
import org.example.course.model.StepType;
import org.example.course.model.UnitRequest;
import org.example.course.model.UserContext;
import org.example.course.service.llm.LlmProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StepProgressionServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final UserContext USER = new UserContext("user-1", "free");

    @Mock
    private CourseService courseService;

    @Mock
    private CourseStore courseStore;

    @Mock
    private GenerationOrchestrator orchestrator;

    @Mock
    private UsageLimiter usageLimiter;

    @Mock
    private PregenerationService pregenerationService;

    @Mock
    private LlmProvider compactionProvider;

    private StepProgressionService service;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(NOW);
        MemoryCompactor compactor = new MemoryCompactor(
                new ContentParser(new ObjectMapper().findAndRegisterModules()), compactionProvider,
                new GenerationMetricsService(), 10, false, clock);
        ProgressEngine progressEngine = new ProgressEngine(
                List.of(new StepProgression(), new LessonProgression()), clock);
        service = new StepProgressionService(courseService, courseStore, orchestrator, usageLimiter, compactor,
                new PositionTracker(), progressEngine, pregenerationService, clock);
    }

    @Test
    void nextStep_returnsFirstIncompleteStepWithoutCharging() {
        Course course = CourseFixtures.courseWithOutline(ProgressionMode.STEPS, 3);
        course.getSteps().add(CourseFixtures.completedStep(0, StepType.LESSON, "intro", null));
        Step open = CourseFixtures.step(1, StepType.QUIZ, "intro");
        course.getSteps().add(open);
        when(courseService.requireOwned(USER, "course-1")).thenReturn(course);

        assertSame(open, service.nextStep(USER, "course-1"));

        verifyNoInteractions(usageLimiter, orchestrator);
    }

    @Test
    void nextStep_generatesAfterReservingStep() {
        Course course = CourseFixtures.courseWithOutline(ProgressionMode.STEPS, 3);
        Step generated = CourseFixtures.step(0, StepType.LESSON, "intro");
        when(courseService.requireOwned(USER, "course-1")).thenReturn(course);
        when(orchestrator.generate(course, UnitRequest.nextStep(0), USER))
                .thenReturn(new GeneratedUnit.StepUnit(generated));

        assertSame(generated, service.nextStep(USER, "course-1"));

        verify(usageLimiter).reserveStep(USER);
        verify(usageLimiter, never()).releaseStep(any());
    }

    @Test
    void nextStep_failedGenerationReleasesReservation() {
        Course course = CourseFixtures.courseWithOutline(ProgressionMode.STEPS, 3);
        when(courseService.requireOwned(USER, "course-1")).thenReturn(course);
        when(orchestrator.generate(course, UnitRequest.nextStep(0), USER))
                .thenThrow(new GenerationException(GenerationException.Cause.TIMEOUT, "Generation timed out"));

        assertThrows(GenerationException.class, () -> service.nextStep(USER, "course-1"));

        verify(usageLimiter).reserveStep(USER);
        verify(usageLimiter).releaseStep(USER);
    }

    @Test
    void nextStep_archivedCourseIsRejectedWithoutCharging() {
        Course course = CourseFixtures.courseWithOutline(ProgressionMode.STEPS, 3);
        course.setStatus(CourseStatus.ARCHIVED);
        when(courseService.requireOwned(USER, "course-1")).thenReturn(course);

        CourseStateException error = assertThrows(CourseStateException.class,
                () -> service.nextStep(USER, "course-1"));

        assertEquals(CourseStateException.COURSE_ARCHIVED, error.getCode());
        assertEquals("This course is archived. Unarchive it to continue learning.", error.getMessage());
        verifyNoInteractions(usageLimiter, orchestrator);
    }

    @Test
    void getStep_archivedCourseStaysReadable() {
        Course course = CourseFixtures.courseWithOutline(ProgressionMode.STEPS, 2);
        Step done = CourseFixtures.completedStep(0, StepType.QUIZ, "ownership", 90.0);
        course.getSteps().add(done);
        course.setStatus(CourseStatus.ARCHIVED);
        when(courseService.requireOwned(USER, "course-1")).thenReturn(course);

        assertSame(done, service.getStep(USER, "course-1", "step-0"));
    }

    @Test
    void completeStep_archivedCourseReturnsStoredOutcomeOfCompletedStep() {
        Course course = CourseFixtures.courseWithOutline(ProgressionMode.STEPS, 2);
        Step done = CourseFixtures.completedStep(0, StepType.QUIZ, "ownership", 90.0);
        course.getSteps().add(done);
        course.setProgress(50);
        course.setLessonsCompleted(1);
        course.setStatus(CourseStatus.ARCHIVED);
        when(courseService.requireOwned(USER, "course-1")).thenReturn(course);

        StepProgressionService.StepCompletion completion =
                service.completeStep(USER, "course-1", "step-0", "answer", 90.0);

        assertSame(done, completion.step());
        assertEquals(50, completion.progress());
        assertEquals(1, completion.lessonsCompleted());
        assertFalse(completion.courseComplete());
        verifyNoInteractions(courseStore, pregenerationService);
    }

    @Test
    void completeStep_passedQuizAdvancesCursorAndPregenerates() {
        Course course = CourseFixtures.courseWithOutline(ProgressionMode.STEPS, 2);
        course.getSteps().add(CourseFixtures.step(0, StepType.QUIZ, "ownership"));
        when(courseService.requireOwned(USER, "course-1")).thenReturn(course);

        StepProgressionService.StepCompletion completion =
                service.completeStep(USER, "course-1", "step-0", "b", 85.0);

        assertEquals(50, completion.progress());
        assertEquals(1, completion.lessonsCompleted());
        assertFalse(completion.courseComplete());
        assertEquals(new LessonPosition(0, 1, "s0", "s0-l1"), course.getCurrentPosition());
        assertEquals(ProgressStatus.COMPLETED, course.getOutline().getSections().get(0).getLessons().get(0).getStatus());
        assertEquals(1, course.getMemory().getTopics().get("ownership").getTimesTested());
        assertEquals(NOW, completion.step().getCompletedAt());
        verify(courseStore).update(course, CourseField.STEPS, CourseField.MEMORY, CourseField.OUTLINE,
                CourseField.POSITION, CourseField.PROGRESS, CourseField.STATUS);
        verify(pregenerationService).pregenerateNextStep(course, USER);
    }

    @Test
    void completeStep_failedQuizKeepsCursor() {
        Course course = CourseFixtures.courseWithOutline(ProgressionMode.STEPS, 2);
        course.getSteps().add(CourseFixtures.step(0, StepType.QUIZ, "ownership"));
        when(courseService.requireOwned(USER, "course-1")).thenReturn(course);

        service.completeStep(USER, "course-1", "step-0", "a", 40.0);

        assertEquals(new LessonPosition(0, 0, "s0", "s0-l0"), course.getCurrentPosition());
    }

    @Test
    void completeStep_secondCallReturnsSameResultWithoutSideEffects() {
        Course course = CourseFixtures.courseWithOutline(ProgressionMode.STEPS, 2);
        course.getSteps().add(CourseFixtures.step(0, StepType.LESSON, "ownership"));
        when(courseService.requireOwned(USER, "course-1")).thenReturn(course);

        StepProgressionService.StepCompletion first = service.completeStep(USER, "course-1", "step-0", null, null);
        StepProgressionService.StepCompletion second = service.completeStep(USER, "course-1", "step-0", null, null);

        assertEquals(first, second);
        assertEquals(1, course.getLessonsCompleted());
        verify(courseStore, times(1)).update(any(Course.class), any(CourseField[].class));
        verify(pregenerationService, times(1)).pregenerateNextStep(course, USER);
    }

    @Test
    void completeStep_lastStepCompletesCourseWithoutPregeneration() {
        Course course = CourseFixtures.courseWithOutline(ProgressionMode.STEPS, 1);
        course.getSteps().add(CourseFixtures.step(0, StepType.EXERCISE, "ownership"));
        when(courseService.requireOwned(USER, "course-1")).thenReturn(course);

        StepProgressionService.StepCompletion completion =
                service.completeStep(USER, "course-1", "step-0", "done", null);

        assertTrue(completion.courseComplete());
        assertEquals(100, completion.progress());
        assertEquals(CourseStatus.COMPLETED, course.getStatus());
        assertNull(course.getCurrentPosition());
        verify(pregenerationService, never()).pregenerateNextStep(any(), any());
    }

    @Test
    void completeStep_rejectsScoreOutOfRange() {
        assertThrows(ValidationException.class,
                () -> service.completeStep(USER, "course-1", "step-0", null, 120.0));
        verifyNoInteractions(courseService);
    }
}
