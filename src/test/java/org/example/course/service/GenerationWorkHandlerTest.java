package org.example.course.service;

import org.example.course.entity.CourseStatus;
import org.example.course.entity.ProgressionMode;
import org.example.course.model.BlockType;
import org.example.course.model.Course;
import org.example.course.model.GeneratedUnit;
import org.example.course.model.GenerationWork;
import org.example.course.model.StepType;
import org.example.course.model.UnitRequest;
import org.example.course.model.UserContext;
import org.example.course.model.WorkMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GenerationWorkHandlerTest {

    private static final UserContext USER = new UserContext("user-1", "pro");

    @Mock
    private CourseStore courseStore;

    @Mock
    private GenerationOrchestrator orchestrator;

    private PregenerationCache cache;
    private GenerationMetricsService metricsService;
    private GenerationWorkHandler handler;

    @BeforeEach
    void setUp() {
        cache = new PregenerationCache(Duration.ofMinutes(30), Duration.ofMinutes(5),
                new MutableClock(Instant.parse("2026-03-01T10:00:00Z")));
        metricsService = new GenerationMetricsService();
        handler = new GenerationWorkHandler(courseStore, orchestrator, cache, metricsService);
    }

    private static GenerationWork work(UnitRequest request, WorkMode mode) {
        return new GenerationWork("course-1", "user-1", "pro", request, mode);
    }

    @Test
    void materializeGeneratesOntoCourse() {
        Course course = CourseFixtures.course(ProgressionMode.LESSONS);
        when(courseStore.find("course-1")).thenReturn(Optional.of(course));

        handler.handle(work(UnitRequest.outline(), WorkMode.MATERIALIZE));

        verify(orchestrator).generate(course, UnitRequest.outline(), USER);
    }

    @Test
    void archivedCourseIsSkipped() {
        Course course = CourseFixtures.course(ProgressionMode.LESSONS);
        course.setStatus(CourseStatus.ARCHIVED);
        when(courseStore.find("course-1")).thenReturn(Optional.of(course));

        handler.handle(work(UnitRequest.outline(), WorkMode.MATERIALIZE));

        verifyNoInteractions(orchestrator);
    }

    @Test
    void pregenerateStoresUnitInCacheAndClearsMarker() {
        Course course = CourseFixtures.courseWithOutline(ProgressionMode.STEPS, 3);
        UnitRequest request = UnitRequest.nextStep(0);
        String key = request.cacheKey("course-1");
        GeneratedUnit unit = new GeneratedUnit.StepUnit(CourseFixtures.step(0, StepType.LESSON, "intro"));
        assertTrue(cache.tryMarkInFlight(key));
        when(courseStore.find("course-1")).thenReturn(Optional.of(course));
        when(orchestrator.produce(course, request, USER)).thenReturn(unit);

        handler.handle(work(request, WorkMode.PREGENERATE));

        assertEquals(Optional.of(unit), cache.take(key));
        assertFalse(cache.isInFlight(key));
        assertEquals(1L, metricsService.snapshot().get("pregenerationStored"));
    }

    @Test
    void pregenerateSkipsUnitAlreadyOnCourse() {
        Course course = CourseFixtures.courseWithOutline(ProgressionMode.LESSONS, 2);
        CourseFixtures.readyBlocks(course.getOutline().getSections().get(0).getLessons().get(0), BlockType.TEXT);
        when(courseStore.find("course-1")).thenReturn(Optional.of(course));

        handler.handle(work(UnitRequest.lessonBlocks("s0", "s0-l0"), WorkMode.PREGENERATE));

        verifyNoInteractions(orchestrator);
        assertEquals(1L, metricsService.snapshot().get("pregenerationSkipped"));
    }

    @Test
    void failedPregenerationStillClearsMarker() {
        Course course = CourseFixtures.courseWithOutline(ProgressionMode.LESSONS, 2);
        UnitRequest request = UnitRequest.lessonBlocks("s0", "s0-l1");
        String key = request.cacheKey("course-1");
        cache.tryMarkInFlight(key);
        when(courseStore.find("course-1")).thenReturn(Optional.of(course));
        when(orchestrator.produce(any(), any(), any()))
                .thenThrow(new GenerationException(GenerationException.Cause.PARSE, "Malformed lesson plan"));

        assertThrows(GenerationException.class, () -> handler.handle(work(request, WorkMode.PREGENERATE)));

        assertFalse(cache.isInFlight(key));
        assertFalse(cache.contains(key));
    }

    @Test
    void retryableErrors() {
        assertTrue(GenerationWorkHandler.isRetryable(
                new GenerationException(GenerationException.Cause.UPSTREAM, "Provider unavailable")));
        assertTrue(GenerationWorkHandler.isRetryable(new QueryTimeoutException("slow")));
        assertFalse(GenerationWorkHandler.isRetryable(new ValidationException("Unknown lesson")));
        assertFalse(GenerationWorkHandler.isRetryable(CourseStateException.archived()));
    }
}
