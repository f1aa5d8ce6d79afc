package org.example.course.service;

import org.example.course.entity.CourseStatus;
import org.example.course.entity.OutlineStatus;
import org.example.course.entity.ProgressionMode;
import org.example.course.model.BlockType;
import org.example.course.model.Course;
import org.example.course.model.GenerationStatus;
import org.example.course.model.Lesson;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataRetrievalFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GenerationRecoveryServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private CourseStore courseStore;

    private GenerationRecoveryService service(boolean enabled) {
        return new GenerationRecoveryService(courseStore, enabled, Duration.ofMinutes(5), new MutableClock(NOW));
    }

    @Test
    void disabledRecoveryTouchesNothing() {
        GenerationRecoveryService.RecoverySummary summary = service(false).recoverStuckGeneration();

        assertEquals(new GenerationRecoveryService.RecoverySummary(0, 0, 0, 0), summary);
        verifyNoInteractions(courseStore);
    }

    @Test
    void stuckOutlineIsMarkedFailed() {
        Course course = CourseFixtures.course(ProgressionMode.LESSONS);
        course.setUpdatedAt(NOW.minus(Duration.ofMinutes(30)));
        when(courseStore.listByStatus(CourseStatus.ACTIVE)).thenReturn(List.of(course));
        when(courseStore.listByStatus(CourseStatus.ARCHIVED)).thenReturn(List.of());

        GenerationRecoveryService.RecoverySummary summary = service(true).recoverStuckGeneration();

        assertEquals(1, summary.outlinesFailed());
        assertEquals(OutlineStatus.FAILED, course.getOutlineStatus());
        assertEquals(GenerationRecoveryService.INTERRUPTED, course.getOutlineError());
        verify(courseStore).update(course, CourseField.OUTLINE);
    }

    @Test
    void stuckBlocksAndContentMoveToError() {
        Course course = CourseFixtures.courseWithOutline(ProgressionMode.LESSONS, 2);
        course.setUpdatedAt(NOW.minus(Duration.ofHours(2)));
        Lesson first = course.getOutline().getSections().get(0).getLessons().get(0);
        CourseFixtures.readyBlocks(first, BlockType.TEXT, BlockType.CODE);
        first.getBlocks().get(1).setContentStatus(GenerationStatus.GENERATING);
        Lesson second = course.getOutline().getSections().get(0).getLessons().get(1);
        second.setBlocksStatus(GenerationStatus.GENERATING);
        when(courseStore.listByStatus(CourseStatus.ACTIVE)).thenReturn(List.of());
        when(courseStore.listByStatus(CourseStatus.ARCHIVED)).thenReturn(List.of(course));

        GenerationRecoveryService.RecoverySummary summary = service(true).recoverStuckGeneration();

        assertEquals(new GenerationRecoveryService.RecoverySummary(1, 0, 1, 1), summary);
        assertEquals(GenerationStatus.ERROR, second.getBlocksStatus());
        assertEquals(GenerationStatus.ERROR, first.getBlocks().get(1).getContentStatus());
        assertEquals(GenerationRecoveryService.INTERRUPTED, first.getBlocks().get(1).getContentError());
        assertEquals(GenerationStatus.READY, first.getBlocksStatus());
        verify(courseStore).update(course, CourseField.OUTLINE);
    }

    @Test
    void recentlyUpdatedCourseIsLeftAlone() {
        Course course = CourseFixtures.course(ProgressionMode.STEPS);
        course.setUpdatedAt(NOW.minus(Duration.ofMinutes(1)));
        when(courseStore.listByStatus(CourseStatus.ACTIVE)).thenReturn(List.of(course));
        when(courseStore.listByStatus(CourseStatus.ARCHIVED)).thenReturn(List.of());

        GenerationRecoveryService.RecoverySummary summary = service(true).recoverStuckGeneration();

        assertEquals(0, summary.outlinesFailed());
        assertEquals(OutlineStatus.GENERATING, course.getOutlineStatus());
        verify(courseStore, never()).update(any(Course.class), any(CourseField[].class));
    }

    @Test
    void startupRecoverySurvivesUnreadableCourses() {
        when(courseStore.listByStatus(CourseStatus.ACTIVE))
                .thenThrow(new DataRetrievalFailureException("Stored steps of course course-1 is unreadable"));

        assertDoesNotThrow(() -> service(true).recoverOnStartup());

        verify(courseStore, never()).update(any(Course.class), any(CourseField[].class));
    }
}
