package org.example.course.service;

import org.example.course.entity.CourseStatus;
import org.example.course.entity.OutlineStatus;
import org.example.course.entity.ProgressionMode;
import org.example.course.model.Course;
import org.example.course.model.GenerationWork;
import org.example.course.model.TopicMemory;
import org.example.course.model.UnitRequest;
import org.example.course.model.UserContext;
import org.example.course.model.WorkMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CourseServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final UserContext USER = new UserContext("user-1", "free");

    @Mock
    private CourseStore courseStore;

    @Mock
    private UsageLimiter usageLimiter;

    @Mock
    private AsyncTaskDispatcher dispatcher;

    private CourseService service;

    @BeforeEach
    void setUp() {
        service = new CourseService(courseStore, usageLimiter, dispatcher, Duration.ofMinutes(5), new MutableClock(NOW));
    }

    private static AsyncTaskDispatcher.DispatchTicket ticket(AsyncTaskDispatcher.DispatchState state) {
        return ticket(state, null);
    }

    private static AsyncTaskDispatcher.DispatchTicket ticket(AsyncTaskDispatcher.DispatchState state, String detail) {
        return new AsyncTaskDispatcher.DispatchTicket("t-1", "outline", state, null, detail, NOW, NOW);
    }

    @Test
    void create_persistsActiveCourseAndDispatchesOutline() {
        when(courseStore.countActive("user-1")).thenReturn(0L);
        when(dispatcher.dispatch(any(GenerationWork.class)))
                .thenReturn(ticket(AsyncTaskDispatcher.DispatchState.RUNNING_DETACHED));

        Course course = service.create(USER, "  Learn Rust  ", "🦀", null);

        assertEquals("Learn Rust", course.getTitle());
        assertEquals("🦀", course.getEmoji());
        assertEquals(CourseStatus.ACTIVE, course.getStatus());
        assertEquals(OutlineStatus.GENERATING, course.getOutlineStatus());
        assertEquals(ProgressionMode.LESSONS, course.getProgressionMode());
        verify(courseStore).create(course);

        ArgumentCaptor<GenerationWork> work = ArgumentCaptor.forClass(GenerationWork.class);
        verify(dispatcher).dispatch(work.capture());
        assertEquals(course.getId(), work.getValue().courseId());
        assertEquals(UnitRequest.outline(), work.getValue().request());
        assertEquals(WorkMode.MATERIALIZE, work.getValue().mode());
        assertEquals("free", work.getValue().tier());
    }

    @Test
    void create_droppedOutlineDispatchMarksOutlineFailed() {
        when(dispatcher.dispatch(any(GenerationWork.class))).thenReturn(
                ticket(AsyncTaskDispatcher.DispatchState.DROPPED, "rejected: detached executor is full"));

        Course course = service.create(USER, "Learn Rust", null, ProgressionMode.LESSONS);

        assertEquals(OutlineStatus.FAILED, course.getOutlineStatus());
        assertEquals("Outline generation could not be scheduled: rejected: detached executor is full",
                course.getOutlineError());
        verify(courseStore).update(course, CourseField.OUTLINE);
    }

    @Test
    void retryOutline_staleGeneratingOutlineCanBeRetried() {
        Course course = CourseFixtures.course(ProgressionMode.LESSONS);
        course.setUpdatedAt(NOW.minus(Duration.ofMinutes(2)));
        when(courseStore.find("course-1")).thenReturn(Optional.of(course));

        assertThrows(CourseStateException.class, () -> service.retryOutline(USER, "course-1"));

        course.setUpdatedAt(NOW.minus(Duration.ofMinutes(6)));
        when(dispatcher.dispatch(any(GenerationWork.class)))
                .thenReturn(ticket(AsyncTaskDispatcher.DispatchState.RUNNING_DETACHED));

        service.retryOutline(USER, "course-1");

        assertEquals(OutlineStatus.GENERATING, course.getOutlineStatus());
        verify(courseStore).update(course, CourseField.OUTLINE);
        verify(dispatcher).dispatch(any(GenerationWork.class));
    }

    @Test
    @SuppressWarnings("unchecked")
    void create_outlineRejectedByFullExecutorCanBeRetried() throws Exception {
        GenerationWorkHandler workHandler = mock(GenerationWorkHandler.class);
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(invocation -> {
            release.await(10, TimeUnit.SECONDS);
            return null;
        }).when(workHandler).handle(any(GenerationWork.class));
        AsyncTaskDispatcher realDispatcher = new AsyncTaskDispatcher(mock(ObjectProvider.class), workHandler,
                new GenerationMetricsService(), Duration.ofSeconds(30), 1, 1, Duration.ofMinutes(30),
                new MutableClock(NOW));
        CourseService realService = new CourseService(courseStore, usageLimiter, realDispatcher,
                Duration.ofMinutes(5), new MutableClock(NOW));
        GenerationWork filler = new GenerationWork(
                "course-0", "user-1", "free", UnitRequest.nextStep(0), WorkMode.PREGENERATE);
        try {
            realDispatcher.dispatch(filler);
            verify(workHandler, timeout(2000)).handle(filler);
            realDispatcher.dispatch(filler);

            Course course = realService.create(USER, "Learn Rust", null, ProgressionMode.LESSONS);

            assertEquals(OutlineStatus.FAILED, course.getOutlineStatus());
            assertEquals(1L, realDispatcher.stateCounts().get(AsyncTaskDispatcher.DispatchState.DROPPED));

            when(courseStore.find(course.getId())).thenReturn(Optional.of(course));
            realService.retryOutline(USER, course.getId());

            assertEquals(OutlineStatus.FAILED, course.getOutlineStatus());
            assertEquals(2L, realDispatcher.stateCounts().get(AsyncTaskDispatcher.DispatchState.DROPPED));
        } finally {
            release.countDown();
            realDispatcher.shutdown();
        }
    }

    @Test
    void create_blankTitleIsRejected() {
        assertThrows(ValidationException.class, () -> service.create(USER, "  ", null, ProgressionMode.STEPS));
        verifyNoInteractions(courseStore, dispatcher);
    }

    @Test
    void create_overCourseLimitDispatchesNothing() {
        when(courseStore.countActive("user-1")).thenReturn(2L);
        doThrow(new UsageLimitExceededException(UsageLimitExceededException.COURSE_LIMIT_REACHED,
                "Active course limit reached (2 on the free plan).", "free", 2, 2, true))
                .when(usageLimiter).checkActiveCourses(USER, 2L);

        assertThrows(UsageLimitExceededException.class,
                () -> service.create(USER, "Learn Go", null, ProgressionMode.LESSONS));

        verify(courseStore, never()).create(any());
        verifyNoInteractions(dispatcher);
    }

    @Test
    void requireOwned_foreignAndDeletedCoursesAreNotFound() {
        Course foreign = CourseFixtures.course(ProgressionMode.LESSONS);
        foreign.setUserId("someone-else");
        when(courseStore.find("course-1")).thenReturn(Optional.of(foreign));
        assertThrows(CourseNotFoundException.class, () -> service.requireOwned(USER, "course-1"));

        Course deleted = CourseFixtures.course(ProgressionMode.LESSONS);
        deleted.setStatus(CourseStatus.DELETED);
        when(courseStore.find("course-2")).thenReturn(Optional.of(deleted));
        assertThrows(CourseNotFoundException.class, () -> service.requireOwned(USER, "course-2"));

        when(courseStore.find("missing")).thenReturn(Optional.empty());
        assertThrows(CourseNotFoundException.class, () -> service.requireOwned(USER, "missing"));
    }

    @Test
    void archiveAndUnarchive() {
        Course course = CourseFixtures.course(ProgressionMode.LESSONS);
        when(courseStore.find("course-1")).thenReturn(Optional.of(course));

        service.archive(USER, "course-1");
        assertEquals(CourseStatus.ARCHIVED, course.getStatus());
        assertEquals(NOW, course.getArchivedAt());

        when(courseStore.countActive("user-1")).thenReturn(1L);
        service.unarchive(USER, "course-1");
        assertEquals(CourseStatus.ACTIVE, course.getStatus());
        assertNull(course.getArchivedAt());
        verify(usageLimiter).checkActiveCourses(USER, 1L);
    }

    @Test
    void archive_completedCourseIsInvalidTransition() {
        Course course = CourseFixtures.course(ProgressionMode.LESSONS);
        course.setStatus(CourseStatus.COMPLETED);
        when(courseStore.find("course-1")).thenReturn(Optional.of(course));

        CourseStateException error = assertThrows(CourseStateException.class,
                () -> service.archive(USER, "course-1"));

        assertEquals(CourseStateException.INVALID_STATUS_TRANSITION, error.getCode());
        assertEquals("Cannot change course status from completed to archived", error.getMessage());
    }

    @Test
    void unarchive_overLimitKeepsCourseArchived() {
        Course course = CourseFixtures.course(ProgressionMode.LESSONS);
        course.setStatus(CourseStatus.ARCHIVED);
        when(courseStore.find("course-1")).thenReturn(Optional.of(course));
        when(courseStore.countActive("user-1")).thenReturn(2L);
        doThrow(new UsageLimitExceededException(UsageLimitExceededException.COURSE_LIMIT_REACHED,
                "Active course limit reached (2 on the free plan).", "free", 2, 2, true))
                .when(usageLimiter).checkActiveCourses(any(), anyLong());

        assertThrows(UsageLimitExceededException.class, () -> service.unarchive(USER, "course-1"));

        assertEquals(CourseStatus.ARCHIVED, course.getStatus());
        verify(courseStore, never()).update(any(Course.class), any(CourseField[].class));
    }

    @Test
    void delete_isSoft() {
        Course course = CourseFixtures.course(ProgressionMode.LESSONS);
        when(courseStore.find("course-1")).thenReturn(Optional.of(course));

        service.delete(USER, "course-1");

        assertEquals(CourseStatus.DELETED, course.getStatus());
        assertEquals(NOW, course.getDeletedAt());
        verify(courseStore).update(course, CourseField.STATUS);
    }

    @Test
    void retryOutline_onlyAfterFailure() {
        Course course = CourseFixtures.course(ProgressionMode.LESSONS);
        when(courseStore.find("course-1")).thenReturn(Optional.of(course));

        CourseStateException error = assertThrows(CourseStateException.class,
                () -> service.retryOutline(USER, "course-1"));
        assertEquals(CourseStateException.INVALID_STATUS_TRANSITION, error.getCode());

        course.setOutlineStatus(OutlineStatus.FAILED);
        course.setOutlineError("Generation interrupted");
        when(dispatcher.dispatch(any(GenerationWork.class)))
                .thenReturn(ticket(AsyncTaskDispatcher.DispatchState.QUEUED));

        service.retryOutline(USER, "course-1");

        assertEquals(OutlineStatus.GENERATING, course.getOutlineStatus());
        assertNull(course.getOutlineError());
        verify(courseStore).update(course, CourseField.OUTLINE);
    }

    @Test
    void rename_truncatesTitleAndClearsBlankEmoji() {
        Course course = CourseFixtures.course(ProgressionMode.LESSONS);
        course.setEmoji("📘");
        when(courseStore.find("course-1")).thenReturn(Optional.of(course));

        service.rename(USER, "course-1", "x".repeat(ContentParser.MAX_TITLE_LENGTH + 20), " ");

        assertEquals(ContentParser.MAX_TITLE_LENGTH, course.getTitle().length());
        assertNull(course.getEmoji());
        verify(courseStore).update(course, CourseField.TITLE);
    }

    @Test
    void updateTopicMemory_replacesEntry() {
        Course course = CourseFixtures.course(ProgressionMode.LESSONS);
        when(courseStore.find("course-1")).thenReturn(Optional.of(course));

        TopicMemory memory = service.updateTopicMemory(USER, "course-1", "borrowing", 0.4, 3);

        assertEquals(0.4, memory.getConfidence());
        assertEquals(3, memory.getTimesTested());
        assertEquals(NOW, memory.getLastReviewed());
        assertEquals(memory, course.getMemory().getTopics().get("borrowing"));
        verify(courseStore).update(course, CourseField.MEMORY);
    }

    @Test
    void updateTopicMemory_confidenceOutOfRangeIsRejected() {
        assertThrows(ValidationException.class,
                () -> service.updateTopicMemory(USER, "course-1", "borrowing", 1.5, 0));
        verifyNoInteractions(courseStore);
    }
}
