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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Course lifecycle: creation with background outline generation, listing, archive, unarchive,
 * soft delete and manual topic memory edits. Courses are only visible to their owner.
 */
@Service
public class CourseService {

    private static final Logger log = LoggerFactory.getLogger(CourseService.class);

    private final CourseStore courseStore;
    private final UsageLimiter usageLimiter;
    private final AsyncTaskDispatcher dispatcher;
    private final Duration stuckAfter;
    private final Clock clock;

    @Autowired
    public CourseService(
            CourseStore courseStore,
            UsageLimiter usageLimiter,
            AsyncTaskDispatcher dispatcher,
            @Value("${generation.recovery.stuck-minutes:5}") long stuckMinutes) {
        this(courseStore, usageLimiter, dispatcher, Duration.ofMinutes(Math.max(0, stuckMinutes)), Clock.systemUTC());
    }

    CourseService(CourseStore courseStore, UsageLimiter usageLimiter, AsyncTaskDispatcher dispatcher,
                  Duration stuckAfter, Clock clock) {
        this.courseStore = courseStore;
        this.usageLimiter = usageLimiter;
        this.dispatcher = dispatcher;
        this.stuckAfter = stuckAfter;
        this.clock = clock;
    }

    public Course create(UserContext user, String title, String emoji, ProgressionMode mode) {
        if (title == null || title.isBlank()) {
            throw new ValidationException("Course title is required");
        }
        usageLimiter.checkActiveCourses(user, courseStore.countActive(user.userId()));

        Course course = new Course();
        course.setId(UUID.randomUUID().toString());
        course.setUserId(user.userId());
        course.setTitle(ContentParser.truncate(title.trim(), ContentParser.MAX_TITLE_LENGTH));
        course.setEmoji(emoji == null || emoji.isBlank() ? null : emoji.trim());
        course.setProgressionMode(mode == null ? ProgressionMode.LESSONS : mode);
        course.setStatus(CourseStatus.ACTIVE);
        course.setOutlineStatus(OutlineStatus.GENERATING);
        courseStore.create(course);
        log.info("Created course {} for user {} ({})", course.getId(), user.userId(), course.getProgressionMode());

        dispatchOutline(course, user);
        return course;
    }

    /**
     * Re-dispatches outline generation for a course whose outline failed, or whose outline has
     * been generating for longer than the stuck threshold with no task left behind it.
     */
    public Course retryOutline(UserContext user, String courseId) {
        Course course = requireOwned(user, courseId);
        if (course.getStatus() == CourseStatus.ARCHIVED) {
            throw CourseStateException.archived();
        }
        if (course.getOutlineStatus() != OutlineStatus.FAILED && !isStuckGenerating(course)) {
            throw new CourseStateException(CourseStateException.INVALID_STATUS_TRANSITION,
                    "Outline can only be retried after it failed (current status: " + course.getOutlineStatus() + ")");
        }
        log.info("Outline status of course {}: {} -> {}", courseId, course.getOutlineStatus(), OutlineStatus.GENERATING);
        course.setOutlineStatus(OutlineStatus.GENERATING);
        course.setOutlineError(null);
        courseStore.update(course, CourseField.OUTLINE);
        dispatchOutline(course, user);
        return course;
    }

    public List<Course> list(UserContext user) {
        return courseStore.listVisible(user.userId());
    }

    /**
     * Loads an owned course and records the access. Archived and completed courses stay readable.
     */
    public Course get(UserContext user, String courseId) {
        Course course = requireOwned(user, courseId);
        course.setLastAccessedAt(clock.instant());
        courseStore.update(course, CourseField.LAST_ACCESSED);
        return course;
    }

    public Course rename(UserContext user, String courseId, String title, String emoji) {
        Course course = requireOwned(user, courseId);
        if (title != null) {
            if (title.isBlank()) {
                throw new ValidationException("Course title cannot be blank");
            }
            course.setTitle(ContentParser.truncate(title.trim(), ContentParser.MAX_TITLE_LENGTH));
        }
        if (emoji != null) {
            course.setEmoji(emoji.isBlank() ? null : emoji.trim());
        }
        courseStore.update(course, CourseField.TITLE);
        return course;
    }

    public Course archive(UserContext user, String courseId) {
        Course course = requireOwned(user, courseId);
        if (course.getStatus() != CourseStatus.ACTIVE) {
            throw invalidTransition(course.getStatus(), CourseStatus.ARCHIVED);
        }
        changeStatus(course, CourseStatus.ARCHIVED);
        course.setArchivedAt(clock.instant());
        courseStore.update(course, CourseField.STATUS);
        return course;
    }

    public Course unarchive(UserContext user, String courseId) {
        Course course = requireOwned(user, courseId);
        if (course.getStatus() != CourseStatus.ARCHIVED) {
            throw invalidTransition(course.getStatus(), CourseStatus.ACTIVE);
        }
        usageLimiter.checkActiveCourses(user, courseStore.countActive(user.userId()));
        changeStatus(course, CourseStatus.ACTIVE);
        course.setArchivedAt(null);
        courseStore.update(course, CourseField.STATUS);
        return course;
    }

    /**
     * Soft delete. Deleted courses disappear from every read path.
     */
    public void delete(UserContext user, String courseId) {
        Course course = requireOwned(user, courseId);
        changeStatus(course, CourseStatus.DELETED);
        course.setDeletedAt(clock.instant());
        courseStore.update(course, CourseField.STATUS);
    }

    public TopicMemory updateTopicMemory(UserContext user, String courseId, String topic,
                                         double confidence, int timesTested) {
        if (topic == null || topic.isBlank()) {
            throw new ValidationException("Topic is required");
        }
        if (Double.isNaN(confidence) || confidence < 0 || confidence > 1) {
            throw new ValidationException("Confidence must be between 0 and 1");
        }
        if (timesTested < 0) {
            throw new ValidationException("timesTested cannot be negative");
        }
        Course course = requireOwned(user, courseId);
        TopicMemory memory = new TopicMemory(confidence, clock.instant(), timesTested);
        course.getMemory().getTopics().put(topic.trim(), memory);
        courseStore.update(course, CourseField.MEMORY);
        return memory;
    }

    /**
     * Loads a course owned by {@code user}. Missing, foreign and deleted courses are all "not found".
     */
    public Course requireOwned(UserContext user, String courseId) {
        return courseStore.find(courseId)
                .filter(course -> course.getStatus() != CourseStatus.DELETED)
                .filter(course -> course.getUserId() != null && course.getUserId().equals(user.userId()))
                .orElseThrow(() -> new CourseNotFoundException(courseId));
    }

    private boolean isStuckGenerating(Course course) {
        return course.getOutlineStatus() == OutlineStatus.GENERATING
                && course.getUpdatedAt() != null
                && course.getUpdatedAt().isBefore(clock.instant().minus(stuckAfter));
    }

    private void dispatchOutline(Course course, UserContext user) {
        AsyncTaskDispatcher.DispatchTicket ticket = dispatcher.dispatch(new GenerationWork(
                course.getId(), user.userId(), user.tier(), UnitRequest.outline(), WorkMode.MATERIALIZE));
        if (ticket.state() == AsyncTaskDispatcher.DispatchState.DROPPED) {
            log.warn("Outline generation for course {} was dropped: {}", course.getId(), ticket.detail());
            log.info("Outline status of course {}: {} -> {}", course.getId(), course.getOutlineStatus(), OutlineStatus.FAILED);
            course.setOutlineStatus(OutlineStatus.FAILED);
            course.setOutlineError("Outline generation could not be scheduled: " + ticket.detail());
            courseStore.update(course, CourseField.OUTLINE);
            return;
        }
        log.debug("Outline generation for course {} dispatched: {}", course.getId(), ticket.state());
    }

    private void changeStatus(Course course, CourseStatus next) {
        log.info("Course {} status: {} -> {}", course.getId(), course.getStatus(), next);
        course.setStatus(next);
    }

    private CourseStateException invalidTransition(CourseStatus from, CourseStatus to) {
        return new CourseStateException(CourseStateException.INVALID_STATUS_TRANSITION,
                "Cannot change course status from " + from.name().toLowerCase(Locale.ROOT) + " to " + to.name().toLowerCase(Locale.ROOT));
    }
}
