package org.example.course.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.course.entity.CourseEntity;
import org.example.course.entity.CourseStatus;
import org.example.course.model.Course;
import org.example.course.model.LessonPosition;
import org.example.course.model.Memory;
import org.example.course.model.Outline;
import org.example.course.model.Step;
import org.example.course.repository.CourseRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Course documents keyed by course id. {@link #update} overwrites only the named field groups,
 * so two concurrent updates of different groups do not clobber each other. Concurrent updates
 * of the same group are last-writer-wins; there is no revision check on courses.
 * A stored field that cannot be read fails the load rather than coming back empty, since a later
 * write of that group would replace the stored value.
 */
@Service
public class CourseStore {

    private static final Logger log = LoggerFactory.getLogger(CourseStore.class);
    private static final TypeReference<List<Step>> STEP_LIST = new TypeReference<>() {
    };

    private final CourseRepository courseRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public CourseStore(CourseRepository courseRepository, ObjectMapper objectMapper) {
        this(courseRepository, objectMapper, Clock.systemUTC());
    }

    CourseStore(CourseRepository courseRepository, ObjectMapper objectMapper, Clock clock) {
        this.courseRepository = courseRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public Optional<Course> find(String courseId) {
        if (courseId == null || courseId.isBlank()) {
            return Optional.empty();
        }
        return courseRepository.findById(courseId).map(this::toCourse);
    }

    @Transactional(readOnly = true)
    public List<Course> listVisible(String userId) {
        return courseRepository
                .findByUserIdAndStatusNotOrderByLastAccessedAtDesc(userId, CourseStatus.DELETED).stream()
                .map(this::toCourse)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<Course> listByStatus(CourseStatus status) {
        return courseRepository.findByStatus(status).stream().map(this::toCourse).toList();
    }

    @Transactional(readOnly = true)
    public long countActive(String userId) {
        return courseRepository.countByUserIdAndStatus(userId, CourseStatus.ACTIVE);
    }

    @Transactional
    public Course create(Course course) {
        Instant now = clock.instant();
        course.setCreatedAt(now);
        course.setUpdatedAt(now);
        course.setLastAccessedAt(now);

        CourseEntity entity = new CourseEntity();
        entity.setId(course.getId());
        entity.setUserId(course.getUserId());
        entity.setProgressionMode(course.getProgressionMode());
        entity.setCreatedAt(now);
        apply(entity, course, EnumSet.allOf(CourseField.class));
        entity.setUpdatedAt(now);
        courseRepository.save(entity);
        return course;
    }

    /**
     * Writes the named field groups of {@code course} onto the stored row.
     *
     * @throws CourseNotFoundException if the course no longer exists
     */
    @Transactional
    public void update(Course course, CourseField... fields) {
        if (fields.length == 0) {
            return;
        }
        Set<CourseField> selected = EnumSet.noneOf(CourseField.class);
        selected.addAll(List.of(fields));

        CourseEntity entity = courseRepository.findById(course.getId())
                .orElseThrow(() -> new CourseNotFoundException(course.getId()));
        Instant now = clock.instant();
        course.setUpdatedAt(now);
        apply(entity, course, selected);
        entity.setUpdatedAt(now);
        courseRepository.save(entity);
        log.debug("Updated course {} fields {}", course.getId(), selected);
    }

    private void apply(CourseEntity entity, Course course, Set<CourseField> fields) {
        for (CourseField field : fields) {
            switch (field) {
                case TITLE -> {
                    entity.setTitle(course.getTitle());
                    entity.setEmoji(course.getEmoji());
                }
                case STATUS -> {
                    entity.setStatus(course.getStatus());
                    entity.setCompletedAt(course.getCompletedAt());
                    entity.setArchivedAt(course.getArchivedAt());
                    entity.setDeletedAt(course.getDeletedAt());
                }
                case OUTLINE -> {
                    entity.setOutlineJson(toJson(course.getOutline()));
                    entity.setOutlineStatus(course.getOutlineStatus());
                    entity.setOutlineError(course.getOutlineError());
                    entity.setTotalLessons(course.getTotalLessons());
                }
                case POSITION -> entity.setPositionJson(toJson(course.getCurrentPosition()));
                case STEPS -> entity.setStepsJson(toJson(course.getSteps()));
                case MEMORY -> entity.setMemoryJson(toJson(course.getMemory()));
                case PROGRESS -> {
                    entity.setProgress(course.getProgress());
                    entity.setLessonsCompleted(course.getLessonsCompleted());
                }
                case LAST_ACCESSED -> entity.setLastAccessedAt(course.getLastAccessedAt());
            }
        }
    }

    Course toCourse(CourseEntity entity) {
        Course course = new Course();
        course.setId(entity.getId());
        course.setUserId(entity.getUserId());
        course.setTitle(entity.getTitle());
        course.setEmoji(entity.getEmoji());
        course.setStatus(entity.getStatus());
        course.setOutlineStatus(entity.getOutlineStatus());
        course.setOutlineError(entity.getOutlineError());
        course.setProgressionMode(entity.getProgressionMode());
        course.setProgress(entity.getProgress());
        course.setLessonsCompleted(entity.getLessonsCompleted());
        course.setTotalLessons(entity.getTotalLessons());
        course.setOutline(fromJson(entity.getOutlineJson(), Outline.class, entity.getId()));
        course.setCurrentPosition(fromJson(entity.getPositionJson(), LessonPosition.class, entity.getId()));
        course.setSteps(readSteps(entity.getStepsJson(), entity.getId()));
        course.setMemory(fromJson(entity.getMemoryJson(), Memory.class, entity.getId()));
        course.setCreatedAt(entity.getCreatedAt());
        course.setUpdatedAt(entity.getUpdatedAt());
        course.setLastAccessedAt(entity.getLastAccessedAt());
        course.setCompletedAt(entity.getCompletedAt());
        course.setArchivedAt(entity.getArchivedAt());
        course.setDeletedAt(entity.getDeletedAt());
        return course;
    }

    private String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize course field " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type, String courseId) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw unreadable(type.getSimpleName(), courseId, e);
        }
    }

    private List<Step> readSteps(String json, String courseId) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(objectMapper.readValue(json, STEP_LIST));
        } catch (JsonProcessingException e) {
            throw unreadable("steps", courseId, e);
        }
    }

    private DataRetrievalFailureException unreadable(String field, String courseId, JsonProcessingException e) {
        log.error("Unreadable {} JSON on course {}", field, courseId);
        return new DataRetrievalFailureException("Stored " + field + " of course " + courseId + " is unreadable", e);
    }
}
