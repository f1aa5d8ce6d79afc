package org.example.course.service;

import org.example.course.model.Course;
import org.example.course.model.GeneratedUnit;
import org.example.course.model.GenerationStatus;
import org.example.course.model.GenerationWork;
import org.example.course.model.Lesson;
import org.example.course.model.UnitRequest;
import org.example.course.model.UserContext;
import org.example.course.model.WorkMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Executes one piece of background generation, whichever path delivered it. Materialize work
 * persists the unit onto the course; pregenerate work only fills the pregeneration cache.
 * Work for courses that are gone or no longer active is skipped.
 */
@Component
public class GenerationWorkHandler {

    private static final Logger log = LoggerFactory.getLogger(GenerationWorkHandler.class);

    private final CourseStore courseStore;
    private final GenerationOrchestrator orchestrator;
    private final PregenerationCache cache;
    private final GenerationMetricsService metricsService;

    public GenerationWorkHandler(
            CourseStore courseStore,
            GenerationOrchestrator orchestrator,
            PregenerationCache cache,
            GenerationMetricsService metricsService) {
        this.courseStore = courseStore;
        this.orchestrator = orchestrator;
        this.cache = cache;
        this.metricsService = metricsService;
    }

    public void handle(GenerationWork work) {
        String cacheKey = work.request().cacheKey(work.courseId());
        try {
            Optional<Course> course = courseStore.find(work.courseId());
            if (course.isEmpty() || !course.get().isActive()) {
                log.debug("Skipping {}: course missing or not active", work.describe());
                return;
            }
            UserContext user = new UserContext(work.userId(), work.tier());
            if (work.mode() == WorkMode.MATERIALIZE) {
                orchestrator.generate(course.get(), work.request(), user);
                log.debug("Materialized {}", work.describe());
            } else {
                pregenerate(course.get(), work.request(), user, cacheKey);
            }
        } finally {
            if (work.mode() == WorkMode.PREGENERATE) {
                cache.clearInFlight(cacheKey);
            }
        }
    }

    private void pregenerate(Course course, UnitRequest request, UserContext user, String cacheKey) {
        if (cache.contains(cacheKey) || alreadyMaterialized(course, request)) {
            metricsService.recordPregeneration(false);
            log.debug("Skipping pregeneration of {} for course {}: already available", request.kind(), course.getId());
            return;
        }
        GeneratedUnit unit = orchestrator.produce(course, request, user);
        cache.put(cacheKey, unit);
        metricsService.recordPregeneration(true);
        log.info("Pregenerated {} for course {}", request.kind(), course.getId());
    }

    private boolean alreadyMaterialized(Course course, UnitRequest request) {
        return switch (request.kind()) {
            case OUTLINE -> course.getOutline() != null;
            case NEXT_STEP -> request.stepIndex() != null && request.stepIndex() < course.getSteps().size();
            case LESSON_BLOCKS -> findLesson(course, request)
                    .map(lesson -> lesson.getBlocksStatus() == GenerationStatus.READY
                            || lesson.getBlocksStatus() == GenerationStatus.GENERATING)
                    .orElse(true);
            case BLOCK_CONTENT -> findLesson(course, request)
                    .flatMap(lesson -> lesson.findBlock(request.blockId()))
                    .map(block -> block.getContentStatus() == GenerationStatus.READY
                            || block.getContentStatus() == GenerationStatus.GENERATING)
                    .orElse(true);
        };
    }

    private Optional<Lesson> findLesson(Course course, UnitRequest request) {
        if (course.getOutline() == null) {
            return Optional.empty();
        }
        return course.getOutline().findLesson(request.sectionId(), request.lessonId());
    }

    /**
     * Generation failures may succeed on a later attempt; domain rejections will not.
     */
    static boolean isRetryable(RuntimeException error) {
        return error instanceof GenerationException
                || error instanceof TransientDataAccessException;
    }
}
