package org.example.course.service;

import org.example.course.entity.CourseStatus;
import org.example.course.entity.OutlineStatus;
import org.example.course.model.Block;
import org.example.course.model.BlockContent;
import org.example.course.model.BlockResult;
import org.example.course.model.BlockType;
import org.example.course.model.Course;
import org.example.course.model.GeneratedUnit;
import org.example.course.model.GenerationStatus;
import org.example.course.model.Lesson;
import org.example.course.model.LessonPosition;
import org.example.course.model.LessonProgress;
import org.example.course.model.ProgressStatus;
import org.example.course.model.UnitRequest;
import org.example.course.model.UserContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Outline model: sections of lessons, each lesson a list of blocks whose content is generated
 * lazily. The cursor only moves when the lesson at the cursor is completed and passed.
 */
@Service
public class LessonProgressionService {

    private static final Logger log = LoggerFactory.getLogger(LessonProgressionService.class);

    /**
     * What the learner should see next. {@code pending} is the unit that still has to be
     * generated before the lesson can be shown, or {@code null} when everything is ready.
     */
    public record NextUnit(LessonPosition position, Lesson lesson, UnitRequest pending, boolean outlineFinished) {
    }

    public record BlockCompletion(
            BlockResult result,
            boolean lessonCompleted,
            double lessonScore,
            LessonPosition position,
            int progress,
            int lessonsCompleted,
            boolean courseComplete) {
    }

    private final CourseService courseService;
    private final CourseStore courseStore;
    private final GenerationOrchestrator orchestrator;
    private final MemoryCompactor memoryCompactor;
    private final PositionTracker positionTracker;
    private final ProgressEngine progressEngine;
    private final PregenerationService pregenerationService;
    private final Clock clock;

    @Autowired
    public LessonProgressionService(
            CourseService courseService,
            CourseStore courseStore,
            GenerationOrchestrator orchestrator,
            MemoryCompactor memoryCompactor,
            PositionTracker positionTracker,
            ProgressEngine progressEngine,
            PregenerationService pregenerationService) {
        this(courseService, courseStore, orchestrator, memoryCompactor, positionTracker, progressEngine,
                pregenerationService, Clock.systemUTC());
    }

    LessonProgressionService(
            CourseService courseService,
            CourseStore courseStore,
            GenerationOrchestrator orchestrator,
            MemoryCompactor memoryCompactor,
            PositionTracker positionTracker,
            ProgressEngine progressEngine,
            PregenerationService pregenerationService,
            Clock clock) {
        this.courseService = courseService;
        this.courseStore = courseStore;
        this.orchestrator = orchestrator;
        this.memoryCompactor = memoryCompactor;
        this.positionTracker = positionTracker;
        this.progressEngine = progressEngine;
        this.pregenerationService = pregenerationService;
        this.clock = clock;
    }

    public NextUnit nextUnit(UserContext user, String courseId) {
        Course course = courseService.requireOwned(user, courseId);
        return nextUnitOf(course);
    }

    /**
     * Generates whatever the lesson at the cursor is still missing: its blocks first, then the
     * content of the first block without content. Returns empty when nothing is missing.
     */
    public Optional<GeneratedUnit> materializeNext(UserContext user, String courseId) {
        Course course = courseService.requireOwned(user, courseId);
        requireActive(course);
        NextUnit next = nextUnitOf(course);
        if (next.pending() == null) {
            return Optional.empty();
        }
        return Optional.of(orchestrator.generate(course, next.pending(), user));
    }

    public Lesson getLesson(UserContext user, String courseId, String sectionId, String lessonId) {
        Course course = courseService.requireOwned(user, courseId);
        requireOutline(course);
        return findLesson(course, sectionId, lessonId);
    }

    public List<Block> generateLessonBlocks(UserContext user, String courseId, String sectionId, String lessonId) {
        Course course = courseService.requireOwned(user, courseId);
        requireActive(course);
        requireOutline(course);
        GeneratedUnit unit = orchestrator.generate(course, UnitRequest.lessonBlocks(sectionId, lessonId), user);
        return ((GeneratedUnit.LessonBlocksUnit) unit).blocks();
    }

    public BlockContent generateBlockContent(
            UserContext user, String courseId, String sectionId, String lessonId, String blockId) {
        Course course = courseService.requireOwned(user, courseId);
        requireActive(course);
        requireOutline(course);
        GeneratedUnit unit = orchestrator.generate(
                course, UnitRequest.blockContent(sectionId, lessonId, blockId), user);
        return ((GeneratedUnit.BlockContentUnit) unit).content();
    }

    /**
     * Records the learner's result for one block. Resubmitting the same outcome is a no-op;
     * a different outcome replaces the stored one and counts as another attempt.
     */
    public BlockCompletion completeBlock(
            UserContext user,
            String courseId,
            String sectionId,
            String lessonId,
            String blockId,
            String answer,
            Boolean isCorrect,
            Double score,
            int timeSpent) {
        if (score != null && (score.isNaN() || score < 0 || score > 100)) {
            throw new ValidationException("Score must be between 0 and 100");
        }
        if (timeSpent < 0) {
            throw new ValidationException("Time spent must not be negative");
        }
        Course course = courseService.requireOwned(user, courseId);
        requireOutline(course);
        Lesson lesson = findLesson(course, sectionId, lessonId);
        Block block = lesson.findBlock(blockId)
                .orElseThrow(() -> new ValidationException("Unknown block " + blockId + " in lesson " + lessonId));

        Instant now = clock.instant();
        double resolvedScore = resolveScore(block, isCorrect, score);
        LessonProgress progress = lesson.getProgress();
        BlockResult existing = progress == null ? null : progress.findResult(blockId).orElse(null);
        BlockResult candidate = new BlockResult(blockId, block.getType(), true, now, answer, isCorrect,
                resolvedScore, existing == null ? 1 : existing.attempts() + 1, timeSpent);
        if (existing != null && existing.sameOutcomeAs(candidate)) {
            log.debug("Block {} of course {} resubmitted with the same outcome", blockId, courseId);
            return completionOf(course, lesson, existing);
        }
        requireActive(course);

        if (progress == null) {
            progress = new LessonProgress(now);
            lesson.setProgress(progress);
        }
        if (lesson.getStatus() == ProgressStatus.PENDING) {
            lesson.setStatus(ProgressStatus.IN_PROGRESS);
        }
        progress.upsert(candidate);
        progress.setCurrentBlockIndex(progress.getBlockResults().size());
        progress.setTimeSpent(progress.getTimeSpent() + timeSpent);

        boolean newlyCompleted = false;
        if (progress.isComplete(lesson.getBlocks().size())) {
            if (!lesson.isCompleted()) {
                lesson.setStatus(ProgressStatus.COMPLETED);
                progress.setCompletedAt(now);
                memoryCompactor.recordOutcome(course, lesson.getTitle());
                newlyCompleted = true;
            }
            // A re-scored lesson that now passes still moves the cursor.
            positionTracker.advance(course, lessonId, LessonProgression.isPassed(lesson));
        }

        ProgressEngine.Result result = progressEngine.recompute(course);
        if (newlyCompleted) {
            memoryCompactor.maybeCompact(course, course.getLessonsCompleted() - 1);
            log.info("Lesson {} of course {} completed (score={}, progress={}%)",
                    lessonId, courseId, Math.round(progress.derivedScore()), result.progress());
        }
        courseStore.update(course, CourseField.OUTLINE, CourseField.POSITION, CourseField.MEMORY,
                CourseField.PROGRESS, CourseField.STATUS);

        if (newlyCompleted && course.getStatus() == CourseStatus.ACTIVE) {
            pregenerationService.pregenerateNextLesson(course, user);
        }
        return completionOf(course, lesson, candidate);
    }

    private NextUnit nextUnitOf(Course course) {
        requireOutline(course);
        LessonPosition position = course.getCurrentPosition();
        Optional<Lesson> current = course.getOutline().lessonAt(position);
        if (current.isEmpty()) {
            return new NextUnit(position, null, null, true);
        }
        Lesson lesson = current.get();
        UnitRequest pending = null;
        if (lesson.getBlocksStatus() != GenerationStatus.READY) {
            pending = UnitRequest.lessonBlocks(position.sectionId(), lesson.getId());
        } else {
            for (Block block : lesson.getBlocks()) {
                if (!block.isContentReady()) {
                    pending = UnitRequest.blockContent(position.sectionId(), lesson.getId(), block.getId());
                    break;
                }
            }
        }
        return new NextUnit(position, lesson, pending, false);
    }

    private BlockCompletion completionOf(Course course, Lesson lesson, BlockResult result) {
        LessonProgress progress = lesson.getProgress();
        double lessonScore = progress == null ? 0 : progress.derivedScore();
        return new BlockCompletion(result, lesson.isCompleted(), lessonScore, course.getCurrentPosition(),
                course.getProgress(), course.getLessonsCompleted(), course.getStatus() == CourseStatus.COMPLETED);
    }

    /**
     * Question blocks without an explicit score are graded by correctness.
     */
    static double resolveScore(Block block, Boolean isCorrect, Double score) {
        if (score != null) {
            return score;
        }
        if (block.getType() == BlockType.QUESTION && isCorrect != null) {
            return isCorrect ? 100 : 0;
        }
        return 0;
    }

    private Lesson findLesson(Course course, String sectionId, String lessonId) {
        return course.getOutline().findLesson(sectionId, lessonId)
                .orElseThrow(() -> new ValidationException(
                        "Unknown lesson " + lessonId + " in section " + sectionId));
    }

    private void requireOutline(Course course) {
        if (course.getOutlineStatus() != OutlineStatus.READY || course.getOutline() == null) {
            throw new CourseStateException(CourseStateException.OUTLINE_NOT_READY,
                    "Course outline is not ready");
        }
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
