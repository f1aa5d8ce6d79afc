package org.example.course.service;

import org.example.course.entity.CourseStatus;
import org.example.course.entity.OutlineStatus;
import org.example.course.model.Block;
import org.example.course.model.BlockType;
import org.example.course.model.Course;
import org.example.course.model.GeneratedUnit;
import org.example.course.model.GenerationStatus;
import org.example.course.model.Lesson;
import org.example.course.model.Outline;
import org.example.course.model.Step;
import org.example.course.model.UnitKind;
import org.example.course.model.UnitRequest;
import org.example.course.model.UserContext;
import org.example.course.service.llm.LlmCompletion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Produces course units: pregeneration cache first, otherwise one bounded generator call whose
 * output is parsed and written back onto the course. The owning status field moves
 * {@code pending -> generating -> ready|error}; unexpected transitions are logged, not blocked.
 */
@Service
public class GenerationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(GenerationOrchestrator.class);

    private final CourseStore courseStore;
    private final PregenerationCache cache;
    private final BoundedGenerator generator;
    private final UnitPromptBuilder promptBuilder;
    private final ContentParser contentParser;
    private final UsageLimiter usageLimiter;
    private final PositionTracker positionTracker;
    private final GenerationMetricsService metricsService;
    private final ApplicationEventPublisher eventPublisher;
    private final Map<UnitKind, Duration> timeouts;
    private final Clock clock;

    @Autowired
    public GenerationOrchestrator(
            CourseStore courseStore,
            PregenerationCache cache,
            BoundedGenerator generator,
            UnitPromptBuilder promptBuilder,
            ContentParser contentParser,
            UsageLimiter usageLimiter,
            PositionTracker positionTracker,
            GenerationMetricsService metricsService,
            ApplicationEventPublisher eventPublisher,
            @Value("${generation.timeout.outline-seconds:120}") long outlineTimeoutSeconds,
            @Value("${generation.timeout.step-seconds:60}") long stepTimeoutSeconds,
            @Value("${generation.timeout.blocks-seconds:60}") long blocksTimeoutSeconds,
            @Value("${generation.timeout.block-content-seconds:60}") long blockContentTimeoutSeconds) {
        this(courseStore, cache, generator, promptBuilder, contentParser, usageLimiter, positionTracker,
                metricsService, eventPublisher,
                timeouts(outlineTimeoutSeconds, stepTimeoutSeconds, blocksTimeoutSeconds, blockContentTimeoutSeconds),
                Clock.systemUTC());
    }

    GenerationOrchestrator(
            CourseStore courseStore,
            PregenerationCache cache,
            BoundedGenerator generator,
            UnitPromptBuilder promptBuilder,
            ContentParser contentParser,
            UsageLimiter usageLimiter,
            PositionTracker positionTracker,
            GenerationMetricsService metricsService,
            ApplicationEventPublisher eventPublisher,
            Map<UnitKind, Duration> timeouts,
            Clock clock) {
        this.courseStore = courseStore;
        this.cache = cache;
        this.generator = generator;
        this.promptBuilder = promptBuilder;
        this.contentParser = contentParser;
        this.usageLimiter = usageLimiter;
        this.positionTracker = positionTracker;
        this.metricsService = metricsService;
        this.eventPublisher = eventPublisher;
        this.timeouts = new EnumMap<>(timeouts);
        this.clock = clock;
    }

    static Map<UnitKind, Duration> timeouts(long outline, long step, long blocks, long blockContent) {
        Map<UnitKind, Duration> timeouts = new EnumMap<>(UnitKind.class);
        timeouts.put(UnitKind.OUTLINE, Duration.ofSeconds(Math.max(1, outline)));
        timeouts.put(UnitKind.NEXT_STEP, Duration.ofSeconds(Math.max(1, step)));
        timeouts.put(UnitKind.LESSON_BLOCKS, Duration.ofSeconds(Math.max(1, blocks)));
        timeouts.put(UnitKind.BLOCK_CONTENT, Duration.ofSeconds(Math.max(1, blockContent)));
        return timeouts;
    }

    public Duration timeoutFor(UnitKind kind) {
        return timeouts.get(kind);
    }

    /**
     * Generates {@code request} for {@code course} and persists it. Units that are already ready
     * are returned as stored without calling the generator.
     *
     * @throws GenerationException when the generator fails, times out or returns unusable output
     */
    public GeneratedUnit generate(Course course, UnitRequest request, UserContext user) {
        ensureGeneratable(course, request);
        Optional<GeneratedUnit> existing = readyUnit(course, request);
        if (existing.isPresent()) {
            log.debug("{} for course {} already ready", request.kind(), course.getId());
            return existing.get();
        }

        String cacheKey = request.cacheKey(course.getId());
        Optional<GeneratedUnit> cached = cache.take(cacheKey)
                .filter(unit -> unit.kind() == request.kind());
        metricsService.recordCacheLookup(cached.isPresent());
        if (cached.isPresent()) {
            markGenerating(course, request);
            try {
                GeneratedUnit stored = persist(course, request, cached.get(), user);
                log.info("Served {} for course {} from pregeneration cache", request.kind(), course.getId());
                return stored;
            } catch (IllegalArgumentException e) {
                log.warn("Discarding cached {} for course {}: {}", request.kind(), course.getId(), e.getMessage());
            } catch (RuntimeException e) {
                markFailed(course, request, e.getMessage());
                throw e;
            }
        } else {
            usageLimiter.checkTokenBudget(user);
            markGenerating(course, request);
        }

        try {
            if (cached.isPresent()) {
                // Cached unit was discarded.
                usageLimiter.checkTokenBudget(user);
            }
            GeneratedUnit unit = produceLive(course, request, user);
            return persist(course, request, unit, user);
        } catch (GenerationException e) {
            markFailed(course, request, e.getMessage());
            throw e;
        } catch (IllegalArgumentException e) {
            markFailed(course, request, e.getMessage());
            throw new GenerationException(GenerationException.Cause.PARSE, e.getMessage(), e);
        } catch (RuntimeException e) {
            markFailed(course, request, e.getMessage());
            throw e;
        }
    }

    /**
     * Generates {@code request} without touching the cache or the stored course.
     */
    public GeneratedUnit produce(Course course, UnitRequest request, UserContext user) {
        ensureGeneratable(course, request);
        usageLimiter.checkTokenBudget(user);
        return produceLive(course, request, user);
    }

    private GeneratedUnit produceLive(Course course, UnitRequest request, UserContext user) {
        metricsService.recordGenerationRequested(request.kind());

        String prompt = promptBuilder.build(course, request);
        long startedAtMs = System.currentTimeMillis();
        try {
            LlmCompletion completion = generator.generate(prompt, promptBuilder.options(request),
                    timeouts.get(request.kind()));
            usageLimiter.recordTokens(user, completion.totalTokens());
            GeneratedUnit unit = contentParser.parse(completion.text(), request.kind(), blockTypeFor(course, request));
            metricsService.recordGenerationCompleted(request.kind(), elapsedSince(startedAtMs),
                    completion.totalTokens());
            return unit;
        } catch (MalformedResponseException e) {
            metricsService.recordGenerationFailed(request.kind(), elapsedSince(startedAtMs),
                    GenerationException.Cause.PARSE);
            log.warn("Unparseable {} output for course {}: {}", request.kind(), course.getId(), e.getMessage());
            throw new GenerationException(GenerationException.Cause.PARSE,
                    "Generated " + describe(request.kind()) + " was malformed: " + e.getMessage(), e);
        } catch (GenerationException e) {
            metricsService.recordGenerationFailed(request.kind(), elapsedSince(startedAtMs), e.getFailureCause());
            log.warn("Generation of {} failed for course {}: {}", request.kind(), course.getId(), e.getMessage());
            throw e;
        }
    }

    private void ensureGeneratable(Course course, UnitRequest request) {
        if (request == null || request.kind() == null) {
            throw new ValidationException("Unit request must name a unit kind");
        }
        if (course.getStatus() == CourseStatus.DELETED) {
            throw new CourseNotFoundException(course.getId());
        }
        if (course.getStatus() == CourseStatus.ARCHIVED) {
            throw CourseStateException.archived();
        }
        if (course.getStatus() == CourseStatus.COMPLETED) {
            throw CourseStateException.completed();
        }
        switch (request.kind()) {
            case OUTLINE, NEXT_STEP -> {
            }
            case LESSON_BLOCKS -> requireLesson(course, request);
            case BLOCK_CONTENT -> {
                Lesson lesson = requireLesson(course, request);
                if (lesson.getBlocksStatus() != GenerationStatus.READY) {
                    throw new ValidationException("Blocks of lesson " + lesson.getId() + " are not ready");
                }
                requireBlock(lesson, request.blockId());
            }
        }
    }

    private Optional<GeneratedUnit> readyUnit(Course course, UnitRequest request) {
        return switch (request.kind()) {
            case OUTLINE -> course.getOutlineStatus() == OutlineStatus.READY && course.getOutline() != null
                    ? Optional.of(new GeneratedUnit.OutlineUnit(course.getOutline()))
                    : Optional.empty();
            case NEXT_STEP -> Optional.empty();
            case LESSON_BLOCKS -> {
                Lesson lesson = requireLesson(course, request);
                yield lesson.getBlocksStatus() == GenerationStatus.READY
                        ? Optional.of(new GeneratedUnit.LessonBlocksUnit(lesson.getBlocks()))
                        : Optional.empty();
            }
            case BLOCK_CONTENT -> {
                Block block = requireBlock(requireLesson(course, request), request.blockId());
                yield block.isContentReady()
                        ? Optional.of(new GeneratedUnit.BlockContentUnit(block.getContent()))
                        : Optional.empty();
            }
        };
    }

    private GeneratedUnit persist(Course course, UnitRequest request, GeneratedUnit unit, UserContext user) {
        Instant now = clock.instant();
        if (unit instanceof GeneratedUnit.OutlineUnit outlineUnit) {
            Outline outline = outlineUnit.outline();
            outline.setGeneratedAt(now);
            course.setOutline(outline);
            course.setTotalLessons(outline.countLessons());
            course.setCurrentPosition(positionTracker.initialize(outline));
            logOutlineTransition(course, OutlineStatus.READY);
            course.setOutlineStatus(OutlineStatus.READY);
            course.setOutlineError(null);
            courseStore.update(course, CourseField.OUTLINE, CourseField.POSITION);
            eventPublisher.publishEvent(new OutlineReadyEvent(course.getId(), user));
        } else if (unit instanceof GeneratedUnit.StepUnit stepUnit) {
            Step step = stepUnit.step();
            if (step.getId() == null || course.findStep(step.getId()).isPresent()) {
                step.setId(UUID.randomUUID().toString());
            }
            step.setIndex(course.getSteps().size());
            step.setCreatedAt(now);
            step.setCompleted(false);
            course.getSteps().add(step);
            courseStore.update(course, CourseField.STEPS);
        } else if (unit instanceof GeneratedUnit.LessonBlocksUnit blocksUnit) {
            Lesson lesson = requireLesson(course, request);
            lesson.setBlocks(blocksUnit.blocks());
            lesson.setBlocksStatus(transition("blocks of lesson " + lesson.getId(),
                    lesson.getBlocksStatus(), GenerationStatus.READY));
            lesson.setBlocksError(null);
            courseStore.update(course, CourseField.OUTLINE);
        } else if (unit instanceof GeneratedUnit.BlockContentUnit contentUnit) {
            Block block = requireBlock(requireLesson(course, request), request.blockId());
            block.setContent(contentUnit.content());
            block.setContentStatus(transition("content of block " + block.getId(),
                    block.getContentStatus(), GenerationStatus.READY));
            block.setContentError(null);
            courseStore.update(course, CourseField.OUTLINE);
        } else {
            throw new IllegalArgumentException("Unsupported unit " + unit.kind());
        }
        return unit;
    }

    private void markGenerating(Course course, UnitRequest request) {
        switch (request.kind()) {
            case OUTLINE -> {
                logOutlineTransition(course, OutlineStatus.GENERATING);
                course.setOutlineStatus(OutlineStatus.GENERATING);
                course.setOutlineError(null);
                courseStore.update(course, CourseField.OUTLINE);
            }
            case NEXT_STEP -> {
            }
            case LESSON_BLOCKS -> {
                Lesson lesson = requireLesson(course, request);
                lesson.setBlocksStatus(transition("blocks of lesson " + lesson.getId(),
                        lesson.getBlocksStatus(), GenerationStatus.GENERATING));
                lesson.setBlocksError(null);
                courseStore.update(course, CourseField.OUTLINE);
            }
            case BLOCK_CONTENT -> {
                Block block = requireBlock(requireLesson(course, request), request.blockId());
                block.setContentStatus(transition("content of block " + block.getId(),
                        block.getContentStatus(), GenerationStatus.GENERATING));
                block.setContentError(null);
                courseStore.update(course, CourseField.OUTLINE);
            }
        }
    }

    private void markFailed(Course course, UnitRequest request, String message) {
        try {
            switch (request.kind()) {
                case OUTLINE -> {
                    logOutlineTransition(course, OutlineStatus.FAILED);
                    course.setOutlineStatus(OutlineStatus.FAILED);
                    course.setOutlineError(message);
                    courseStore.update(course, CourseField.OUTLINE);
                }
                case NEXT_STEP -> {
                }
                case LESSON_BLOCKS -> {
                    Lesson lesson = requireLesson(course, request);
                    lesson.setBlocksStatus(transition("blocks of lesson " + lesson.getId(),
                            lesson.getBlocksStatus(), GenerationStatus.ERROR));
                    lesson.setBlocksError(message);
                    courseStore.update(course, CourseField.OUTLINE);
                }
                case BLOCK_CONTENT -> {
                    Block block = requireBlock(requireLesson(course, request), request.blockId());
                    block.setContentStatus(transition("content of block " + block.getId(),
                            block.getContentStatus(), GenerationStatus.ERROR));
                    block.setContentError(message);
                    courseStore.update(course, CourseField.OUTLINE);
                }
            }
        } catch (RuntimeException e) {
            log.error("Could not record {} failure on course {}", request.kind(), course.getId(), e);
        }
    }

    private GenerationStatus transition(String subject, GenerationStatus from, GenerationStatus to) {
        if (GenerationStatus.isValidTransition(from, to)) {
            log.info("Status of {}: {} -> {}", subject, from, to);
        } else {
            log.warn("Unexpected status transition for {}: {} -> {}", subject, from, to);
        }
        return to;
    }

    private void logOutlineTransition(Course course, OutlineStatus to) {
        log.info("Outline status of course {}: {} -> {}", course.getId(), course.getOutlineStatus(), to);
    }

    private BlockType blockTypeFor(Course course, UnitRequest request) {
        if (request.kind() != UnitKind.BLOCK_CONTENT) {
            return null;
        }
        return requireBlock(requireLesson(course, request), request.blockId()).getType();
    }

    private Lesson requireLesson(Course course, UnitRequest request) {
        if (course.getOutline() == null) {
            throw new CourseStateException(CourseStateException.OUTLINE_NOT_READY, "Course outline is not ready yet.");
        }
        return course.getOutline().findLesson(request.sectionId(), request.lessonId())
                .orElseThrow(() -> new ValidationException(
                        "Unknown lesson " + request.lessonId() + " in section " + request.sectionId()));
    }

    private Block requireBlock(Lesson lesson, String blockId) {
        return lesson.findBlock(blockId)
                .orElseThrow(() -> new ValidationException("Unknown block " + blockId + " in lesson " + lesson.getId()));
    }

    private static String describe(UnitKind kind) {
        return switch (kind) {
            case OUTLINE -> "outline";
            case NEXT_STEP -> "step";
            case LESSON_BLOCKS -> "lesson blocks";
            case BLOCK_CONTENT -> "block content";
        };
    }

    private static long elapsedSince(long startedAtMs) {
        return Math.max(0L, System.currentTimeMillis() - startedAtMs);
    }
}
