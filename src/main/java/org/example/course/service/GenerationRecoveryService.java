package org.example.course.service;

import org.example.course.entity.CourseStatus;
import org.example.course.entity.OutlineStatus;
import org.example.course.model.Block;
import org.example.course.model.Course;
import org.example.course.model.GenerationStatus;
import org.example.course.model.Lesson;
import org.example.course.model.Section;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Units still marked generating when the process starts have no task behind them any more.
 * They are moved to an error state so the learner can retry them.
 */
@Service
public class GenerationRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(GenerationRecoveryService.class);

    static final String INTERRUPTED = "Generation interrupted";

    private final CourseStore courseStore;
    private final boolean recoveryEnabled;
    private final Duration stuckAfter;
    private final Clock clock;

    @Autowired
    public GenerationRecoveryService(
            CourseStore courseStore,
            @Value("${generation.recovery.enabled:true}") boolean recoveryEnabled,
            @Value("${generation.recovery.stuck-minutes:5}") long stuckMinutes) {
        this(courseStore, recoveryEnabled, Duration.ofMinutes(Math.max(0, stuckMinutes)), Clock.systemUTC());
    }

    GenerationRecoveryService(CourseStore courseStore, boolean recoveryEnabled, Duration stuckAfter, Clock clock) {
        this.courseStore = courseStore;
        this.recoveryEnabled = recoveryEnabled;
        this.stuckAfter = stuckAfter;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void recoverOnStartup() {
        try {
            recoverStuckGeneration();
        } catch (DataAccessException e) {
            log.error("Generation recovery failed; stuck units stay generating until retried", e);
        }
    }

    RecoverySummary recoverStuckGeneration() {
        if (!recoveryEnabled) {
            log.info("Generation recovery is disabled");
            return new RecoverySummary(0, 0, 0, 0);
        }

        List<Course> courses = new ArrayList<>(courseStore.listByStatus(CourseStatus.ACTIVE));
        courses.addAll(courseStore.listByStatus(CourseStatus.ARCHIVED));
        Instant cutoff = clock.instant().minus(stuckAfter);

        int outlinesFailed = 0;
        int blocksReset = 0;
        int contentsReset = 0;
        for (Course course : courses) {
            if (course.getUpdatedAt() != null && course.getUpdatedAt().isAfter(cutoff)) {
                continue;
            }
            boolean changed = false;
            if (course.getOutlineStatus() == OutlineStatus.GENERATING) {
                course.setOutlineStatus(OutlineStatus.FAILED);
                course.setOutlineError(INTERRUPTED);
                outlinesFailed++;
                changed = true;
            }
            if (course.getOutline() != null) {
                for (Section section : course.getOutline().getSections()) {
                    for (Lesson lesson : section.getLessons()) {
                        if (lesson.getBlocksStatus() == GenerationStatus.GENERATING) {
                            lesson.setBlocksStatus(GenerationStatus.ERROR);
                            lesson.setBlocksError(INTERRUPTED);
                            blocksReset++;
                            changed = true;
                        }
                        for (Block block : lesson.getBlocks()) {
                            if (block.getContentStatus() == GenerationStatus.GENERATING) {
                                block.setContentStatus(GenerationStatus.ERROR);
                                block.setContentError(INTERRUPTED);
                                contentsReset++;
                                changed = true;
                            }
                        }
                    }
                }
            }
            if (changed) {
                courseStore.update(course, CourseField.OUTLINE);
            }
        }

        RecoverySummary summary = new RecoverySummary(courses.size(), outlinesFailed, blocksReset, contentsReset);
        if (outlinesFailed + blocksReset + contentsReset > 0) {
            log.info("Recovered interrupted generation across {} courses: outlines={}, blocks={}, contents={}",
                    summary.coursesScanned(), summary.outlinesFailed(), summary.blocksReset(), summary.contentsReset());
        } else {
            log.debug("No interrupted generation found across {} courses", summary.coursesScanned());
        }
        return summary;
    }

    record RecoverySummary(int coursesScanned, int outlinesFailed, int blocksReset, int contentsReset) {
    }
}
