package org.example.course.service;

import org.example.course.model.Course;
import org.example.course.model.GenerationStatus;
import org.example.course.model.GenerationWork;
import org.example.course.model.Lesson;
import org.example.course.model.LessonPosition;
import org.example.course.model.Outline;
import org.example.course.model.Section;
import org.example.course.model.UnitRequest;
import org.example.course.model.UserContext;
import org.example.course.model.WorkMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Schedules speculative background generation: the next step after a step completes, the next
 * lesson's blocks after a lesson completes, and the first lessons of a freshly generated outline.
 */
@Service
public class PregenerationService {

    private static final Logger log = LoggerFactory.getLogger(PregenerationService.class);

    private final AsyncTaskDispatcher dispatcher;
    private final PregenerationCache cache;
    private final CourseStore courseStore;
    private final int lessonBuffer;

    public PregenerationService(
            AsyncTaskDispatcher dispatcher,
            PregenerationCache cache,
            CourseStore courseStore,
            @Value("${generation.progressive-lesson-buffer:2}") int lessonBuffer) {
        this.dispatcher = dispatcher;
        this.cache = cache;
        this.courseStore = courseStore;
        this.lessonBuffer = Math.max(0, lessonBuffer);
    }

    /**
     * Materializes the block plans of the first lessons so the learner never waits on lesson one.
     */
    @EventListener
    public void onOutlineReady(OutlineReadyEvent event) {
        Optional<Course> course = courseStore.find(event.courseId());
        if (course.isEmpty() || course.get().getOutline() == null) {
            return;
        }
        List<UnitRequest> requests = new ArrayList<>();
        for (Section section : course.get().getOutline().getSections()) {
            for (Lesson lesson : section.getLessons()) {
                if (requests.size() >= lessonBuffer) {
                    break;
                }
                if (lesson.getBlocksStatus() == GenerationStatus.PENDING) {
                    requests.add(UnitRequest.lessonBlocks(section.getId(), lesson.getId()));
                }
            }
        }
        for (UnitRequest request : requests) {
            dispatcher.dispatch(new GenerationWork(
                    event.courseId(), event.user().userId(), event.user().tier(), request, WorkMode.MATERIALIZE));
        }
        log.info("Scheduled block generation for {} initial lessons of course {}", requests.size(), event.courseId());
    }

    public boolean pregenerateNextStep(Course course, UserContext user) {
        if (!course.isActive()) {
            return false;
        }
        return schedule(course, UnitRequest.nextStep(course.getSteps().size()), user);
    }

    /**
     * Pregenerates the blocks of the first lesson at or after the cursor that has none yet.
     */
    public boolean pregenerateNextLesson(Course course, UserContext user) {
        if (!course.isActive() || course.getOutline() == null || course.getCurrentPosition() == null) {
            return false;
        }
        Outline outline = course.getOutline();
        LessonPosition position = course.getCurrentPosition();
        for (int s = position.sectionIndex(); s < outline.getSections().size(); s++) {
            Section section = outline.getSections().get(s);
            int firstLesson = s == position.sectionIndex() ? position.lessonIndex() : 0;
            for (int l = firstLesson; l < section.getLessons().size(); l++) {
                Lesson lesson = section.getLessons().get(l);
                GenerationStatus status = lesson.getBlocksStatus();
                if (status == GenerationStatus.PENDING || status == GenerationStatus.ERROR || status == null) {
                    return schedule(course, UnitRequest.lessonBlocks(section.getId(), lesson.getId()), user);
                }
            }
        }
        return false;
    }

    private boolean schedule(Course course, UnitRequest request, UserContext user) {
        String key = request.cacheKey(course.getId());
        if (!cache.tryMarkInFlight(key)) {
            log.debug("Pregeneration of {} already cached or in flight", key);
            return false;
        }
        AsyncTaskDispatcher.DispatchTicket ticket = dispatcher.dispatch(new GenerationWork(
                course.getId(), user.userId(), user.tier(), request, WorkMode.PREGENERATE));
        if (ticket.state() == AsyncTaskDispatcher.DispatchState.DROPPED) {
            cache.clearInFlight(key);
        }
        return true;
    }
}
