package org.example.course.service;

import org.example.course.entity.GenerationTaskEntity;
import org.example.course.entity.GenerationTaskStatus;
import org.example.course.model.GenerationWork;
import org.example.course.model.UnitRequest;
import org.example.course.repository.GenerationTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

@Component
@ConditionalOnProperty(name = "generation.queue.store", havingValue = "database")
public class DatabaseGenerationTaskQueue implements GenerationTaskQueue {

    private static final Logger log = LoggerFactory.getLogger(DatabaseGenerationTaskQueue.class);

    private final GenerationTaskRepository repository;

    public DatabaseGenerationTaskQueue(GenerationTaskRepository repository) {
        this.repository = repository;
    }

    @Override
    public String submit(GenerationWork work) {
        UnitRequest request = work.request();
        GenerationTaskEntity task = new GenerationTaskEntity();
        task.setId(UUID.randomUUID().toString());
        task.setCourseId(work.courseId());
        task.setUserId(work.userId());
        task.setTier(work.tier());
        task.setUnitKind(request.kind());
        task.setMode(work.mode());
        task.setStepIndex(request.stepIndex());
        task.setSectionId(request.sectionId());
        task.setLessonId(request.lessonId());
        task.setBlockId(request.blockId());
        task.setStatus(GenerationTaskStatus.PENDING);
        task.setAttempts(0);
        task.setNextAttemptAt(LocalDateTime.now());
        repository.save(task);
        log.debug("Queued generation task {}: {}", task.getId(), work.describe());
        return task.getId();
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public Map<String, Long> statusCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (GenerationTaskStatus status : GenerationTaskStatus.values()) {
            counts.put(status.name().toLowerCase(Locale.ROOT), repository.countByStatus(status));
        }
        return counts;
    }

    static GenerationWork toWork(GenerationTaskEntity task) {
        UnitRequest request = new UnitRequest(
                task.getUnitKind(), task.getStepIndex(), task.getSectionId(), task.getLessonId(), task.getBlockId());
        return new GenerationWork(task.getCourseId(), task.getUserId(), task.getTier(), request, task.getMode());
    }
}
