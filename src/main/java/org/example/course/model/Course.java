package org.example.course.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.example.course.entity.CourseStatus;
import org.example.course.entity.OutlineStatus;
import org.example.course.entity.ProgressionMode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Course document: the root aggregate read from and written back to the course store.
 */
public class Course {

    private String id;
    private String userId;
    private String title;
    private String emoji;
    private CourseStatus status = CourseStatus.ACTIVE;
    private OutlineStatus outlineStatus;
    private String outlineError;
    private ProgressionMode progressionMode = ProgressionMode.LESSONS;
    private int progress;
    private int lessonsCompleted;
    private int totalLessons;
    private Outline outline;
    private LessonPosition currentPosition;
    private List<Step> steps = new ArrayList<>();
    private Memory memory = new Memory();
    private Instant createdAt;
    private Instant updatedAt;
    private Instant lastAccessedAt;
    private Instant completedAt;
    private Instant archivedAt;
    private Instant deletedAt;

    @JsonIgnore
    public boolean isActive() {
        return status == CourseStatus.ACTIVE;
    }

    public Optional<Step> findStep(String stepId) {
        return steps.stream().filter(step -> step.getId().equals(stepId)).findFirst();
    }

    public Optional<Step> firstIncompleteStep() {
        return steps.stream().filter(step -> !step.isCompleted()).findFirst();
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getEmoji() { return emoji; }
    public void setEmoji(String emoji) { this.emoji = emoji; }

    public CourseStatus getStatus() { return status; }
    public void setStatus(CourseStatus status) { this.status = status; }

    public OutlineStatus getOutlineStatus() { return outlineStatus; }
    public void setOutlineStatus(OutlineStatus outlineStatus) { this.outlineStatus = outlineStatus; }

    public String getOutlineError() { return outlineError; }
    public void setOutlineError(String outlineError) { this.outlineError = outlineError; }

    public ProgressionMode getProgressionMode() { return progressionMode; }
    public void setProgressionMode(ProgressionMode progressionMode) { this.progressionMode = progressionMode; }

    public int getProgress() { return progress; }
    public void setProgress(int progress) { this.progress = progress; }

    public int getLessonsCompleted() { return lessonsCompleted; }
    public void setLessonsCompleted(int lessonsCompleted) { this.lessonsCompleted = lessonsCompleted; }

    public int getTotalLessons() { return totalLessons; }
    public void setTotalLessons(int totalLessons) { this.totalLessons = totalLessons; }

    public Outline getOutline() { return outline; }
    public void setOutline(Outline outline) { this.outline = outline; }

    public LessonPosition getCurrentPosition() { return currentPosition; }
    public void setCurrentPosition(LessonPosition currentPosition) { this.currentPosition = currentPosition; }

    public List<Step> getSteps() { return steps; }
    public void setSteps(List<Step> steps) { this.steps = steps == null ? new ArrayList<>() : steps; }

    public Memory getMemory() { return memory; }
    public void setMemory(Memory memory) { this.memory = memory == null ? new Memory() : memory; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    public Instant getLastAccessedAt() { return lastAccessedAt; }
    public void setLastAccessedAt(Instant lastAccessedAt) { this.lastAccessedAt = lastAccessedAt; }

    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }

    public Instant getArchivedAt() { return archivedAt; }
    public void setArchivedAt(Instant archivedAt) { this.archivedAt = archivedAt; }

    public Instant getDeletedAt() { return deletedAt; }
    public void setDeletedAt(Instant deletedAt) { this.deletedAt = deletedAt; }
}
