package org.example.course.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * Stored course document. Nested field groups are kept as JSON text so each group can be
 * overwritten on its own.
 */
@Entity
@Table(name = "courses", indexes = {
        @Index(name = "idx_courses_user_status", columnList = "user_id,status")
})
public class CourseEntity {

    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "user_id", nullable = false, length = 128)
    private String userId;

    @Column(nullable = false, length = 500)
    private String title;

    @Column(length = 32)
    private String emoji;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CourseStatus status;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private OutlineStatus outlineStatus;

    @Column(length = 2000)
    private String outlineError;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ProgressionMode progressionMode;

    @Column(nullable = false)
    private int progress;

    @Column(nullable = false)
    private int lessonsCompleted;

    @Column(nullable = false)
    private int totalLessons;

    @Column(name = "outline_json", columnDefinition = "TEXT")
    private String outlineJson;

    @Column(name = "position_json", columnDefinition = "TEXT")
    private String positionJson;

    @Column(name = "steps_json", columnDefinition = "TEXT")
    private String stepsJson;

    @Column(name = "memory_json", columnDefinition = "TEXT")
    private String memoryJson;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    private Instant lastAccessedAt;

    private Instant completedAt;

    private Instant archivedAt;

    private Instant deletedAt;

    @PrePersist
    @PreUpdate
    public void fillDefaults() {
        Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
        if (status == null) {
            status = CourseStatus.ACTIVE;
        }
        if (progressionMode == null) {
            progressionMode = ProgressionMode.LESSONS;
        }
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

    public String getOutlineJson() { return outlineJson; }
    public void setOutlineJson(String outlineJson) { this.outlineJson = outlineJson; }

    public String getPositionJson() { return positionJson; }
    public void setPositionJson(String positionJson) { this.positionJson = positionJson; }

    public String getStepsJson() { return stepsJson; }
    public void setStepsJson(String stepsJson) { this.stepsJson = stepsJson; }

    public String getMemoryJson() { return memoryJson; }
    public void setMemoryJson(String memoryJson) { this.memoryJson = memoryJson; }

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
