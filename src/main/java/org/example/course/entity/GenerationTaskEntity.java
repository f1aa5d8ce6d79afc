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
import org.example.course.model.UnitKind;
import org.example.course.model.WorkMode;

import java.time.LocalDateTime;

/**
 * Row of the database-backed generation queue. A worker owns a task while its lease is valid.
 */
@Entity
@Table(name = "generation_tasks", indexes = {
        @Index(name = "idx_generation_tasks_status_due", columnList = "status,nextAttemptAt")
})
public class GenerationTaskEntity {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 64)
    private String courseId;

    @Column(nullable = false, length = 128)
    private String userId;

    @Column(length = 32)
    private String tier;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UnitKind unitKind;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private WorkMode mode;

    private Integer stepIndex;

    @Column(length = 64)
    private String sectionId;

    @Column(length = 64)
    private String lessonId;

    @Column(length = 64)
    private String blockId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private GenerationTaskStatus status;

    @Column(nullable = false)
    private int attempts;

    @Column(nullable = false)
    private LocalDateTime nextAttemptAt;

    @Column(length = 120)
    private String leaseOwner;

    private LocalDateTime leaseExpiresAt;

    @Column(length = 2000)
    private String lastError;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    @PreUpdate
    public void updateTimestamps() {
        LocalDateTime now = LocalDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
        if (status == null) {
            status = GenerationTaskStatus.PENDING;
        }
        if (nextAttemptAt == null) {
            nextAttemptAt = now;
        }
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getCourseId() { return courseId; }
    public void setCourseId(String courseId) { this.courseId = courseId; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getTier() { return tier; }
    public void setTier(String tier) { this.tier = tier; }

    public UnitKind getUnitKind() { return unitKind; }
    public void setUnitKind(UnitKind unitKind) { this.unitKind = unitKind; }

    public WorkMode getMode() { return mode; }
    public void setMode(WorkMode mode) { this.mode = mode; }

    public Integer getStepIndex() { return stepIndex; }
    public void setStepIndex(Integer stepIndex) { this.stepIndex = stepIndex; }

    public String getSectionId() { return sectionId; }
    public void setSectionId(String sectionId) { this.sectionId = sectionId; }

    public String getLessonId() { return lessonId; }
    public void setLessonId(String lessonId) { this.lessonId = lessonId; }

    public String getBlockId() { return blockId; }
    public void setBlockId(String blockId) { this.blockId = blockId; }

    public GenerationTaskStatus getStatus() { return status; }
    public void setStatus(GenerationTaskStatus status) { this.status = status; }

    public int getAttempts() { return attempts; }
    public void setAttempts(int attempts) { this.attempts = attempts; }

    public LocalDateTime getNextAttemptAt() { return nextAttemptAt; }
    public void setNextAttemptAt(LocalDateTime nextAttemptAt) { this.nextAttemptAt = nextAttemptAt; }

    public String getLeaseOwner() { return leaseOwner; }
    public void setLeaseOwner(String leaseOwner) { this.leaseOwner = leaseOwner; }

    public LocalDateTime getLeaseExpiresAt() { return leaseExpiresAt; }
    public void setLeaseExpiresAt(LocalDateTime leaseExpiresAt) { this.leaseExpiresAt = leaseExpiresAt; }

    public String getLastError() { return lastError; }
    public void setLastError(String lastError) { this.lastError = lastError; }

    public LocalDateTime getCreatedAt() { return createdAt; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
}
