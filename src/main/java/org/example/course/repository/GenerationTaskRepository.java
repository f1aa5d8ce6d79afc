package org.example.course.repository;

import org.example.course.entity.GenerationTaskEntity;
import org.example.course.entity.GenerationTaskStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface GenerationTaskRepository extends JpaRepository<GenerationTaskEntity, String> {

    @Query("""
            SELECT t.id
            FROM GenerationTaskEntity t
            WHERE (t.status = :pendingStatus AND t.nextAttemptAt <= :now)
               OR (t.status = :runningStatus AND (t.leaseExpiresAt IS NULL OR t.leaseExpiresAt < :now))
            ORDER BY t.nextAttemptAt ASC
            """)
    List<String> findClaimableIds(
            @Param("now") LocalDateTime now,
            @Param("pendingStatus") GenerationTaskStatus pendingStatus,
            @Param("runningStatus") GenerationTaskStatus runningStatus,
            Pageable page);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
            UPDATE GenerationTaskEntity t
            SET t.status = :runningStatus,
                t.updatedAt = :now,
                t.leaseOwner = :leaseOwner,
                t.leaseExpiresAt = :leaseExpiresAt,
                t.attempts = t.attempts + 1
            WHERE t.id = :taskId
              AND (
                (t.status = :pendingStatus AND t.nextAttemptAt <= :now)
                OR (t.status = :runningStatus AND (t.leaseExpiresAt IS NULL OR t.leaseExpiresAt < :now))
              )
            """)
    int claimLease(
            @Param("taskId") String taskId,
            @Param("now") LocalDateTime now,
            @Param("leaseExpiresAt") LocalDateTime leaseExpiresAt,
            @Param("leaseOwner") String leaseOwner,
            @Param("pendingStatus") GenerationTaskStatus pendingStatus,
            @Param("runningStatus") GenerationTaskStatus runningStatus);

    long countByStatus(GenerationTaskStatus status);
}
