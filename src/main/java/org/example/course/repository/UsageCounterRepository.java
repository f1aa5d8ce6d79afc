package org.example.course.repository;

import org.example.course.entity.UsageCounterEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

public interface UsageCounterRepository extends JpaRepository<UsageCounterEntity, String> {

    /**
     * Adds {@code amount} only while the result stays within {@code limit}. Returns the number of
     * rows changed: 0 means the row is missing or the limit would be exceeded.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
            UPDATE UsageCounterEntity u
            SET u.used = u.used + :amount,
                u.usageLimit = :limit,
                u.updatedAt = :now
            WHERE u.counterKey = :counterKey
              AND u.used + :amount <= :limit
            """)
    int incrementWithinLimit(
            @Param("counterKey") String counterKey,
            @Param("amount") long amount,
            @Param("limit") long limit,
            @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
            UPDATE UsageCounterEntity u
            SET u.used = u.used + :amount,
                u.updatedAt = :now
            WHERE u.counterKey = :counterKey
            """)
    int increment(
            @Param("counterKey") String counterKey,
            @Param("amount") long amount,
            @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("""
            UPDATE UsageCounterEntity u
            SET u.used = CASE WHEN u.used > :amount THEN u.used - :amount ELSE 0 END,
                u.updatedAt = :now
            WHERE u.counterKey = :counterKey
            """)
    int decrement(
            @Param("counterKey") String counterKey,
            @Param("amount") long amount,
            @Param("now") Instant now);

    @Modifying
    @Transactional
    @Query("delete from UsageCounterEntity u where u.expiresAt < :cutoff")
    int deleteExpired(@Param("cutoff") Instant cutoff);
}
