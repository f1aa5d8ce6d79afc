package org.example.course.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;

import java.time.Instant;

@Entity
@Table(name = "usage_counters")
public class UsageCounterEntity {

    @Id
    @Column(name = "counter_key", nullable = false, length = 255)
    private String counterKey;

    @Column(name = "user_id", nullable = false, length = 128)
    private String userId;

    @Column(nullable = false, length = 32)
    private String tier;

    @Column(nullable = false, length = 32)
    private String metric;

    @Column(name = "period_bucket", nullable = false, length = 16)
    private String periodBucket;

    @Column(name = "used", nullable = false)
    private long used;

    @Column(name = "usage_limit", nullable = false)
    private long usageLimit;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    public String getCounterKey() {
        return counterKey;
    }

    public void setCounterKey(String counterKey) {
        this.counterKey = counterKey;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getTier() {
        return tier;
    }

    public void setTier(String tier) {
        this.tier = tier;
    }

    public String getMetric() {
        return metric;
    }

    public void setMetric(String metric) {
        this.metric = metric;
    }

    public String getPeriodBucket() {
        return periodBucket;
    }

    public void setPeriodBucket(String periodBucket) {
        this.periodBucket = periodBucket;
    }

    public long getUsed() {
        return used;
    }

    public void setUsed(long used) {
        this.used = used;
    }

    public long getUsageLimit() {
        return usageLimit;
    }

    public void setUsageLimit(long usageLimit) {
        this.usageLimit = usageLimit;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }

    public Long getVersion() {
        return version;
    }
}
