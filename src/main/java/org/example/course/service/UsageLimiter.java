package org.example.course.service;

import jakarta.persistence.OptimisticLockException;
import org.example.course.config.TierLimitsProperties;
import org.example.course.entity.UsageCounterEntity;
import org.example.course.model.UserContext;
import org.example.course.repository.UsageCounterRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.IsoFields;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-user, per-tier counters backed by {@code usage_counters}. Reservation is a single
 * conditional UPDATE, so concurrent requests can never push a counter past its limit.
 * Day buckets are UTC dates, week buckets ISO weeks.
 */
@Service
public class UsageLimiter {

    private static final Logger log = LoggerFactory.getLogger(UsageLimiter.class);

    public record Decision(boolean allowed, long used, long limit) {
    }

    private final UsageCounterRepository repository;
    private final TierLimitsProperties tierLimits;
    private final AtomicInteger cleanupTicker = new AtomicInteger();
    private final int cleanupInterval;
    private final int maxRetries;
    private final Clock clock;

    @Autowired
    public UsageLimiter(
            UsageCounterRepository repository,
            TierLimitsProperties tierLimits,
            @Value("${course.usage.cleanup-interval:256}") int cleanupInterval,
            @Value("${course.usage.db-max-retries:4}") int maxRetries) {
        this(repository, tierLimits, cleanupInterval, maxRetries, Clock.systemUTC());
    }

    UsageLimiter(
            UsageCounterRepository repository,
            TierLimitsProperties tierLimits,
            int cleanupInterval,
            int maxRetries,
            Clock clock) {
        this.repository = repository;
        this.tierLimits = tierLimits;
        this.cleanupInterval = Math.max(1, cleanupInterval);
        this.maxRetries = Math.max(1, maxRetries);
        this.clock = clock;
    }

    /**
     * Reserves one step for today or throws {@code DAILY_STEP_LIMIT_REACHED}.
     */
    public void reserveStep(UserContext user) {
        String tier = tierLimits.normalizeTier(user.tier());
        long limit = limitFor(tier, UsageMetric.DAILY_STEPS);
        Decision decision = checkAndReserve(user.userId(), tier, UsageMetric.DAILY_STEPS, 1, limit);
        if (!decision.allowed()) {
            log.info("Daily step limit reached for user {} ({}): {}/{}",
                    user.userId(), tier, decision.used(), decision.limit());
            throw new UsageLimitExceededException(
                    UsageLimitExceededException.DAILY_STEP_LIMIT_REACHED,
                    "Daily step limit reached (" + decision.limit() + " steps per day on the " + tier + " plan).",
                    tier, decision.used(), decision.limit(), canUpgrade(tier, UsageMetric.DAILY_STEPS));
        }
    }

    /**
     * Gives back a step reserved by {@link #reserveStep} whose generation failed.
     */
    public void releaseStep(UserContext user) {
        String tier = tierLimits.normalizeTier(user.tier());
        release(user.userId(), tier, UsageMetric.DAILY_STEPS, 1);
    }

    /**
     * Fails with {@code TOKEN_LIMIT_REACHED} when the daily or weekly token budget is spent.
     */
    public void checkTokenBudget(UserContext user) {
        String tier = tierLimits.normalizeTier(user.tier());
        for (UsageMetric metric : new UsageMetric[]{UsageMetric.DAILY_TOKENS, UsageMetric.WEEKLY_TOKENS}) {
            long limit = limitFor(tier, metric);
            long used = peek(user.userId(), tier, metric);
            if (used >= limit) {
                throw new UsageLimitExceededException(
                        UsageLimitExceededException.TOKEN_LIMIT_REACHED,
                        (metric.isWeekly() ? "Weekly" : "Daily") + " token budget reached on the " + tier + " plan.",
                        tier, used, limit, canUpgrade(tier, metric));
            }
        }
    }

    public void recordTokens(UserContext user, long tokens) {
        if (tokens <= 0) {
            return;
        }
        String tier = tierLimits.normalizeTier(user.tier());
        record(user.userId(), tier, UsageMetric.DAILY_TOKENS, tokens);
        record(user.userId(), tier, UsageMetric.WEEKLY_TOKENS, tokens);
    }

    /**
     * Fails with {@code COURSE_LIMIT_REACHED} when {@code activeCourses} already fills the tier.
     */
    public void checkActiveCourses(UserContext user, long activeCourses) {
        String tier = tierLimits.normalizeTier(user.tier());
        int limit = tierLimits.resolve(tier).getMaxActiveCourses();
        if (activeCourses >= limit) {
            throw new UsageLimitExceededException(
                    UsageLimitExceededException.COURSE_LIMIT_REACHED,
                    "Active course limit reached (" + limit + " on the " + tier + " plan).",
                    tier, activeCourses, limit, canUpgradeCourses(tier));
        }
    }

    public Map<String, Object> usageSnapshot(UserContext user) {
        String tier = tierLimits.normalizeTier(user.tier());
        TierLimitsProperties.Limits limits = tierLimits.resolve(tier);
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("tier", tier);
        snapshot.put("maxActiveCourses", limits.getMaxActiveCourses());
        snapshot.put("dailySteps", limits.getDailySteps());
        snapshot.put("dailyStepsUsed", peek(user.userId(), tier, UsageMetric.DAILY_STEPS));
        snapshot.put("dailyTokens", limits.getDailyTokens());
        snapshot.put("dailyTokensUsed", peek(user.userId(), tier, UsageMetric.DAILY_TOKENS));
        snapshot.put("weeklyTokens", limits.getWeeklyTokens());
        snapshot.put("weeklyTokensUsed", peek(user.userId(), tier, UsageMetric.WEEKLY_TOKENS));
        return snapshot;
    }

    /**
     * Adds {@code amount} to the counter when the result stays within {@code limit}.
     * A denied reservation leaves the counter untouched.
     */
    public Decision checkAndReserve(String userId, String tier, UsageMetric metric, long amount, long limit) {
        if (userId == null || userId.isBlank() || amount <= 0 || limit <= 0) {
            return new Decision(false, 0, Math.max(0, limit));
        }
        Instant now = clock.instant();
        String counterKey = counterKey(userId, tier, metric, now);
        maybeCleanup(now);

        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            if (repository.incrementWithinLimit(counterKey, amount, limit, now) == 1) {
                long used = repository.findById(counterKey).map(UsageCounterEntity::getUsed).orElse(amount);
                return new Decision(true, used, limit);
            }
            Optional<UsageCounterEntity> existing = repository.findById(counterKey);
            if (existing.isPresent()) {
                return new Decision(false, existing.get().getUsed(), limit);
            }
            if (amount > limit) {
                return new Decision(false, 0, limit);
            }
            try {
                repository.saveAndFlush(newCounter(counterKey, userId, tier, metric, amount, limit, now));
                return new Decision(true, amount, limit);
            } catch (DataIntegrityViolationException
                     | ObjectOptimisticLockingFailureException
                     | OptimisticLockException e) {
                log.debug("Concurrent insert of usage counter {} (attempt {})", counterKey, attempt);
            }
        }
        return new Decision(false, peek(userId, tier, metric), limit);
    }

    public void release(String userId, String tier, UsageMetric metric, long amount) {
        if (userId == null || amount <= 0) {
            return;
        }
        Instant now = clock.instant();
        repository.decrement(counterKey(userId, tier, metric, now), amount, now);
    }

    public long peek(String userId, String tier, UsageMetric metric) {
        if (userId == null) {
            return 0;
        }
        return repository.findById(counterKey(userId, tier, metric, clock.instant()))
                .map(UsageCounterEntity::getUsed)
                .orElse(0L);
    }

    /**
     * Unconditionally adds {@code amount}; used for consumption that already happened.
     */
    public void record(String userId, String tier, UsageMetric metric, long amount) {
        if (userId == null || amount <= 0) {
            return;
        }
        Instant now = clock.instant();
        String counterKey = counterKey(userId, tier, metric, now);
        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            if (repository.increment(counterKey, amount, now) == 1) {
                return;
            }
            try {
                repository.saveAndFlush(
                        newCounter(counterKey, userId, tier, metric, amount, limitFor(tier, metric), now));
                return;
            } catch (DataIntegrityViolationException
                     | ObjectOptimisticLockingFailureException
                     | OptimisticLockException e) {
                log.debug("Concurrent insert of usage counter {} (attempt {})", counterKey, attempt);
            }
        }
        log.warn("Could not record {} {} for user {} after {} attempts", amount, metric.key(), userId, maxRetries);
    }

    String counterKey(String userId, String tier, UsageMetric metric, Instant now) {
        return userId + ":" + tier + ":" + metric.key() + ":" + bucket(metric, now);
    }

    static String bucket(UsageMetric metric, Instant now) {
        LocalDate date = LocalDate.ofInstant(now, ZoneOffset.UTC);
        if (metric.isWeekly()) {
            return String.format("%d-W%02d",
                    date.get(IsoFields.WEEK_BASED_YEAR), date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
        }
        return date.toString();
    }

    private long limitFor(String tier, UsageMetric metric) {
        TierLimitsProperties.Limits limits = tierLimits.resolve(tier);
        return switch (metric) {
            case DAILY_STEPS -> limits.getDailySteps();
            case DAILY_TOKENS -> limits.getDailyTokens();
            case WEEKLY_TOKENS -> limits.getWeeklyTokens();
        };
    }

    private boolean canUpgrade(String tier, UsageMetric metric) {
        long current = limitFor(tier, metric);
        return tierLimits.getLimits().keySet().stream().anyMatch(other -> limitFor(other, metric) > current);
    }

    private boolean canUpgradeCourses(String tier) {
        int current = tierLimits.resolve(tier).getMaxActiveCourses();
        return tierLimits.getLimits().values().stream().anyMatch(limits -> limits.getMaxActiveCourses() > current);
    }

    private UsageCounterEntity newCounter(String counterKey, String userId, String tier, UsageMetric metric,
                                          long used, long limit, Instant now) {
        LocalDate date = LocalDate.ofInstant(now, ZoneOffset.UTC);
        UsageCounterEntity counter = new UsageCounterEntity();
        counter.setCounterKey(counterKey);
        counter.setUserId(userId);
        counter.setTier(tier);
        counter.setMetric(metric.key());
        counter.setPeriodBucket(bucket(metric, now));
        counter.setUsed(used);
        counter.setUsageLimit(limit);
        counter.setUpdatedAt(now);
        counter.setExpiresAt(date.plusDays(metric.isWeekly() ? 15 : 2).atStartOfDay(ZoneOffset.UTC).toInstant());
        return counter;
    }

    private void maybeCleanup(Instant now) {
        int tick = cleanupTicker.incrementAndGet();
        if (tick % cleanupInterval != 0) {
            return;
        }
        int removed = repository.deleteExpired(now);
        if (removed > 0) {
            log.debug("Removed {} expired usage counters", removed);
        }
    }
}
