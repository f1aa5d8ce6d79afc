package org.example.course.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.example.course.model.GeneratedUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * In-memory TTL store of speculatively generated units, keyed by course id and unit.
 * Reads check expiry themselves, so an expired entry is never returned even before a sweep.
 * {@link #take} removes the entry atomically: at most one caller gets a given payload.
 */
@Component
public class PregenerationCache {

    private static final Logger log = LoggerFactory.getLogger(PregenerationCache.class);

    record CacheEntry(GeneratedUnit payload, Instant createdAt) {
    }

    private final ConcurrentHashMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Instant> inFlight = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Duration sweepInterval;
    private final Clock clock;
    private ScheduledExecutorService sweeper;

    @Autowired
    public PregenerationCache(
            @Value("${generation.cache.ttl-minutes:10}") long ttlMinutes,
            @Value("${generation.cache.sweep-interval-minutes:5}") long sweepIntervalMinutes) {
        this(Duration.ofMinutes(Math.max(1, ttlMinutes)), Duration.ofMinutes(Math.max(1, sweepIntervalMinutes)),
                Clock.systemUTC());
    }

    PregenerationCache(Duration ttl, Duration sweepInterval, Clock clock) {
        this.ttl = ttl;
        this.sweepInterval = sweepInterval;
        this.clock = clock;
    }

    @PostConstruct
    public void startSweeper() {
        sweeper = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "pregen-cache-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        long intervalMs = sweepInterval.toMillis();
        sweeper.scheduleAtFixedRate(this::sweepSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Pregeneration cache started: ttl={}, sweepInterval={}", ttl, sweepInterval);
    }

    @PreDestroy
    public void stopSweeper() {
        if (sweeper != null) {
            sweeper.shutdownNow();
        }
    }

    public void put(String key, GeneratedUnit payload) {
        if (key == null || payload == null) {
            return;
        }
        entries.put(key, new CacheEntry(payload, clock.instant()));
    }

    public Optional<GeneratedUnit> take(String key) {
        if (key == null) {
            return Optional.empty();
        }
        CacheEntry entry = entries.remove(key);
        if (entry == null || isExpired(entry, clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(entry.payload());
    }

    public boolean contains(String key) {
        CacheEntry entry = key == null ? null : entries.get(key);
        return entry != null && !isExpired(entry, clock.instant());
    }

    /**
     * Number of live entries; expired ones awaiting the sweep are not counted.
     */
    public int size() {
        Instant now = clock.instant();
        return (int) entries.values().stream().filter(entry -> !isExpired(entry, now)).count();
    }

    /**
     * Claims the right to pregenerate {@code key}. Fails while another claim younger than the
     * TTL exists or the key is already cached.
     */
    public boolean tryMarkInFlight(String key) {
        if (contains(key)) {
            return false;
        }
        Instant now = clock.instant();
        Instant[] claimed = new Instant[1];
        inFlight.compute(key, (k, existing) -> {
            if (existing != null && existing.plus(ttl).isAfter(now)) {
                return existing;
            }
            claimed[0] = now;
            return now;
        });
        return claimed[0] != null;
    }

    public void clearInFlight(String key) {
        if (key != null) {
            inFlight.remove(key);
        }
    }

    public boolean isInFlight(String key) {
        Instant started = key == null ? null : inFlight.get(key);
        return started != null && started.plus(ttl).isAfter(clock.instant());
    }

    /**
     * Drops expired entries and stale in-flight claims. Returns the number of entries removed.
     */
    public int sweep() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.entrySet().removeIf(entry -> isExpired(entry.getValue(), now));
        inFlight.entrySet().removeIf(entry -> !entry.getValue().plus(ttl).isAfter(now));
        return Math.max(0, before - entries.size());
    }

    private void sweepSafely() {
        try {
            int removed = sweep();
            if (removed > 0) {
                log.debug("Swept {} expired pregenerated units", removed);
            }
        } catch (RuntimeException e) {
            log.warn("Pregeneration cache sweep failed", e);
        }
    }

    private boolean isExpired(CacheEntry entry, Instant now) {
        return !entry.createdAt().plus(ttl).isAfter(now);
    }
}
