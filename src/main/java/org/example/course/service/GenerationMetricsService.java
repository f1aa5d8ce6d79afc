package org.example.course.service;

import org.example.course.model.UnitKind;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

@Service
public class GenerationMetricsService {

    private final Map<UnitKind, LongAdder> generationRequested = new EnumMap<>(UnitKind.class);
    private final Map<UnitKind, LongAdder> generationCompleted = new EnumMap<>(UnitKind.class);
    private final Map<UnitKind, LongAdder> generationFailed = new EnumMap<>(UnitKind.class);
    private final Map<GenerationException.Cause, LongAdder> failuresByCause =
            new EnumMap<>(GenerationException.Cause.class);
    private final LongAdder cacheHits = new LongAdder();
    private final LongAdder cacheMisses = new LongAdder();
    private final LongAdder pregenerationStored = new LongAdder();
    private final LongAdder pregenerationSkipped = new LongAdder();
    private final LongAdder dispatchQueued = new LongAdder();
    private final LongAdder dispatchDetached = new LongAdder();
    private final LongAdder dispatchDropped = new LongAdder();
    private final LongAdder compactionsCompleted = new LongAdder();
    private final LongAdder compactionsFallback = new LongAdder();
    private final LongAdder tokensRecorded = new LongAdder();
    private final AtomicLong generationLatencyTotalMs = new AtomicLong(0);

    public GenerationMetricsService() {
        for (UnitKind kind : UnitKind.values()) {
            generationRequested.put(kind, new LongAdder());
            generationCompleted.put(kind, new LongAdder());
            generationFailed.put(kind, new LongAdder());
        }
        for (GenerationException.Cause cause : GenerationException.Cause.values()) {
            failuresByCause.put(cause, new LongAdder());
        }
    }

    public void recordGenerationRequested(UnitKind kind) {
        generationRequested.get(kind).increment();
    }

    public void recordGenerationCompleted(UnitKind kind, long durationMs, long tokens) {
        generationCompleted.get(kind).increment();
        if (durationMs > 0) {
            generationLatencyTotalMs.addAndGet(durationMs);
        }
        if (tokens > 0) {
            tokensRecorded.add(tokens);
        }
    }

    public void recordGenerationFailed(UnitKind kind, long durationMs, GenerationException.Cause cause) {
        generationFailed.get(kind).increment();
        if (cause != null) {
            failuresByCause.get(cause).increment();
        }
        if (durationMs > 0) {
            generationLatencyTotalMs.addAndGet(durationMs);
        }
    }

    public void recordCacheLookup(boolean hit) {
        if (hit) {
            cacheHits.increment();
        } else {
            cacheMisses.increment();
        }
    }

    public void recordPregeneration(boolean stored) {
        if (stored) {
            pregenerationStored.increment();
        } else {
            pregenerationSkipped.increment();
        }
    }

    public void recordDispatchQueued() {
        dispatchQueued.increment();
    }

    public void recordDispatchDetached() {
        dispatchDetached.increment();
    }

    public void recordDispatchDropped() {
        dispatchDropped.increment();
    }

    public void recordCompaction(boolean fallbackUsed) {
        compactionsCompleted.increment();
        if (fallbackUsed) {
            compactionsFallback.increment();
        }
    }

    public Map<String, Object> snapshot() {
        long completed = 0;
        long failed = 0;
        Map<String, Object> metrics = new LinkedHashMap<>();
        for (UnitKind kind : UnitKind.values()) {
            String name = kind.name().toLowerCase(Locale.ROOT);
            long kindCompleted = generationCompleted.get(kind).sum();
            long kindFailed = generationFailed.get(kind).sum();
            completed += kindCompleted;
            failed += kindFailed;
            metrics.put(name + "Requested", generationRequested.get(kind).sum());
            metrics.put(name + "Completed", kindCompleted);
            metrics.put(name + "Failed", kindFailed);
        }
        long measured = completed + failed;
        for (GenerationException.Cause cause : GenerationException.Cause.values()) {
            metrics.put("failures" + cause.name().charAt(0) + cause.name().substring(1).toLowerCase(Locale.ROOT),
                    failuresByCause.get(cause).sum());
        }
        metrics.put("generationAverageLatencyMs", measured == 0 ? 0 : generationLatencyTotalMs.get() / measured);
        metrics.put("tokensRecorded", tokensRecorded.sum());
        metrics.put("cacheHits", cacheHits.sum());
        metrics.put("cacheMisses", cacheMisses.sum());
        metrics.put("pregenerationStored", pregenerationStored.sum());
        metrics.put("pregenerationSkipped", pregenerationSkipped.sum());
        metrics.put("dispatchQueued", dispatchQueued.sum());
        metrics.put("dispatchDetached", dispatchDetached.sum());
        metrics.put("dispatchDropped", dispatchDropped.sum());
        metrics.put("compactionsCompleted", compactionsCompleted.sum());
        metrics.put("compactionsFallback", compactionsFallback.sum());
        return metrics;
    }
}
