package org.example.course.service;

import jakarta.annotation.PreDestroy;
import org.example.course.model.GenerationWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Hands background generation to the durable queue when one is configured and accepts the work;
 * otherwise runs it on a detached executor with its own timeout. Detached work is best-effort:
 * a timeout, failure or rejection moves its ticket to {@link DispatchState#DROPPED} with no retry.
 */
@Service
public class AsyncTaskDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AsyncTaskDispatcher.class);

    public enum DispatchState {
        QUEUED,
        RUNNING_DETACHED,
        DONE,
        DROPPED
    }

    public record DispatchTicket(
            String ticketId,
            String description,
            DispatchState state,
            String queueHandle,
            String detail,
            Instant createdAt,
            Instant updatedAt) {
    }

    private final ObjectProvider<GenerationTaskQueue> queueProvider;
    private final GenerationWorkHandler workHandler;
    private final GenerationMetricsService metricsService;
    private final ThreadPoolExecutor detachedExecutor;
    private final ScheduledExecutorService watchdog;
    private final Duration detachedTimeout;
    private final Duration ticketRetention;
    private final Clock clock;
    private final ConcurrentHashMap<String, Ticket> tickets = new ConcurrentHashMap<>();

    @Autowired
    public AsyncTaskDispatcher(
            ObjectProvider<GenerationTaskQueue> queueProvider,
            GenerationWorkHandler workHandler,
            GenerationMetricsService metricsService,
            @Value("${generation.dispatch.detached-timeout-seconds:90}") long detachedTimeoutSeconds,
            @Value("${generation.dispatch.max-concurrent:4}") int maxConcurrent,
            @Value("${generation.dispatch.max-pending:100}") int maxPending,
            @Value("${generation.dispatch.ticket-retention-minutes:30}") long ticketRetentionMinutes) {
        this(queueProvider, workHandler, metricsService,
                Duration.ofSeconds(Math.max(1, detachedTimeoutSeconds)),
                maxConcurrent, maxPending,
                Duration.ofMinutes(Math.max(1, ticketRetentionMinutes)),
                Clock.systemUTC());
    }

    AsyncTaskDispatcher(
            ObjectProvider<GenerationTaskQueue> queueProvider,
            GenerationWorkHandler workHandler,
            GenerationMetricsService metricsService,
            Duration detachedTimeout,
            int maxConcurrent,
            int maxPending,
            Duration ticketRetention,
            Clock clock) {
        this.queueProvider = queueProvider;
        this.workHandler = workHandler;
        this.metricsService = metricsService;
        this.detachedTimeout = detachedTimeout;
        this.ticketRetention = ticketRetention;
        this.clock = clock;
        int threads = Math.max(1, maxConcurrent);
        this.detachedExecutor = new ThreadPoolExecutor(
                threads, threads, 60L, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(Math.max(1, maxPending)),
                new DispatchThreadFactory("detached-generation-"));
        this.watchdog = Executors.newSingleThreadScheduledExecutor(new DispatchThreadFactory("detached-watchdog-"));
    }

    @PreDestroy
    public void shutdown() {
        detachedExecutor.shutdownNow();
        watchdog.shutdownNow();
        long abandoned = tickets.values().stream()
                .filter(ticket -> ticket.state.get() == DispatchState.RUNNING_DETACHED)
                .count();
        if (abandoned > 0) {
            log.warn("Dropping {} detached generation tasks on shutdown", abandoned);
        }
    }

    /**
     * Dispatches {@code work} without waiting for it. Never throws for delivery problems.
     */
    public DispatchTicket dispatch(GenerationWork work) {
        pruneTickets();
        Ticket ticket = new Ticket(UUID.randomUUID().toString(), work.describe(), clock.instant());
        tickets.put(ticket.id, ticket);

        GenerationTaskQueue queue = queueProvider.getIfAvailable();
        if (queue != null && queue.isAvailable()) {
            try {
                String handle = queue.submit(work);
                ticket.queueHandle = handle;
                ticket.moveTo(DispatchState.QUEUED, null, clock.instant());
                metricsService.recordDispatchQueued();
                log.debug("Queued {} as task {}", work.describe(), handle);
                return ticket.snapshot();
            } catch (RuntimeException e) {
                log.warn("Queue submission failed for {}; running detached", work.describe(), e);
            }
        }
        runDetached(ticket, work);
        return ticket.snapshot();
    }

    public Optional<DispatchTicket> findTicket(String ticketId) {
        return Optional.ofNullable(tickets.get(ticketId)).map(Ticket::snapshot);
    }

    public Map<DispatchState, Long> stateCounts() {
        Map<DispatchState, Long> counts = new EnumMap<>(DispatchState.class);
        for (DispatchState state : DispatchState.values()) {
            counts.put(state, 0L);
        }
        for (Ticket ticket : tickets.values()) {
            DispatchState state = ticket.state.get();
            if (state != null) {
                counts.merge(state, 1L, Long::sum);
            }
        }
        return counts;
    }

    public boolean isQueueAvailable() {
        GenerationTaskQueue queue = queueProvider.getIfAvailable();
        return queue != null && queue.isAvailable();
    }

    /**
     * Task counts per status of the durable queue, empty when no queue is configured.
     */
    public Map<String, Long> queueStatusCounts() {
        GenerationTaskQueue queue = queueProvider.getIfAvailable();
        return queue == null ? Map.of() : queue.statusCounts();
    }

    private void runDetached(Ticket ticket, GenerationWork work) {
        ticket.moveTo(DispatchState.RUNNING_DETACHED, null, clock.instant());
        metricsService.recordDispatchDetached();
        Map<String, String> context = MDC.getCopyOfContextMap();
        try {
            Future<?> future = detachedExecutor.submit(() -> execute(ticket, work, context));
            watchdog.schedule(() -> {
                if (!future.isDone()) {
                    future.cancel(true);
                    if (drop(ticket, "timed out after " + detachedTimeout.toSeconds() + "s")) {
                        log.warn("Detached {} timed out after {}s and was dropped",
                                work.describe(), detachedTimeout.toSeconds());
                    }
                }
            }, detachedTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            drop(ticket, "rejected: detached executor is full");
            log.warn("Detached executor full; dropped {}", work.describe());
        }
    }

    private void execute(Ticket ticket, GenerationWork work, Map<String, String> context) {
        if (context != null) {
            MDC.setContextMap(context);
        }
        try {
            workHandler.handle(work);
            if (ticket.moveFrom(DispatchState.RUNNING_DETACHED, DispatchState.DONE, null, clock.instant())) {
                log.debug("Detached {} done", work.describe());
            }
        } catch (RuntimeException e) {
            if (drop(ticket, e.getMessage())) {
                log.warn("Detached {} failed and was dropped: {}", work.describe(), e.getMessage());
            }
        } finally {
            MDC.clear();
        }
    }

    private boolean drop(Ticket ticket, String reason) {
        boolean dropped = ticket.moveFrom(DispatchState.RUNNING_DETACHED, DispatchState.DROPPED, reason, clock.instant());
        if (dropped) {
            metricsService.recordDispatchDropped();
        }
        return dropped;
    }

    private void pruneTickets() {
        Instant cutoff = clock.instant().minus(ticketRetention);
        tickets.values().removeIf(ticket -> ticket.isSettled() && ticket.updatedAt.isBefore(cutoff));
    }

    private static final class Ticket {
        private final String id;
        private final String description;
        private final Instant createdAt;
        private final AtomicReference<DispatchState> state = new AtomicReference<>();
        private volatile String queueHandle;
        private volatile String detail;
        private volatile Instant updatedAt;

        private Ticket(String id, String description, Instant createdAt) {
            this.id = id;
            this.description = description;
            this.createdAt = createdAt;
            this.updatedAt = createdAt;
        }

        private void moveTo(DispatchState next, String detail, Instant now) {
            state.set(next);
            this.detail = detail;
            this.updatedAt = now;
        }

        private boolean moveFrom(DispatchState expected, DispatchState next, String detail, Instant now) {
            if (!state.compareAndSet(expected, next)) {
                return false;
            }
            this.detail = detail;
            this.updatedAt = now;
            return true;
        }

        // Queued tickets are settled from this process's point of view.
        private boolean isSettled() {
            DispatchState current = state.get();
            return current != null && current != DispatchState.RUNNING_DETACHED;
        }

        private DispatchTicket snapshot() {
            return new DispatchTicket(id, description, state.get(), queueHandle, detail, createdAt, updatedAt);
        }
    }

    private static final class DispatchThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger nextThreadId = new AtomicInteger(1);

        private DispatchThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + nextThreadId.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
